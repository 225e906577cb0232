package com.querydigest.log.parser.report;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

import com.querydigest.log.parser.model.Snapshot;

/**
 * The report outputs. The set is closed; {@link #render(Snapshot, PrintStream)} handles every one.
 */
public enum ReportFormat {

    TERMINAL, JSON, GREPPABLE, NULL;

    public void render(Snapshot snapshot, PrintStream out) {
        switch (this) {
            case TERMINAL:
                TerminalReport.render(snapshot, out);
                break;
            case JSON:
                JsonReport.render(snapshot, out);
                break;
            case GREPPABLE:
                GreppableReport.render(snapshot, out);
                break;
            case NULL:
                break;
            default:
                throw new AssertionError("Unhandled report format " + this);
        }
        out.flush();
    }

    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ReportFormat parse(String name) {
        for (ReportFormat format : values()) {
            if (format.displayName().equalsIgnoreCase(name.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException("unknown output " + name + "; possible outputs: " + names());
    }

    public static String names() {
        return Arrays.stream(values()).map(ReportFormat::displayName).collect(Collectors.joining(", "));
    }
}
