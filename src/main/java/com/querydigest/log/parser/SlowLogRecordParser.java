package com.querydigest.log.parser;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querydigest.log.parser.model.QueryEvent;
import com.querydigest.log.parser.model.RawRecordBlock;

/**
 * Decodes the lines of one record block into a {@link QueryEvent}.
 *
 * Supports two dialects:
 *
 * 1. MySQL 5.7+ / Percona:
 *    # Time: 2018-12-17T15:18:58.744913Z
 *    # User@Host: agency[agency] @  [192.168.0.102]  Id: 3502988
 *    # Schema: taskl-production  Last_errno: 0  Killed: 0
 *    # Query_time: 0.000030  Lock_time: 0.000000  Rows_sent: 0  Rows_examined: 0  Rows_affected: 0
 *    # Bytes_sent: 561
 *
 * 2. MySQL 5.5 / MariaDB:
 *    # Time: 181217 15:18:58
 *    # Thread_id: 3502988  Schema: taskl  QC_hit: No
 *    # Query_time: 0.000030  Lock_time: 0.000000  Rows_sent: 0  Rows_examined: 0
 *    # Rows_affected: 0  Bytes_sent: 561
 *
 * Malformed annotation lines are logged at debug level and skipped; they never abort the record.
 */
public class SlowLogRecordParser {

    private static final Logger logger = LoggerFactory.getLogger(SlowLogRecordParser.class);

    private static final DateTimeFormatter LEGACY_TIME_FORMAT = DateTimeFormatter.ofPattern("yyMMdd H:mm:ss");

    private static final Pattern USER_HOST_PATTERN = Pattern.compile(
        "^# User@Host:\\s*([^\\[\\s]*)\\[([^\\]]*)\\]\\s*@\\s*([^\\[\\s]*)\\s*\\[([^\\]]*)\\](?:\\s+Id:\\s*(\\d+))?");

    private static final Pattern SCHEMA_PATTERN = Pattern.compile(
        "^# Schema:\\s*(\\S*)(?:\\s+Last_errno:\\s*(\\d+))?(?:\\s+Killed:\\s*(\\d+))?");

    private static final Pattern THREAD_PATTERN = Pattern.compile(
        "^# Thread_id:\\s*(\\d+)(?:\\s+Schema:\\s*(\\S*))?(?:\\s+QC_hit:\\s*(\\S+))?");

    private static final Pattern QUERY_TIME_PATTERN = Pattern.compile(
        "^# Query_time:\\s*([0-9.]+)\\s+Lock_time:\\s*([0-9.]+)\\s+Rows_sent:\\s*(\\d+)\\s+Rows_examined:\\s*(\\d+)\\s+Rows_affected:\\s*(\\d+)");

    private static final Pattern QUERY_TIME_REDUCED_PATTERN = Pattern.compile(
        "^# Query_time:\\s*([0-9.]+)\\s+Lock_time:\\s*([0-9.]+)\\s+Rows_sent:\\s*(\\d+)\\s+Rows_examined:\\s*(\\d+)");

    private static final Pattern BYTES_SENT_PATTERN = Pattern.compile("^# Bytes_sent:\\s*(\\d+)");

    private static final Pattern ROWS_AFFECTED_BYTES_PATTERN = Pattern.compile(
        "^# Rows_affected:\\s*(\\d+)(?:\\s+Bytes_sent:\\s*(\\d+))?");

    /**
     * @return the event, or empty when the block carried no statement
     */
    public Optional<QueryEvent> parse(RawRecordBlock block) {
        QueryEvent event = new QueryEvent();

        for (String line : block.getLines()) {
            if (line == null || line.isEmpty()) {
                continue;
            }
            String prefix = line.substring(0, Math.min(4, line.length())).toUpperCase(Locale.ROOT);
            switch (prefix) {
                case "# TI":
                    event.time = parseTime(line, block.getPosition());
                    break;
                case "# US":
                    parseUserHost(line, event, block.getPosition());
                    break;
                case "# SC":
                    parseSchema(line, event, block.getPosition());
                    break;
                case "# TH":
                    parseThread(line, event, block.getPosition());
                    break;
                case "# QU":
                    parseQueryTime(line, event, block.getPosition());
                    break;
                case "# BY":
                    parseBytesSent(line, event, block.getPosition());
                    break;
                case "# RO":
                    parseRowsAffectedAndBytes(line, event, block.getPosition());
                    break;
                case "SET ":
                case "USE ":
                case "# AD":
                    break;
                default:
                    if (line.startsWith("#")) {
                        logger.debug("Ignoring unknown annotation in record at line {}: {}", block.getPosition(),
                                abbreviate(line));
                    } else {
                        event.fullQuery = line;
                    }
            }
        }

        if (event.fullQuery == null) {
            return Optional.empty();
        }

        event.fingerprint = Fingerprinter.fingerprint(event.fullQuery);
        if (!event.hasFingerprint()) {
            logger.debug("Empty fingerprint for record at line {}", block.getPosition());
            return Optional.empty();
        }
        event.key = Fingerprinter.key(event.fingerprint);
        return Optional.of(event);
    }

    /**
     * Parses the value of a "# Time:" line, trying the ISO-8601 form first and the older
     * {@code yyMMdd H:mm:ss} form second. Returns null when neither matches.
     */
    static Instant parseTime(String line, long position) {
        int colon = line.indexOf(':');
        if (colon < 0) {
            logger.debug("Malformed time line at {}: {}", position, abbreviate(line));
            return null;
        }
        String value = line.substring(colon + 1).trim().replaceAll("\\s+", " ");
        try {
            return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            // Try the older format
        }
        try {
            return LocalDateTime.parse(value, LEGACY_TIME_FORMAT).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            logger.debug("Unable to parse time at line {}: {}", position, value);
            return null;
        }
    }

    private void parseUserHost(String line, QueryEvent event, long position) {
        Matcher m = USER_HOST_PATTERN.matcher(line);
        if (!m.lookingAt()) {
            logger.debug("Malformed User@Host line at {}: {}", position, abbreviate(line));
            return;
        }
        event.altUser = m.group(1);
        event.user = m.group(2);
        String host = m.group(3);
        String ip = m.group(4);
        event.client = ip.isEmpty() ? host : ip;
        if (m.group(5) != null) {
            event.connectionId = parseLong(m.group(5), "Id", position);
        }
    }

    private void parseSchema(String line, QueryEvent event, long position) {
        Matcher m = SCHEMA_PATTERN.matcher(line);
        if (!m.lookingAt()) {
            logger.debug("Malformed Schema line at {}: {}", position, abbreviate(line));
            return;
        }
        event.schema = m.group(1);
        if (m.group(2) != null) {
            event.lastErrno = (int) parseLong(m.group(2), "Last_errno", position);
        }
        if (m.group(3) != null) {
            event.killed = (int) parseLong(m.group(3), "Killed", position);
        }
    }

    private void parseThread(String line, QueryEvent event, long position) {
        Matcher m = THREAD_PATTERN.matcher(line);
        if (!m.lookingAt()) {
            logger.debug("Malformed Thread_id line at {}: {}", position, abbreviate(line));
            return;
        }
        event.connectionId = parseLong(m.group(1), "Thread_id", position);
        if (m.group(2) != null) {
            event.schema = m.group(2);
        }
    }

    private void parseQueryTime(String line, QueryEvent event, long position) {
        Matcher m = QUERY_TIME_PATTERN.matcher(line);
        boolean withRowsAffected = m.lookingAt();
        if (!withRowsAffected) {
            m = QUERY_TIME_REDUCED_PATTERN.matcher(line);
            if (!m.lookingAt()) {
                logger.debug("Malformed Query_time line at {}: {}", position, abbreviate(line));
                return;
            }
        }
        event.queryTime = parseDouble(m.group(1), "Query_time", position);
        event.lockTime = parseDouble(m.group(2), "Lock_time", position);
        event.rowsSent = parseLong(m.group(3), "Rows_sent", position);
        event.rowsExamined = parseLong(m.group(4), "Rows_examined", position);
        if (withRowsAffected) {
            event.rowsAffected = parseLong(m.group(5), "Rows_affected", position);
        }
    }

    private void parseBytesSent(String line, QueryEvent event, long position) {
        Matcher m = BYTES_SENT_PATTERN.matcher(line);
        if (!m.lookingAt()) {
            logger.debug("Malformed Bytes_sent line at {}: {}", position, abbreviate(line));
            return;
        }
        event.bytesSent = parseLong(m.group(1), "Bytes_sent", position);
    }

    private void parseRowsAffectedAndBytes(String line, QueryEvent event, long position) {
        Matcher m = ROWS_AFFECTED_BYTES_PATTERN.matcher(line);
        if (!m.lookingAt()) {
            logger.debug("Malformed Rows_affected line at {}: {}", position, abbreviate(line));
            return;
        }
        event.rowsAffected = parseLong(m.group(1), "Rows_affected", position);
        if (m.group(2) != null) {
            event.bytesSent = parseLong(m.group(2), "Bytes_sent", position);
        }
    }

    private static long parseLong(String value, String field, long position) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            logger.debug("Invalid {} value '{}' in record at line {}", field, value, position);
            return 0L;
        }
    }

    private static double parseDouble(String value, String field, long position) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            logger.debug("Invalid {} value '{}' in record at line {}", field, value, position);
            return 0.0;
        }
    }

    private static String abbreviate(String line) {
        return line.substring(0, Math.min(200, line.length()));
    }
}
