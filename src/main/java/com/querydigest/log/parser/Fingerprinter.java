package com.querydigest.log.parser;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querydigest.log.parser.accumulator.FingerprintKey;

/**
 * Reduces a SQL statement to its shape so occurrences differing only in literals group together.
 * Loosely follows the QueryRewriter rules of pt-query-digest. The rules run in order and the order
 * matters: lowercasing first lets every pattern be written in lowercase only.
 */
public final class Fingerprinter {

    private static final Logger logger = LoggerFactory.getLogger(Fingerprinter.class);

    private static final class Rule {
        final Pattern pattern;
        final String replacement;

        Rule(String regex, String replacement) {
            this.pattern = Pattern.compile(regex);
            this.replacement = replacement;
        }

        String apply(String input) {
            return pattern.matcher(input).replaceAll(replacement);
        }
    }

    private static final List<Rule> RULES = List.of(
        // multi-row inserts collapse to a single VALUES list
        new Rule("(insert .*) values.*", "$1 values (?)"),
        // comments; anchored so a line without one is rejected in a single pass
        new Rule("(?m)^(.*)/\\*.*\\*/(.*)", "$1$2"),
        new Rule("(?m)^(.*) --.*", "$1"),
        // right-hand side of comparisons: quoted, backtick-quoted, then bare literals
        new Rule("\\s*([!><=]{1,2})\\s*'[^']+'", " $1 ?"),
        new Rule("\\s*([!><=]{1,2})\\s*`[^`]+`", " $1 ?"),
        new Rule("\\s*([!><=]{1,2})\\s*[.a-zA-Z0-9_-]+", " $1 ?"),
        new Rule("\\s*(not)?\\s+like\\s+'[^']+'", " not like ?"),
        // whitespace
        new Rule("\\s{2,}", " "),
        new Rule("\\s+$", ""),
        // IN lists and OFFSET
        new Rule("in\\s+\\([^)]+\\)", "in (?)"),
        new Rule("offset\\s+\\d+", "offset ?")
    );

    private Fingerprinter() {
    }

    /**
     * @return the normalized statement, or an empty string for a null or empty statement
     */
    public static String fingerprint(String statement) {
        if (statement == null || statement.isEmpty()) {
            return "";
        }
        String fingerprint = statement.toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            fingerprint = rule.apply(fingerprint);
        }
        if (logger.isTraceEnabled()) {
            logger.trace("fingerprint {} -> {}", statement, fingerprint);
        }
        return fingerprint;
    }

    public static FingerprintKey key(String fingerprint) {
        return FingerprintKey.of(fingerprint);
    }
}
