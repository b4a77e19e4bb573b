package com.flinkcursor.hints;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@link ExecutionHints} from comment hints embedded in SQL text.
 *
 * <p>Hints are written inside {@code /** ... *}{@code /} comment blocks as
 * {@code name(value)} or {@code name('value')} pairs, separated by whitespace
 * or commas:
 * <pre>
 *   /** mode('streaming') fetch_max(100) fetch_timeout_ms(5000) *&#47;
 *   SELECT * FROM clicks
 * </pre>
 *
 * <p>Recognized hints are {@code mode}, {@code fetch_max},
 * {@code fetch_timeout_ms} and {@code test_query}. Unknown hints are ignored.
 * When a hint appears more than once the last occurrence wins.
 */
public final class ExecutionHintsParser {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionHintsParser.class);

    private static final Pattern HINT_BLOCK = Pattern.compile("/\\*\\*(.*?)\\*/", Pattern.DOTALL);

    private static final Pattern HINT = Pattern.compile(
        "([A-Za-z_][A-Za-z0-9_]*)\\s*\\(\\s*(?:'([^']*)'|([^)'\\s]*))\\s*\\)");

    private ExecutionHintsParser() {} // Utility class

    /**
     * Parses the hints of a statement.
     *
     * @param sql the statement text
     * @return the hints, or {@link ExecutionHints#none()} if the text carries none
     * @throws IllegalArgumentException if a recognized hint has a malformed value
     */
    public static ExecutionHints parse(String sql) {
        if (sql == null || sql.isEmpty()) {
            return ExecutionHints.none();
        }

        QueryMode mode = null;
        Integer fetchMax = null;
        Long fetchTimeoutMs = null;
        boolean testQuery = false;
        boolean found = false;

        Matcher block = HINT_BLOCK.matcher(sql);
        while (block.find()) {
            Matcher hint = HINT.matcher(block.group(1));
            while (hint.find()) {
                String name = hint.group(1).toLowerCase(Locale.ROOT);
                String value = hint.group(2) != null ? hint.group(2) : hint.group(3);

                switch (name) {
                    case "mode":
                        mode = parseMode(value);
                        break;
                    case "fetch_max":
                        fetchMax = (int) parseNonNegative(name, value, Integer.MAX_VALUE);
                        break;
                    case "fetch_timeout_ms":
                        fetchTimeoutMs = parseNonNegative(name, value, Long.MAX_VALUE);
                        break;
                    case "test_query":
                        testQuery = parseBoolean(name, value);
                        break;
                    default:
                        logger.debug("Ignoring unknown hint '{}'", name);
                        continue;
                }
                found = true;
            }
        }

        if (!found) {
            return ExecutionHints.none();
        }
        return new ExecutionHints(mode, fetchMax, fetchTimeoutMs, testQuery);
    }

    private static QueryMode parseMode(String value) {
        try {
            return QueryMode.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Invalid value for hint 'mode': '" + value + "' (expected 'batch' or 'streaming')", e);
        }
    }

    private static long parseNonNegative(String name, String value, long max) {
        long parsed;
        try {
            parsed = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Invalid value for hint '" + name + "': '" + value + "' (expected a non-negative integer)", e);
        }
        if (parsed < 0 || parsed > max) {
            throw new IllegalArgumentException(
                "Invalid value for hint '" + name + "': " + parsed + " is out of range");
        }
        return parsed;
    }

    private static boolean parseBoolean(String name, String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("true".equals(normalized)) {
            return true;
        }
        if ("false".equals(normalized)) {
            return false;
        }
        throw new IllegalArgumentException(
            "Invalid value for hint '" + name + "': '" + value + "' (expected 'true' or 'false')");
    }
}
