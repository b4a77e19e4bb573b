package com.flinkcursor.runtime;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.Date;
import java.util.List;
import java.util.Locale;

/**
 * Substitutes positional bindings into statement text.
 *
 * <p>Each {@code {}} placeholder is replaced, in order, by the rendering of
 * the next binding:
 * <ul>
 *   <li>strings are wrapped in single quotes</li>
 *   <li>date/time values become {@code TIMESTAMP 'yyyy-MM-dd HH:mm:ss[.f]'}</li>
 *   <li>anything else is inserted as {@link String#valueOf(Object)}</li>
 * </ul>
 *
 * <p>Values are not escaped. A string containing a quote, or a non-string
 * value with SQL in its text form, changes the statement. Callers must only
 * bind trusted values.
 */
public final class BindingRenderer {

    /** Positional placeholder marker */
    public static final String PLACEHOLDER = "{}";

    private static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
        .appendPattern("yyyy-MM-dd HH:mm:ss")
        .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
        .toFormatter(Locale.ROOT);

    private BindingRenderer() {} // Utility class

    /**
     * Replaces the placeholders of a statement with rendered bindings.
     *
     * <p>Bindings beyond the number of placeholders are ignored.
     *
     * @param sql the statement template
     * @param bindings the binding values in placeholder order
     * @return the statement with bindings substituted
     * @throws IllegalArgumentException if there are fewer bindings than placeholders
     */
    public static String substitute(String sql, List<?> bindings) {
        StringBuilder sb = new StringBuilder(sql.length());
        int from = 0;
        int index = 0;
        int at;
        while ((at = sql.indexOf(PLACEHOLDER, from)) >= 0) {
            if (index >= bindings.size()) {
                throw new IllegalArgumentException(
                    "Statement has more placeholders than the " + bindings.size() + " bindings given");
            }
            sb.append(sql, from, at).append(render(bindings.get(index++)));
            from = at + PLACEHOLDER.length();
        }
        sb.append(sql, from, sql.length());
        return sb.toString();
    }

    /**
     * Renders a single binding value as SQL text.
     *
     * @param binding the value
     * @return the SQL text for the value
     */
    public static String render(Object binding) {
        if (binding instanceof CharSequence) {
            return "'" + binding + "'";
        }
        LocalDateTime timestamp = toLocalDateTime(binding);
        if (timestamp != null) {
            return "TIMESTAMP '" + TIMESTAMP_FORMAT.format(timestamp) + "'";
        }
        return String.valueOf(binding);
    }

    private static LocalDateTime toLocalDateTime(Object value) {
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toLocalDateTime();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toLocalDateTime();
        }
        if (value instanceof Instant) {
            return LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
        }
        if (value instanceof java.sql.Timestamp) {
            return ((java.sql.Timestamp) value).toLocalDateTime();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().atStartOfDay();
        }
        if (value instanceof Date) {
            return LocalDateTime.ofInstant(((Date) value).toInstant(), ZoneOffset.UTC);
        }
        return null;
    }
}
