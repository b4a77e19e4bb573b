package com.flinkcursor.result;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One result row: an immutable, ordered tuple of column values.
 *
 * <p>Values are plain Java objects as decoded from the gateway's JSON
 * (String, Integer, Long, BigInteger, Double, Boolean, List, Map or null).
 * Two rows are equal when their values are equal position by position.
 */
public final class Row {

    private final List<Object> values;

    /**
     * Creates a row from its values.
     *
     * @param values the column values in order
     */
    public Row(List<?> values) {
        Objects.requireNonNull(values, "values must not be null");
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * Creates a row from its values.
     *
     * @param values the column values in order
     * @return the row
     */
    public static Row of(Object... values) {
        return new Row(Arrays.asList(values));
    }

    /**
     * Returns the value at the given position.
     *
     * @param index the zero-based column position
     * @return the value, possibly null
     */
    public Object get(int index) {
        return values.get(index);
    }

    /**
     * Returns the number of values in this row.
     *
     * @return the row width
     */
    public int size() {
        return values.size();
    }

    /**
     * Returns all values in order.
     *
     * @return an unmodifiable view of the values
     */
    public List<Object> values() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row)) return false;
        return values.equals(((Row) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Row" + values;
    }
}
