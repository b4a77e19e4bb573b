package com.flinkcursor.result;

import java.util.Objects;

/**
 * Describes one output column of a statement.
 *
 * <p>The gateway result carries only the column name that the cursor
 * reports; type information is not exposed.
 */
public record ColumnDescription(String name) {

    public ColumnDescription {
        Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public String toString() {
        return name;
    }
}
