package com.e2eq.relations.model;

import com.e2eq.relations.exceptions.InvalidJoinSpecException;

/**
 * A fully qualified column, rendered as {@code table.column}.
 */
public record ColumnRef(String table, String column) {

    public ColumnRef {
        if (table == null || table.isBlank() || column == null || column.isBlank()) {
            throw new InvalidJoinSpecException("Column reference requires a table and a column, got table='"
                    + table + "' column='" + column + "'");
        }
    }

    public static ColumnRef of(String table, String column) {
        return new ColumnRef(table, column);
    }

    /**
     * Parses {@code table.column}. The split happens at the last dot so schema qualified tables
     * ({@code sales.Person.id}) keep their schema.
     *
     * @throws InvalidJoinSpecException when the text is blank or has no table part
     */
    public static ColumnRef parse(String qualified) {
        if (qualified == null || qualified.isBlank()) {
            throw new InvalidJoinSpecException("Column reference must not be blank");
        }
        String trimmed = qualified.trim();
        int dot = trimmed.lastIndexOf('.');
        if (dot <= 0 || dot == trimmed.length() - 1) {
            throw new InvalidJoinSpecException("Column reference '" + qualified + "' is not of the form table.column");
        }
        return new ColumnRef(trimmed.substring(0, dot), trimmed.substring(dot + 1));
    }

    @Override
    public String toString() {
        return table + "." + column;
    }
}
