package com.tablediff.exception;

/**
 * Thrown when a column name would collide with a name the comparison itself
 * uses: a side-prefixed result label or a field of the diff record.
 */
public class ColumnNameConflictException extends TableDiffException {

    private final String column;

    public ColumnNameConflictException(String column, String message) {
        super(ErrorKind.COLUMN_NAME_CONFLICT, message);
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
