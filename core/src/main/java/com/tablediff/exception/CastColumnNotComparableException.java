package com.tablediff.exception;

/**
 * Thrown when a scalar cast targets a column that is not value-compared:
 * a primary key column, an ignored column, or a column missing from one table.
 */
public class CastColumnNotComparableException extends TableDiffException {

    private final String column;

    public CastColumnNotComparableException(String column, String message) {
        super(ErrorKind.CAST_COLUMN_NOT_COMPARABLE, message);
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
