package com.tablediff.exception;

/**
 * Thrown when a primary key column is absent from one of the compared tables,
 * or when no primary key column was given at all.
 */
public class MissingPrimaryKeyException extends TableDiffException {

    private final String column;

    public MissingPrimaryKeyException(String column, String message) {
        super(ErrorKind.MISSING_PRIMARY_KEY, message);
        this.column = column;
    }

    /**
     * Returns the missing primary key column.
     *
     * @return the column name, or null when the key list itself was empty
     */
    public String getColumn() {
        return column;
    }
}
