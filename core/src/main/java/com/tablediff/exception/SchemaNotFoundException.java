package com.tablediff.exception;

/**
 * Thrown when a table reference cannot be resolved by the schema lookup.
 */
public class SchemaNotFoundException extends TableDiffException {

    private final String tableName;

    public SchemaNotFoundException(String tableName, String message) {
        super(ErrorKind.SCHEMA_NOT_FOUND, message);
        this.tableName = tableName;
    }

    public SchemaNotFoundException(String tableName, String message, Throwable cause) {
        super(ErrorKind.SCHEMA_NOT_FOUND, message, cause);
        this.tableName = tableName;
    }

    /**
     * Returns the table name that could not be resolved.
     *
     * @return the table name
     */
    public String getTableName() {
        return tableName;
    }
}
