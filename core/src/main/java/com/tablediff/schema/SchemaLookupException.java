package com.tablediff.schema;

/**
 * Exception thrown when a schema lookup fails for a reason other than a missing table.
 */
public class SchemaLookupException extends RuntimeException {

    public SchemaLookupException(String message) {
        super(message);
    }

    public SchemaLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
