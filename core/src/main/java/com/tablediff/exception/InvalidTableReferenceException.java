package com.tablediff.exception;

/**
 * Thrown when a table name does not have the shape an engine expects,
 * e.g. a BigQuery name that is neither {@code dataset.table} nor
 * {@code project.dataset.table}.
 */
public class InvalidTableReferenceException extends TableDiffException {

    public InvalidTableReferenceException(String message) {
        super(ErrorKind.INVALID_TABLE_REFERENCE, message);
    }
}
