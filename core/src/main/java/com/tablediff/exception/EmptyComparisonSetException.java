package com.tablediff.exception;

/**
 * Thrown when every column shared by both tables is either part of the primary
 * key or ignored, and presence-only comparison was not requested.
 */
public class EmptyComparisonSetException extends TableDiffException {

    public EmptyComparisonSetException(String message) {
        super(ErrorKind.EMPTY_COMPARISON_SET, message);
    }

    @Override
    public String getUserMessage() {
        return getMessage() + ". Use presence-only comparison to only check row existence.";
    }
}
