package com.tablediff.exception;

/**
 * Thrown when a scalar cast names a type outside the supported set.
 */
public class UnknownCastTypeException extends TableDiffException {

    private final String requestedType;

    public UnknownCastTypeException(String requestedType, String message) {
        super(ErrorKind.UNKNOWN_CAST_TYPE, message);
        this.requestedType = requestedType;
    }

    public String getRequestedType() {
        return requestedType;
    }
}
