package com.tablediff.exception;

import java.util.Objects;

/**
 * Base class for all failures raised by a table comparison.
 *
 * <p>Subclasses are unchecked so that planning code can fail fast without
 * threading checked exceptions through every layer. Callers that need to
 * react to a specific failure switch on {@link #errorKind()}.
 *
 * @see ErrorKind
 */
public abstract class TableDiffException extends RuntimeException {

    private final ErrorKind errorKind;

    protected TableDiffException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = Objects.requireNonNull(errorKind, "errorKind must not be null");
    }

    protected TableDiffException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = Objects.requireNonNull(errorKind, "errorKind must not be null");
    }

    /**
     * Returns the category of this failure.
     *
     * @return the error kind
     */
    public ErrorKind errorKind() {
        return errorKind;
    }

    /**
     * Returns a message suitable for printing to an end user.
     *
     * @return user-facing message
     */
    public String getUserMessage() {
        return getMessage();
    }
}
