package com.guno.drawimport.exception;

/**
 * Raised when a draw record would break the 20-distinct-balls-in-range invariant.
 */
public class InvalidDrawRecordException extends IllegalArgumentException {

    public InvalidDrawRecordException(String message) {
        super(message);
    }

    public InvalidDrawRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
