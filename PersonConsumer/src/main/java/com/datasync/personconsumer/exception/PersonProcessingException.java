package com.datasync.personconsumer.exception;

/**
 * Base class for failures scoped to a single message. The consumer logs them
 * and rejects the message; they never stop consumption.
 */
public abstract class PersonProcessingException extends RuntimeException {

    protected PersonProcessingException(String message) {
        super(message);
    }

    protected PersonProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

}
