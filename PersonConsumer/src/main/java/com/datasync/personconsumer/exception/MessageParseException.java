package com.datasync.personconsumer.exception;

/**
 * Message body is not a JSON object, or one of its timestamps cannot be read.
 */
public class MessageParseException extends PersonProcessingException {

    public MessageParseException(String message) {
        super(message);
    }

    public MessageParseException(String message, Throwable cause) {
        super(message, cause);
    }

}
