package com.datasync.personconsumer.exception;

/**
 * A broker channel operation failed or was attempted on a channel that is not open.
 */
public class BrokerChannelException extends RuntimeException {

    public BrokerChannelException(String message) {
        super(message);
    }

    public BrokerChannelException(String message, Throwable cause) {
        super(message, cause);
    }

}
