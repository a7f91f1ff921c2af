package com.datasync.personconsumer.exception;

/**
 * The broker could not be reached within the connect retry budget.
 * Fatal: the application does not start.
 */
public class BrokerConnectionException extends RuntimeException {

    public BrokerConnectionException(String message) {
        super(message);
    }

    public BrokerConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

}
