package com.datasync.personconsumer.exception;

/**
 * The database rejected or failed to execute the upsert.
 */
public class StorageException extends PersonProcessingException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

}
