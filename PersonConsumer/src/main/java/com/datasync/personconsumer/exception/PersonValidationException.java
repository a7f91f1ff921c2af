package com.datasync.personconsumer.exception;

/**
 * Well-formed message describing an incomplete person.
 */
public class PersonValidationException extends PersonProcessingException {

    public PersonValidationException(String message) {
        super(message);
    }

}
