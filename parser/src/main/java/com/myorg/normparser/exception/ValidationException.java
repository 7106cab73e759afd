package com.myorg.normparser.exception;

/**
 * Rejected request input: missing upload, wrong file type.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
