package com.company.podwatch.exception;

/**
 * Authorized admin operation that could not be carried out (cluster call failed, cycle busy, ...)
 */
public class AdminOperationException extends RuntimeException {
    public AdminOperationException(String message) {
        super(message);
    }

    public AdminOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
