package com.company.podwatch.exception;

public class HistoryWriteException extends RuntimeException {
    public HistoryWriteException(String message) {
        super(message);
    }

    public HistoryWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
