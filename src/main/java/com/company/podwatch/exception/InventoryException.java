package com.company.podwatch.exception;

/**
 * Cluster API could not be reached or answered with an error
 */
public class InventoryException extends RuntimeException {
    public InventoryException(String message) {
        super(message);
    }

    public InventoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
