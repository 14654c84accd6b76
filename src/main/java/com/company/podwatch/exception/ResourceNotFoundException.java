package com.company.podwatch.exception;

public class ResourceNotFoundException extends RuntimeException {
    public ResourceNotFoundException(String what, String id) {
        super(what + " not found: " + id);
    }
}
