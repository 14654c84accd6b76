package com.company.podwatch.exception;

public class InvalidCredentialException extends RuntimeException {
    public InvalidCredentialException() {
        super("Admin credential is missing or invalid");
    }
}
