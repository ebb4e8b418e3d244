package com.example.resourceapi.security.exception;

/**
 * Raised when a request to a protected path carries no usable bearer token.
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
