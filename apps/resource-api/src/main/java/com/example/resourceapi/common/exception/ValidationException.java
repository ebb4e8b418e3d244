package com.example.resourceapi.common.exception;

public class ValidationException extends ResourceException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
