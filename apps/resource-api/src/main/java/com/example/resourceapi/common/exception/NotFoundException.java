package com.example.resourceapi.common.exception;

public class NotFoundException extends ResourceException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
