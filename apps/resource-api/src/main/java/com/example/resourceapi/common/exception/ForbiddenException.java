package com.example.resourceapi.common.exception;

public class ForbiddenException extends ResourceException {

    public ForbiddenException(String message) {
        super(ErrorKind.FORBIDDEN, message);
    }
}
