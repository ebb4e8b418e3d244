package com.example.resourceapi.common.exception;

public class InternalErrorException extends ResourceException {

    public InternalErrorException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL, message, cause);
    }
}
