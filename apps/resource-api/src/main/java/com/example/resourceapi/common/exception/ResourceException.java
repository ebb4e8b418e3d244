package com.example.resourceapi.common.exception;

/**
 * Base class of the resource error taxonomy. The message is safe to return to the caller;
 * internal detail only travels in the cause.
 */
public abstract class ResourceException extends RuntimeException {

    private final ErrorKind kind;

    protected ResourceException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ResourceException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
