package com.example.resourceapi.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure classes surfaced by the resource layer, each with a fixed boundary status.
 */
public enum ErrorKind {

    /** Bad query or body parameters. */
    VALIDATION(HttpStatus.BAD_REQUEST, "validation_error"),

    /** Denied by the permission policy. */
    FORBIDDEN(HttpStatus.FORBIDDEN, "forbidden"),

    /** Unknown identifier or resource. */
    NOT_FOUND(HttpStatus.NOT_FOUND, "not_found"),

    /** Store failures and anything unexpected. The caller only ever sees a generic message. */
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error");

    private final HttpStatus status;
    private final String code;

    ErrorKind(HttpStatus status, String code) {
        this.status = status;
        this.code = code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }
}
