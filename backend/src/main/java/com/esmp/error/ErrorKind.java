package com.esmp.error;

import org.springframework.http.HttpStatus;

/**
 * Client-attributable rejection reasons. Each kind knows the HTTP status it is reported with;
 * the TCP listener reports the enum name.
 */
public enum ErrorKind {

    MALFORMED_INPUT(HttpStatus.BAD_REQUEST),
    SIGNATURE_INVALID(HttpStatus.UNAUTHORIZED),
    SCHEMA_VIOLATION(HttpStatus.BAD_REQUEST),
    STALE_MUTATION(HttpStatus.BAD_REQUEST),
    DUPLICATE_GROUP(HttpStatus.CONFLICT),
    UNKNOWN_GROUP(HttpStatus.NOT_FOUND),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    INVALID_FIELD(HttpStatus.BAD_REQUEST),

    /** A membership precondition of a group transition does not hold. */
    INVALID_TRANSITION(HttpStatus.CONFLICT);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
