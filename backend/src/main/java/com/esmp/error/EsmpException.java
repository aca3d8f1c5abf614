package com.esmp.error;

/**
 * A protocol-level rejection. Thrown (or emitted through {@code Mono.error}) for every
 * expected, client-attributable problem with an envelope or request. Infrastructure
 * failures never use this type.
 */
public class EsmpException extends RuntimeException {

    private final ErrorKind kind;

    public EsmpException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EsmpException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static EsmpException schema(String field, String problem) {
        return new EsmpException(ErrorKind.SCHEMA_VIOLATION, field + ": " + problem);
    }

    public static EsmpException invalidField(String field, String problem) {
        return new EsmpException(ErrorKind.INVALID_FIELD, field + ": " + problem);
    }
}
