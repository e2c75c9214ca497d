package com.masterplan;

/**
 * An error to be reported to an API client, carrying the HTTP status code it should produce.
 */
public class ReleaseServerException extends RuntimeException {

    public final int httpCode;
    public final Type type;

    public enum Type {
        BAD_REQUEST,
        CONFLICT,
        NOT_FOUND,
        RUNTIME,
        UNKNOWN;
    }

    public static ReleaseServerException badRequest (String message) {
        return new ReleaseServerException(Type.BAD_REQUEST, message, 400);
    }

    public static ReleaseServerException notFound (String message) {
        return new ReleaseServerException(Type.NOT_FOUND, message, 404);
    }

    public static ReleaseServerException conflict (String message) {
        return new ReleaseServerException(Type.CONFLICT, message, 409);
    }

    public ReleaseServerException (Type type, String message, int httpCode) {
        super(message);
        this.type = type;
        this.httpCode = httpCode;
    }

}
