package com.neohoods.bridge.exceptions;

import lombok.Getter;

/**
 * A failed call to the Matrix homeserver.
 * Carries the HTTP status and the Matrix errcode/error pair from the response body, when present.
 */
@Getter
public class MatrixApiException extends RuntimeException {

    public static final String M_UNKNOWN_TOKEN = "M_UNKNOWN_TOKEN";
    public static final String M_MISSING_TOKEN = "M_MISSING_TOKEN";
    public static final String M_ROOM_IN_USE = "M_ROOM_IN_USE";
    public static final String M_UNKNOWN = "M_UNKNOWN";
    public static final String M_NOT_FOUND = "M_NOT_FOUND";

    private final int code;
    private final String errcode;

    public MatrixApiException(int code, String errcode, String message) {
        super(message);
        this.code = code;
        this.errcode = errcode;
    }

    public MatrixApiException(String message, Throwable cause) {
        super(message, cause);
        this.code = 0;
        this.errcode = null;
    }

    public boolean isAuthFailure() {
        return M_UNKNOWN_TOKEN.equals(errcode) || M_MISSING_TOKEN.equals(errcode);
    }

    public boolean isAliasInUse() {
        return M_ROOM_IN_USE.equals(errcode);
    }

    /**
     * The homeserver no longer knows the since token (expired or issued by another session).
     */
    public boolean isInvalidSyncToken() {
        return M_UNKNOWN.equals(errcode)
                || (getMessage() != null && getMessage().contains("Invalid stream token"));
    }

    @Override
    public String toString() {
        return "MatrixApiException{code=" + code + ", errcode=" + errcode + ", message=" + getMessage() + "}";
    }
}
