package com.voxlink.servicebackend.common;

import java.util.Optional;

/**
 * Failure categories shared by the control plane and the relay.
 * The wire code is what clients see in the {@code code} field of an error response.
 */
public enum ErrorKind {
    AUTH_REQUIRED("session_required"),
    AUTH_INVALID("session_invalid"),
    NOT_FOUND("not_found"),
    FORBIDDEN("forbidden"),
    CONFLICT("conflict"),
    TRANSIENT("transient"),
    MALFORMED("malformed");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<ErrorKind> fromCode(String code) {
        for (ErrorKind kind : values()) {
            if (kind.code.equals(code)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public boolean isAuthFailure() {
        return this == AUTH_REQUIRED || this == AUTH_INVALID;
    }
}
