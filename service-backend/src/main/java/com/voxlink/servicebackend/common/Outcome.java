package com.voxlink.servicebackend.common;

/**
 * Result of a state-machine operation that reports failure instead of throwing.
 */
public record Outcome(
        boolean success,
        ErrorKind kind,
        String message
) {
    private static final Outcome OK = new Outcome(true, null, "ok");

    public static Outcome ok() {
        return OK;
    }

    public static Outcome failure(ErrorKind kind, String message) {
        return new Outcome(false, kind, message);
    }

    /**
     * Throws the failure as a {@link ServiceException}; no-op on success.
     */
    public void orThrow() {
        if (!success) {
            throw new ServiceException(kind, message);
        }
    }
}
