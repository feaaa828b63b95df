package io.vodsync.auth;

import io.vodsync.VodSyncException;

/**
 * Raised when the LTI hop chain does not yield a resource token.
 */
public final class TokenException extends VodSyncException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        /** Canvas answered with its login form; the caller must authenticate again. */
        SESSION_EXPIRED,
        /** The token resolution endpoint returned a non-zero code. */
        REJECTED
    }

    private final Reason reason;

    public TokenException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
