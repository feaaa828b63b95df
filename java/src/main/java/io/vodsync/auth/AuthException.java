package io.vodsync.auth;

import io.vodsync.VodSyncException;

/**
 * Raised when the jAccount login cannot produce an authenticated session.
 */
public final class AuthException extends VodSyncException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        SESSION_EXPIRED,
        /** Retried through the operator loop; only escapes when the loop is bypassed. */
        BAD_CREDENTIALS,
        /** Retried through the operator loop; only escapes when the loop is bypassed. */
        BAD_CAPTCHA,
        /** The operator closed the prompt (end of input) instead of answering. */
        CANCELLED,
        UNKNOWN
    }

    private final Reason reason;
    private final String payload;

    public AuthException(Reason reason, String message, String payload) {
        super(payload == null || payload.isBlank() ? message : message + ": " + payload);
        this.reason = reason;
        this.payload = payload;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * @return raw identity provider response, when one was received.
     */
    public String getPayload() {
        return payload;
    }
}
