package io.vodsync;

/**
 * Raised when a remote response lacks a form, field or header the protocol requires.
 */
public final class DataShapeException extends VodSyncException {

    private static final long serialVersionUID = 1L;

    public DataShapeException(String message) {
        super(message);
    }

    public DataShapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
