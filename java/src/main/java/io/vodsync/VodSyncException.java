package io.vodsync;

/**
 * Base exception thrown by vod-sync.
 */
public class VodSyncException extends Exception {

    private static final long serialVersionUID = 1L;

    public VodSyncException(String message) {
        super(message);
    }

    public VodSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
