package io.vodsync;

/**
 * Exception representing a failed HTTP exchange: a non-2xx status, a timeout, or an I/O failure. Transport errors
 * are never retried; they abort the operation that issued the request.
 */
public final class TransportException extends VodSyncException {

    private static final long serialVersionUID = 1L;
    private static final int MAX_EXCERPT = 512;

    /**
     * Failure category.
     */
    public enum Kind {
        HTTP_STATUS,
        TIMEOUT,
        IO
    }

    private final Kind kind;
    private final int statusCode;
    private final String body;

    public TransportException(int statusCode, String url, String body) {
        super(defaultMessage(statusCode, url, body));
        this.kind = Kind.HTTP_STATUS;
        this.statusCode = statusCode;
        this.body = body;
    }

    public TransportException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = -1;
        this.body = null;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return HTTP status code, or {@code -1} when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return response body as text (nullable when the response was empty or never arrived).
     */
    public String getBody() {
        return body;
    }

    private static String defaultMessage(int status, String url, String body) {
        String base = "request to " + url + " failed with status " + status;
        if (body == null || body.isBlank()) {
            return base;
        }
        String excerpt = body.length() > MAX_EXCERPT ? body.substring(0, MAX_EXCERPT) + "..." : body;
        return base + ": " + excerpt;
    }
}
