package io.vodsync;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;

/**
 * Immutable configuration shared by the login, token exchange and synchronisation components.
 *
 * <p>
 * The defaults target the live jAccount, Canvas and lecture video deployments; tests point every URL at local
 * fixtures instead.
 * </p>
 */
public final class Config {

    public static final String DEFAULT_IDENTITY_PROVIDER_URL = "https://jaccount.sjtu.edu.cn";
    public static final String DEFAULT_CLIENT_URL = "https://oc.sjtu.edu.cn/login/openid_connect";
    public static final String DEFAULT_CANVAS_BASE_URL = "https://oc.sjtu.edu.cn";
    public static final String DEFAULT_VIDEO_BASE_URL = "https://v.sjtu.edu.cn/jy-application-canvas-sjtu";
    public static final int DEFAULT_EXTERNAL_TOOL_ID = 8329;
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(10);
    public static final String DEFAULT_TRANSCRIPT_LANGUAGE = "res";
    public static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    private final String identityProviderUrl;
    private final String clientUrl;
    private final String canvasBaseUrl;
    private final String videoBaseUrl;
    private final int externalToolId;
    private final Duration httpTimeout;
    private final String userAgent;
    private final String transcriptLanguage;
    private final HttpClient httpClient;

    private Config(Builder builder) {
        this.identityProviderUrl = builder.identityProviderUrl;
        this.clientUrl = builder.clientUrl;
        this.canvasBaseUrl = builder.canvasBaseUrl;
        this.videoBaseUrl = builder.videoBaseUrl;
        this.externalToolId = builder.externalToolId;
        this.httpTimeout = builder.httpTimeout;
        this.userAgent = builder.userAgent;
        this.transcriptLanguage = builder.transcriptLanguage;
        this.httpClient = builder.httpClient;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a configuration with every default applied.
     */
    public static Config defaults() {
        return builder().build();
    }

    public Config withDefaults() {
        String resolvedIdp = sanitizeUrl(Optional.ofNullable(identityProviderUrl).orElse(DEFAULT_IDENTITY_PROVIDER_URL));
        String resolvedClient = sanitizeUrl(Optional.ofNullable(clientUrl).orElse(DEFAULT_CLIENT_URL));
        String resolvedCanvas = sanitizeUrl(Optional.ofNullable(canvasBaseUrl).orElse(DEFAULT_CANVAS_BASE_URL));
        String resolvedVideo = sanitizeUrl(Optional.ofNullable(videoBaseUrl).orElse(DEFAULT_VIDEO_BASE_URL));

        int resolvedToolId = externalToolId <= 0 ? DEFAULT_EXTERNAL_TOOL_ID : externalToolId;

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        String resolvedAgent = Optional.ofNullable(userAgent)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(DEFAULT_USER_AGENT);

        String resolvedLanguage = Optional.ofNullable(transcriptLanguage)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(DEFAULT_TRANSCRIPT_LANGUAGE);

        HttpClient resolvedClientHttp = httpClient;
        if (resolvedClientHttp == null) {
            resolvedClientHttp = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        }

        return new Builder()
            .identityProviderUrl(resolvedIdp)
            .clientUrl(resolvedClient)
            .canvasBaseUrl(resolvedCanvas)
            .videoBaseUrl(resolvedVideo)
            .externalToolId(resolvedToolId)
            .httpTimeout(resolvedTimeout)
            .userAgent(resolvedAgent)
            .transcriptLanguage(resolvedLanguage)
            .httpClient(resolvedClientHttp)
            .buildInternal();
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public String getIdentityProviderUrl() {
        return identityProviderUrl;
    }

    /**
     * @return the Canvas OpenID Connect entry point whose redirects reveal whether the session is authenticated.
     */
    public String getClientUrl() {
        return clientUrl;
    }

    public String getCanvasBaseUrl() {
        return canvasBaseUrl;
    }

    public String getVideoBaseUrl() {
        return videoBaseUrl;
    }

    public int getExternalToolId() {
        return externalToolId;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public String getTranscriptLanguage() {
        return transcriptLanguage;
    }

    /**
     * @return client for the token-bearing video service calls; it carries no cookie jar.
     */
    public HttpClient getHttpClient() {
        return httpClient;
    }

    public static final class Builder {
        private String identityProviderUrl;
        private String clientUrl;
        private String canvasBaseUrl;
        private String videoBaseUrl;
        private int externalToolId;
        private Duration httpTimeout;
        private String userAgent;
        private String transcriptLanguage;
        private HttpClient httpClient;

        public Builder identityProviderUrl(String identityProviderUrl) {
            this.identityProviderUrl = identityProviderUrl;
            return this;
        }

        public Builder clientUrl(String clientUrl) {
            this.clientUrl = clientUrl;
            return this;
        }

        public Builder canvasBaseUrl(String canvasBaseUrl) {
            this.canvasBaseUrl = canvasBaseUrl;
            return this;
        }

        public Builder videoBaseUrl(String videoBaseUrl) {
            this.videoBaseUrl = videoBaseUrl;
            return this;
        }

        public Builder externalToolId(int externalToolId) {
            this.externalToolId = externalToolId;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder transcriptLanguage(String transcriptLanguage) {
            this.transcriptLanguage = transcriptLanguage;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
