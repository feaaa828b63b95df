package io.vodsync.auth;

import io.vodsync.Config;
import io.vodsync.internal.HttpUtil;

import java.net.CookieManager;
import java.net.HttpCookie;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.Objects;
import java.util.Optional;

/**
 * Authenticated browser-like context: a cookie jar plus the HTTP clients bound to it. Instances come from
 * {@link AuthSession#authenticate()}; there is no lazily created default session.
 */
public final class Session {

    /**
     * Name of the jAccount cookie that lets a later run skip the interactive login.
     */
    public static final String AUTH_COOKIE = "JAAuthCookie";

    private final Config config;
    private final CookieManager cookies;
    private final HttpClient client;
    private final HttpClient nonRedirectingClient;

    Session(Config config, CookieManager cookies) {
        this.config = Objects.requireNonNull(config, "config");
        this.cookies = Objects.requireNonNull(cookies, "cookies");
        this.client = HttpClient.newBuilder()
            .cookieHandler(cookies)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(config.getHttpTimeout())
            .build();
        this.nonRedirectingClient = HttpClient.newBuilder()
            .cookieHandler(cookies)
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(config.getHttpTimeout())
            .build();
    }

    public Config config() {
        return config;
    }

    /**
     * @return client following redirects and sharing this session's cookies.
     */
    public HttpClient client() {
        return client;
    }

    /**
     * @return client that hands 3xx responses back to the caller; shares this session's cookies.
     */
    public HttpClient nonRedirectingClient() {
        return nonRedirectingClient;
    }

    /**
     * Request builder carrying the configured timeout and browser user agent.
     */
    public HttpRequest.Builder request(String url) {
        return HttpUtil.newRequest(url, config.getHttpTimeout())
            .header("User-Agent", config.getUserAgent());
    }

    public Optional<HttpCookie> cookie(String name) {
        return cookies.getCookieStore().getCookies().stream()
            .filter(c -> c.getName().equals(name))
            .filter(c -> !c.hasExpired())
            .findFirst();
    }

    CookieManager cookieManager() {
        return cookies;
    }
}
