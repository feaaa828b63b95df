package io.vodsync.auth;

import com.fasterxml.jackson.databind.JsonNode;
import io.vodsync.Config;
import io.vodsync.DataShapeException;
import io.vodsync.VodSyncException;
import io.vodsync.internal.HttpUtil;
import io.vodsync.internal.ResponseDecoder;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.HttpCookie;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * <p>
 * Performs the jAccount password login and hands back an authenticated {@link Session}.
 * </p>
 *
 * <h2>Flow</h2>
 * <ol>
 *   <li>Probe the client URL with any stored {@value Session#AUTH_COOKIE}. Ending up anywhere but the identity
 *       provider means the cookie is still good.</li>
 *   <li>Otherwise scrape the captcha {@code uuid} from the login page and ask the {@link Operator} for credentials.</li>
 *   <li>Fetch a captcha, ask for its transcription, and submit. A wrong captcha fetches a fresh image and asks
 *       again; wrong credentials go back to the credential prompt with the username pre-filled.</li>
 *   <li>On success re-request the client URL so the relying party sets its own cookies, then persist the
 *       authentication cookie.</li>
 * </ol>
 *
 * <p>
 * Transport failures are fatal at every step; only operator mistakes are retried, and only the failed sub-step is
 * redone.
 * </p>
 */
public final class AuthSession {

    private static final Logger LOGGER = Logger.getLogger(AuthSession.class.getName());

    static final String LOGIN_PATH = "/jaccount/ulogin";
    static final String CAPTCHA_PATH = "/jaccount/captcha";
    static final String UUID_ANCHOR = "a#firefox_link";

    enum State {
        COOKIE_PROBE,
        CREDENTIAL_PROMPT,
        CAPTCHA_CHALLENGE,
        SUBMIT,
        AUTHENTICATED
    }

    private final Config config;
    private final Operator operator;
    private final CredentialStore credentialStore;

    public AuthSession(Config config, Operator operator, CredentialStore credentialStore) {
        this.config = Objects.requireNonNull(config, "config");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.credentialStore = credentialStore == null ? CredentialStore.none() : credentialStore;
    }

    /**
     * Runs the login state machine to completion.
     *
     * @return a session whose cookie jar is accepted by the client URL.
     * @throws AuthException      when the identity provider answers with an unrecognised error or the operator
     *                            stops answering.
     * @throws VodSyncException   on transport failures or an unexpected login page layout.
     */
    public Session authenticate() throws VodSyncException {
        URI identityProvider = URI.create(config.getIdentityProviderUrl());
        CookieManager jar = new CookieManager(null, CookiePolicy.ACCEPT_ALL);
        Optional<HttpCookie> stored = credentialStore.load();
        stored.ifPresent(cookie -> {
            if (cookie.getDomain() == null) {
                cookie.setDomain(identityProvider.getHost());
            }
            if (cookie.getPath() == null) {
                cookie.setPath("/");
            }
            jar.getCookieStore().add(identityProvider, cookie);
        });
        Session session = new Session(config, jar);

        State state = State.COOKIE_PROBE;
        ChallengeContext challenge = null;
        String username = null;
        String password = null;
        String captcha = null;

        while (state != State.AUTHENTICATED) {
            switch (state) {
                case COOKIE_PROBE -> {
                    challenge = probe(session, identityProvider, stored.isPresent());
                    state = challenge == null ? State.AUTHENTICATED : State.CREDENTIAL_PROMPT;
                }
                case CREDENTIAL_PROMPT -> {
                    String answer = answered(operator.username(username), "username");
                    if (!answer.isBlank()) {
                        username = answer.trim();
                    } else if (username == null) {
                        LOGGER.warning("[vod-sync] a username is required");
                        continue;
                    }
                    password = answered(operator.password(username), "password");
                    state = State.CAPTCHA_CHALLENGE;
                }
                case CAPTCHA_CHALLENGE -> {
                    byte[] image = fetchCaptcha(session, challenge);
                    captcha = answered(operator.captcha(image), "captcha");
                    state = State.SUBMIT;
                }
                case SUBMIT -> {
                    LoginOutcome outcome = submit(session, challenge, username, password, captcha);
                    switch (outcome.status()) {
                        case SUCCESS -> {
                            finalizeLogin(session, identityProvider, outcome);
                            state = State.AUTHENTICATED;
                        }
                        case BAD_CREDENTIALS -> {
                            LOGGER.warning("[vod-sync] incorrect username or password");
                            password = null;
                            state = State.CREDENTIAL_PROMPT;
                        }
                        case BAD_CAPTCHA -> {
                            LOGGER.warning("[vod-sync] incorrect captcha");
                            state = State.CAPTCHA_CHALLENGE;
                        }
                        default -> throw new AuthException(AuthException.Reason.UNKNOWN,
                            "identity provider rejected the login", outcome.payload());
                    }
                }
                default -> throw new IllegalStateException("unexpected state " + state);
            }
        }

        if (challenge != null) {
            persistCookie(session);
        }
        return session;
    }

    private static String answered(String answer, String prompt) throws AuthException {
        if (answer == null) {
            throw new AuthException(AuthException.Reason.CANCELLED, "no " + prompt + " given, login cancelled", null);
        }
        return answer;
    }

    /**
     * @return {@code null} when the session is already authenticated, otherwise the login page context.
     */
    private ChallengeContext probe(Session session, URI identityProvider, boolean cookieLoaded)
        throws VodSyncException {
        HttpRequest request = session.request(config.getClientUrl()).GET().build();
        HttpResponse<byte[]> response = HttpUtil.sendChecked(session.client(), request, "probe client url");

        URI landed = response.uri();
        if (!Objects.equals(landed.getRawAuthority(), identityProvider.getRawAuthority())) {
            LOGGER.info(() -> cookieLoaded
                ? "[vod-sync] logged in with stored cookie"
                : "[vod-sync] client accepted the session without a login");
            return null;
        }

        LOGGER.info("[vod-sync] login required, please proceed with authentication");
        return parseChallenge(ResponseDecoder.text(response), landed.toString());
    }

    static ChallengeContext parseChallenge(String html, String pageUrl) throws DataShapeException {
        Document document = Jsoup.parse(html, pageUrl);
        Element anchor = document.selectFirst(UUID_ANCHOR);
        if (anchor == null) {
            throw new DataShapeException("login page has no " + UUID_ANCHOR + " anchor");
        }
        String href = anchor.absUrl("href");
        if (href.isEmpty()) {
            href = anchor.attr("href");
        }
        String query;
        try {
            query = URI.create(href).getRawQuery();
        } catch (IllegalArgumentException ex) {
            throw new DataShapeException("login page anchor has a malformed href: " + href, ex);
        }
        List<String> uuid = HttpUtil.parseQuery(query).get("uuid");
        if (uuid == null || uuid.isEmpty() || uuid.get(0).isBlank()) {
            throw new DataShapeException("login page anchor carries no uuid: " + href);
        }
        Map<String, List<String>> params = HttpUtil.parseQuery(URI.create(pageUrl).getRawQuery());
        return new ChallengeContext(pageUrl, uuid.get(0), params);
    }

    private byte[] fetchCaptcha(Session session, ChallengeContext challenge) throws VodSyncException {
        String url = config.getIdentityProviderUrl() + CAPTCHA_PATH
            + "?uuid=" + URLEncoder.encode(challenge.uuid(), StandardCharsets.UTF_8)
            + "&t=" + System.currentTimeMillis();
        HttpRequest request = session.request(url)
            .header("Referer", challenge.url())
            .GET()
            .build();
        byte[] image = HttpUtil.sendChecked(session.client(), request, "fetch captcha").body();
        LOGGER.fine(() -> "[vod-sync] captcha image received (" + image.length + " bytes)");
        return image;
    }

    private LoginOutcome submit(Session session, ChallengeContext challenge, String username, String password,
                                String captcha) throws VodSyncException {
        String form = HttpUtil.formEncode(challenge.loginFields(
            username,
            password == null ? "" : password,
            captcha == null ? "" : captcha.trim()));
        HttpRequest request = session.request(config.getIdentityProviderUrl() + LOGIN_PATH)
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString(form))
            .build();
        HttpResponse<byte[]> response = HttpUtil.sendChecked(session.client(), request, "submit login");
        JsonNode body = ResponseDecoder.readJson(response, "decode login response");
        return LoginOutcome.of(body);
    }

    private void finalizeLogin(Session session, URI identityProvider, LoginOutcome outcome)
        throws VodSyncException {
        HttpRequest request = session.request(config.getClientUrl()).GET().build();
        HttpResponse<byte[]> response = HttpUtil.sendChecked(session.client(), request, "finalise login");
        if (Objects.equals(response.uri().getRawAuthority(), identityProvider.getRawAuthority())) {
            throw new AuthException(AuthException.Reason.SESSION_EXPIRED,
                "login accepted but the client still redirects to the identity provider", outcome.payload());
        }
        LOGGER.info("[vod-sync] logged in with password");
    }

    private void persistCookie(Session session) {
        Optional<HttpCookie> cookie = session.cookie(Session.AUTH_COOKIE);
        if (cookie.isEmpty()) {
            LOGGER.warning(() -> "[vod-sync] identity provider did not set " + Session.AUTH_COOKIE + "; nothing to persist");
            return;
        }
        try {
            credentialStore.save(cookie.get());
        } catch (VodSyncException ex) {
            LOGGER.log(Level.WARNING, "[vod-sync] login succeeded but the cookie could not be persisted", ex);
        }
    }
}
