package io.vodsync.auth;

import io.vodsync.Config;
import io.vodsync.DataShapeException;
import io.vodsync.internal.HttpUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.io.OutputStream;
import java.net.HttpCookie;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import static org.junit.jupiter.api.Assertions.*;

class AuthSessionTest {

    private static final String LOGIN_PAGE = "/jaccount/jalogin";
    private static final byte[] CAPTCHA = {1, 2, 3};

    private HttpServer identityProvider;
    private HttpServer canvas;
    private Config config;

    private final AtomicInteger captchaFetches = new AtomicInteger();
    private final List<String> captchaReferers = Collections.synchronizedList(new ArrayList<>());
    private final List<Map<String, List<String>>> submissions = Collections.synchronizedList(new ArrayList<>());
    private final Deque<String> loginResponses = new ConcurrentLinkedDeque<>();

    @BeforeEach
    void setUp() throws IOException {
        identityProvider = HttpServer.create(new InetSocketAddress(0), 0);
        canvas = HttpServer.create(new InetSocketAddress(0), 0);
        String idpBase = "http://localhost:" + identityProvider.getAddress().getPort();
        String canvasBase = "http://localhost:" + canvas.getAddress().getPort();

        identityProvider.createContext(LOGIN_PAGE, exchange -> respond(exchange, 200, "text/html",
            "<html><body><a id=\"firefox_link\" href=\"" + idpBase
                + "/jaccount/jalogin?uuid=5f3c-uuid&amp;browser=ff\">Firefox</a></body></html>"));
        identityProvider.createContext(AuthSession.CAPTCHA_PATH, exchange -> {
            captchaFetches.incrementAndGet();
            captchaReferers.add(exchange.getRequestHeaders().getFirst("Referer"));
            exchange.getResponseHeaders().add("Content-Type", "image/png");
            exchange.sendResponseHeaders(200, CAPTCHA.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(CAPTCHA);
            }
        });
        identityProvider.createContext(AuthSession.LOGIN_PATH, exchange -> {
            String form = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            submissions.add(HttpUtil.parseQuery(form));
            String response = loginResponses.isEmpty() ? "{\"errno\":0}" : loginResponses.poll();
            if (response.contains("\"errno\":0")) {
                exchange.getResponseHeaders().add("Set-Cookie", Session.AUTH_COOKIE + "=fresh-cookie; Path=/");
            }
            respond(exchange, 200, "application/json", response);
        });

        canvas.createContext("/login/openid_connect", exchange -> {
            String cookies = exchange.getRequestHeaders().getFirst("Cookie");
            if (cookies != null && cookies.contains(Session.AUTH_COOKIE + "=")) {
                respond(exchange, 200, "text/html", "<html>dashboard</html>");
            } else {
                exchange.getResponseHeaders().add("Location", idpBase + LOGIN_PAGE + "?sid=abc&client=canvas");
                exchange.sendResponseHeaders(302, -1);
                exchange.close();
            }
        });

        identityProvider.start();
        canvas.start();
        config = Config.builder()
            .identityProviderUrl(idpBase)
            .clientUrl(canvasBase + "/login/openid_connect")
            .canvasBaseUrl(canvasBase)
            .httpTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    void tearDown() {
        if (identityProvider != null) {
            identityProvider.stop(0);
        }
        if (canvas != null) {
            canvas.stop(0);
        }
    }

    @Test
    void wrongCaptchaRefetchesImageAndKeepsCredentials() throws Exception {
        loginResponses.add("{\"errno\":1,\"code\":\"WRONG_CAPTCHA\"}");
        loginResponses.add("{\"errno\":1,\"code\":\"WRONG_CAPTCHA\"}");
        ScriptedOperator operator = new ScriptedOperator("alice");
        RecordingStore store = new RecordingStore(null);

        Session session = new AuthSession(config, operator, store).authenticate();

        assertEquals(3, captchaFetches.get());
        assertEquals(1, operator.usernamePrompts);
        assertEquals(1, operator.passwordPrompts);
        assertEquals(3, submissions.size());
        for (Map<String, List<String>> form : submissions) {
            assertEquals(List.of("alice"), form.get("user"));
            assertEquals(List.of("secret"), form.get("pass"));
            assertEquals(List.of("p"), form.get("lt"));
            assertEquals(List.of("5f3c-uuid"), form.get("uuid"));
            assertEquals(List.of("abc"), form.get("sid"));
        }
        assertTrue(captchaReferers.get(0).endsWith(LOGIN_PAGE + "?sid=abc&client=canvas"));
        assertEquals("fresh-cookie", session.cookie(Session.AUTH_COOKIE).orElseThrow().getValue());
        assertEquals("fresh-cookie", store.saved.getValue());
    }

    @Test
    void wrongPasswordPromptsAgainWithPreviousUsername() throws Exception {
        loginResponses.add("{\"errno\":1,\"code\":\"WRONG_USER_OR_PASSWORD\"}");
        ScriptedOperator operator = new ScriptedOperator("alice", "");

        new AuthSession(config, operator, new RecordingStore(null)).authenticate();

        assertEquals(2, operator.usernamePrompts);
        assertEquals(List.of("alice"), operator.previousSeen.subList(1, 2));
        assertEquals(2, operator.passwordPrompts);
        assertEquals(2, captchaFetches.get());
        assertEquals(List.of("alice"), submissions.get(1).get("user"));
    }

    @Test
    void storedCookieSkipsTheLogin() throws Exception {
        HttpCookie stored = new HttpCookie(Session.AUTH_COOKIE, "stored-cookie");
        ScriptedOperator operator = new ScriptedOperator();
        RecordingStore store = new RecordingStore(stored);

        Session session = new AuthSession(config, operator, store).authenticate();

        assertEquals(0, operator.usernamePrompts);
        assertEquals(0, captchaFetches.get());
        assertTrue(submissions.isEmpty());
        assertNull(store.saved);
        assertTrue(session.cookie(Session.AUTH_COOKIE).isPresent());
    }

    @Test
    void unknownErrorAborts() {
        loginResponses.add("{\"errno\":1,\"code\":\"ACCOUNT_LOCKED\",\"error\":\"locked\"}");
        ScriptedOperator operator = new ScriptedOperator("alice");

        AuthException ex = assertThrows(AuthException.class,
            () -> new AuthSession(config, operator, new RecordingStore(null)).authenticate());
        assertEquals(AuthException.Reason.UNKNOWN, ex.getReason());
        assertTrue(ex.getPayload().contains("ACCOUNT_LOCKED"));
    }

    @Test
    @Timeout(value = 5, threadMode = Timeout.ThreadMode.SEPARATE_THREAD)
    void closedInputCancelsTheLogin() {
        Operator closed = new Operator() {
            @Override
            public String username(String previous) {
                return null;
            }

            @Override
            public String password(String username) {
                return null;
            }

            @Override
            public String captcha(byte[] image) {
                return null;
            }
        };

        AuthException ex = assertThrows(AuthException.class,
            () -> new AuthSession(config, closed, new RecordingStore(null)).authenticate());
        assertEquals(AuthException.Reason.CANCELLED, ex.getReason());
        assertEquals(0, captchaFetches.get());
        assertTrue(submissions.isEmpty());
    }

    @Test
    void closedInputAtCaptchaPromptCancelsTheLogin() {
        ScriptedOperator operator = new ScriptedOperator("alice") {
            @Override
            public String captcha(byte[] image) {
                return null;
            }
        };

        AuthException ex = assertThrows(AuthException.class,
            () -> new AuthSession(config, operator, new RecordingStore(null)).authenticate());
        assertEquals(AuthException.Reason.CANCELLED, ex.getReason());
        assertEquals(1, captchaFetches.get());
        assertTrue(submissions.isEmpty());
    }

    @Test
    void challengeNeedsTheUuidAnchor() throws Exception {
        ChallengeContext context = AuthSession.parseChallenge(
            "<a id=\"firefox_link\" href=\"/jaccount/jalogin?uuid=u-1\">x</a>",
            "https://idp.example/jaccount/jalogin?sid=s&client=c");
        assertEquals("u-1", context.uuid());
        assertEquals(List.of("sid", "client"), List.copyOf(context.queryParams().keySet()));

        assertThrows(DataShapeException.class,
            () -> AuthSession.parseChallenge("<html></html>", "https://idp.example/jaccount/jalogin"));
        assertThrows(DataShapeException.class,
            () -> AuthSession.parseChallenge("<a id=\"firefox_link\" href=\"/x?y=1\">x</a>",
                "https://idp.example/jaccount/jalogin"));
    }

    private static class ScriptedOperator implements Operator {
        private final Deque<String> usernames = new ConcurrentLinkedDeque<>();
        private final List<String> previousSeen = new ArrayList<>();
        int usernamePrompts;
        int passwordPrompts;

        ScriptedOperator(String... usernames) {
            this.usernames.addAll(List.of(usernames));
        }

        @Override
        public String username(String previous) {
            usernamePrompts++;
            previousSeen.add(previous);
            return usernames.isEmpty() ? "" : usernames.poll();
        }

        @Override
        public String password(String username) {
            passwordPrompts++;
            return "secret";
        }

        @Override
        public String captcha(byte[] image) {
            assertArrayEquals(CAPTCHA, image);
            return " ab12 ";
        }
    }

    private static final class RecordingStore implements CredentialStore {
        private final HttpCookie stored;
        HttpCookie saved;

        RecordingStore(HttpCookie stored) {
            this.stored = stored;
        }

        @Override
        public Optional<HttpCookie> load() {
            return Optional.ofNullable(stored);
        }

        @Override
        public void save(HttpCookie cookie) {
            saved = cookie;
        }
    }

    private static void respond(HttpExchange exchange, int status, String contentType, String body)
        throws IOException {
        exchange.getResponseHeaders().add("Content-Type", contentType);
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
