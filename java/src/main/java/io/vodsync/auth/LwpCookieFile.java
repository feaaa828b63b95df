package io.vodsync.auth;

import io.vodsync.VodSyncException;

import java.io.IOException;
import java.net.HttpCookie;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link CredentialStore} backed by a libwww-perl ({@code #LWP-Cookies-2.0}) cookie file holding only
 * {@value Session#AUTH_COOKIE}.
 */
public final class LwpCookieFile implements CredentialStore {

    private static final Logger LOGGER = Logger.getLogger(LwpCookieFile.class.getName());

    static final String MAGIC = "#LWP-Cookies-2.0";
    private static final String PREFIX = "Set-Cookie3:";
    private static final DateTimeFormatter EXPIRES =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss'Z'", Locale.ROOT).withZone(ZoneOffset.UTC);

    private final Path path;

    public LwpCookieFile(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    @Override
    public Optional<HttpCookie> load() {
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "[vod-sync] cannot read cookie file " + path + "; falling back to login", ex);
            return Optional.empty();
        }
        if (lines.isEmpty() || !lines.get(0).trim().startsWith(MAGIC)) {
            LOGGER.warning(() -> "[vod-sync] " + path + " is not an LWP cookie file; ignoring it");
            return Optional.empty();
        }
        for (String line : lines) {
            if (!line.startsWith(PREFIX)) {
                continue;
            }
            HttpCookie cookie = parse(line.substring(PREFIX.length()));
            if (cookie != null && Session.AUTH_COOKIE.equals(cookie.getName())
                && !cookie.getValue().isEmpty() && !cookie.hasExpired()) {
                return Optional.of(cookie);
            }
        }
        return Optional.empty();
    }

    @Override
    public void save(HttpCookie cookie) throws VodSyncException {
        Objects.requireNonNull(cookie, "cookie");
        StringBuilder out = new StringBuilder(MAGIC).append('\n');
        out.append(PREFIX).append(' ').append(format(cookie)).append('\n');
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, out.toString(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new VodSyncException("write cookie file " + path + ": " + ex.getMessage(), ex);
        }
        LOGGER.info(() -> "[vod-sync] cookies saved to " + path);
    }

    static String format(HttpCookie cookie) {
        StringBuilder line = new StringBuilder();
        line.append(cookie.getName()).append('=').append(quote(cookie.getValue()));
        line.append("; path=").append(quote(cookie.getPath() == null ? "/" : cookie.getPath()));
        if (cookie.getDomain() != null) {
            line.append("; domain=").append(quote(cookie.getDomain()));
        }
        line.append("; path_spec");
        if (cookie.getSecure()) {
            line.append("; secure");
        }
        if (cookie.getMaxAge() > 0) {
            Instant expiry = Instant.now().plusSeconds(cookie.getMaxAge());
            line.append("; expires=").append(quote(EXPIRES.format(expiry)));
        } else {
            line.append("; discard");
        }
        line.append("; version=0");
        return line.toString();
    }

    static HttpCookie parse(String attributes) {
        String[] parts = attributes.split(";");
        String first = parts[0].trim();
        int eq = first.indexOf('=');
        if (eq <= 0) {
            return null;
        }
        HttpCookie cookie = new HttpCookie(first.substring(0, eq).trim(), unquote(first.substring(eq + 1).trim()));
        cookie.setVersion(0);
        cookie.setPath("/");
        for (int i = 1; i < parts.length; i++) {
            String part = parts[i].trim();
            int sep = part.indexOf('=');
            String key = (sep < 0 ? part : part.substring(0, sep)).trim().toLowerCase(Locale.ROOT);
            String value = sep < 0 ? "" : unquote(part.substring(sep + 1).trim());
            switch (key) {
                case "path" -> cookie.setPath(value);
                case "domain" -> cookie.setDomain(value);
                case "secure" -> cookie.setSecure(true);
                case "expires" -> applyExpiry(cookie, value);
                default -> {
                    // path_spec, discard, version and HttpOnly carry nothing the login needs
                }
            }
        }
        return cookie;
    }

    private static void applyExpiry(HttpCookie cookie, String value) {
        try {
            long seconds = Instant.now().until(Instant.from(EXPIRES.parse(value)), ChronoUnit.SECONDS);
            cookie.setMaxAge(Math.max(seconds, 0));
        } catch (DateTimeParseException ex) {
            LOGGER.fine(() -> "[vod-sync] unparseable cookie expiry '" + value + "'; treating as session cookie");
        }
    }

    private static String quote(String value) {
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1).replace("\\\"", "\"").replace("\\\\", "\\");
        }
        return value;
    }
}
