package io.vodsync.internal;

import io.vodsync.DataShapeException;
import io.vodsync.TransportException;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helper methods for building requests and issuing them with uniform error mapping.
 */
public final class HttpUtil {

    /**
     * Header carrying the subject-scoped bearer token on video service calls.
     */
    public static final String TOKEN_HEADER = "token";

    private HttpUtil() {
    }

    public static HttpRequest.Builder newRequest(String url, Duration timeout) {
        return HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(timeout);
    }

    /**
     * Builds a JSON POST carrying the bearer token in the {@value #TOKEN_HEADER} header.
     */
    public static HttpRequest jsonPost(String url, Object payload, String token, Duration timeout)
        throws DataShapeException {
        byte[] body;
        try {
            body = Json.mapper().writeValueAsBytes(payload);
        } catch (IOException ex) {
            throw new DataShapeException("encode request payload: " + ex.getMessage(), ex);
        }
        HttpRequest.Builder builder = newRequest(url, timeout)
            .POST(HttpRequest.BodyPublishers.ofByteArray(body))
            .header("Content-Type", "application/json")
            .header("Accept", "application/json");
        if (token != null && !token.isBlank()) {
            builder.header(TOKEN_HEADER, token);
        }
        return builder.build();
    }

    public static String formEncode(Map<String, ? extends Collection<String>> fields) {
        StringBuilder form = new StringBuilder();
        for (Map.Entry<String, ? extends Collection<String>> entry : fields.entrySet()) {
            String key = URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8);
            for (String value : entry.getValue()) {
                if (form.length() > 0) {
                    form.append('&');
                }
                form.append(key).append('=').append(URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8));
            }
        }
        return form.toString();
    }

    /**
     * Decodes a raw query string into an ordered multimap. Keys without {@code =} map to an empty value.
     */
    public static Map<String, List<String>> parseQuery(String rawQuery) {
        Map<String, List<String>> params = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.computeIfAbsent(URLDecoder.decode(key, StandardCharsets.UTF_8), k -> new ArrayList<>())
                .add(URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    /**
     * Sends the request, mapping I/O failures and timeouts to {@link TransportException}. The status code is not
     * inspected.
     */
    public static HttpResponse<byte[]> send(HttpClient client, HttpRequest request, String action)
        throws TransportException {
        try {
            return client.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException ex) {
            throw new TransportException(TransportException.Kind.TIMEOUT, action + " timed out", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TransportException(TransportException.Kind.IO, action + " interrupted", ex);
        } catch (IOException ex) {
            throw new TransportException(TransportException.Kind.IO, action + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Like {@link #send(HttpClient, HttpRequest, String)} but fails on any status of 400 or above.
     */
    public static HttpResponse<byte[]> sendChecked(HttpClient client, HttpRequest request, String action)
        throws TransportException {
        HttpResponse<byte[]> response = send(client, request, action);
        if (response.statusCode() >= 400) {
            throw ResponseDecoder.decode(response);
        }
        return response;
    }
}
