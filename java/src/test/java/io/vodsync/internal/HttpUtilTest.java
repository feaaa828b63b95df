package io.vodsync.internal;

import io.vodsync.DataShapeException;
import io.vodsync.TransportException;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HttpUtilTest {

    @Test
    void formEncodingRepeatsMultiValuedKeys() {
        Map<String, List<String>> fields = new LinkedHashMap<>();
        fields.put("user", List.of("a b"));
        fields.put("scope", List.of("x", "y&z"));

        assertEquals("user=a+b&scope=x&scope=y%26z", HttpUtil.formEncode(fields));
    }

    @Test
    void parsesQueriesInOrder() {
        Map<String, List<String>> params = HttpUtil.parseQuery("b=2&a=1&a=%20x&flag&=v");

        assertEquals(List.of("b", "a", "flag", ""), List.copyOf(params.keySet()));
        assertEquals(List.of("1", " x"), params.get("a"));
        assertEquals(List.of(""), params.get("flag"));
        assertTrue(HttpUtil.parseQuery(null).isEmpty());
    }

    @Test
    void jsonPostCarriesTokenHeader() throws DataShapeException {
        HttpRequest request = HttpUtil.jsonPost("http://localhost/x", Map.of("k", 1), "tok", Duration.ofSeconds(2));

        assertEquals("POST", request.method());
        assertEquals("tok", request.headers().firstValue(HttpUtil.TOKEN_HEADER).orElseThrow());
        assertEquals("application/json", request.headers().firstValue("Content-Type").orElseThrow());
        assertEquals(Duration.ofSeconds(2), request.timeout().orElseThrow());
    }

    @Test
    void unreachableHostIsAnIoFailure() {
        HttpRequest request = HttpUtil.newRequest("http://127.0.0.1:1/", Duration.ofSeconds(2)).GET().build();

        TransportException ex = assertThrows(TransportException.class,
            () -> HttpUtil.send(HttpClient.newHttpClient(), request, "probe"));
        assertEquals(-1, ex.getStatusCode());
        assertNotEquals(TransportException.Kind.HTTP_STATUS, ex.getKind());
    }
}
