package io.vodsync.internal;

import com.fasterxml.jackson.databind.JsonNode;
import io.vodsync.DataShapeException;
import io.vodsync.TransportException;

import java.io.IOException;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;

/**
 * Utility for turning raw responses into JSON trees or transport errors.
 */
public final class ResponseDecoder {

    private ResponseDecoder() {
    }

    public static TransportException decode(HttpResponse<byte[]> response) {
        return new TransportException(response.statusCode(), response.uri().toString(), text(response));
    }

    public static String text(HttpResponse<byte[]> response) {
        byte[] bytes = response.body();
        if (bytes == null || bytes.length == 0) {
            return "";
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Parses the response body as JSON.
     *
     * @throws DataShapeException when the body is empty or not JSON.
     */
    public static JsonNode readJson(HttpResponse<byte[]> response, String action) throws DataShapeException {
        byte[] bytes = response.body();
        if (bytes == null || bytes.length == 0) {
            throw new DataShapeException(action + ": empty response body");
        }
        try {
            return Json.mapper().readTree(bytes);
        } catch (IOException ex) {
            throw new DataShapeException(action + ": response is not JSON: " + ex.getMessage(), ex);
        }
    }
}
