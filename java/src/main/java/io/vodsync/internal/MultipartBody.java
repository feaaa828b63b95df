package io.vodsync.internal;

import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Minimal {@code multipart/form-data} encoder for plain text fields.
 */
public final class MultipartBody {

    private final String boundary;
    private final Map<String, String> fields = new LinkedHashMap<>();

    public MultipartBody() {
        this("----vodsync" + UUID.randomUUID().toString().replace("-", ""));
    }

    MultipartBody(String boundary) {
        this.boundary = boundary;
    }

    public MultipartBody field(String name, String value) {
        fields.put(name, value == null ? "" : value);
        return this;
    }

    public String contentType() {
        return "multipart/form-data; boundary=" + boundary;
    }

    public String encode() {
        StringBuilder body = new StringBuilder();
        for (Map.Entry<String, String> entry : fields.entrySet()) {
            body.append("--").append(boundary).append("\r\n")
                .append("Content-Disposition: form-data; name=\"").append(entry.getKey()).append("\"\r\n\r\n")
                .append(entry.getValue()).append("\r\n");
        }
        body.append("--").append(boundary).append("--\r\n");
        return body.toString();
    }

    public HttpRequest.BodyPublisher publisher() {
        return HttpRequest.BodyPublishers.ofString(encode(), StandardCharsets.UTF_8);
    }
}
