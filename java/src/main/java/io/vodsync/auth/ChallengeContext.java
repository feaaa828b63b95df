package io.vodsync.auth;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State captured from the jAccount login page: the page URL (used as captcha referer), the captcha scope
 * {@code uuid}, and the page's own query parameters, which are echoed back on submission.
 */
public record ChallengeContext(String url, String uuid, Map<String, List<String>> queryParams) {

    public ChallengeContext {
        queryParams = Collections.unmodifiableMap(new LinkedHashMap<>(queryParams));
    }

    /**
     * Builds the {@code ulogin} form: credentials first, then {@code uuid}, then the login page query parameters
     * (which win on a key clash).
     */
    public Map<String, List<String>> loginFields(String user, String password, String captcha) {
        Map<String, List<String>> fields = new LinkedHashMap<>();
        fields.put("user", List.of(user));
        fields.put("pass", List.of(password));
        fields.put("captcha", List.of(captcha));
        fields.put("lt", List.of("p"));
        fields.put("uuid", List.of(uuid));
        fields.putAll(queryParams);
        return fields;
    }
}
