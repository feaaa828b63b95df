package io.vodsync.auth;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Auto-submitting HTML form found at each LTI hop.
 *
 * @param id     the form's {@code id} attribute (empty when absent).
 * @param action absolute action URL.
 * @param fields named input values in document order.
 */
public record RedirectForm(String id, String action, Map<String, String> fields) {

    public RedirectForm {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    Map<String, List<String>> multiValued() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        fields.forEach((name, value) -> out.put(name, List.of(value)));
        return out;
    }
}
