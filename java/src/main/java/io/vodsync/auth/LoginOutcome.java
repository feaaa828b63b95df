package io.vodsync.auth;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Classified {@code ulogin} response.
 */
public record LoginOutcome(Status status, String payload) {

    static final String WRONG_CREDENTIALS = "WRONG_USER_OR_PASSWORD";
    static final String WRONG_CAPTCHA = "WRONG_CAPTCHA";

    public enum Status {
        SUCCESS,
        BAD_CREDENTIALS,
        BAD_CAPTCHA,
        UNKNOWN
    }

    public static LoginOutcome of(JsonNode response) {
        String payload = response.toString();
        if (response.path("errno").asInt(1) == 0) {
            return new LoginOutcome(Status.SUCCESS, payload);
        }
        String code = response.path("code").asText("");
        if (WRONG_CREDENTIALS.equals(code)) {
            return new LoginOutcome(Status.BAD_CREDENTIALS, payload);
        }
        if (WRONG_CAPTCHA.equals(code)) {
            return new LoginOutcome(Status.BAD_CAPTCHA, payload);
        }
        return new LoginOutcome(Status.UNKNOWN, payload);
    }
}
