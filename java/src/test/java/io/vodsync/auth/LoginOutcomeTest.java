package io.vodsync.auth;

import io.vodsync.internal.Json;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LoginOutcomeTest {

    @Test
    void classifiesIdentityProviderAnswers() throws Exception {
        assertEquals(LoginOutcome.Status.SUCCESS, outcome("{\"errno\":0,\"url\":\"/x\"}").status());
        assertEquals(LoginOutcome.Status.BAD_CREDENTIALS,
            outcome("{\"errno\":1,\"code\":\"WRONG_USER_OR_PASSWORD\"}").status());
        assertEquals(LoginOutcome.Status.BAD_CAPTCHA, outcome("{\"errno\":1,\"code\":\"WRONG_CAPTCHA\"}").status());
        assertEquals(LoginOutcome.Status.UNKNOWN, outcome("{\"errno\":3,\"code\":\"OTHER\"}").status());
        assertEquals(LoginOutcome.Status.UNKNOWN, outcome("{}").status());
    }

    @Test
    void keepsRawPayload() throws Exception {
        assertTrue(outcome("{\"errno\":9,\"error\":\"boom\"}").payload().contains("boom"));
    }

    @Test
    void loginFieldsEchoPageParameters() {
        ChallengeContext context = new ChallengeContext("https://idp/jalogin?sid=1", "u-1",
            Map.of("sid", List.of("1")));

        Map<String, List<String>> fields = context.loginFields("bob", "pw", "xy");

        assertEquals(List.of("user", "pass", "captcha", "lt", "uuid", "sid"), List.copyOf(fields.keySet()));
        assertEquals(List.of("p"), fields.get("lt"));
    }

    private static LoginOutcome outcome(String json) throws Exception {
        return LoginOutcome.of(Json.mapper().readTree(json));
    }
}
