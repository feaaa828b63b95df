package io.vodsync;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

    @Test
    void appliesDefaultsForOptionalFields() {
        Config config = Config.defaults();

        assertEquals(Config.DEFAULT_IDENTITY_PROVIDER_URL, config.getIdentityProviderUrl());
        assertEquals(Config.DEFAULT_CLIENT_URL, config.getClientUrl());
        assertEquals(Config.DEFAULT_CANVAS_BASE_URL, config.getCanvasBaseUrl());
        assertEquals(Config.DEFAULT_VIDEO_BASE_URL, config.getVideoBaseUrl());
        assertEquals(8329, config.getExternalToolId());
        assertEquals(Duration.ofSeconds(10), config.getHttpTimeout());
        assertEquals("res", config.getTranscriptLanguage());
        assertEquals(Config.DEFAULT_USER_AGENT, config.getUserAgent());
        assertNotNull(config.getHttpClient());
    }

    @Test
    void rejectsInvalidUrls() {
        Config.Builder builder = Config.builder().videoBaseUrl("invalid");

        assertThrows(IllegalArgumentException.class, builder::build);
        assertThrows(IllegalArgumentException.class, () -> Config.builder().canvasBaseUrl("  ").build());
    }

    @Test
    void stripsTrailingSlashAndFallsBackOnBadValues() {
        Config config = Config.builder()
            .canvasBaseUrl("https://canvas.example.org/ ")
            .httpTimeout(Duration.ZERO)
            .externalToolId(-1)
            .userAgent("   ")
            .transcriptLanguage("")
            .build();

        assertEquals("https://canvas.example.org", config.getCanvasBaseUrl());
        assertEquals(Config.DEFAULT_HTTP_TIMEOUT, config.getHttpTimeout());
        assertEquals(Config.DEFAULT_EXTERNAL_TOOL_ID, config.getExternalToolId());
        assertEquals(Config.DEFAULT_USER_AGENT, config.getUserAgent());
        assertEquals(Config.DEFAULT_TRANSCRIPT_LANGUAGE, config.getTranscriptLanguage());
    }

    @Test
    void honoursCustomValues() {
        Config config = Config.builder()
            .httpTimeout(Duration.ofSeconds(3))
            .externalToolId(77)
            .transcriptLanguage("en")
            .build();

        assertEquals(Duration.ofSeconds(3), config.getHttpTimeout());
        assertEquals(77, config.getExternalToolId());
        assertEquals("en", config.getTranscriptLanguage());
    }
}
