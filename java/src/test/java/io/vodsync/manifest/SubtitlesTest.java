package io.vodsync.manifest;

import io.vodsync.catalog.TranscriptSegment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SubtitlesTest {

    @Test
    void formatsTimestampWithMillis() {
        assertEquals("01:02:03,045", Subtitles.formatTimestamp(3_723_045));
        assertEquals("00:00:00,000", Subtitles.formatTimestamp(0));
        assertEquals("00:00:59,999", Subtitles.formatTimestamp(59_999));
    }

    @Test
    void hoursAreNotWrapped() {
        assertEquals("25:00:00,000", Subtitles.formatTimestamp(25L * 3_600_000));
        assertEquals("100:00:00,001", Subtitles.formatTimestamp(100L * 3_600_000 + 1));
    }

    @Test
    void rejectsNegativeOffsets() {
        assertThrows(IllegalArgumentException.class, () -> Subtitles.formatTimestamp(-1));
    }

    @Test
    void rendersNumberedCuesWithoutTrailingBlankLine() {
        String srt = Subtitles.render(List.of(
            new TranscriptSegment(0, 1500, "a\nb"),
            new TranscriptSegment(1500, 3000, "  second  ")));

        assertEquals("1\n00:00:00,000 --> 00:00:01,500\na b\n\n"
            + "2\n00:00:01,500 --> 00:00:03,000\nsecond", srt);
    }

    @Test
    void emptyTranscriptRendersEmptyText() {
        assertEquals("", Subtitles.render(List.of()));
    }
}
