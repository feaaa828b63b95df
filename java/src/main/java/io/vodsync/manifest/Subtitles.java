package io.vodsync.manifest;

import io.vodsync.catalog.TranscriptSegment;

import java.util.List;
import java.util.Locale;

/**
 * SRT rendering.
 */
public final class Subtitles {

    private Subtitles() {
    }

    /**
     * Formats a millisecond offset as {@code HH:MM:SS,mmm}. Hours are not wrapped at 24 and widen past 99.
     */
    public static String formatTimestamp(long ms) {
        if (ms < 0) {
            throw new IllegalArgumentException("negative timestamp: " + ms);
        }
        long hours = ms / 3_600_000;
        long rest = ms % 3_600_000;
        long minutes = rest / 60_000;
        rest %= 60_000;
        long seconds = rest / 1000;
        long millis = rest % 1000;
        return String.format(Locale.ROOT, "%02d:%02d:%02d,%03d", hours, minutes, seconds, millis);
    }

    /**
     * Renders segments as numbered SRT cues. Line breaks inside a segment become spaces; no trailing blank line.
     */
    public static String render(List<TranscriptSegment> segments) {
        StringBuilder srt = new StringBuilder();
        int index = 1;
        for (TranscriptSegment segment : segments) {
            String text = segment.text() == null ? "" : segment.text().replace("\n", " ").strip();
            srt.append(index++).append('\n')
                .append(formatTimestamp(segment.startMs())).append(" --> ").append(formatTimestamp(segment.endMs()))
                .append('\n')
                .append(text).append("\n\n");
        }
        return srt.toString().strip();
    }
}
