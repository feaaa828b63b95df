package io.vodsync.catalog;

/**
 * One timed line of a course transcript. Offsets are milliseconds from the start of the recording.
 */
public record TranscriptSegment(long startMs, long endMs, String text) {
}
