package io.vodsync.manifest;

/**
 * Rendered SRT text and the path, relative to the manifest directory, it belongs at.
 */
public record SubtitleFile(String outputPath, String content) {
}
