package io.vodsync.manifest;

import io.vodsync.VodSyncException;
import io.vodsync.catalog.Course;
import io.vodsync.catalog.Subject;
import io.vodsync.catalog.TranscriptSegment;

import java.util.List;

/**
 * Supplies transcripts while a manifest is built.
 */
@FunctionalInterface
public interface TranscriptSource {

    List<TranscriptSegment> transcripts(Subject subject, Course course) throws VodSyncException;
}
