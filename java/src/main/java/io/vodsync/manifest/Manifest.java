package io.vodsync.manifest;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Output of {@link ManifestBuilder}: the download jobs and the subtitle files to write next to them.
 */
public record Manifest(List<DownloadJob> jobs, List<SubtitleFile> subtitles) {

    /**
     * File name the download agent reads its input from.
     */
    public static final String FILE_NAME = "download.txt";

    public Manifest {
        jobs = List.copyOf(jobs);
        subtitles = List.copyOf(subtitles);
    }

    /**
     * @return entries separated by a blank line, in the aria2 input-file format.
     */
    public String text() {
        return jobs.stream()
            .map(DownloadJob::toManifestEntry)
            .collect(Collectors.joining("\n"));
    }
}
