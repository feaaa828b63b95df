package io.vodsync.manifest;

import io.vodsync.VodSyncException;
import io.vodsync.catalog.Course;
import io.vodsync.catalog.Subject;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Turns a selection of subjects and courses into download jobs and subtitle files.
 *
 * <p>
 * Output paths are {@code {subject}/{course}_{channel}.{ext}} and {@code {subject}/{course}_0.srt}, built from
 * display names. Two courses with the same name therefore map to the same path; such jobs are still emitted and the
 * download agent, which never overwrites, keeps whichever finishes first.
 * </p>
 */
public final class ManifestBuilder {

    private static final Logger LOGGER = Logger.getLogger(ManifestBuilder.class.getName());

    /**
     * Builds jobs only; no transcripts are fetched.
     */
    public Manifest build(Map<Long, ? extends Collection<Long>> selection, List<Subject> subjects,
                          boolean includeSecondary) {
        try {
            return build(selection, subjects, includeSecondary, null);
        } catch (VodSyncException ex) {
            throw new IllegalStateException("unreachable without a transcript source", ex);
        }
    }

    /**
     * @param selection        subject id to selected course ids; iteration order is kept in the output.
     * @param subjects         known subjects with resolved courses.
     * @param includeSecondary whether the screen capture channel is downloaded as well.
     * @param transcripts      source for subtitle files, or {@code null} to skip them.
     * @throws VodSyncException when fetching a transcript fails.
     */
    public Manifest build(Map<Long, ? extends Collection<Long>> selection, List<Subject> subjects,
                          boolean includeSecondary, TranscriptSource transcripts) throws VodSyncException {
        Set<DownloadJob> jobs = new LinkedHashSet<>();
        List<SubtitleFile> subtitles = new ArrayList<>();
        Set<String> paths = new LinkedHashSet<>();

        for (Map.Entry<Long, ? extends Collection<Long>> entry : selection.entrySet()) {
            Optional<Subject> found = subjects.stream().filter(s -> s.id() == entry.getKey()).findFirst();
            if (found.isEmpty()) {
                LOGGER.warning(() -> "[vod-sync] selected subject " + entry.getKey() + " is not known; skipped");
                continue;
            }
            Subject subject = found.get();
            for (Long courseId : entry.getValue()) {
                Optional<Course> course = subject.course(courseId);
                if (course.isEmpty()) {
                    LOGGER.warning(() -> String.format(Locale.ROOT,
                        "[vod-sync] course %d is not part of subject %d; skipped", courseId, subject.id()));
                    continue;
                }
                for (DownloadJob job : jobsFor(subject, course.get(), includeSecondary)) {
                    if (jobs.add(job) && !paths.add(job.outputPath())) {
                        LOGGER.warning(() -> "[vod-sync] several downloads target " + job.outputPath());
                    }
                }
                if (transcripts != null) {
                    String path = subject.name() + "/" + course.get().name() + "_" + Course.CHANNEL_CAMERA + ".srt";
                    String content = Subtitles.render(transcripts.transcripts(subject, course.get()));
                    subtitles.add(new SubtitleFile(path, content));
                }
            }
        }
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[vod-sync] manifest has %d downloads and %d subtitle files", jobs.size(), subtitles.size()));
        return new Manifest(new ArrayList<>(jobs), subtitles);
    }

    private static List<DownloadJob> jobsFor(Subject subject, Course course, boolean includeSecondary) {
        if (!course.isResolved()) {
            LOGGER.fine(() -> "[vod-sync] course " + course.id() + " has no media yet");
            return List.of();
        }
        List<DownloadJob> jobs = new ArrayList<>();
        for (Map.Entry<Integer, String> url : new TreeMap<>(course.downloadUrls()).entrySet()) {
            int channel = url.getKey();
            if (url.getValue() == null || url.getValue().isBlank()) {
                continue;
            }
            if (channel != Course.CHANNEL_CAMERA && !includeSecondary) {
                continue;
            }
            String path = String.format(Locale.ROOT, "%s/%s_%d.%s",
                subject.name(), course.name(), channel, extension(url.getValue()));
            jobs.add(new DownloadJob(url.getValue(), path, channel));
        }
        return jobs;
    }

    /**
     * @return the text after the last {@code .} of the URL with its query removed.
     */
    static String extension(String url) {
        int query = url.indexOf('?');
        String base = query < 0 ? url : url.substring(0, query);
        return base.substring(base.lastIndexOf('.') + 1);
    }
}
