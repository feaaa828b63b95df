package io.vodsync;

import io.vodsync.auth.ResourceToken;
import io.vodsync.auth.Session;
import io.vodsync.auth.TokenException;
import io.vodsync.auth.TokenExchange;
import io.vodsync.catalog.Course;
import io.vodsync.catalog.ResourceSync;
import io.vodsync.catalog.Snapshot;
import io.vodsync.catalog.SnapshotStore;
import io.vodsync.catalog.Subject;
import io.vodsync.catalog.SubjectDirectory;
import io.vodsync.catalog.TranscriptSegment;
import io.vodsync.manifest.DownloadAgent;
import io.vodsync.manifest.Manifest;
import io.vodsync.manifest.ManifestBuilder;
import io.vodsync.manifest.SubtitleFile;
import io.vodsync.manifest.TranscriptSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * <p>
 * Keeps the local {@link Snapshot} in step with Canvas and the lecture video service and drives downloads from it.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>{@link #synchronize(Session)} re-lists favourite subjects, exchanges a fresh token for each and updates its
 *       courses. A subject that fails keeps its previous state and is reported; an expired Canvas session aborts the
 *       whole pass since every later subject would fail the same way.</li>
 *   <li>{@link #update()} reuses stored tokens and needs no session.</li>
 *   <li>The snapshot is written after every pass when a snapshot file is configured.</li>
 * </ul>
 *
 * Instances are not thread-safe.
 */
public final class SyncManager {

    private static final Logger LOGGER = Logger.getLogger(SyncManager.class.getName());

    private final Config config;
    private final Path snapshotFile;
    private final SubjectDirectory directory;
    private final TokenExchange tokenExchange;
    private final ResourceSync resourceSync;
    private final ManifestBuilder manifestBuilder;
    private final DownloadAgent downloadAgent;
    private final Clock clock;

    private Snapshot snapshot;

    SyncManager(Config config, Path snapshotFile, Snapshot initial, SubjectDirectory directory,
                TokenExchange tokenExchange, ResourceSync resourceSync, ManifestBuilder manifestBuilder,
                DownloadAgent downloadAgent, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.snapshotFile = snapshotFile;
        this.snapshot = initial == null ? Snapshot.empty() : initial;
        this.directory = Objects.requireNonNull(directory, "directory");
        this.tokenExchange = Objects.requireNonNull(tokenExchange, "tokenExchange");
        this.resourceSync = Objects.requireNonNull(resourceSync, "resourceSync");
        this.manifestBuilder = Objects.requireNonNull(manifestBuilder, "manifestBuilder");
        this.downloadAgent = Objects.requireNonNull(downloadAgent, "downloadAgent");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Loads the snapshot stored at {@code snapshotFile}, if any, and wires the default components.
     *
     * @param snapshotFile where state is read from and written to; {@code null} keeps state in memory only.
     */
    public static SyncManager open(Config config, Path snapshotFile, DownloadAgent downloadAgent)
        throws VodSyncException {
        Snapshot initial = snapshotFile == null ? null : SnapshotStore.load(snapshotFile).orElse(null);
        return new SyncManager(config, snapshotFile, initial, new SubjectDirectory(), new TokenExchange(),
            new ResourceSync(config), new ManifestBuilder(), downloadAgent, Clock.systemUTC());
    }

    public Snapshot snapshot() {
        return snapshot;
    }

    public Config config() {
        return config;
    }

    /**
     * Full pass over the account's favourite subjects.
     *
     * @throws TokenException when Canvas answers with its login form; the snapshot is left untouched.
     * @throws VodSyncException when the subject listing itself fails.
     */
    public SyncReport synchronize(Session session) throws VodSyncException {
        Objects.requireNonNull(session, "session");
        List<Subject> listed = directory.list(session);

        List<Subject> result = new ArrayList<>(listed.size());
        List<Long> synced = new ArrayList<>();
        Map<Long, VodSyncException> failed = new LinkedHashMap<>();
        for (Subject fresh : listed) {
            Optional<Subject> previous = snapshot.subject(fresh.id());
            List<Course> known = previous.map(Subject::courses).orElse(List.of());
            try {
                ResourceToken token = tokenExchange.acquire(session, fresh.id());
                List<Course> courses = resourceSync.update(token, known);
                result.add(fresh.withToken(token).withCourses(courses));
                synced.add(fresh.id());
            } catch (TokenException ex) {
                if (ex.getReason() == TokenException.Reason.SESSION_EXPIRED) {
                    LOGGER.warning("[vod-sync] Canvas session expired during synchronisation; nothing was saved");
                    throw ex;
                }
                result.add(keep(fresh, previous));
                failed.put(fresh.id(), recordFailure(fresh, ex));
            } catch (VodSyncException ex) {
                result.add(keep(fresh, previous));
                failed.put(fresh.id(), recordFailure(fresh, ex));
            }
        }
        commit(result);
        return new SyncReport(synced, failed, List.of());
    }

    /**
     * Refreshes the courses of every stored subject with its stored token.
     */
    public SyncReport update() throws VodSyncException {
        List<Subject> result = new ArrayList<>(snapshot.subjects().size());
        List<Long> synced = new ArrayList<>();
        List<Long> skipped = new ArrayList<>();
        Map<Long, VodSyncException> failed = new LinkedHashMap<>();
        for (Subject subject : snapshot.subjects()) {
            Optional<ResourceToken> token = subject.token();
            if (token.isEmpty()) {
                LOGGER.fine(() -> "[vod-sync] subject " + subject.id() + " has no token; skipped");
                skipped.add(subject.id());
                result.add(subject);
                continue;
            }
            try {
                result.add(subject.withCourses(resourceSync.update(token.get(), subject.courses())));
                synced.add(subject.id());
            } catch (VodSyncException ex) {
                result.add(subject);
                failed.put(subject.id(), recordFailure(subject, ex));
            }
        }
        commit(result);
        return new SyncReport(synced, failed, skipped);
    }

    /**
     * Writes {@value Manifest#FILE_NAME} and the subtitle files under {@code directory}, then runs the download
     * agent on it.
     *
     * @return the manifest that was written.
     */
    public Manifest download(Map<Long, ? extends Collection<Long>> selection, Path directory,
                             boolean includeSecondary) throws VodSyncException {
        Manifest manifest = manifestBuilder.build(selection, snapshot.subjects(), includeSecondary,
            transcriptSource());
        try {
            Files.createDirectories(directory);
            Files.writeString(directory.resolve(Manifest.FILE_NAME), manifest.text(), StandardCharsets.UTF_8);
            for (SubtitleFile subtitle : manifest.subtitles()) {
                Path target = directory.resolve(subtitle.outputPath());
                Path parent = target.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(target, subtitle.content(), StandardCharsets.UTF_8);
            }
        } catch (IOException ex) {
            throw new VodSyncException("write manifest to " + directory + ": " + ex.getMessage(), ex);
        }
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[vod-sync] wrote %d downloads to %s", manifest.jobs().size(), directory.resolve(Manifest.FILE_NAME)));
        downloadAgent.download(directory);
        return manifest;
    }

    private TranscriptSource transcriptSource() {
        return (subject, course) -> {
            Optional<ResourceToken> token = subject.token();
            if (token.isEmpty()) {
                LOGGER.warning(() -> "[vod-sync] subject " + subject.id() + " has no token; subtitles left empty");
                return List.<TranscriptSegment>of();
            }
            return resourceSync.resolveTranscripts(token.get(), course.id());
        };
    }

    private void commit(List<Subject> subjects) throws VodSyncException {
        snapshot = new Snapshot(subjects, clock.millis() / 1000.0);
        if (snapshotFile != null) {
            SnapshotStore.save(snapshotFile, snapshot);
        }
    }

    private static Subject keep(Subject fresh, Optional<Subject> previous) {
        return previous.orElse(fresh);
    }

    private static VodSyncException recordFailure(Subject subject, VodSyncException ex) {
        LOGGER.log(Level.WARNING, String.format(Locale.ROOT,
            "[vod-sync] subject %d (%s) kept its previous state", subject.id(), subject.name()), ex);
        return ex;
    }
}
