package io.vodsync.catalog;

import io.vodsync.VodSyncException;
import io.vodsync.internal.Json;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Reads and writes {@link Snapshot} JSON documents.
 */
public final class SnapshotStore {

    private static final Logger LOGGER = Logger.getLogger(SnapshotStore.class.getName());

    private SnapshotStore() {
    }

    /**
     * @return the stored snapshot, or empty when {@code file} does not exist.
     * @throws VodSyncException when the file exists but cannot be read or parsed.
     */
    public static Optional<Snapshot> load(Path file) throws VodSyncException {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try (InputStream in = Files.newInputStream(file)) {
            Snapshot snapshot = Json.mapper().readValue(in, Snapshot.class);
            LOGGER.info(() -> "[vod-sync] loaded " + snapshot.subjects().size() + " subjects from " + file);
            return Optional.of(snapshot);
        } catch (IOException ex) {
            throw new VodSyncException("read snapshot " + file + ": " + ex.getMessage(), ex);
        }
    }

    public static void save(Path file, Snapshot snapshot) throws VodSyncException {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(file)) {
                Json.snapshotWriter().writeValue(out, snapshot);
            }
        } catch (IOException ex) {
            throw new VodSyncException("write snapshot " + file + ": " + ex.getMessage(), ex);
        }
        LOGGER.fine(() -> "[vod-sync] snapshot written to " + file);
    }
}
