package io.vodsync.manifest;

import io.vodsync.VodSyncException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Runs {@code aria2c} over the manifest: 16 connections per file, 1 MiB pieces, existing files are neither renamed
 * nor overwritten, and unchanged files are skipped with a conditional GET.
 */
public final class Aria2DownloadAgent implements DownloadAgent {

    private static final Logger LOGGER = Logger.getLogger(Aria2DownloadAgent.class.getName());

    private final String executable;

    public Aria2DownloadAgent() {
        this("aria2c");
    }

    public Aria2DownloadAgent(String executable) {
        this.executable = executable;
    }

    /**
     * Paths are absolute since the process runs inside {@code directory}.
     */
    List<String> command(Path directory) {
        Path dir = directory.toAbsolutePath().normalize();
        return List.of(
            executable,
            "-x", "16",
            "-s", "16",
            "-k", "1M",
            "--auto-file-renaming=false",
            "--allow-overwrite=false",
            "--conditional-get=true",
            "-d", dir.toString(),
            "-i", dir.resolve(Manifest.FILE_NAME).toString()
        );
    }

    @Override
    public void download(Path directory) throws VodSyncException {
        List<String> command = command(directory);
        LOGGER.info(() -> "[vod-sync] running " + String.join(" ", command));
        int exit;
        try {
            Process process = new ProcessBuilder(command)
                .directory(directory.toFile())
                .inheritIO()
                .start();
            exit = process.waitFor();
        } catch (IOException ex) {
            throw new VodSyncException("start " + executable + ": " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new VodSyncException(executable + " interrupted", ex);
        }
        if (exit != 0) {
            throw new VodSyncException(String.format(Locale.ROOT, "%s exited with status %d", executable, exit));
        }
    }
}
