package io.vodsync.manifest;

import io.vodsync.VodSyncException;

import java.nio.file.Path;

/**
 * Transfers the files listed in a written manifest.
 */
public interface DownloadAgent {

    /**
     * @param directory directory holding {@value Manifest#FILE_NAME}; output paths resolve against it.
     */
    void download(Path directory) throws VodSyncException;
}
