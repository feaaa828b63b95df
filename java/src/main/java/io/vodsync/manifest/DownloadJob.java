package io.vodsync.manifest;

/**
 * One file for the download agent to fetch.
 *
 * @param url        media URL.
 * @param outputPath path relative to the manifest directory.
 * @param channel    media channel the URL was resolved for.
 */
public record DownloadJob(String url, String outputPath, int channel) {

    /**
     * @return the job as a manifest entry: the URL, then an indented {@code out=} option line.
     */
    public String toManifestEntry() {
        return url + "\n  out=" + outputPath + "\n";
    }
}
