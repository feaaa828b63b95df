package io.vodsync.catalog;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One recorded class session of a subject.
 *
 * @param id           video service course id; stable across runs and used as the merge key.
 * @param name         display name, also used for output file names.
 * @param startTime    scheduled start as reported by the service.
 * @param endTime      scheduled end as reported by the service.
 * @param mediaRef     video id used for media resolution.
 * @param downloadUrls channel (0 camera, 1 screen) to URL; {@code null} until resolved.
 */
public record Course(
    long id,
    String name,
    @JsonProperty("dt_start") @JsonAlias("start_time") String startTime,
    @JsonProperty("dt_end") @JsonAlias("end_time") String endTime,
    @JsonProperty("video_id") @JsonAlias("media_ref") String mediaRef,
    @JsonProperty("download_urls") Map<Integer, String> downloadUrls
) {

    public static final int CHANNEL_CAMERA = 0;
    public static final int CHANNEL_SCREEN = 1;

    public Course {
        downloadUrls = downloadUrls == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(downloadUrls));
    }

    /**
     * @return {@code true} once media resolution produced at least one URL.
     */
    @JsonIgnore
    public boolean isResolved() {
        return downloadUrls != null && !downloadUrls.isEmpty();
    }

    public Course withDownloadUrls(Map<Integer, String> urls) {
        return new Course(id, name, startTime, endTime, mediaRef, urls);
    }
}
