package io.vodsync.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import io.vodsync.Config;
import io.vodsync.DataShapeException;
import io.vodsync.VodSyncException;
import io.vodsync.auth.ResourceToken;
import io.vodsync.internal.HttpUtil;
import io.vodsync.internal.MultipartBody;
import io.vodsync.internal.ResponseDecoder;

import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>
 * Fetches the course tree of one subject from the lecture video service.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>{@link #refresh(ResourceToken)} re-lists and re-resolves every course.</li>
 *   <li>{@link #update(ResourceToken, List)} re-lists but only resolves media for courses that are new or still
 *       unresolved. Media resolution is the slow, rate-limited call; repeated runs should take this path.</li>
 *   <li>Transcripts are fetched on demand and never cached.</li>
 * </ul>
 *
 * Every call sends the subject token in the {@value HttpUtil#TOKEN_HEADER} header.
 */
public final class ResourceSync {

    private static final Logger LOGGER = Logger.getLogger(ResourceSync.class.getName());

    static final String LIST_PATH = "/directOnDemandPlay/findVodVideoList";
    static final String MEDIA_PATH = "/directOnDemandPlay/getVodVideoInfos";
    static final String TRANSCRIPT_PATH = "/transfer/translate/detail";

    private final Config config;
    private final HttpClient httpClient;

    public ResourceSync(Config config) {
        this.config = Objects.requireNonNull(config, "config");
        this.httpClient = config.getHttpClient();
    }

    /**
     * Lists the subject's courses without resolving media.
     *
     * @return courses in service order; empty when the service reports {@code code == -1} or no data.
     */
    public List<Course> listCourses(ResourceToken token) throws VodSyncException {
        Map<String, Object> payload = Map.of("canvasCourseId", quote(token.canvasSubjectId()));
        JsonNode root = post(HttpUtil.jsonPost(
            config.getVideoBaseUrl() + LIST_PATH, payload, token.accessToken(), config.getHttpTimeout()),
            "list courses");

        JsonNode data = root.path("data");
        if (root.path("code").asInt(0) == -1 || isEmpty(data)) {
            LOGGER.info(() -> "[vod-sync] no courses listed for video course " + token.canvasSubjectId());
            return List.of();
        }

        List<Course> courses = new ArrayList<>();
        for (JsonNode item : data.path("records")) {
            courses.add(new Course(
                item.path("courId").asLong(),
                textOrNull(item, "videoName"),
                textOrNull(item, "courseBeginTime"),
                textOrNull(item, "courseEndTime"),
                textOrNull(item, "videoId"),
                null
            ));
        }
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[vod-sync] video course %s lists %d courses", token.canvasSubjectId(), courses.size()));
        return courses;
    }

    /**
     * Full resync: lists every course and resolves media for all of them.
     */
    public List<Course> refresh(ResourceToken token) throws VodSyncException {
        List<Course> listed = listCourses(token);
        List<Course> resolved = new ArrayList<>(listed.size());
        for (Course course : listed) {
            resolved.add(course.withDownloadUrls(resolveMedia(token, course.mediaRef())));
        }
        return resolved;
    }

    /**
     * Incremental resync against {@code previous}; see {@link CourseMerge#merge(Map, Map)} for the merge rule.
     * Only courses in the fresh listing that end up unresolved after the merge trigger media resolution.
     */
    public List<Course> update(ResourceToken token, List<Course> previous) throws VodSyncException {
        Map<Long, Course> fresh = CourseMerge.index(listCourses(token));
        Map<Long, Course> merged = CourseMerge.merge(CourseMerge.index(previous), fresh);

        int resolvedCount = 0;
        List<Course> result = new ArrayList<>(merged.size());
        for (Course course : merged.values()) {
            if (fresh.containsKey(course.id()) && !course.isResolved()) {
                course = course.withDownloadUrls(resolveMedia(token, course.mediaRef()));
                resolvedCount++;
            }
            result.add(course);
        }
        int calls = resolvedCount;
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[vod-sync] video course %s: %d courses, %d media lookups", token.canvasSubjectId(), result.size(), calls));
        return result;
    }

    /**
     * Resolves the download URLs of one recording.
     *
     * <p>
     * The service does not label streams. The stream whose {@code cdviViewNum} is zero is taken as the camera
     * (channel 0) and any other as the screen capture (channel 1); a later stream on the same channel wins. Streams
     * without a URL are left out, so a recording none of whose streams has one stays unresolved.
     * </p>
     */
    public Map<Integer, String> resolveMedia(ResourceToken token, String mediaRef) throws VodSyncException {
        MultipartBody body = new MultipartBody()
            .field("playTypeHls", "true")
            .field("isAudit", "true")
            .field("id", mediaRef);
        HttpRequest request = HttpUtil.newRequest(config.getVideoBaseUrl() + MEDIA_PATH, config.getHttpTimeout())
            .header("Content-Type", body.contentType())
            .header(HttpUtil.TOKEN_HEADER, token.accessToken())
            .POST(body.publisher())
            .build();
        JsonNode root = post(request, "resolve media " + mediaRef);

        JsonNode data = root.path("data");
        if (!data.isObject()) {
            throw new DataShapeException("media response for " + mediaRef + " has no data: " + root);
        }
        Map<Integer, String> urls = new LinkedHashMap<>();
        for (JsonNode video : data.path("videoPlayResponseVoList")) {
            JsonNode views = video.path("cdviViewNum");
            if (views.isMissingNode() || views.isNull()) {
                throw new DataShapeException("media descriptor for " + mediaRef + " lacks cdviViewNum");
            }
            int channel = views.asLong() != 0 ? Course.CHANNEL_SCREEN : Course.CHANNEL_CAMERA;
            String url = textOrNull(video, "rtmpUrlHdv");
            if (url == null || url.isBlank()) {
                LOGGER.fine(() -> "[vod-sync] media " + mediaRef + " lists a stream without a URL on channel " + channel);
                continue;
            }
            urls.put(channel, url);
        }
        if (urls.isEmpty()) {
            LOGGER.warning(() -> "[vod-sync] no streams listed for media " + mediaRef + "; will retry on next update");
        }
        return urls;
    }

    public List<TranscriptSegment> resolveTranscripts(ResourceToken token, long courseId) throws VodSyncException {
        return resolveTranscripts(token, courseId, config.getTranscriptLanguage());
    }

    /**
     * @param lang transcript field to read from each item; {@code res} is the original language.
     * @return segments in service order; empty when the course has no transcript.
     * @throws DataShapeException when a segment carries a negative offset.
     */
    public List<TranscriptSegment> resolveTranscripts(ResourceToken token, long courseId, String lang)
        throws VodSyncException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("courseId", courseId);
        payload.put("platform", 1);
        JsonNode root = post(HttpUtil.jsonPost(
            config.getVideoBaseUrl() + TRANSCRIPT_PATH, payload, token.accessToken(), config.getHttpTimeout()),
            "fetch transcript " + courseId);

        JsonNode data = root.path("data");
        if (isEmpty(data)) {
            return List.of();
        }
        String field = lang == null || lang.isBlank() ? Config.DEFAULT_TRANSCRIPT_LANGUAGE : lang;
        List<TranscriptSegment> segments = new ArrayList<>();
        for (JsonNode item : data.path("originalList")) {
            long start = item.path("bg").asLong();
            long end = item.path("ed").asLong();
            if (start < 0 || end < 0) {
                throw new DataShapeException("transcript for course " + courseId + " has a negative offset: " + item);
            }
            segments.add(new TranscriptSegment(start, end, item.path(field).asText("")));
        }
        return segments;
    }

    private JsonNode post(HttpRequest request, String action) throws VodSyncException {
        HttpResponse<byte[]> response = HttpUtil.sendChecked(httpClient, request, action);
        return ResponseDecoder.readJson(response, action);
    }

    private static boolean isEmpty(JsonNode node) {
        return node.isMissingNode() || node.isNull() || (node.isContainerNode() && node.size() == 0)
            || (node.isTextual() && node.asText().isEmpty());
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    /**
     * Percent-encodes like a path segment: spaces become {@code %20} and {@code /} is kept.
     */
    static String quote(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
            .replace("+", "%20")
            .replace("*", "%2A")
            .replace("%7E", "~")
            .replace("%2F", "/");
    }
}
