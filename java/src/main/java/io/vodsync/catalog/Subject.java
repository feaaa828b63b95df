package io.vodsync.catalog;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.vodsync.auth.ResourceToken;

import java.util.List;
import java.util.Optional;

/**
 * A Canvas subject (course shell) and the recorded courses known for it.
 *
 * <p>
 * {@code accessToken} and {@code canvasSubjectId} come from the same token exchange, so either both are present or
 * neither is.
 * </p>
 */
public record Subject(
    long id,
    String name,
    @JsonProperty("account") Long accountId,
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("canvas_subject_id") String canvasSubjectId,
    List<Course> courses
) {

    public Subject {
        accessToken = blankToNull(accessToken);
        canvasSubjectId = blankToNull(canvasSubjectId);
        if ((accessToken == null) != (canvasSubjectId == null)) {
            throw new IllegalArgumentException(
                "subject " + id + ": access_token and canvas_subject_id must be set together");
        }
        courses = courses == null ? List.of() : List.copyOf(courses);
    }

    public Subject(long id, String name, Long accountId) {
        this(id, name, accountId, null, null, List.of());
    }

    @JsonIgnore
    public Optional<ResourceToken> token() {
        if (accessToken == null) {
            return Optional.empty();
        }
        return Optional.of(new ResourceToken(accessToken, canvasSubjectId));
    }

    public int total() {
        return courses.size();
    }

    public Optional<Course> course(long courseId) {
        return courses.stream().filter(c -> c.id() == courseId).findFirst();
    }

    public Subject withToken(ResourceToken token) {
        return new Subject(id, name, accountId, token.accessToken(), token.canvasSubjectId(), courses);
    }

    public Subject withCourses(List<Course> updated) {
        return new Subject(id, name, accountId, accessToken, canvasSubjectId, updated);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
