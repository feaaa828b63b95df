package io.vodsync.auth;

import java.util.Objects;

/**
 * Subject-scoped bearer credential for the video service, paired with the subject id the service knows it by.
 * The token is opaque: it is only ever echoed back in the {@code token} header.
 *
 * @param accessToken     bearer value.
 * @param canvasSubjectId the video service's id for the subject ({@code params.courId}).
 */
public record ResourceToken(String accessToken, String canvasSubjectId) {

    public ResourceToken {
        Objects.requireNonNull(accessToken, "accessToken");
        Objects.requireNonNull(canvasSubjectId, "canvasSubjectId");
        if (accessToken.isBlank() || canvasSubjectId.isBlank()) {
            throw new IllegalArgumentException("accessToken and canvasSubjectId must be non-blank");
        }
    }

    @Override
    public String toString() {
        return "ResourceToken[canvasSubjectId=" + canvasSubjectId + "]";
    }
}
