package io.vodsync.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Persisted synchronisation state.
 *
 * @param subjects     every known subject with its courses.
 * @param lastUpdateAt epoch seconds of the last successful sync; {@code null} when never synced.
 */
public record Snapshot(
    List<Subject> subjects,
    @JsonProperty("last_update_at") Double lastUpdateAt
) {

    public Snapshot {
        subjects = subjects == null ? List.of() : List.copyOf(subjects);
    }

    public static Snapshot empty() {
        return new Snapshot(List.of(), null);
    }

    public Optional<Subject> subject(long id) {
        return subjects.stream().filter(s -> s.id() == id).findFirst();
    }
}
