package io.vodsync;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one synchronisation pass, per subject.
 *
 * @param synced  ids of subjects whose courses were refreshed.
 * @param failed  ids of subjects that kept their previous state, with the error that stopped them.
 * @param skipped ids of subjects that were not attempted because they carry no token.
 */
public record SyncReport(List<Long> synced, Map<Long, VodSyncException> failed, List<Long> skipped) {

    public SyncReport {
        synced = List.copyOf(synced);
        failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
        skipped = List.copyOf(skipped);
    }

    public boolean isComplete() {
        return failed.isEmpty();
    }
}
