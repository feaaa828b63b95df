package io.vodsync.catalog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reconciles a cached course list with a fresh listing.
 */
public final class CourseMerge {

    private CourseMerge() {
    }

    /**
     * Indexes courses by id, keeping list order. A repeated id keeps the later entry.
     */
    public static Map<Long, Course> index(List<Course> courses) {
        Map<Long, Course> indexed = new LinkedHashMap<>();
        for (Course course : courses) {
            indexed.put(course.id(), course);
        }
        return indexed;
    }

    /**
     * Merges by course id. A previous course that is already resolved is carried forward untouched; any fresh course
     * that is new, or whose previous version is unresolved, replaces it in place. Previous courses absent from the
     * fresh listing are kept. New courses are appended in fresh order.
     *
     * @return a new map; neither argument is modified.
     */
    public static Map<Long, Course> merge(Map<Long, Course> previous, Map<Long, Course> fresh) {
        Map<Long, Course> merged = new LinkedHashMap<>(previous);
        for (Course course : fresh.values()) {
            Course known = merged.get(course.id());
            if (known != null && known.isResolved()) {
                continue;
            }
            merged.put(course.id(), course);
        }
        return merged;
    }
}
