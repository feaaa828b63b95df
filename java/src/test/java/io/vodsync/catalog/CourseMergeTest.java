package io.vodsync.catalog;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CourseMergeTest {

    private static Course listed(long id, String name) {
        return new Course(id, name, "s", "e", "v" + id, null);
    }

    private static Course resolved(long id, String name) {
        return listed(id, name).withDownloadUrls(Map.of(0, "https://cdn/" + id + ".mp4"));
    }

    @Test
    void resolvedCoursesSurviveUntouched() {
        Course old = resolved(1, "old name");
        Map<Long, Course> merged = CourseMerge.merge(
            CourseMerge.index(List.of(old)),
            CourseMerge.index(List.of(listed(1, "new name"))));

        assertSame(old, merged.get(1L));
    }

    @Test
    void unresolvedCoursesAreReplacedAndNewOnesAppended() {
        Map<Long, Course> merged = CourseMerge.merge(
            CourseMerge.index(List.of(listed(1, "a"), resolved(2, "b"))),
            CourseMerge.index(List.of(listed(3, "c"), listed(1, "a2"))));

        assertEquals(List.of(1L, 2L, 3L), List.copyOf(merged.keySet()));
        assertEquals("a2", merged.get(1L).name());
        assertTrue(merged.get(2L).isResolved());
        assertFalse(merged.get(3L).isResolved());
    }

    @Test
    void coursesMissingFromFreshListingAreKept() {
        Map<Long, Course> merged = CourseMerge.merge(
            CourseMerge.index(List.of(resolved(5, "gone"))),
            Map.of());

        assertEquals(1, merged.size());
    }

    @Test
    void emptyUrlMapCountsAsUnresolved() {
        Course empty = listed(1, "a").withDownloadUrls(Map.of());
        assertFalse(empty.isResolved());

        Map<Long, Course> merged = CourseMerge.merge(
            CourseMerge.index(List.of(empty)),
            CourseMerge.index(List.of(listed(1, "a"))));
        assertNull(merged.get(1L).downloadUrls());
    }
}
