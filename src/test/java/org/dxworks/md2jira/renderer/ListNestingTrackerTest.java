package org.dxworks.md2jira.renderer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ListNestingTrackerTest {

    @Test
    void prefixHasOneMarkerPerDepth() {
        ListNestingTracker tracker = new ListNestingTracker();
        assertFalse(tracker.enter(true, true));
        assertEquals("#", tracker.itemPrefix());
        assertTrue(tracker.enter(false, true));
        assertEquals("#*", tracker.itemPrefix());
        assertTrue(tracker.enter(true, true));
        assertEquals("#*#", tracker.itemPrefix());
        assertEquals(3, tracker.depth());
    }

    @Test
    void exitReportsWhenOutermostListClosed() {
        ListNestingTracker tracker = new ListNestingTracker();
        tracker.enter(false, true);
        tracker.enter(false, true);
        assertFalse(tracker.exit());
        assertTrue(tracker.exit());
        assertEquals(0, tracker.depth());
        assertEquals("", tracker.itemPrefix());
    }

    @Test
    void tightFlagFollowsInnermostList() {
        ListNestingTracker tracker = new ListNestingTracker();
        assertFalse(tracker.isInTightList());
        tracker.enter(false, true);
        assertTrue(tracker.isInTightList());
        tracker.enter(false, false);
        assertFalse(tracker.isInTightList());
        tracker.exit();
        tracker.exit();
        assertFalse(tracker.isInTightList());
    }

    @Test
    void tightFlagRestoredWhenNestedLooseListCloses() {
        ListNestingTracker tracker = new ListNestingTracker();
        tracker.enter(false, true);
        tracker.enter(false, false);
        assertFalse(tracker.isInTightList());
        assertFalse(tracker.exit());
        assertTrue(tracker.isInTightList());
    }

    @Test
    void looseFlagRestoredWhenNestedTightListCloses() {
        ListNestingTracker tracker = new ListNestingTracker();
        tracker.enter(true, false);
        tracker.enter(true, true);
        assertTrue(tracker.isInTightList());
        tracker.exit();
        assertFalse(tracker.isInTightList());
    }

    @Test
    void exitOnEmptyStackIsHarmless() {
        ListNestingTracker tracker = new ListNestingTracker();
        assertTrue(tracker.exit());
        assertEquals(0, tracker.depth());
    }
}
