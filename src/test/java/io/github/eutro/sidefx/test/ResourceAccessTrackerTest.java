package io.github.eutro.sidefx.test;

import io.github.eutro.sidefx.analysis.ResourceAccessTracker;
import io.github.eutro.sidefx.analysis.ResourceId;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.BitSet;

import static org.junit.jupiter.api.Assertions.*;

public class ResourceAccessTrackerTest {
    private static final ResourceId A = ResourceId.known(0);
    private static final ResourceId B = ResourceId.known(1);

    private final ResourceAccessTracker tracker = new ResourceAccessTracker();

    private BitSet preds(ResourceId resource, boolean readOnly) {
        BitSet bs = new BitSet();
        tracker.addPredecessorsForAccess(resource, readOnly, bs);
        return bs;
    }

    private static BitSet bits(int... indices) {
        BitSet bs = new BitSet();
        for (int i : indices) bs.set(i);
        return bs;
    }

    @Test
    void testUntracked() {
        assertTrue(preds(A, true).isEmpty());
        assertTrue(preds(A, false).isEmpty());
        assertFalse(tracker.unknownAccessIndirectlyTrackedBy(A, true));
        assertFalse(tracker.unknownAccessIndirectlyTrackedBy(A, false));
        assertNull(tracker.getAccessInfo(A));
    }

    @Test
    void testWriteThenRead() {
        tracker.trackAccess(A, 3, false);
        assertEquals(bits(3), preds(A, true));
        assertEquals(bits(3), preds(A, false));

        ResourceAccessTracker.AccessInfo info = tracker.getAccessInfo(A);
        assertNotNull(info);
        assertEquals(3, info.getLastWrite());
        assertTrue(info.isTrackedLastUnknownWriteForRead());
        assertTrue(info.isTrackedLastUnknownWriteForWrite());
        assertTrue(info.isTrackedLastUnknownRead());
    }

    @Test
    void testWriteWaitsForReadsOnly() {
        tracker.trackAccess(A, 0, false);
        tracker.trackAccess(A, 1, true);
        tracker.trackAccess(A, 2, true);
        assertEquals(bits(0), preds(A, true));
        assertEquals(bits(1, 2), preds(A, false));

        tracker.trackAccess(A, 3, false);
        assertEquals(bits(3), preds(A, false));
        assertTrue(tracker.getAccessInfo(A).getReadsSinceLastWrite().isEmpty());
    }

    @Test
    void testReadOnlyResource() {
        tracker.trackAccess(A, 0, true);
        assertTrue(preds(A, true).isEmpty());
        assertEquals(bits(0), preds(A, false));
        ResourceAccessTracker.AccessInfo info = tracker.getAccessInfo(A);
        assertEquals(-1, info.getLastWrite());
        assertFalse(info.isTrackedLastUnknownWriteForRead());
        assertTrue(info.isTrackedLastUnknownWriteForWrite());
        assertTrue(tracker.unknownAccessIndirectlyTrackedBy(A, false));
        assertFalse(tracker.unknownAccessIndirectlyTrackedBy(A, true));
    }

    @Test
    void testUnknownWriteClears() {
        tracker.trackAccess(A, 0, false);
        tracker.trackAccess(B, 1, true);
        tracker.trackAccess(ResourceId.UNKNOWN, 2, false);
        assertEquals(Arrays.asList(ResourceId.UNKNOWN), Arrays.asList(tracker.getTrackedResources().toArray()));
        assertNull(tracker.getAccessInfo(A));
        assertEquals(bits(2), preds(ResourceId.UNKNOWN, true));
    }

    @Test
    void testUnknownReadResetsReadTracking() {
        tracker.trackAccess(A, 0, false);
        assertTrue(tracker.unknownAccessIndirectlyTrackedBy(A, false));

        tracker.trackAccess(ResourceId.UNKNOWN, 1, true);
        assertFalse(tracker.getAccessInfo(A).isTrackedLastUnknownRead());
        // the pending unknown read isn't carried by A's write
        assertFalse(tracker.unknownAccessIndirectlyTrackedBy(A, false));
        assertTrue(tracker.unknownAccessIndirectlyTrackedBy(A, true));
        assertEquals(bits(1), preds(ResourceId.UNKNOWN, false));

        tracker.trackAccess(A, 2, false);
        assertTrue(tracker.unknownAccessIndirectlyTrackedBy(A, false));
    }

    @Test
    void testTrackedResourcesInFirstAccessOrder() {
        tracker.trackAccess(B, 0, false);
        tracker.trackAccess(A, 1, false);
        tracker.trackAccess(B, 2, true);
        assertEquals(Arrays.asList(B, A), Arrays.asList(tracker.getTrackedResources().toArray()));
        assertThrows(UnsupportedOperationException.class, () -> tracker.getTrackedResources().clear());
    }

    @Test
    void testResourceIds() {
        assertEquals(ResourceId.known(5), ResourceId.known(5));
        assertNotEquals(ResourceId.known(5), ResourceId.UNKNOWN);
        assertEquals(5, ResourceId.known(5).getId());
        assertTrue(ResourceId.UNKNOWN.isUnknown());
        assertThrows(IllegalStateException.class, ResourceId.UNKNOWN::getId);
        assertThrows(IllegalArgumentException.class, () -> ResourceId.known(-1));
    }
}
