package io.github.eutro.sidefx.analysis;

import org.jetbrains.annotations.Nullable;

import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Tracks, for each resource, the last write to it and the reads of it since,
 * over the effects of one region in program order.
 * <p>
 * Effects are referred to by their {@link EffectIndex index}.
 */
public class ResourceAccessTracker {
    private final Map<ResourceId, AccessInfo> perResourceAccessInfo = new LinkedHashMap<>();

    /**
     * The accesses of a single resource.
     */
    public static final class AccessInfo {
        private int lastWrite = -1;
        private final BitSet readsSinceLastWrite = new BitSet();

        // Whether this resource's accesses already depend on the most recent unknown
        // write (for a later read, or a later write) or unknown read.
        private boolean trackedLastUnknownWriteForRead = false;
        private boolean trackedLastUnknownWriteForWrite = false;
        private boolean trackedLastUnknownRead = false;

        /**
         * @return The index of the last write, or -1 if there was none.
         */
        public int getLastWrite() {
            return lastWrite;
        }

        /**
         * @return A copy of the indices of the reads since the last write.
         */
        public BitSet getReadsSinceLastWrite() {
            return (BitSet) readsSinceLastWrite.clone();
        }

        public boolean isTrackedLastUnknownWriteForRead() {
            return trackedLastUnknownWriteForRead;
        }

        public boolean isTrackedLastUnknownWriteForWrite() {
            return trackedLastUnknownWriteForWrite;
        }

        public boolean isTrackedLastUnknownRead() {
            return trackedLastUnknownRead;
        }
    }

    /**
     * Record an access to a resource.
     *
     * @param resource The resource.
     * @param insn     The index of the accessing effect.
     * @param readOnly Whether the access is a read.
     */
    public void trackAccess(ResourceId resource, int insn, boolean readOnly) {
        if (resource.isUnknown()) {
            if (readOnly) {
                // no known resource carries this unknown read yet
                for (AccessInfo info : perResourceAccessInfo.values()) {
                    info.trackedLastUnknownRead = false;
                }
            } else {
                // an unknown write is a barrier, nothing before it matters any more
                perResourceAccessInfo.clear();
            }
        }
        AccessInfo info = perResourceAccessInfo.computeIfAbsent(resource, $ -> new AccessInfo());
        if (readOnly) {
            info.readsSinceLastWrite.set(insn);
            // A later write to this resource will depend on this read, which depends
            // on the last unknown write. A later read won't, since reads can be reordered.
            info.trackedLastUnknownWriteForWrite = true;
        } else {
            info.trackedLastUnknownWriteForRead = true;
            info.trackedLastUnknownWriteForWrite = true;
            info.trackedLastUnknownRead = true;
            info.lastWrite = insn;
            info.readsSinceLastWrite.clear();
        }
    }

    /**
     * Add the accesses of {@code resource} that a new access must come after to {@code predecessors}.
     * <p>
     * A read must come after the last write. A write must come after every read since the last write,
     * or after the last write itself if there were no such reads.
     *
     * @param resource     The resource.
     * @param readOnly     Whether the new access is a read.
     * @param predecessors The set of predecessor indices to add to.
     */
    public void addPredecessorsForAccess(ResourceId resource, boolean readOnly, BitSet predecessors) {
        AccessInfo info = perResourceAccessInfo.get(resource);
        if (info == null) return;
        boolean readTracked = false;
        if (!readOnly) {
            predecessors.or(info.readsSinceLastWrite);
            readTracked = !info.readsSinceLastWrite.isEmpty();
        }
        if (info.lastWrite != -1 && !readTracked) {
            predecessors.set(info.lastWrite);
        }
    }

    /**
     * Whether a new access of {@code resource} can skip depending on earlier accesses to the unknown resource,
     * because earlier accesses to {@code resource} already depend on them.
     *
     * @param resource The resource.
     * @param readOnly Whether the new access is a read.
     * @return Whether the unknown resource is indirectly tracked.
     */
    public boolean unknownAccessIndirectlyTrackedBy(ResourceId resource, boolean readOnly) {
        AccessInfo info = perResourceAccessInfo.get(resource);
        if (info == null) return false;
        if (readOnly) return info.trackedLastUnknownWriteForRead;
        AccessInfo unknownInfo = perResourceAccessInfo.get(ResourceId.UNKNOWN);
        boolean noUnknownRead = unknownInfo == null || unknownInfo.readsSinceLastWrite.isEmpty();
        return info.trackedLastUnknownWriteForWrite
                && (info.trackedLastUnknownRead || noUnknownRead);
    }

    /**
     * Get the resources with accesses currently tracked, in the order they were first accessed.
     *
     * @return An unmodifiable view of the resources.
     */
    public Set<ResourceId> getTrackedResources() {
        return Collections.unmodifiableSet(perResourceAccessInfo.keySet());
    }

    @Nullable
    public AccessInfo getAccessInfo(ResourceId resource) {
        return perResourceAccessInfo.get(resource);
    }
}
