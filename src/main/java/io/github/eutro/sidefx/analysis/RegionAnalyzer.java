package io.github.eutro.sidefx.analysis;

import io.github.eutro.sidefx.ssa.Effect;
import io.github.eutro.sidefx.ssa.Insn;
import io.github.eutro.sidefx.ssa.Region;

import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Walks a region in program order, computing the direct control predecessors
 * of each of its effects, and those of its nested regions.
 * <p>
 * Each region is walked with its own {@link ResourceAccessTracker}: nested regions
 * contribute their edges to the result, but not their accesses to the enclosing region's tracker.
 */
public class RegionAnalyzer {
    private final EffectIndex index;
    private final ResourceAliasAnalysis.Info aliases;
    private final EffectClassifier classifier;

    public RegionAnalyzer(EffectIndex index, ResourceAliasAnalysis.Info aliases, EffectClassifier classifier) {
        this.index = index;
        this.aliases = aliases;
        this.classifier = classifier;
    }

    /**
     * Analyze a region.
     *
     * @param region The region.
     * @return The control predecessors of the region's effects, by {@link EffectIndex index}.
     * Effects without predecessors may be absent.
     */
    public Map<Integer, BitSet> analyze(Region region) {
        Map<Integer, BitSet> controlPredecessors = new HashMap<>();
        ResourceAccessTracker tracker = new ResourceAccessTracker();

        for (Effect effect : region.getEffects()) {
            Insn insn = effect.insn();
            if (insn.hasRegions()) {
                for (Region child : insn.regions()) {
                    mergeInto(controlPredecessors, analyze(child));
                }
            }

            if (classifier.isResourceDeclaration(effect, aliases)) continue;

            ResourceAccessKind kind = classifier.getAccessKind(effect);
            if (!kind.hasAccessInfo() && classifier.isKnownSideEffectFree(effect)) continue;

            Set<ResourceId> resources = kind.hasAccessInfo()
                    ? aliases.findAccessedResources(effect)
                    : ResourceId.UNKNOWN_SET;
            if (resources.isEmpty()) {
                throw malformed("effect with resource access info accesses no resources: ", effect);
            }
            boolean isUnknown = resources.contains(ResourceId.UNKNOWN);
            boolean readOnly = kind == ResourceAccessKind.READ;
            int insnIdx = index.indexOf(effect);
            if (insnIdx == -1) {
                throw malformed("effect not in the analysed function: ", effect);
            }

            BitSet predecessors = new BitSet();
            boolean indirectlyTrackedUnknownAccess = false;
            if (isUnknown) {
                for (ResourceId resource : tracker.getTrackedResources()) {
                    if (resource.isUnknown()) continue;
                    tracker.addPredecessorsForAccess(resource, readOnly, predecessors);
                    indirectlyTrackedUnknownAccess |= tracker.unknownAccessIndirectlyTrackedBy(resource, readOnly);
                }
            } else {
                for (ResourceId resource : resources) {
                    tracker.addPredecessorsForAccess(resource, readOnly, predecessors);
                    indirectlyTrackedUnknownAccess |= tracker.unknownAccessIndirectlyTrackedBy(resource, readOnly);
                    tracker.trackAccess(resource, insnIdx, readOnly);
                }
            }
            if (!indirectlyTrackedUnknownAccess) {
                tracker.addPredecessorsForAccess(ResourceId.UNKNOWN, readOnly, predecessors);
            }
            if (isUnknown) {
                tracker.trackAccess(ResourceId.UNKNOWN, insnIdx, readOnly);
            }

            if (!predecessors.isEmpty()) {
                mergeInto(controlPredecessors, insnIdx, predecessors);
            }
        }
        return controlPredecessors;
    }

    private static IllegalStateException malformed(String message, Effect effect) {
        IllegalStateException e = new IllegalStateException(message + effect);
        Throwable created = effect.insn().created;
        if (created != null) e.addSuppressed(created);
        return e;
    }

    private static void mergeInto(Map<Integer, BitSet> into, Map<Integer, BitSet> from) {
        for (Map.Entry<Integer, BitSet> entry : from.entrySet()) {
            mergeInto(into, entry.getKey(), entry.getValue());
        }
    }

    private static void mergeInto(Map<Integer, BitSet> into, int insn, BitSet predecessors) {
        into.merge(insn, predecessors, (lhs, rhs) -> {
            lhs.or(rhs);
            return lhs;
        });
    }
}
