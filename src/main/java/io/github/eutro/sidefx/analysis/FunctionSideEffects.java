package io.github.eutro.sidefx.analysis;

import io.github.eutro.sidefx.ext.CommonExts;
import io.github.eutro.sidefx.ext.MetadataState;
import io.github.eutro.sidefx.ssa.Effect;
import io.github.eutro.sidefx.ssa.Function;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * The control dependencies between the effects of a single function.
 * <p>
 * An effect's direct control predecessors are the effects that must stay before it
 * for the function's accesses to resources to keep their meaning. Only effects in the same
 * region are ever related.
 * <p>
 * This is a snapshot: it must be recomputed if the function changes.
 */
public final class FunctionSideEffects {
    private final Function function;
    private final EffectIndex index;
    private final ControlDepGraph graph;

    private FunctionSideEffects(Function function, EffectIndex index, ControlDepGraph graph) {
        this.function = function;
        this.index = index;
        this.graph = graph;
    }

    /**
     * Analyze a function.
     *
     * @param func       The function.
     * @param aliases    The resource alias info of the function.
     * @param classifier The classifier for the function's effects.
     * @return The control dependencies.
     */
    public static FunctionSideEffects analyze(Function func,
                                              ResourceAliasAnalysis.Info aliases,
                                              EffectClassifier classifier) {
        EffectIndex index = new EffectIndex(func);
        Map<Integer, BitSet> controlPredecessors = new RegionAnalyzer(index, aliases, classifier).analyze(func.body);
        return new FunctionSideEffects(func, index, ControlDepGraph.build(index.size(), controlPredecessors));
    }

    /**
     * Get the up-to-date control dependencies of a function, computing them with the
     * default classifier if they are missing or stale.
     *
     * @param func The function.
     * @return The control dependencies.
     */
    public static FunctionSideEffects of(Function func) {
        func.getExtOrThrow(CommonExts.METADATA_STATE).ensureValid(func, MetadataState.CONTROL_DEPS);
        return func.getExtOrThrow(CommonExts.CONTROL_DEPS);
    }

    public List<Effect> getDirectControlPredecessors(Effect effect) {
        return getDirectControlPredecessors(effect, null);
    }

    /**
     * Get the direct control predecessors of an effect, in program order.
     *
     * @param effect The effect.
     * @param filter Which predecessors to keep, or null to keep all of them.
     * @return The predecessors, or an empty list if the effect is not part of the function.
     */
    public List<Effect> getDirectControlPredecessors(Effect effect, @Nullable Predicate<Effect> filter) {
        int insn = index.indexOf(effect);
        if (insn == -1) return Collections.emptyList();
        return toEffects(graph.predecessorsOf(insn), filter);
    }

    public List<Effect> getDirectControlSuccessors(Effect effect) {
        return getDirectControlSuccessors(effect, null);
    }

    /**
     * Get the direct control successors of an effect, in program order.
     *
     * @param effect The effect.
     * @param filter Which successors to keep, or null to keep all of them.
     * @return The successors, or an empty list if the effect is not part of the function.
     */
    public List<Effect> getDirectControlSuccessors(Effect effect, @Nullable Predicate<Effect> filter) {
        int insn = index.indexOf(effect);
        if (insn == -1) return Collections.emptyList();
        return toEffects(graph.successorsOf(insn), filter);
    }

    private List<Effect> toEffects(int[] indices, @Nullable Predicate<Effect> filter) {
        List<Effect> result = new ArrayList<>(indices.length);
        for (int i : indices) {
            Effect effect = index.get(i);
            if (filter == null || filter.test(effect)) result.add(effect);
        }
        return result;
    }

    public Function getFunction() {
        return function;
    }

    /**
     * Get every effect of the function, including those in nested regions, in preorder.
     *
     * @return The effects.
     */
    public List<Effect> getEffects() {
        return index.getEffects();
    }

    public int getEdgeCount() {
        return graph.getEdgeCount();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("control deps of ").append(function.name).append(" {\n");
        for (int i = 0; i < index.size(); i++) {
            int[] preds = graph.predecessorsOf(i);
            if (preds.length == 0) continue;
            sb.append("  ").append(index.get(i)).append(" <-");
            for (int pred : preds) {
                sb.append(" [").append(index.get(pred)).append(']');
            }
            sb.append('\n');
        }
        sb.append('}');
        return sb.toString();
    }
}
