package io.github.eutro.sidefx.analysis;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Map;

/**
 * The finalised control dependency graph of a function, over {@link EffectIndex effect indices}.
 * <p>
 * The predecessors and successors of each effect are deduplicated, sorted by ascending index,
 * and exact mirrors of each other. The graph is immutable.
 */
public final class ControlDepGraph {
    private static final int[] NONE = new int[0];

    private final int[][] predecessors;
    private final int[][] successors;
    private final int edgeCount;

    private ControlDepGraph(int[][] predecessors, int[][] successors, int edgeCount) {
        this.predecessors = predecessors;
        this.successors = successors;
        this.edgeCount = edgeCount;
    }

    /**
     * Build the graph from the raw predecessor sets of a {@link RegionAnalyzer}.
     *
     * @param size                The number of effects in the function.
     * @param controlPredecessors The predecessors of each effect.
     * @return The graph.
     */
    public static ControlDepGraph build(int size, Map<Integer, BitSet> controlPredecessors) {
        int[][] preds = new int[size][];
        Arrays.fill(preds, NONE);
        int[] succCounts = new int[size];
        int edgeCount = 0;
        for (Map.Entry<Integer, BitSet> entry : controlPredecessors.entrySet()) {
            int[] sorted = entry.getValue().stream().toArray();
            for (int pred : sorted) {
                if (pred >= size) throw new IllegalArgumentException("predecessor out of range: " + pred);
                succCounts[pred]++;
            }
            preds[entry.getKey()] = sorted;
            edgeCount += sorted.length;
        }

        int[][] succs = new int[size][];
        for (int i = 0; i < size; i++) {
            succs[i] = succCounts[i] == 0 ? NONE : new int[succCounts[i]];
        }
        // visiting successors in ascending order fills each list already sorted
        int[] filled = new int[size];
        for (int succ = 0; succ < size; succ++) {
            for (int pred : preds[succ]) {
                succs[pred][filled[pred]++] = succ;
            }
        }
        return new ControlDepGraph(preds, succs, edgeCount);
    }

    /**
     * @param insn The index of an effect.
     * @return The sorted indices of its direct control predecessors.
     */
    public int[] predecessorsOf(int insn) {
        return predecessors[insn].clone();
    }

    /**
     * @param insn The index of an effect.
     * @return The sorted indices of its direct control successors.
     */
    public int[] successorsOf(int insn) {
        return successors[insn].clone();
    }

    public int size() {
        return predecessors.length;
    }

    public int getEdgeCount() {
        return edgeCount;
    }
}
