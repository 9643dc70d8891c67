package io.github.eutro.sidefx.ssa.display;

import io.github.eutro.sidefx.analysis.FunctionSideEffects;
import io.github.eutro.sidefx.ssa.Effect;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders control dependency graphs in the Graphviz DOT format, for debugging.
 */
public class ControlDepsDisplay {
    public static void debugDisplayToFile(String dot, File file) {
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null) parent.mkdirs();
        try (Writer writer = new FileWriter(file)) {
            writer.write(dot);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Render the control dependencies of a function as a DOT digraph, with an edge
     * from each effect to each of its direct control successors.
     *
     * @param deps The control dependencies.
     * @return The DOT source.
     */
    public static String displayDot(FunctionSideEffects deps) {
        List<Effect> effects = deps.getEffects();
        Map<Effect, Integer> ids = new IdentityHashMap<>();
        StringBuilder sb = new StringBuilder();
        sb.append("digraph \"").append(escape(deps.getFunction().name)).append("\" {\n");
        sb.append("  node [shape=box, fontname=monospace];\n");
        for (Effect effect : effects) {
            int id = ids.size();
            ids.put(effect, id);
            sb.append("  n").append(id).append(" [label=\"").append(escape(effect.toString())).append("\"];\n");
        }
        for (Effect effect : effects) {
            for (Effect succ : deps.getDirectControlSuccessors(effect)) {
                sb.append("  n").append(ids.get(effect)).append(" -> n").append(ids.get(succ)).append(";\n");
            }
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':
                case '\\':
                    sb.append('\\').append(c);
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }
}
