package io.github.eutro.sidefx.analysis;

import io.github.eutro.sidefx.ext.ExtContainer;
import io.github.eutro.sidefx.ssa.Function;
import io.github.eutro.sidefx.ssa.Module;
import io.github.eutro.sidefx.ssa.display.ControlDepsDisplay;
import org.jetbrains.annotations.Nullable;

import java.io.File;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Computes the control dependencies between the effects of every function in a module.
 * <p>
 * Functions are analysed independently, and resource ids are scoped to
 * a function, so they can be analysed in parallel.
 *
 * @see FunctionSideEffects
 */
public class SideEffectAnalysis {
    /**
     * Whether to analyse the functions of a module in parallel by default.
     */
    public static boolean PARALLEL_ANALYSIS = System.getenv("SIDEFX_PARALLEL_ANALYSIS") != null;
    /**
     * A directory to write the control dependency graph of every analysed function to, if any.
     */
    @Nullable
    public static String DEBUG_DEPS_DIR = System.getenv("SIDEFX_DEBUG_DEPS_DIR");

    private final Map<Function, FunctionSideEffects> infoMap = new LinkedHashMap<>();

    public SideEffectAnalysis(Module module) {
        this(module, OpEffectClassifier.INSTANCE, PARALLEL_ANALYSIS);
    }

    /**
     * Analyze a module.
     *
     * @param module     The module.
     * @param classifier The classifier for the effects of the module.
     * @param parallel   Whether to analyse functions in parallel.
     */
    public SideEffectAnalysis(Module module, EffectClassifier classifier, boolean parallel) {
        ResourceAliasAnalysis aliasAnalysis = new ResourceAliasAnalysis(module);

        Stream<Function> functions = parallel
                ? module.functions.parallelStream()
                : module.functions.stream();
        List<FunctionSideEffects> analyses = functions
                .map(func -> FunctionSideEffects.analyze(func, aliasAnalysis.getAnalysisForFunc(func), classifier))
                .collect(Collectors.toList());
        for (FunctionSideEffects analysis : analyses) {
            infoMap.put(analysis.getFunction(), analysis);
        }

        if (DEBUG_DEPS_DIR != null) {
            int i = 0;
            for (FunctionSideEffects analysis : analyses) {
                ControlDepsDisplay.debugDisplayToFile(
                        ControlDepsDisplay.displayDot(analysis),
                        new File(DEBUG_DEPS_DIR, String.format("%03d_%s.dot", i++, analysis.getFunction().name))
                );
            }
        }
    }

    /**
     * Analyze some IR, which must be a whole {@link Module}.
     *
     * @param ir The IR.
     * @return The analysis.
     * @throws IllegalArgumentException If {@code ir} is not a module.
     */
    public static SideEffectAnalysis of(ExtContainer ir) {
        if (!(ir instanceof Module)) {
            throw new IllegalArgumentException("side effect analysis requires a module, got: " + ir.getClass().getName());
        }
        return new SideEffectAnalysis((Module) ir);
    }

    /**
     * Get the analysis of a function in the module.
     *
     * @param func The function.
     * @return The analysis.
     * @throws IllegalArgumentException If the function wasn't in the module.
     */
    public FunctionSideEffects getAnalysisForFunc(Function func) {
        FunctionSideEffects info = infoMap.get(func);
        if (info == null) throw new IllegalArgumentException("function not in analysed module: " + func.name);
        return info;
    }

    /**
     * Get every function's analysis, in module order.
     *
     * @return An unmodifiable view of the analyses.
     */
    public Map<Function, FunctionSideEffects> getAnalyses() {
        return Collections.unmodifiableMap(infoMap);
    }
}
