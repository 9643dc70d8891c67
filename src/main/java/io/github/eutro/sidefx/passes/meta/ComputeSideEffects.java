package io.github.eutro.sidefx.passes.meta;

import io.github.eutro.sidefx.analysis.EffectClassifier;
import io.github.eutro.sidefx.analysis.FunctionSideEffects;
import io.github.eutro.sidefx.analysis.OpEffectClassifier;
import io.github.eutro.sidefx.analysis.ResourceAliasAnalysis;
import io.github.eutro.sidefx.ext.CommonExts;
import io.github.eutro.sidefx.ext.MetadataState;
import io.github.eutro.sidefx.passes.InPlaceIRPass;
import io.github.eutro.sidefx.ssa.Function;

/**
 * Computes {@link CommonExts#CONTROL_DEPS} for a function.
 */
public class ComputeSideEffects implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass, classifying effects by their operations.
     */
    public static final ComputeSideEffects INSTANCE = new ComputeSideEffects(OpEffectClassifier.INSTANCE);

    private final EffectClassifier classifier;

    public ComputeSideEffects(EffectClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        FunctionSideEffects deps = FunctionSideEffects.analyze(func, new ResourceAliasAnalysis.Info(func), classifier);
        func.attachExt(CommonExts.CONTROL_DEPS, deps);
        ms.validate(MetadataState.CONTROL_DEPS);
    }
}
