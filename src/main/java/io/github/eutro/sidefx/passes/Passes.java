package io.github.eutro.sidefx.passes;

import io.github.eutro.sidefx.passes.meta.ComputeSideEffects;
import io.github.eutro.sidefx.passes.misc.ForPass;
import io.github.eutro.sidefx.ssa.Module;

/**
 * Some pre-composed passes.
 */
public class Passes {
    /**
     * Computes the control dependencies of every function in a module.
     */
    public static final IRPass<Module, Module> CONTROL_DEPS = ForPass.liftFunctions(ComputeSideEffects.INSTANCE);
}
