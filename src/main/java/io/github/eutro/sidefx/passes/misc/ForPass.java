package io.github.eutro.sidefx.passes.misc;

import io.github.eutro.sidefx.passes.IRPass;
import io.github.eutro.sidefx.passes.InPlaceIRPass;
import io.github.eutro.sidefx.ssa.Function;
import io.github.eutro.sidefx.ssa.Module;

/**
 * Lifts passes over functions into passes over whole modules.
 */
public class ForPass {
    /**
     * Lift an in-place function pass to run on every function of a module, in order.
     *
     * @param pass The function pass.
     * @return The module pass.
     */
    public static InPlaceIRPass<Module> liftFunctions(IRPass<Function, Function> pass) {
        if (!pass.isInPlace()) throw new IllegalArgumentException("pass is not in-place: " + pass);
        return module -> {
            int i = 0;
            try {
                for (Function func : module.functions) {
                    pass.run(func);
                    i++;
                }
            } catch (Throwable t) {
                t.addSuppressed(new RuntimeException("in function " + i + " (" + module.functions.get(i).name + ")"));
                throw t;
            }
        };
    }
}
