package io.github.eutro.sidefx.ssa;

import io.github.eutro.sidefx.ext.CommonExts;
import io.github.eutro.sidefx.ext.ExtHolder;
import io.github.eutro.sidefx.ext.TrackedList;

import java.util.List;

/**
 * A whole program: an ordered collection of {@link Function}s.
 */
public final class Module extends ExtHolder {
    /**
     * The functions of this module, in order. Modifiable.
     */
    public final List<Function> functions = new TrackedList<>(CommonExts.OWNING_MODULE, this);

    /**
     * Create a new function, and add it to this module.
     *
     * @param name The name of the function.
     * @return The function.
     */
    public Function newFunction(String name) {
        Function func = new Function(name);
        functions.add(func);
        return func;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Function func : functions) {
            sb.append(func).append('\n');
        }
        return sb.toString();
    }
}
