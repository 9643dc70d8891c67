package io.github.eutro.sidefx.passes;

import io.github.eutro.sidefx.passes.misc.ChainedPass;
import io.github.eutro.sidefx.ssa.Function;
import io.github.eutro.sidefx.ssa.Module;

/**
 * A pass over some part of the IR ({@link Module} or {@link Function}),
 * which may modify it, compute metadata for it, or produce something else from it.
 * <p>
 * An <i>in-place</i> pass returns its own input, and should return true for {@link #isInPlace()}.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The IR to run it on.
     * @return The result.
     */
    B run(A a);

    default boolean isInPlace() {
        return false;
    }

    /**
     * Compose this pass with another, which runs on its result.
     *
     * @param next The pass to run after this.
     * @param <C>  The result type.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
