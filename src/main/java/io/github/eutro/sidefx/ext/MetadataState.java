package io.github.eutro.sidefx.ext;

import io.github.eutro.sidefx.passes.IRPass;
import io.github.eutro.sidefx.passes.meta.ComputeSideEffects;
import io.github.eutro.sidefx.ssa.Function;

import java.util.BitSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks which derived metadata of a {@link Function}, attached as {@link CommonExts#METADATA_STATE},
 * is up to date.
 * <p>
 * Anything that changes the regions or effects of a function must call {@link #graphChanged()}
 * (usually through {@link Function#markChanged()}), so stale metadata is recomputed on next use.
 */
public class MetadataState {
    /**
     * A kind of derived metadata, computed by running an in-place pass.
     *
     * @param <T> The IR the metadata is attached to.
     */
    public static final class MetaKind<T> {
        private static final AtomicInteger COUNTER = new AtomicInteger();

        private final int id = COUNTER.getAndIncrement();
        public final String name;
        private final IRPass<T, T> pass;

        private MetaKind(String name, IRPass<T, T> pass) {
            if (!pass.isInPlace()) throw new IllegalArgumentException("metadata pass is not in-place: " + pass);
            this.name = name;
            this.pass = pass;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * The control dependency graph, {@link CommonExts#CONTROL_DEPS}.
     */
    public static final MetaKind<Function> CONTROL_DEPS = new MetaKind<>("CONTROL_DEPS", ComputeSideEffects.INSTANCE);

    private final BitSet valid = new BitSet();

    public boolean isValid(MetaKind<?> kind) {
        return valid.get(kind.id);
    }

    /**
     * Compute any of the given kinds of metadata that are not valid, and mark them as valid.
     *
     * @param t     The IR to compute them for, which this must be the state of.
     * @param kinds The kinds of metadata.
     * @param <T>   The type of the IR.
     */
    @SafeVarargs
    public final <T> void ensureValid(T t, MetaKind<T>... kinds) {
        for (MetaKind<T> kind : kinds) {
            if (isValid(kind)) continue;
            kind.pass.run(t);
            validate(kind);
        }
    }

    public void validate(MetaKind<?>... kinds) {
        for (MetaKind<?> kind : kinds) {
            valid.set(kind.id);
        }
    }

    public void invalidate(MetaKind<?>... kinds) {
        for (MetaKind<?> kind : kinds) {
            valid.clear(kind.id);
        }
    }

    /**
     * Mark everything derived from the regions and effects of the function as stale.
     */
    public void graphChanged() {
        invalidate(CONTROL_DEPS);
    }
}
