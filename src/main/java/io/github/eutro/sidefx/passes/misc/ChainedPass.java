package io.github.eutro.sidefx.passes.misc;

import io.github.eutro.sidefx.passes.IRPass;

import java.util.ArrayList;
import java.util.List;

/**
 * Two passes run one after the other, the second on the result of the first.
 * <p>
 * Nested chains are flattened when run, so a failure reports the position of
 * the failing pass in the whole chain.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final IRPass<A, B> first;
    private final IRPass<B, C> second;

    public ChainedPass(IRPass<A, B> first, IRPass<B, C> second) {
        this.first = first;
        this.second = second;
    }

    private static void flattenInto(IRPass<?, ?> pass, List<IRPass<?, ?>> out) {
        if (pass instanceof ChainedPass) {
            ChainedPass<?, ?, ?> chain = (ChainedPass<?, ?, ?>) pass;
            flattenInto(chain.first, out);
            flattenInto(chain.second, out);
        } else {
            out.add(pass);
        }
    }

    @Override
    public boolean isInPlace() {
        return first.isInPlace() && second.isInPlace();
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        List<IRPass<?, ?>> passes = new ArrayList<>();
        flattenInto(this, passes);
        Object acc = a;
        for (int i = 0; i < passes.size(); i++) {
            try {
                acc = ((IRPass<Object, Object>) passes.get(i)).run(acc);
            } catch (Throwable t) {
                t.addSuppressed(new RuntimeException("running pass " + i + " in chain"));
                throw t;
            }
        }
        return (C) acc;
    }
}
