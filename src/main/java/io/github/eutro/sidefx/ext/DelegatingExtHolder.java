package io.github.eutro.sidefx.ext;

import org.jetbrains.annotations.Nullable;

/**
 * An {@link ExtHolder} that falls back to another container for exts it doesn't have itself.
 * <p>
 * This is how classification exts attached to an {@link io.github.eutro.sidefx.ops.OpKey}
 * are visible from every instruction using it.
 */
public abstract class DelegatingExtHolder extends ExtHolder {
    /**
     * Get the container to look in when this one doesn't have an ext.
     *
     * @return The delegate, or null to look nowhere else.
     */
    protected abstract @Nullable ExtContainer getDelegate();

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        T localExt = super.getNullable(ext);
        if (localExt != null) return localExt;
        ExtContainer delegate = getDelegate();
        return delegate == null ? null : delegate.getNullable(ext);
    }
}
