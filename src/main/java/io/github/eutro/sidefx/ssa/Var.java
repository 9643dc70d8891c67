package io.github.eutro.sidefx.ssa;

import io.github.eutro.sidefx.ext.CommonExts;
import io.github.eutro.sidefx.ext.Ext;
import io.github.eutro.sidefx.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

/**
 * A variable, assigned exactly once by an {@link Effect}.
 */
public final class Var extends ExtHolder {
    public final String name;
    public final int index;

    public Var(String name, int index) {
        this.name = name;
        this.index = index;
    }

    /**
     * Whether this variable holds a resource handle.
     *
     * @return Whether it is resource-typed.
     */
    public boolean isResource() {
        return isResource;
    }

    @Override
    public String toString() {
        return (isResource ? "%" : "$") + name + (index == 0 ? "" : "." + index);
    }

    // exts
    private Effect assignedAt = null;
    private boolean isResource = false;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) {
            return (T) assignedAt;
        } if (ext == CommonExts.IS_RESOURCE) {
            return isResource ? (T) Boolean.TRUE : null;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = (Effect) value;
            return;
        } if (ext == CommonExts.IS_RESOURCE) {
            isResource = (Boolean) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = null;
            return;
        } if (ext == CommonExts.IS_RESOURCE) {
            isResource = false;
            return;
        }
        super.removeExt(ext);
    }
}
