package io.github.eutro.sidefx.ssa;

import io.github.eutro.sidefx.ext.*;
import org.intellij.lang.annotations.PrintFormat;
import org.jetbrains.annotations.Nullable;

import java.lang.ref.SoftReference;
import java.util.HashMap;
import java.util.Map;

/**
 * A function: a named body {@link Region}.
 */
public final class Function extends ExtHolder {
    public static boolean UNIQUE_VAR_NAMES = System.getenv("SIDEFX_UNIQUE_VAR_NAMES") != null;

    public final String name;
    public final Region body = new Region();

    // names only matter when debugging, so let the JVM clear them if it has to
    private SoftReference<Map<String, Integer>> varsRef = UNIQUE_VAR_NAMES ? new SoftReference<>(new HashMap<>()) : null;

    public Function(String name) {
        this.name = name;
        body.attachExt(CommonExts.OWNING_FUNCTION, this);
    }

    public Var newVar(String name, int indexHint) {
        if (!UNIQUE_VAR_NAMES) {
            return new Var(name, indexHint);
        }
        Map<String, Integer> vars = varsRef.get();
        if (vars == null) {
            vars = new HashMap<>();
            varsRef = new SoftReference<>(vars);
        }
        Integer next = vars.get(name);
        int index = next == null ? indexHint : Math.max(indexHint, next);
        vars.put(name, index + 1);
        return new Var(name, index);
    }

    public Var newVar(String name) {
        return newVar(name, 0);
    }

    public Var newVarFmt(@PrintFormat String fmt, Object... args) {
        return newVar(String.format(fmt, args));
    }

    /**
     * Create a new variable holding a resource handle.
     *
     * @param name The name of the variable.
     * @return The variable.
     */
    public Var newResourceVar(String name) {
        Var var = newVar(name);
        var.attachExt(CommonExts.IS_RESOURCE, true);
        return var;
    }

    /**
     * Notify the metadata state of this function that its effects or regions changed.
     */
    public void markChanged() {
        metaState.graphChanged();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("fn ").append(name).append("() ");
        body.appendTo(sb, "");
        return sb.toString();
    }

    // exts
    private MetadataState metaState = new MetadataState();
    private Module owner = null;

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = (MetadataState) value;
            return;
        } if (ext == CommonExts.OWNING_MODULE) {
            owner = (Module) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            throw new UnsupportedOperationException();
        } if (ext == CommonExts.OWNING_MODULE) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            return (T) metaState;
        } if (ext == CommonExts.OWNING_MODULE) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }
}
