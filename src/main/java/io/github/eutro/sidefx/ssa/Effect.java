package io.github.eutro.sidefx.ssa;

import io.github.eutro.sidefx.ext.*;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An effect, encapsulating an {@link Insn instruction}, and the
 * variables its results are assigned to.
 * <p>
 * Effects are what the side effect analysis orders: each is
 * a node of the control dependency graph.
 */
public final class Effect extends DelegatingExtHolder {
    private static final Var[] NO_VARS = new Var[0];

    private final Var[] assignsTo;
    private final Insn insn;

    Effect(List<Var> assignsTo, Insn insn) {
        this.assignsTo = assignsTo.isEmpty() ? NO_VARS : assignsTo.toArray(NO_VARS);
        for (Var var : this.assignsTo) {
            var.attachExt(CommonExts.ASSIGNED_AT, this);
        }
        insn.attachExt(CommonExts.OWNING_EFFECT, this);
        this.insn = insn;
    }

    @Override
    protected ExtContainer getDelegate() {
        return insn;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (assignsTo.length != 0) {
            sb.append(Arrays.stream(assignsTo)
                    .map(Var::toString)
                    .collect(Collectors.joining(", ", "", " = ")));
        }
        sb.append(insn);
        return sb.toString();
    }

    /**
     * Get the variables this effect assigns to.
     *
     * @return An unmodifiable list of the variables.
     */
    public List<Var> getAssignsTo() {
        return Collections.unmodifiableList(Arrays.asList(assignsTo));
    }

    /**
     * Get the {@link Insn underlying instruction} of this effect.
     *
     * @return The instruction.
     */
    public Insn insn() {
        return insn;
    }

    // exts
    private Region owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_REGION) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_REGION) {
            owner = (Region) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_REGION) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
