package io.github.eutro.sidefx.ssa;

import io.github.eutro.sidefx.ext.*;
import io.github.eutro.sidefx.ops.Op;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * An instruction: an {@link Op operation} applied to argument {@link Var}s,
 * possibly owning nested {@link Region}s.
 * <p>
 * An instruction sees the exts of its operation, so classification attached to an
 * {@link io.github.eutro.sidefx.ops.OpKey} can be overridden per instruction.
 */
public final class Insn extends DelegatingExtHolder implements Iterable<Var> {
    /**
     * Whether to record where each instruction was constructed, for error messages.
     */
    public static boolean TRACK_INSN_CREATIONS = System.getenv("SIDEFX_TRACK_INSN_CREATIONS") != null;

    @Nullable
    public final Throwable created = TRACK_INSN_CREATIONS ? new Throwable("constructed") : null;
    public final Op op;

    private final Var[] args;
    @Nullable
    private TrackedList<Region, Insn> regions = null;

    public Insn(Op op, List<Var> args) {
        this.op = op;
        this.args = args.toArray(new Var[0]);
    }

    @Override
    protected ExtContainer getDelegate() {
        return op;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(op);
        for (Var arg : args) {
            sb.append(' ').append(arg);
        }
        if (regions != null) {
            for (Region region : regions) {
                sb.append(" { ").append(region.getEffects().size()).append(" effects }");
            }
        }
        return sb.toString();
    }

    public Effect assignTo(Var... vars) {
        return new Effect(Arrays.asList(vars), this);
    }

    public Effect assignTo(List<Var> vars) {
        return new Effect(vars, this);
    }

    /**
     * Get the arguments of this instruction, which can be replaced with {@link List#set(int, Object)},
     * but not added or removed.
     *
     * @return The arguments.
     */
    public List<Var> args() {
        return Arrays.asList(args);
    }

    /**
     * Get the regions nested in this instruction, in order. The list is modifiable.
     *
     * @return The regions.
     */
    public List<Region> regions() {
        if (regions == null) {
            regions = new TrackedList<>(CommonExts.OWNING_INSN, this, 2);
        }
        return regions;
    }

    /**
     * Whether this instruction has any nested regions, without allocating the region list.
     *
     * @return Whether there are nested regions.
     */
    public boolean hasRegions() {
        return regions != null && !regions.isEmpty();
    }

    @NotNull
    @Override
    public Iterator<Var> iterator() {
        return args().iterator();
    }

    // exts
    private Effect owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_EFFECT) {
            owner = (Effect) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
