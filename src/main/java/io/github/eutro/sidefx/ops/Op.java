package io.github.eutro.sidefx.ops;

import io.github.eutro.sidefx.ext.DelegatingExtHolder;
import io.github.eutro.sidefx.ext.ExtContainer;
import io.github.eutro.sidefx.ssa.Insn;
import io.github.eutro.sidefx.ssa.Region;
import io.github.eutro.sidefx.ssa.Var;

import java.util.Arrays;
import java.util.List;

/**
 * An operation, encapsulating an {@link OpKey operation key} and any immediates.
 */
public /* virtual */ class Op extends DelegatingExtHolder {
    public final OpKey key;

    public Op(OpKey key) {
        this.key = key;
    }

    @Override
    protected ExtContainer getDelegate() {
        return key;
    }

    @Override
    public String toString() {
        return key.toString();
    }

    public Insn insn(Var... vars) {
        return new Insn(this, Arrays.asList(vars));
    }

    public Insn insn(List<Var> vars) {
        return new Insn(this, vars);
    }

    /**
     * Create an instruction of this operation owning the given regions.
     *
     * @param regions The nested regions.
     * @param vars    The arguments.
     * @return The instruction.
     */
    public Insn insnWithRegions(List<Region> regions, Var... vars) {
        Insn insn = insn(vars);
        insn.regions().addAll(regions);
        return insn;
    }
}
