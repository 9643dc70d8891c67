package io.github.eutro.sidefx.test;

import io.github.eutro.sidefx.ops.CommonOps;
import io.github.eutro.sidefx.ops.ResourceOps;
import io.github.eutro.sidefx.ssa.*;

import java.util.Arrays;

/**
 * Shorthands for building test IR.
 */
public class Utils {
    public static Var handle(IRBuilder ib, String name) {
        return ib.insertResource(ResourceOps.VAR_HANDLE.create(name).insn(), name);
    }

    public static Var argHandle(IRBuilder ib, int n) {
        return ib.insertResource(CommonOps.ARG.create(n).insn(), "arg" + n);
    }

    public static Effect write(IRBuilder ib, Var resource) {
        Var value = ib.insert(CommonOps.constant(1), "c");
        return ib.insert(ResourceOps.ASSIGN_VAR.insn(resource, value));
    }

    public static Effect read(IRBuilder ib, Var resource) {
        return ib.insert(ResourceOps.READ_VAR.insn(resource).assignTo(ib.func.newVar("x")));
    }

    public static Effect call(IRBuilder ib, String name) {
        return ib.insert(CommonOps.CALL.create(name).insn());
    }

    /**
     * Insert an {@code if} with a single branch, and point the builder into that branch.
     *
     * @return The {@code if} effect.
     */
    public static Effect enterIf(IRBuilder ib) {
        Var cond = ib.insert(CommonOps.constant(true), "cond");
        Region then = new Region();
        Effect ifEffect = ib.insert(CommonOps.IF.insnWithRegions(Arrays.asList(then), cond));
        ib.setRegion(then);
        return ifEffect;
    }
}
