package io.github.eutro.sidefx.ext;

import io.github.eutro.sidefx.analysis.FunctionSideEffects;
import io.github.eutro.sidefx.analysis.ResourceAccessKind;
import io.github.eutro.sidefx.ssa.Module;
import io.github.eutro.sidefx.ssa.*;

/**
 * The {@link Ext}s used throughout the IR and the analyses over it.
 */
public class CommonExts {
    /**
     * Attached to a {@link Function}. Which of its metadata is currently valid.
     */
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * Attached to an {@link io.github.eutro.sidefx.ops.OpKey}. Whether the operation is known
     * to have no side effects.
     */
    public static final Ext<Boolean> IS_PURE = Ext.create(Boolean.class, "IS_PURE");
    /**
     * Attached to an {@link io.github.eutro.sidefx.ops.OpKey}. How the operation accesses
     * the resources among its operands and results. Operations without it have
     * no resource access info.
     */
    public static final Ext<ResourceAccessKind> RESOURCE_ACCESS = Ext.create(ResourceAccessKind.class, "RESOURCE_ACCESS");
    /**
     * Attached to an {@link io.github.eutro.sidefx.ops.OpKey}. Whether the operation
     * creates a fresh resource handle.
     */
    public static final Ext<Boolean> IS_RESOURCE_DECLARATION = Ext.create(Boolean.class, "IS_RESOURCE_DECLARATION");

    /**
     * Attached to a {@link Var}. Whether it holds a resource handle.
     */
    public static final Ext<Boolean> IS_RESOURCE = Ext.create(Boolean.class, "IS_RESOURCE");
    /**
     * Attached to a {@link Var}. The effect that assigns it.
     */
    public static final Ext<Effect> ASSIGNED_AT = Ext.create(Effect.class, "ASSIGNED_AT");

    public static final Ext<Module> OWNING_MODULE = Ext.create(Module.class, "OWNING_MODULE");
    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");
    public static final Ext<Region> OWNING_REGION = Ext.create(Region.class, "OWNING_REGION");
    public static final Ext<Insn> OWNING_INSN = Ext.create(Insn.class, "OWNING_INSN");
    public static final Ext<Effect> OWNING_EFFECT = Ext.create(Effect.class, "OWNING_EFFECT");

    /**
     * Attached to a {@link Function}, computed by {@link io.github.eutro.sidefx.passes.meta.ComputeSideEffects}.
     * Its control dependency graph.
     */
    public static final Ext<FunctionSideEffects> CONTROL_DEPS = Ext.create(FunctionSideEffects.class, "CONTROL_DEPS");

    public static <T extends ExtContainer> T markPure(T t) {
        t.attachExt(IS_PURE, true);
        return t;
    }

    public static <T extends ExtContainer> T markAccess(T t, ResourceAccessKind kind) {
        t.attachExt(RESOURCE_ACCESS, kind);
        return t;
    }

    public static <T extends ExtContainer> T markDeclaration(T t) {
        t.attachExt(IS_RESOURCE_DECLARATION, true);
        return t;
    }
}
