package io.github.eutro.sidefx.ops;

import io.github.eutro.sidefx.analysis.ResourceAccessKind;
import io.github.eutro.sidefx.ext.CommonExts;

/**
 * Operations on resources: stateful locations reached through resource handle {@link io.github.eutro.sidefx.ssa.Var}s.
 * <p>
 * Each of these carries its {@link CommonExts#RESOURCE_ACCESS access kind},
 * or is a {@link CommonExts#IS_RESOURCE_DECLARATION declaration}.
 */
public class ResourceOps {
    /**
     * Effect: returns a handle to the resource with the given shared name.
     * Handles with the same name in one function alias each other.
     */
    public static final UnaryOpKey<String> VAR_HANDLE = new UnaryOpKey<>("var_handle");

    /**
     * Effect: returns the value of the resource.
     */
    public static final Op READ_VAR = SimpleOpKey.accessing("read_var", ResourceAccessKind.READ);
    /**
     * Effect: returns the elements of the resource at the given indices. Arguments: handle, indices.
     */
    public static final Op GATHER = SimpleOpKey.accessing("gather", ResourceAccessKind.READ);

    /**
     * Effect: sets the value of the resource. Arguments: handle, value.
     */
    public static final Op ASSIGN_VAR = SimpleOpKey.accessing("assign_var", ResourceAccessKind.WRITE);
    /**
     * Effect: adds to the value of the resource. Arguments: handle, value.
     */
    public static final Op ASSIGN_ADD_VAR = SimpleOpKey.accessing("assign_add_var", ResourceAccessKind.WRITE);
    /**
     * Effect: sets the elements of the resource at the given indices. Arguments: handle, indices, values.
     */
    public static final Op SCATTER_UPDATE = SimpleOpKey.accessing("scatter_update", ResourceAccessKind.WRITE);
    /**
     * Effect: releases the resource.
     */
    public static final Op DESTROY_RESOURCE = SimpleOpKey.accessing("destroy_resource", ResourceAccessKind.WRITE);

    /**
     * Effect: applies the named stateful operation to the resources among its arguments.
     * Only which resources it touches is known, not how.
     */
    public static final UnaryOpKey<String> APPLY = new UnaryOpKey<>("apply");

    static {
        CommonExts.markDeclaration(VAR_HANDLE);
        CommonExts.markPure(VAR_HANDLE);
        CommonExts.markAccess(APPLY, ResourceAccessKind.UNKNOWN);
    }
}
