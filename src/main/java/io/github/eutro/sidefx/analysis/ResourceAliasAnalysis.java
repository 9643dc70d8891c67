package io.github.eutro.sidefx.analysis;

import io.github.eutro.sidefx.ext.CommonExts;
import io.github.eutro.sidefx.ops.CommonOps;
import io.github.eutro.sidefx.ops.ResourceOps;
import io.github.eutro.sidefx.ssa.Module;
import io.github.eutro.sidefx.ssa.*;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * Finds which resources each resource handle {@link Var} may refer to.
 * <p>
 * Resource ids are scoped to a function. Within one, handles from
 * {@link ResourceOps#VAR_HANDLE var_handle}s with the same name share an id,
 * and {@link CommonOps#IDENTITY identity} forwards the ids of its arguments
 * to its results. Every other handle, including function arguments, is unknown.
 */
public class ResourceAliasAnalysis {
    private final Map<Function, Info> infos = new HashMap<>();

    public ResourceAliasAnalysis(Module module) {
        for (Function func : module.functions) {
            infos.put(func, new Info(func));
        }
    }

    /**
     * Get the alias info of a function in the module.
     *
     * @param func The function.
     * @return The info.
     * @throws IllegalArgumentException If the function wasn't in the module.
     */
    public Info getAnalysisForFunc(Function func) {
        Info info = infos.get(func);
        if (info == null) throw new IllegalArgumentException("function not in analysed module: " + func.name);
        return info;
    }

    /**
     * Resource alias info for a single function.
     */
    public static class Info {
        private final Map<Var, Set<ResourceId>> resourceIds = new HashMap<>();
        private final Map<String, ResourceId> sharedNames = new HashMap<>();
        private long nextId = 0;

        public Info(Function func) {
            analyzeRegion(func.body);
        }

        private void analyzeRegion(Region region) {
            for (Effect effect : region.getEffects()) {
                analyzeEffect(effect);
                Insn insn = effect.insn();
                if (insn.hasRegions()) {
                    for (Region child : insn.regions()) {
                        analyzeRegion(child);
                    }
                }
            }
        }

        private void analyzeEffect(Effect effect) {
            Insn insn = effect.insn();
            List<Var> results = effect.getAssignsTo();
            if (insn.op.key == CommonOps.IDENTITY.key) {
                List<Var> args = insn.args();
                for (int i = 0; i < results.size(); i++) {
                    Var result = results.get(i);
                    if (!result.isResource()) continue;
                    resourceIds.put(result, i < args.size() ? idsOf(args.get(i)) : ResourceId.UNKNOWN_SET);
                }
                return;
            }

            boolean isDeclaration = insn.getExt(CommonExts.IS_RESOURCE_DECLARATION).orElse(false);
            String sharedName = ResourceOps.VAR_HANDLE.argNullable(insn.op);
            for (Var result : results) {
                if (!result.isResource()) continue;
                if (!isDeclaration) {
                    resourceIds.put(result, ResourceId.UNKNOWN_SET);
                } else if (sharedName != null) {
                    resourceIds.put(result, Collections.singleton(sharedNames.computeIfAbsent(sharedName, $ -> freshId())));
                } else {
                    resourceIds.put(result, Collections.singleton(freshId()));
                }
            }
        }

        private ResourceId freshId() {
            return ResourceId.known(nextId++);
        }

        @NotNull
        private Set<ResourceId> idsOf(Var var) {
            if (!var.isResource()) return ResourceId.UNKNOWN_SET;
            return resourceIds.getOrDefault(var, ResourceId.UNKNOWN_SET);
        }

        /**
         * Whether the resources {@code var} refers to are unknown.
         *
         * @param var The resource handle.
         * @return Whether it may alias any resource.
         */
        public boolean isUnknownResource(Var var) {
            return idsOf(var).contains(ResourceId.UNKNOWN);
        }

        /**
         * Get the resources {@code var} may refer to.
         *
         * @param var The resource handle.
         * @return The resource ids, none of them unknown.
         * @throws IllegalStateException If the resource is {@link #isUnknownResource(Var) unknown}.
         */
        public Set<ResourceId> getResourceIds(Var var) {
            Set<ResourceId> ids = idsOf(var);
            if (ids.contains(ResourceId.UNKNOWN)) {
                throw new IllegalStateException("resource ids of unknown resource requested: " + var);
            }
            return Collections.unmodifiableSet(ids);
        }

        /**
         * Find every resource that {@code effect} may access, through its resource-typed arguments and results.
         *
         * @param effect The effect.
         * @return The resources, or {@link ResourceId#UNKNOWN_SET} if any of them is unknown.
         */
        public Set<ResourceId> findAccessedResources(Effect effect) {
            Set<ResourceId> resources = new LinkedHashSet<>();
            for (Var arg : effect.insn()) {
                if (!arg.isResource()) continue;
                if (isUnknownResource(arg)) return ResourceId.UNKNOWN_SET;
                resources.addAll(getResourceIds(arg));
            }
            for (Var result : effect.getAssignsTo()) {
                if (!result.isResource()) continue;
                if (isUnknownResource(result)) return ResourceId.UNKNOWN_SET;
                resources.addAll(getResourceIds(result));
            }
            return resources;
        }
    }
}
