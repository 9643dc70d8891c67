package io.github.eutro.sidefx.analysis;

import io.github.eutro.sidefx.ext.CommonExts;
import io.github.eutro.sidefx.ops.CommonOps;
import io.github.eutro.sidefx.ssa.Effect;

/**
 * An {@link EffectClassifier} that reads the classification exts of each effect's operation.
 */
public class OpEffectClassifier implements EffectClassifier {
    public static final OpEffectClassifier INSTANCE = new OpEffectClassifier();

    @Override
    public ResourceAccessKind getAccessKind(Effect effect) {
        return effect.getExt(CommonExts.RESOURCE_ACCESS).orElse(ResourceAccessKind.NOT_APPLICABLE);
    }

    @Override
    public boolean isKnownSideEffectFree(Effect effect) {
        // identity may be forwarding resource handles, but it never touches them
        if (isIdentity(effect)) return true;
        return effect.getExt(CommonExts.IS_PURE).orElse(false);
    }

    @Override
    public boolean isResourceDeclaration(Effect effect, ResourceAliasAnalysis.Info aliases) {
        if (effect.getExt(CommonExts.IS_RESOURCE_DECLARATION).orElse(false)) return true;
        return isIdentity(effect) && !aliases.findAccessedResources(effect).isEmpty();
    }

    private static boolean isIdentity(Effect effect) {
        return effect.insn().op.key == CommonOps.IDENTITY.key;
    }
}
