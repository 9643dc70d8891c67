package io.github.eutro.sidefx.analysis;

import io.github.eutro.sidefx.ssa.Effect;

/**
 * Classifies the side effects of an {@link Effect}, for the {@link SideEffectAnalysis}.
 *
 * @see OpEffectClassifier
 */
public interface EffectClassifier {
    /**
     * Get how the effect accesses its resources.
     *
     * @param effect The effect.
     * @return The access kind, {@link ResourceAccessKind#NOT_APPLICABLE} if there is no info.
     */
    ResourceAccessKind getAccessKind(Effect effect);

    /**
     * Whether the effect is known to have no side effects at all.
     *
     * @param effect The effect.
     * @return Whether it is side effect free.
     */
    boolean isKnownSideEffectFree(Effect effect);

    /**
     * Whether the effect only declares a resource handle, and so needs no ordering.
     *
     * @param effect  The effect.
     * @param aliases The alias info of the effect's function.
     * @return Whether it is a declaration.
     */
    boolean isResourceDeclaration(Effect effect, ResourceAliasAnalysis.Info aliases);
}
