package io.github.eutro.sidefx.analysis;

import io.github.eutro.sidefx.ssa.Effect;
import io.github.eutro.sidefx.ssa.Function;
import io.github.eutro.sidefx.ssa.Insn;
import io.github.eutro.sidefx.ssa.Region;

import java.util.*;

/**
 * Numbers every {@link Effect} of a function, including those in nested regions,
 * densely and in preorder.
 * <p>
 * Within a region, a lower index always means earlier in program order.
 */
public final class EffectIndex {
    private final List<Effect> effects = new ArrayList<>();
    private final Map<Effect, Integer> indices = new IdentityHashMap<>();

    public EffectIndex(Function func) {
        addRegion(func.body);
    }

    private void addRegion(Region region) {
        for (Effect effect : region.getEffects()) {
            indices.put(effect, effects.size());
            effects.add(effect);
            Insn insn = effect.insn();
            if (insn.hasRegions()) {
                for (Region child : insn.regions()) {
                    addRegion(child);
                }
            }
        }
    }

    /**
     * Get the index of an effect.
     *
     * @param effect The effect.
     * @return The index, or -1 if the effect is not in the function.
     */
    public int indexOf(Effect effect) {
        Integer index = indices.get(effect);
        return index == null ? -1 : index;
    }

    public Effect get(int index) {
        return effects.get(index);
    }

    public int size() {
        return effects.size();
    }

    /**
     * Get all the indexed effects, in index order.
     *
     * @return An unmodifiable view of the effects.
     */
    public List<Effect> getEffects() {
        return Collections.unmodifiableList(effects);
    }
}
