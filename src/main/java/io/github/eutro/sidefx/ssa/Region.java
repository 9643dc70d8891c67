package io.github.eutro.sidefx.ssa;

import io.github.eutro.sidefx.ext.*;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A region: an ordered sequence of {@link Effect}s.
 * <p>
 * A region is either the body of a {@link Function}, or nested in an {@link Insn}.
 * Effects in nested regions may use variables from enclosing regions, but not the other way around.
 */
public final class Region extends ExtHolder {
    private final TrackedList<Effect, Region> effects = new TrackedList<>(CommonExts.OWNING_REGION, this);

    /**
     * Get the effects of this region, in program order. The list is modifiable.
     *
     * @return The effects.
     */
    public List<Effect> getEffects() {
        return effects;
    }

    public void addEffect(Effect effect) {
        effects.add(effect);
    }

    /**
     * Find the function this region is part of, walking up through any owning instructions.
     *
     * @return The function, or null if the region is detached.
     */
    public @Nullable Function findFunction() {
        Region region = this;
        while (true) {
            Function func = region.getNullable(CommonExts.OWNING_FUNCTION);
            if (func != null) return func;
            Insn insn = region.getNullable(CommonExts.OWNING_INSN);
            if (insn == null) return null;
            Effect effect = insn.getNullable(CommonExts.OWNING_EFFECT);
            if (effect == null) return null;
            region = effect.getNullable(CommonExts.OWNING_REGION);
            if (region == null) return null;
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb, "");
        return sb.toString();
    }

    void appendTo(StringBuilder sb, String indent) {
        sb.append("{\n");
        String innerIndent = indent + "  ";
        for (Effect effect : effects) {
            sb.append(innerIndent).append(effect);
            Insn insn = effect.insn();
            if (insn.hasRegions()) {
                for (Region region : insn.regions()) {
                    sb.append(' ');
                    region.appendTo(sb, innerIndent);
                }
            }
            sb.append('\n');
        }
        sb.append(indent).append('}');
    }

    // exts
    private Insn owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_INSN) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_INSN) {
            owner = (Insn) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_INSN) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
