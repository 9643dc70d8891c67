package io.github.eutro.sidefx.ops;

import io.github.eutro.sidefx.ext.ExtHolder;

/**
 * Identifies a kind of operation, apart from any immediates.
 * <p>
 * Classification exts, like {@link io.github.eutro.sidefx.ext.CommonExts#RESOURCE_ACCESS},
 * are attached to keys, and compared by identity.
 */
public abstract class OpKey extends ExtHolder {
    public final String mnemonic;

    protected OpKey(String mnemonic) {
        for (int i = 0; i < mnemonic.length(); i++) {
            if (Character.isWhitespace(mnemonic.charAt(i))) {
                throw new IllegalArgumentException("whitespace in mnemonic: '" + mnemonic + "'");
            }
        }
        if (mnemonic.isEmpty()) throw new IllegalArgumentException("empty mnemonic");
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
