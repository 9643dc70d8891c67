package io.github.eutro.sidefx.ops;

import io.github.eutro.sidefx.analysis.ResourceAccessKind;
import io.github.eutro.sidefx.ext.CommonExts;

/**
 * A key for operations without immediates. There is only one such operation per key,
 * created along with it.
 */
public class SimpleOpKey extends OpKey {
    public final Op op;

    public SimpleOpKey(String mnemonic) {
        super(mnemonic);
        op = new Op(this);
    }

    /**
     * Create an operation with no side effects.
     *
     * @param mnemonic The mnemonic.
     * @return The operation.
     */
    public static Op pure(String mnemonic) {
        return CommonExts.markPure(new SimpleOpKey(mnemonic)).op;
    }

    /**
     * Create an operation that accesses the resources among its arguments and results.
     *
     * @param mnemonic The mnemonic.
     * @param kind     How it accesses them.
     * @return The operation.
     */
    public static Op accessing(String mnemonic, ResourceAccessKind kind) {
        return CommonExts.markAccess(new SimpleOpKey(mnemonic), kind).op;
    }

    /**
     * Create an operation with unclassified, and so unknown, side effects.
     *
     * @param mnemonic The mnemonic.
     * @return The operation.
     */
    public static Op opaque(String mnemonic) {
        return new SimpleOpKey(mnemonic).op;
    }
}
