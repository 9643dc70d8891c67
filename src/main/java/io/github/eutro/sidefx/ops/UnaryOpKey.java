package io.github.eutro.sidefx.ops;

import org.jetbrains.annotations.Nullable;

/**
 * A key for operations carrying a single immediate, such as a constant or a name.
 *
 * @param <T> The type of the immediate.
 */
public class UnaryOpKey<T> extends OpKey {
    private boolean nullable = false;

    public UnaryOpKey(String mnemonic) {
        super(mnemonic);
    }

    /**
     * Permit null immediates.
     *
     * @return This key.
     */
    public UnaryOpKey<T> allowNull() {
        nullable = true;
        return this;
    }

    public UnaryOp create(T arg) {
        if (arg == null && !nullable) {
            throw new IllegalArgumentException("null immediate for " + mnemonic);
        }
        return new UnaryOp(arg);
    }

    /**
     * Get the immediate of an operation, if it is one of this key.
     *
     * @param op The operation.
     * @return The immediate, or null if the operation has a different key.
     */
    @Nullable
    public T argNullable(Op op) {
        if (op.key != this) return null;
        @SuppressWarnings("unchecked")
        UnaryOp unary = (UnaryOp) op;
        return unary.arg;
    }

    public class UnaryOp extends Op {
        public final T arg;

        private UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public String toString() {
            if (arg instanceof String) return key + " \"" + arg + "\"";
            return key + " " + arg;
        }
    }
}
