package io.github.eutro.sidefx.ops;

import io.github.eutro.sidefx.ext.CommonExts;
import io.github.eutro.sidefx.ssa.Insn;

/**
 * General purpose {@link Op}s and {@link OpKey}s.
 * <p>
 * Operations here that aren't {@link CommonExts#IS_PURE pure} have no resource access info,
 * so the side effect analysis treats them as accessing the unknown resource.
 */
public class CommonOps {
    /**
     * Effect: returns its argument(s). Forwards resource handles unchanged.
     */
    public static final Op IDENTITY = SimpleOpKey.pure("id");

    /**
     * Effect: returns the {@code n}th argument of the function.
     */
    public static final UnaryOpKey<Integer> ARG = new UnaryOpKey<>("arg");
    /**
     * Effect: returns the constant.
     */
    public static final UnaryOpKey<Object> CONST = new UnaryOpKey<>("const").allowNull();
    /**
     * Effect: returns the sum of its arguments.
     */
    public static final Op ADD = SimpleOpKey.pure("add");

    /**
     * Effect: calls the named function, with whatever effects it has.
     */
    public static final UnaryOpKey<String> CALL = new UnaryOpKey<>("call");

    /**
     * Effect: runs its first region if its argument is true, and its second (if any) otherwise.
     */
    public static final Op IF = SimpleOpKey.opaque("if");
    /**
     * Effect: runs its first region, the condition, then its second region, the body,
     * for as long as the condition yields true.
     */
    public static final Op WHILE = SimpleOpKey.opaque("while");
    /**
     * Effect: ends a nested region, passing its arguments to the owning instruction.
     */
    public static final Op YIELD = SimpleOpKey.opaque("yield");
    /**
     * Effect: returns its arguments from the function.
     */
    public static final Op RETURN = SimpleOpKey.opaque("return");

    static {
        CommonExts.markPure(ARG);
        CommonExts.markPure(CONST);
    }

    /**
     * Return a constant instruction which returns {@code k}.
     *
     * @param k The constant.
     * @return The instruction.
     */
    public static Insn constant(Object k) {
        return CONST.create(k).insn();
    }
}
