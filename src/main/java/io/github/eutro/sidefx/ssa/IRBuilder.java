package io.github.eutro.sidefx.ssa;

/**
 * An IR, or instruction, builder, which encapsulates a position in a function
 * where instructions are being inserted.
 */
public class IRBuilder {
    /**
     * The function being inserted into.
     */
    public final Function func;
    private Region region;

    /**
     * Construct an instruction builder, inserting at the end of the function's body.
     *
     * @param func The function.
     */
    public IRBuilder(Function func) {
        this(func, func.body);
    }

    /**
     * Construct an instruction builder, inserting into
     * a specific region.
     *
     * @param func   The function.
     * @param region The region, which should be, or be nested in, the body of the function.
     */
    public IRBuilder(Function func, Region region) {
        this.func = func;
        this.region = region;
    }

    /**
     * Get the region this builder is inserting at the end of.
     *
     * @return The region.
     */
    public Region getRegion() {
        return region;
    }

    /**
     * Set the region this builder should insert at the end of.
     *
     * @param region The region.
     */
    public void setRegion(Region region) {
        this.region = region;
    }

    /**
     * Insert an effect at the end of the region.
     *
     * @param effect The effect.
     * @return The same effect.
     */
    public Effect insert(Effect effect) {
        region.addEffect(effect);
        return effect;
    }

    /**
     * Insert an instruction whose results are not used.
     *
     * @param insn The instruction.
     * @return The inserted effect.
     */
    public Effect insert(Insn insn) {
        return insert(insn.assignTo());
    }

    /**
     * Assign the result of the instruction to a variable,
     * and insert the effect.
     *
     * @param insn The instruction.
     * @param v    The variable.
     * @return The same variable.
     */
    public Var insert(Insn insn, Var v) {
        insert(insn.assignTo(v));
        return v;
    }

    /**
     * Assign the result of the instruction to a new variable,
     * and insert the effect.
     *
     * @param insn The instruction.
     * @param name The name of variable.
     * @return The assigned variable.
     */
    public Var insert(Insn insn, String name) {
        return insert(insn, func.newVar(name));
    }

    /**
     * Assign the result of the instruction to a new resource handle variable,
     * and insert the effect.
     *
     * @param insn The instruction.
     * @param name The name of variable.
     * @return The assigned variable.
     */
    public Var insertResource(Insn insn, String name) {
        return insert(insn, func.newResourceVar(name));
    }
}
