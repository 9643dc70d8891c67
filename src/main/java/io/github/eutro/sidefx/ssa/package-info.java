/**
 * The intermediate representation (IR) the side effect analysis runs over.
 * <p>
 * A {@link io.github.eutro.sidefx.ssa.Module} is a list of
 * {@link io.github.eutro.sidefx.ssa.Function}s, each with a body
 * {@link io.github.eutro.sidefx.ssa.Region}. A region is a list of
 * {@link io.github.eutro.sidefx.ssa.Effect}s, each wrapping an
 * {@link io.github.eutro.sidefx.ssa.Insn instruction} that may itself own nested regions,
 * such as the branches of an {@link io.github.eutro.sidefx.ops.CommonOps#IF if}.
 * <p>
 * The IR is in static single assignment form (SSA), hence the name of the package.
 * That is, each {@link io.github.eutro.sidefx.ssa.Var}
 * is assigned to by <i>exactly</i> one effect, which precedes all its uses in program order.
 * There is no explicit control flow between regions: the instruction owning a region
 * decides when, and how often, it runs.
 */
package io.github.eutro.sidefx.ssa;
