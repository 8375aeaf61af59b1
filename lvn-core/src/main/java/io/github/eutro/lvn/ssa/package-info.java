/**
 * The IR: {@link io.github.eutro.lvn.ssa.Function functions} made of
 * {@link io.github.eutro.lvn.ssa.BasicBlock basic blocks}, each a list of
 * {@link io.github.eutro.lvn.ssa.Effect effects} closed by a
 * {@link io.github.eutro.lvn.ssa.Control control}.
 * <p>
 * Effects assign the results of an {@link io.github.eutro.lvn.ssa.Insn instruction}
 * to {@link io.github.eutro.lvn.ssa.Var variables}. Memory is explicit:
 * {@code local} effects produce pointers, which {@code load} reads from and
 * {@code store} writes through.
 */
package io.github.eutro.lvn.ssa;
