/**
 * {@link io.github.eutro.lvn.passes.IRPass IR passes}, which can be
 * {@link io.github.eutro.lvn.passes.IRPass#then chained} into pipelines.
 */
package io.github.eutro.lvn.passes;
