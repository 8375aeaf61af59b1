package io.github.eutro.lvn.passes;

import io.github.eutro.lvn.passes.misc.ChainedPass;

/**
 * A pass over some IR, taking an {@code A} and producing a {@code B}.
 *
 * @param <A> The input type.
 * @param <B> The output type.
 */
public interface IRPass<A, B> {
    B run(A a);

    /**
     * Whether this pass only inspects its input, leaving it unchanged.
     *
     * @return Whether this pass is an analysis.
     */
    default boolean isAnalysis() {
        return false;
    }

    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
