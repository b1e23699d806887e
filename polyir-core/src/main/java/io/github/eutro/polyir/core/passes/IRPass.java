package io.github.eutro.polyir.core.passes;

import io.github.eutro.polyir.core.passes.misc.ChainedPass;

/**
 * A transformation from one piece of IR to another.
 *
 * @param <A> The type of the input.
 * @param <B> The type of the output.
 */
public interface IRPass<A, B> {
    B run(A a);

    /**
     * Whether this pass mutates its input and returns it, rather than building something new.
     *
     * @return Whether this pass is in-place.
     */
    default boolean isInPlace() {
        return false;
    }

    /**
     * Make a pass that runs this one, then {@code next} on its result.
     *
     * @param next The pass to run after this one.
     * @param <C>  The type of the final output.
     * @return The chained pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
