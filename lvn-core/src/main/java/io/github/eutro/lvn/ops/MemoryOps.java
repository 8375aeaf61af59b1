package io.github.eutro.lvn.ops;

import io.github.eutro.lvn.ext.CommonExts;

/**
 * Operations on memory locations.
 * <p>
 * Pointers are ordinary variables; two pointers are the same location
 * only if they are the same variable.
 */
public class MemoryOps {
    /**
     * Effect: returns a pointer to the function-local slot {@code n}.
     */
    public static final UnaryOpKey<Integer> LOCAL = CommonExts.markPure(new UnaryOpKey<>("local"));
    /**
     * Effect: returns the value last stored through the pointer argument.
     */
    public static final Op LOAD = new SimpleOpKey("load").create();
    /**
     * Effect: stores the first argument through the pointer in the second, returns nothing.
     */
    public static final Op STORE = new SimpleOpKey("store").create();
}
