package io.github.eutro.lvn.ops;

import io.github.eutro.lvn.ext.ExtHolder;

/**
 * A kind of operation, without any immediates.
 * <p>
 * Exts attached to a key are visible from every instruction of that kind.
 */
public abstract class OpKey extends ExtHolder {
    public final String mnemonic;

    protected OpKey(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
