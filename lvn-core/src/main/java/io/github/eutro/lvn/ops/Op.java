package io.github.eutro.lvn.ops;

import io.github.eutro.lvn.ext.DelegatingExtHolder;
import io.github.eutro.lvn.ext.ExtContainer;
import io.github.eutro.lvn.ssa.Insn;
import io.github.eutro.lvn.ssa.Var;

import java.util.List;

/**
 * An operation: an {@link OpKey} together with its immediates, if any.
 */
public class Op extends DelegatingExtHolder {
    public final OpKey key;

    public Op(OpKey key) {
        this.key = key;
    }

    @Override
    protected ExtContainer getDelegate() {
        return key;
    }

    public Insn insn(Var... args) {
        return new Insn(this, args);
    }

    public Insn insn(List<Var> args) {
        return new Insn(this, args);
    }

    @Override
    public String toString() {
        return key.toString();
    }
}
