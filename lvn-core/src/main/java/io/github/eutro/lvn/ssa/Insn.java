package io.github.eutro.lvn.ssa;

import io.github.eutro.lvn.ext.CommonExts;
import io.github.eutro.lvn.ext.DelegatingExtHolder;
import io.github.eutro.lvn.ext.Ext;
import io.github.eutro.lvn.ext.ExtContainer;
import io.github.eutro.lvn.ops.Op;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A raw instruction: an {@link Op operation} applied to some arguments.
 * <p>
 * An instruction becomes part of a block by being wrapped in an {@link Effect},
 * which names its results, or in a {@link Control}, which names its jump targets.
 */
public final class Insn extends DelegatingExtHolder implements Iterable<Var> {
    public Op op;
    private final List<Var> args;

    public Insn(Op op, List<Var> args) {
        this.op = op;
        this.args = new ArrayList<>(args);
    }

    public Insn(Op op, Var... args) {
        this(op, Arrays.asList(args));
    }

    @Override
    protected ExtContainer getDelegate() {
        return op;
    }

    /**
     * Get the arguments of this instruction. The list is live, and may be modified.
     *
     * @return The arguments.
     */
    public List<Var> args() {
        return args;
    }

    @NotNull
    @Override
    public Iterator<Var> iterator() {
        return args.iterator();
    }

    public Effect assignTo(Var... vars) {
        return assignTo(Arrays.asList(vars));
    }

    public Effect assignTo(List<Var> vars) {
        return new Effect(vars, this);
    }

    public Control jumpsTo(BasicBlock... targets) {
        return jumpsTo(Arrays.asList(targets));
    }

    public Control jumpsTo(List<BasicBlock> targets) {
        return new Control(this, new ArrayList<>(targets));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(op);
        for (Var arg : args) {
            sb.append(' ').append(arg);
        }
        return sb.toString();
    }

    // exts
    private Object owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT) {
            return owner instanceof Effect ? (T) owner : null;
        } else if (ext == CommonExts.OWNING_CONTROL) {
            return owner instanceof Control ? (T) owner : null;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_EFFECT || ext == CommonExts.OWNING_CONTROL) {
            owner = value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT || ext == CommonExts.OWNING_CONTROL) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
