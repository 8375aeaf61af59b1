package io.github.eutro.lvn.ssa;

import io.github.eutro.lvn.ext.CommonExts;
import io.github.eutro.lvn.ext.DelegatingExtHolder;
import io.github.eutro.lvn.ext.Ext;
import io.github.eutro.lvn.ext.ExtContainer;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An effect, encapsulating an {@link Insn instruction}, and the
 * variables its results are assigned to.
 * <p>
 * Effects are the instructions of a {@link BasicBlock}, executed in order.
 */
public final class Effect extends DelegatingExtHolder {
    private List<Var> assignsTo;
    private Insn insn;

    Effect(List<Var> assignsTo, Insn insn) {
        setAssignsTo(assignsTo);
        setInsn(insn);
    }

    @Override
    protected ExtContainer getDelegate() {
        return insn;
    }

    /**
     * Get the variables this effect assigns to, in result order.
     *
     * @return An unmodifiable view of the variables.
     */
    public List<Var> getAssignsTo() {
        return Collections.unmodifiableList(assignsTo);
    }

    /**
     * Set the variables this effect assigns to. The list is copied,
     * and each variable is marked as {@link CommonExts#ASSIGNED_AT assigned} here.
     *
     * @param assignsTo The variables.
     */
    public void setAssignsTo(List<Var> assignsTo) {
        this.assignsTo = new ArrayList<>(assignsTo);
        for (Var var : this.assignsTo) {
            var.attachExt(CommonExts.ASSIGNED_AT, this);
        }
    }

    public Insn insn() {
        return insn;
    }

    public void setInsn(Insn insn) {
        insn.attachExt(CommonExts.OWNING_EFFECT, this);
        this.insn = insn;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (!assignsTo.isEmpty()) {
            sb.append(assignsTo.stream()
                    .map(Objects::toString)
                    .collect(Collectors.joining(", ", "", " = ")));
        }
        sb.append(insn);
        return sb.toString();
    }

    // exts
    private BasicBlock owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (BasicBlock) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
