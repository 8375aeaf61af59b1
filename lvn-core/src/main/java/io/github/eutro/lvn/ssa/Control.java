package io.github.eutro.lvn.ssa;

import io.github.eutro.lvn.ext.CommonExts;
import io.github.eutro.lvn.ext.Ext;
import io.github.eutro.lvn.ext.ExtHolder;
import io.github.eutro.lvn.ops.CommonOps;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * The terminating instruction of a block, with the blocks it may jump to.
 */
public final class Control extends ExtHolder {
    private Insn insn;
    /**
     * The jump targets. What each position means depends on the instruction.
     */
    public final List<BasicBlock> targets;

    Control(Insn insn, List<BasicBlock> targets) {
        setInsn(insn);
        this.targets = targets;
    }

    /**
     * Construct an unconditional jump.
     *
     * @param target The block to jump to.
     * @return The jump.
     */
    public static Control br(BasicBlock target) {
        return CommonOps.BR.insn().jumpsTo(target);
    }

    public Insn insn() {
        return insn;
    }

    public void setInsn(Insn insn) {
        insn.attachExt(CommonExts.OWNING_CONTROL, this);
        this.insn = insn;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(insn);
        if (!targets.isEmpty()) {
            sb.append(" ->");
            for (BasicBlock target : targets) {
                sb.append(' ').append(target.toTargetString());
            }
        }
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
