package io.github.eutro.lvn.ssa;

/**
 * An instruction builder, which appends to the end of one block of a function.
 */
public class IRBuilder {
    public final Function func;
    private BasicBlock bb;

    public IRBuilder(Function func, BasicBlock bb) {
        this.func = func;
        this.bb = bb;
    }

    public BasicBlock getBlock() {
        return bb;
    }

    public void setBlock(BasicBlock bb) {
        this.bb = bb;
    }

    public void insert(Effect effect) {
        bb.addEffect(effect);
    }

    /**
     * Assign the result of an instruction to a variable, and insert it.
     *
     * @param insn The instruction.
     * @param v    The variable.
     * @return {@code v}.
     */
    public Var insert(Insn insn, Var v) {
        insert(insn.assignTo(v));
        return v;
    }

    /**
     * Assign the result of an instruction to a fresh variable, and insert it.
     *
     * @param insn The instruction.
     * @param name The name of the new variable.
     * @return The new variable.
     */
    public Var insert(Insn insn, String name) {
        return insert(insn, func.newVar(name));
    }

    public void insertCtrl(Control ctrl) {
        bb.setControl(ctrl);
    }
}
