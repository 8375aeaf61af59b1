package io.github.eutro.lvn.ops;

/**
 * Two-operand arithmetic opcodes.
 */
public enum BinaryOpcode {
    ADD("add", true),
    SUB("sub", false),
    MUL("mul", true),
    DIV("div", false),
    REM("rem", false),
    AND("and", false),
    OR("or", false),
    XOR("xor", false),
    SHL("shl", false),
    SHR("shr", false),
    USHR("ushr", false),
    ;

    public final String mnemonic;
    /**
     * Whether {@code a op b} and {@code b op a} are treated as the same expression.
     */
    public final boolean commutative;

    BinaryOpcode(String mnemonic, boolean commutative) {
        this.mnemonic = mnemonic;
        this.commutative = commutative;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
