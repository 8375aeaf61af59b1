package io.github.eutro.lvn.numbering;

import io.github.eutro.lvn.ops.BinaryOpcode;
import org.jetbrains.annotations.NotNull;

/**
 * A canonical {@code (opcode, lhs, rhs)} key for a binary operation over value numbers.
 * <p>
 * Operands of {@link BinaryOpcode#commutative commutative} opcodes are
 * stored smaller number first, so {@code a + b} and {@code b + a} make equal keys.
 */
public final class Expression implements Comparable<Expression> {
    public final BinaryOpcode opcode;
    public final int lhs;
    public final int rhs;

    private Expression(BinaryOpcode opcode, int lhs, int rhs) {
        this.opcode = opcode;
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public static Expression of(BinaryOpcode opcode, int lhs, int rhs) {
        if (opcode.commutative && lhs > rhs) {
            return new Expression(opcode, rhs, lhs);
        }
        return new Expression(opcode, lhs, rhs);
    }

    @Override
    public int compareTo(@NotNull Expression o) {
        int c = opcode.compareTo(o.opcode);
        if (c != 0) return c;
        c = Integer.compare(lhs, o.lhs);
        if (c != 0) return c;
        return Integer.compare(rhs, o.rhs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Expression)) return false;
        Expression that = (Expression) o;
        return opcode == that.opcode && lhs == that.lhs && rhs == that.rhs;
    }

    @Override
    public int hashCode() {
        return (opcode.hashCode() * 31 + lhs) * 31 + rhs;
    }

    @Override
    public String toString() {
        return lhs + " " + opcode + " " + rhs;
    }
}
