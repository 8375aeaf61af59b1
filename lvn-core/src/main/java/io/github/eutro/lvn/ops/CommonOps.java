package io.github.eutro.lvn.ops;

import io.github.eutro.lvn.ext.CommonExts;
import io.github.eutro.lvn.ssa.Effect;
import io.github.eutro.lvn.ssa.Insn;
import io.github.eutro.lvn.ssa.Var;
import org.jetbrains.annotations.Nullable;

/**
 * Operations that every frontend uses.
 */
public class CommonOps {
    /**
     * Control: an unconditional jump.
     */
    public static final Op BR = new SimpleOpKey("br").create();
    /**
     * Control: returns from the function, with its arguments as the results.
     */
    public static final Op RETURN = new SimpleOpKey("return").create();

    /**
     * Effect: returns the {@code n}th argument of the function.
     */
    public static final UnaryOpKey<Integer> ARG = CommonExts.markPure(new UnaryOpKey<>("arg"));
    /**
     * Effect: returns the constant.
     */
    public static final UnaryOpKey<Object> CONST = CommonExts.markPure(new UnaryOpKey<>("const").allowNull());

    public static Insn constant(@Nullable Object k) {
        return CONST.create(k).insn();
    }

    /**
     * Get the literal integral value of {@code var}, if it is
     * assigned by a {@link #CONST} of a {@link Byte}, {@link Short},
     * {@link Character}, {@link Integer} or {@link Long}.
     *
     * @param var The variable.
     * @return The value, sign-extended, or null if {@code var} isn't such a literal.
     */
    public static @Nullable Long integralConstant(Var var) {
        Effect assigned = var.getNullable(CommonExts.ASSIGNED_AT);
        if (assigned == null) return null;
        Object k = CONST.argNullable(assigned.insn().op);
        if (k instanceof Integer || k instanceof Long || k instanceof Short || k instanceof Byte) {
            return ((Number) k).longValue();
        }
        if (k instanceof Character) {
            return (long) (Character) k;
        }
        return null;
    }
}
