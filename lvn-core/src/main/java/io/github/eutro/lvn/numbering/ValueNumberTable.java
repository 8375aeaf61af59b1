package io.github.eutro.lvn.numbering;

import io.github.eutro.lvn.ops.CommonOps;
import io.github.eutro.lvn.ssa.Var;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Hands out value numbers for one walk over one function.
 * <p>
 * Numbers start at 1 and are allocated in first-encounter order. Variables
 * and pointers are keyed by identity; integral literals by value, so every
 * {@code const 5} shares a number.
 */
public final class ValueNumberTable {
    private final Map<Var, Integer> values = new IdentityHashMap<>();
    private final Map<Var, Integer> pointers = new IdentityHashMap<>();
    private final Map<Long, Integer> constants = new HashMap<>();
    private int nextNumber = 1;

    /**
     * Allocate a number that nothing has had before.
     *
     * @return The number.
     */
    public int allocate() {
        return nextNumber++;
    }

    /**
     * Get the number of {@code value}, allocating one if it has none yet.
     *
     * @param value The variable.
     * @return Its number.
     */
    public int numberOf(Var value) {
        return values.computeIfAbsent(value, $ -> allocate());
    }

    /**
     * Get the number of the integral literal {@code literal}, allocating one if it has none yet.
     *
     * @param literal The literal value.
     * @return Its number.
     */
    public int numberOfConstant(long literal) {
        return constants.computeIfAbsent(literal, $ -> allocate());
    }

    /**
     * Get the number of an operand: through {@link #numberOfConstant(long)} if
     * it is an integral literal, through {@link #numberOf(Var)} otherwise.
     *
     * @param operand The operand.
     * @return Its number.
     */
    public int resolve(Var operand) {
        Long literal = CommonOps.integralConstant(operand);
        if (literal == null) {
            return numberOf(operand);
        }
        int number = numberOfConstant(literal);
        values.put(operand, number);
        return number;
    }

    /**
     * Give {@code value} the number {@code number}, as the result of a load or binary operation.
     *
     * @param value  The variable.
     * @param number The number.
     */
    public void assign(Var value, int number) {
        values.put(value, number);
    }

    /**
     * Record that {@code number} was last stored through {@code pointer}.
     *
     * @param pointer The pointer.
     * @param number  The number of the stored value.
     */
    public void recordPointerNumber(Var pointer, int number) {
        pointers.put(pointer, number);
    }

    /**
     * Get the number last stored through {@code pointer}.
     *
     * @param pointer The pointer.
     * @return The number, or null if nothing was stored through it.
     */
    public @Nullable Integer pointerNumber(Var pointer) {
        return pointers.get(pointer);
    }

    /**
     * Get how many numbers have been allocated.
     *
     * @return The count.
     */
    public int size() {
        return nextNumber - 1;
    }

    public Map<Var, Integer> values() {
        return Collections.unmodifiableMap(values);
    }

    public Map<Var, Integer> pointers() {
        return Collections.unmodifiableMap(pointers);
    }
}
