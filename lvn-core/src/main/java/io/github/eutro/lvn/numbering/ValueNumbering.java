package io.github.eutro.lvn.numbering;

import io.github.eutro.lvn.ssa.Effect;
import io.github.eutro.lvn.ssa.Function;
import io.github.eutro.lvn.ssa.Var;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The value numbers found for one {@link Function}.
 */
public final class ValueNumbering {
    public final Function function;
    private final Map<Var, Integer> numbers;
    private final Map<Var, Integer> pointerNumbers;
    private final List<Effect> redundant;
    private final Set<Effect> redundantSet;
    private final List<String> diagnostics;
    private final int valueCount;

    public ValueNumbering(Function function,
                          ValueNumberTable table,
                          List<Effect> redundant,
                          List<String> diagnostics) {
        this.function = function;
        this.numbers = new IdentityHashMap<>(table.values());
        this.pointerNumbers = new IdentityHashMap<>(table.pointers());
        this.redundant = Collections.unmodifiableList(new ArrayList<>(redundant));
        this.redundantSet = Collections.newSetFromMap(new IdentityHashMap<>());
        this.redundantSet.addAll(redundant);
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
        this.valueCount = table.size();
    }

    public @Nullable Integer getNumber(Var var) {
        return numbers.get(var);
    }

    /**
     * Get the number last stored through a pointer by the end of the function.
     *
     * @param pointer The pointer.
     * @return The number, or null if nothing was stored through it.
     */
    public @Nullable Integer getPointerNumber(Var pointer) {
        return pointerNumbers.get(pointer);
    }

    public boolean isRedundant(Effect effect) {
        return redundantSet.contains(effect);
    }

    /**
     * Get the binary operations which recompute an earlier expression, in the order they were found.
     *
     * @return The effects.
     */
    public List<Effect> getRedundant() {
        return redundant;
    }

    /**
     * Get every diagnostic line emitted for the function, header first.
     *
     * @return The lines.
     */
    public List<String> getDiagnostics() {
        return diagnostics;
    }

    public int getValueCount() {
        return valueCount;
    }

    /**
     * Whether the function, and every ext on it, was left as it was.
     * Value numbering never changes the function, so this is always true.
     *
     * @return {@code true}
     */
    public boolean preservesMetadata() {
        return true;
    }
}
