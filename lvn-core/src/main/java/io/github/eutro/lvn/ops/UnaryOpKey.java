package io.github.eutro.lvn.ops;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * A key for operations with exactly one immediate of type {@code T}.
 *
 * @param <T> The type of the immediate.
 */
public class UnaryOpKey<T> extends OpKey {
    private final Function<T, String> printer;
    private boolean allowNull = false;

    public UnaryOpKey(String mnemonic, Function<T, String> printer) {
        super(mnemonic);
        this.printer = printer;
    }

    public UnaryOpKey(String mnemonic) {
        this(mnemonic, Objects::toString);
    }

    /**
     * Permit null immediates for this key.
     *
     * @return This key.
     */
    public UnaryOpKey<T> allowNull() {
        allowNull = true;
        return this;
    }

    public class UnaryOp extends Op {
        public final T arg;

        UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public String toString() {
            return key + " " + printer.apply(arg);
        }
    }

    public UnaryOp create(T arg) {
        if (!allowNull && arg == null) {
            throw new IllegalArgumentException("Immediate of " + mnemonic + " is null");
        }
        return new UnaryOp(arg);
    }

    /**
     * Get {@code op} as one of this key's operations.
     *
     * @param op The operation.
     * @return {@code op}, or null if it has a different key.
     */
    public @Nullable UnaryOp checkNullable(Op op) {
        if (op.key != this) return null;
        @SuppressWarnings("unchecked")
        UnaryOp ret = (UnaryOp) op;
        return ret;
    }

    public Optional<UnaryOp> check(Op op) {
        return Optional.ofNullable(checkNullable(op));
    }

    /**
     * Get the immediate of {@code op}, if it is one of this key's operations.
     *
     * @param op The operation.
     * @return The immediate, or null if the key differs (or the immediate is null).
     */
    public @Nullable T argNullable(Op op) {
        UnaryOp unary = checkNullable(op);
        return unary == null ? null : unary.arg;
    }
}
