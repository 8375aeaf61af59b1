package io.github.eutro.lvn.ext;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key for metadata that can be attached to an {@link ExtContainer}.
 * <p>
 * Exts are compared by identity. Their ordering follows creation order,
 * which is only stable within one run of the program.
 *
 * @param <T> The type of the value associated with the ext.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger NEXT_ID = new AtomicInteger();

    private final int id = NEXT_ID.getAndIncrement();
    private final Class<T> type;
    private final String name;

    private Ext(Class<T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * {@code type} may be the raw class of a generic type, in which case the
     * ext's type parameter can be narrowed by the caller.
     *
     * @param type The class of values of the ext.
     * @param name The name of the ext, for debugging.
     * @param <T>  The class type.
     * @param <R>  The (possibly generic) value type.
     * @return The ext.
     */
    @SuppressWarnings("unchecked")
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return (Ext<R>) new Ext<>(type, name);
    }

    public Class<T> getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    /**
     * Look this ext up in a container.
     *
     * @param ec The container.
     * @return The value, if any.
     */
    public Optional<T> getIn(ExtContainer ec) {
        return ec.getExt(this);
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getSimpleName();
    }
}
