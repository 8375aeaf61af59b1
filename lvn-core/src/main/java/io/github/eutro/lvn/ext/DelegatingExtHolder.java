package io.github.eutro.lvn.ext;

import org.jetbrains.annotations.Nullable;

/**
 * An {@link ExtHolder} which looks exts up in another container when
 * they aren't attached to it directly.
 * <p>
 * This is how instructions see the exts of their operation,
 * and operations the exts of their key.
 */
public abstract class DelegatingExtHolder extends ExtHolder {
    protected abstract @Nullable ExtContainer getDelegate();

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        T local = super.getNullable(ext);
        if (local != null) return local;
        ExtContainer delegate = getDelegate();
        return delegate == null ? null : delegate.getNullable(ext);
    }
}
