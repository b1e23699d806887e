package io.github.eutro.polyir.core.ext;

import org.jetbrains.annotations.Nullable;

/**
 * An {@link ExtHolder} that looks up some exts on another {@link ExtContainer}
 * when they aren't attached to itself.
 * <p>
 * Operations use this to see the hooks attached to their kind, while metadata
 * such as {@link IRExts#NAME_HINT} stays per operation.
 */
public abstract class DelegatingExtHolder extends ExtHolder {
    /**
     * Get the container to delegate to.
     *
     * @return The delegate, or null if there is none.
     */
    protected abstract @Nullable ExtContainer getDelegate();

    /**
     * Whether an ext that isn't attached here should be looked up on the delegate.
     *
     * @param ext The ext.
     * @return Whether to delegate it.
     */
    protected abstract boolean isDelegated(Ext<?> ext);

    /**
     * Get an ext attached to this holder itself, without looking at the delegate.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value, or null if it isn't attached here.
     */
    public <T> @Nullable T getLocalNullable(Ext<T> ext) {
        return super.getNullable(ext);
    }

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        T localExt = getLocalNullable(ext);
        if (localExt != null || !isDelegated(ext)) return localExt;
        ExtContainer delegate = getDelegate();
        return delegate == null ? null : delegate.getNullable(ext);
    }
}
