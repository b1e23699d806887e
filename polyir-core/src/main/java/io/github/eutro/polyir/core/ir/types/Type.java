package io.github.eutro.polyir.core.ir.types;

import io.github.eutro.polyir.core.ir.Context;

/**
 * The type of a {@link io.github.eutro.polyir.core.ir.Value}.
 * <p>
 * Types are uniqued in their {@link Context}, so two types from the same
 * context are equal exactly when they are the same object. Subclasses implement
 * structural {@link #equals(Object)} and {@link #hashCode()} for the uniquer.
 */
public abstract class Type {
    private final Context context;

    protected Type(Context context) {
        this.context = context;
    }

    public Context getContext() {
        return context;
    }

    public boolean isIndex() {
        return this instanceof IndexType;
    }

    public boolean isInteger(int width) {
        return this instanceof IntegerType && ((IntegerType) this).getWidth() == width;
    }

    /**
     * Whether this is an integer or an index type.
     *
     * @return Whether this is integer-like.
     */
    public boolean isIntOrIndex() {
        return this instanceof IntegerType || this instanceof IndexType;
    }

    /**
     * Get the element type of this type if it is shaped, or this type otherwise.
     *
     * @return The element type.
     */
    public Type getElementTypeOrSelf() {
        return this instanceof ShapedType ? ((ShapedType) this).getElementType() : this;
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();
}
