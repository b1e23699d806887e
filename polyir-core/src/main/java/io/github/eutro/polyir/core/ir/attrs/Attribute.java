package io.github.eutro.polyir.core.ir.attrs;

import io.github.eutro.polyir.core.ir.Context;

/**
 * A compile-time constant attached to an operation by name, or produced by folding.
 * <p>
 * Attributes are immutable and uniqued in their {@link Context}, like types.
 */
public abstract class Attribute {
    private final Context context;

    protected Attribute(Context context) {
        this.context = context;
    }

    public Context getContext() {
        return context;
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();
}
