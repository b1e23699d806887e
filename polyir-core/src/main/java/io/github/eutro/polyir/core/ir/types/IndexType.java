package io.github.eutro.polyir.core.ir.types;

import io.github.eutro.polyir.core.ir.Context;

/**
 * The target-width integer type used for sizes, subscripts and affine map operands.
 */
public final class IndexType extends Type {
    private IndexType(Context context) {
        super(context);
    }

    public static IndexType get(Context context) {
        return context.unique(new IndexType(context));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IndexType;
    }

    @Override
    public int hashCode() {
        return IndexType.class.hashCode();
    }

    @Override
    public String toString() {
        return "index";
    }
}
