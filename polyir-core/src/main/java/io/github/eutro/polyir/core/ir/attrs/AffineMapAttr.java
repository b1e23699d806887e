package io.github.eutro.polyir.core.ir.attrs;

import io.github.eutro.polyir.core.affine.AffineMap;
import io.github.eutro.polyir.core.ir.Context;

public final class AffineMapAttr extends Attribute {
    private final AffineMap value;

    private AffineMapAttr(Context context, AffineMap value) {
        super(context);
        this.value = value;
    }

    public static AffineMapAttr get(AffineMap value) {
        Context context = value.getContext();
        return context.unique(new AffineMapAttr(context, value));
    }

    public AffineMap getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        // maps are uniqued themselves
        return o instanceof AffineMapAttr && ((AffineMapAttr) o).value == value;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(value);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
