package io.github.eutro.polyir.core.ir.attrs;

import io.github.eutro.polyir.core.ir.Context;

/**
 * An attribute whose presence is its only meaning.
 */
public final class UnitAttr extends Attribute {
    private UnitAttr(Context context) {
        super(context);
    }

    public static UnitAttr get(Context context) {
        return context.unique(new UnitAttr(context));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UnitAttr;
    }

    @Override
    public int hashCode() {
        return UnitAttr.class.hashCode();
    }

    @Override
    public String toString() {
        return "unit";
    }
}
