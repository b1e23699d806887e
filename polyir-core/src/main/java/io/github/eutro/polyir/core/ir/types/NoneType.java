package io.github.eutro.polyir.core.ir.types;

import io.github.eutro.polyir.core.ir.Context;

public final class NoneType extends Type {
    private NoneType(Context context) {
        super(context);
    }

    public static NoneType get(Context context) {
        return context.unique(new NoneType(context));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NoneType;
    }

    @Override
    public int hashCode() {
        return NoneType.class.hashCode();
    }

    @Override
    public String toString() {
        return "none";
    }
}
