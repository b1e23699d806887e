package io.github.eutro.polyir.core.ir.attrs;

import io.github.eutro.polyir.core.ir.Context;
import io.github.eutro.polyir.core.ir.types.Type;

public final class TypeAttr extends Attribute {
    private final Type value;

    private TypeAttr(Context context, Type value) {
        super(context);
        this.value = value;
    }

    public static TypeAttr get(Type value) {
        Context context = value.getContext();
        return context.unique(new TypeAttr(context, value));
    }

    public Type getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TypeAttr && ((TypeAttr) o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return 7 * value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
