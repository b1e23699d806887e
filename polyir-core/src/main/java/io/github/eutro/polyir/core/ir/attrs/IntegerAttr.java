package io.github.eutro.polyir.core.ir.attrs;

import io.github.eutro.polyir.core.ir.Context;
import io.github.eutro.polyir.core.ir.types.IntegerType;
import io.github.eutro.polyir.core.ir.types.Type;

/**
 * An integer constant of an integer or index type.
 */
public final class IntegerAttr extends Attribute {
    private final Type type;
    private final long value;

    private IntegerAttr(Context context, Type type, long value) {
        super(context);
        this.type = type;
        this.value = value;
    }

    public static IntegerAttr get(Type type, long value) {
        if (!type.isIntOrIndex()) {
            throw new IllegalArgumentException("integer attribute of non-integer type " + type);
        }
        Context context = type.getContext();
        return context.unique(new IntegerAttr(context, type, value));
    }

    public static IntegerAttr getBool(boolean value, Context context) {
        return get(IntegerType.get(1, context), value ? 1 : 0);
    }

    public Type getType() {
        return type;
    }

    public long getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof IntegerAttr)) return false;
        IntegerAttr that = (IntegerAttr) o;
        return value == that.value && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Long.hashCode(value);
    }

    @Override
    public String toString() {
        if (type.isInteger(1)) return value != 0 ? "true" : "false";
        return value + " : " + type;
    }
}
