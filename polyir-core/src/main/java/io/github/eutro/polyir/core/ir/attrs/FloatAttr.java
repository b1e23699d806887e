package io.github.eutro.polyir.core.ir.attrs;

import io.github.eutro.polyir.core.ir.Context;
import io.github.eutro.polyir.core.ir.types.FloatType;

public final class FloatAttr extends Attribute {
    private final FloatType type;
    private final double value;

    private FloatAttr(Context context, FloatType type, double value) {
        super(context);
        this.type = type;
        this.value = value;
    }

    public static FloatAttr get(FloatType type, double value) {
        Context context = type.getContext();
        return context.unique(new FloatAttr(context, type, value));
    }

    public FloatType getType() {
        return type;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof FloatAttr)) return false;
        FloatAttr that = (FloatAttr) o;
        // bitwise: NaN equals NaN, 0.0 differs from -0.0
        return Double.doubleToLongBits(value) == Double.doubleToLongBits(that.value) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Double.hashCode(value);
    }

    @Override
    public String toString() {
        return value + " : " + type;
    }
}
