package io.github.eutro.polyir.core.ir.types;

import io.github.eutro.polyir.core.ir.Context;

/**
 * An IEEE floating point type.
 */
public final class FloatType extends Type {
    private final int width;

    private FloatType(Context context, int width) {
        super(context);
        this.width = width;
    }

    public static FloatType get(int width, Context context) {
        switch (width) {
            case 16:
            case 32:
            case 64:
                return context.unique(new FloatType(context, width));
            default:
                throw new IllegalArgumentException("unsupported float width " + width);
        }
    }

    public int getWidth() {
        return width;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FloatType && ((FloatType) o).width == width;
    }

    @Override
    public int hashCode() {
        return 31 * FloatType.class.hashCode() + width;
    }

    @Override
    public String toString() {
        return "f" + width;
    }
}
