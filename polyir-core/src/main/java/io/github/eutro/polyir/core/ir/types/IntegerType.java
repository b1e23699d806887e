package io.github.eutro.polyir.core.ir.types;

import io.github.eutro.polyir.core.ir.Context;

/**
 * A signless integer type of a fixed bit width, {@code i1} being the boolean type.
 */
public final class IntegerType extends Type {
    private final int width;

    private IntegerType(Context context, int width) {
        super(context);
        this.width = width;
    }

    public static IntegerType get(int width, Context context) {
        if (width <= 0) throw new IllegalArgumentException("integer width must be positive, got " + width);
        return context.unique(new IntegerType(context, width));
    }

    public int getWidth() {
        return width;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IntegerType && ((IntegerType) o).width == width;
    }

    @Override
    public int hashCode() {
        return 31 * IntegerType.class.hashCode() + width;
    }

    @Override
    public String toString() {
        return "i" + width;
    }
}
