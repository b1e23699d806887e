package io.github.eutro.polyir.core.ir.types;

import io.github.eutro.polyir.core.ir.Context;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * A type with an element type and an optional shape.
 * Dimensions of size {@link #DYNAMIC_SIZE} are only known at runtime.
 */
public abstract class ShapedType extends Type {
    public static final long DYNAMIC_SIZE = -1;

    private final Type elementType;
    private final long @Nullable [] shape;

    protected ShapedType(Context context, Type elementType, long @Nullable [] shape) {
        super(context);
        this.elementType = elementType;
        this.shape = shape == null ? null : shape.clone();
    }

    public Type getElementType() {
        return elementType;
    }

    public boolean hasRank() {
        return shape != null;
    }

    public int getRank() {
        if (shape == null) throw new IllegalStateException("unranked type has no rank");
        return shape.length;
    }

    public long[] getShape() {
        if (shape == null) throw new IllegalStateException("unranked type has no shape");
        return shape.clone();
    }

    public long getDimSize(int i) {
        if (shape == null) throw new IllegalStateException("unranked type has no shape");
        return shape[i];
    }

    public boolean isDynamicDim(int i) {
        return getDimSize(i) == DYNAMIC_SIZE;
    }

    public boolean hasStaticShape() {
        if (shape == null) return false;
        for (long dim : shape) {
            if (dim == DYNAMIC_SIZE) return false;
        }
        return true;
    }

    protected boolean shapeEquals(ShapedType that) {
        return elementType.equals(that.elementType) && Arrays.equals(shape, that.shape);
    }

    protected int shapeHash() {
        return 31 * elementType.hashCode() + Arrays.hashCode(shape);
    }

    protected void appendShape(StringBuilder sb) {
        if (shape == null) {
            sb.append("*x");
        } else {
            for (long dim : shape) {
                sb.append(dim == DYNAMIC_SIZE ? "?" : Long.toString(dim)).append('x');
            }
        }
        sb.append(elementType);
    }
}
