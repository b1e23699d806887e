package io.github.eutro.polyir.core.ir.types;

import io.github.eutro.polyir.core.ir.Context;
import org.jetbrains.annotations.Nullable;

/**
 * An immutable multi-dimensional value, ranked or unranked.
 */
public final class TensorType extends ShapedType {
    private TensorType(Context context, long @Nullable [] shape, Type elementType) {
        super(context, elementType, shape);
    }

    public static TensorType getRanked(long[] shape, Type elementType, Context context) {
        return context.unique(new TensorType(context, shape, elementType));
    }

    public static TensorType getUnranked(Type elementType, Context context) {
        return context.unique(new TensorType(context, null, elementType));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TensorType && shapeEquals((TensorType) o);
    }

    @Override
    public int hashCode() {
        return 17 * shapeHash();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("tensor<");
        appendShape(sb);
        return sb.append('>').toString();
    }
}
