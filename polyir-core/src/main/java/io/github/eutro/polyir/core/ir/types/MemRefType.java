package io.github.eutro.polyir.core.ir.types;

import io.github.eutro.polyir.core.ir.Context;

/**
 * A ranked reference to a region of memory in a given memory space.
 */
public final class MemRefType extends ShapedType {
    private final int memorySpace;

    private MemRefType(Context context, long[] shape, Type elementType, int memorySpace) {
        super(context, elementType, shape);
        this.memorySpace = memorySpace;
    }

    public static MemRefType get(long[] shape, Type elementType, Context context) {
        return get(shape, elementType, 0, context);
    }

    public static MemRefType get(long[] shape, Type elementType, int memorySpace, Context context) {
        for (long dim : shape) {
            if (dim < 0 && dim != DYNAMIC_SIZE) {
                throw new IllegalArgumentException("invalid memref dimension size " + dim);
            }
        }
        return context.unique(new MemRefType(context, shape, elementType, memorySpace));
    }

    public int getMemorySpace() {
        return memorySpace;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof MemRefType)) return false;
        MemRefType that = (MemRefType) o;
        return memorySpace == that.memorySpace && shapeEquals(that);
    }

    @Override
    public int hashCode() {
        return 31 * shapeHash() + memorySpace;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("memref<");
        appendShape(sb);
        if (memorySpace != 0) sb.append(", ").append(memorySpace);
        return sb.append('>').toString();
    }
}
