package io.github.eutro.polyir.core.fold;

import io.github.eutro.polyir.core.ir.Operation;
import io.github.eutro.polyir.core.ir.Value;
import io.github.eutro.polyir.core.ir.attrs.Attribute;
import io.github.eutro.polyir.core.ir.attrs.IntegerAttr;
import io.github.eutro.polyir.core.traits.Traits;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Matchers {
    private Matchers() {
    }

    /**
     * Get the constant an operation produces, if it is constant-like.
     *
     * @param op The operation.
     * @return The constant, or null if the operation is not a constant.
     */
    public static @Nullable Attribute matchConstant(Operation op) {
        if (!op.hasTrait(Traits.CONSTANT_LIKE) || op.getNumResults() != 1) return null;
        List<FoldResult> results = new ArrayList<>(1);
        if (op.fold(Collections.<Attribute>emptyList(), results).failed() || results.size() != 1) return null;
        return results.get(0).getAttribute();
    }

    public static @Nullable Attribute matchConstant(@Nullable Value value) {
        if (value == null) return null;
        Operation def = value.getDefiningOp();
        return def == null ? null : matchConstant(def);
    }

    public static @Nullable Long matchConstantInt(@Nullable Value value) {
        Attribute attr = matchConstant(value);
        return attr instanceof IntegerAttr ? ((IntegerAttr) attr).getValue() : null;
    }

    public static boolean isConstantIntValue(@Nullable Value value, long expected) {
        Long actual = matchConstantInt(value);
        return actual != null && actual == expected;
    }
}
