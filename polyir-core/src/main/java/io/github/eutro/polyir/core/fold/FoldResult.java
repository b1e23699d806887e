package io.github.eutro.polyir.core.fold;

import io.github.eutro.polyir.core.ir.Value;
import io.github.eutro.polyir.core.ir.attrs.Attribute;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * What one result of an operation folded to: either an existing value, or a constant.
 */
public final class FoldResult {
    private final @Nullable Value value;
    private final @Nullable Attribute attribute;

    private FoldResult(@Nullable Value value, @Nullable Attribute attribute) {
        this.value = value;
        this.attribute = attribute;
    }

    public static FoldResult of(@NotNull Value value) {
        return new FoldResult(value, null);
    }

    public static FoldResult of(@NotNull Attribute attribute) {
        return new FoldResult(null, attribute);
    }

    public boolean isValue() {
        return value != null;
    }

    public @Nullable Value getValue() {
        return value;
    }

    public @Nullable Attribute getAttribute() {
        return attribute;
    }

    @Override
    public String toString() {
        return value != null ? value.toString() : String.valueOf(attribute);
    }
}
