package io.github.eutro.polyir.core.traits;

import io.github.eutro.polyir.core.diag.LogicalResult;
import io.github.eutro.polyir.core.ir.Operation;
import org.jetbrains.annotations.Nullable;

import java.util.function.Function;

/**
 * A structural property declared by an operation kind, with the check that enforces it.
 * <p>
 * Marker traits have no check; they only answer {@link io.github.eutro.polyir.core.ir.OpKind#hasTrait(Trait)}.
 * Traits are compared by identity, so parameterised traits made by the factories in {@link Traits}
 * are distinct from each other.
 */
public final class Trait {
    private final String name;
    private final @Nullable Function<Operation, LogicalResult> check;

    private Trait(String name, @Nullable Function<Operation, LogicalResult> check) {
        this.name = name;
        this.check = check;
    }

    public static Trait marker(String name) {
        return new Trait(name, null);
    }

    public static Trait checked(String name, Function<Operation, LogicalResult> check) {
        return new Trait(name, check);
    }

    public String getName() {
        return name;
    }

    /**
     * Check that an operation has this trait's property.
     *
     * @param op The operation.
     * @return The outcome of the check.
     */
    public LogicalResult verify(Operation op) {
        return check == null ? LogicalResult.success() : check.apply(op);
    }

    @Override
    public String toString() {
        return name;
    }
}
