package io.github.eutro.polyir.core.fold;

import io.github.eutro.polyir.core.ir.Operation;
import io.github.eutro.polyir.core.ir.attrs.Attribute;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Folds an operation of a given kind, using only the operation and the constant values of its operands.
 * <p>
 * A hook may update the operation in place and return an empty list, but must not
 * create, erase or otherwise touch other operations.
 */
@FunctionalInterface
public interface FoldHook {
    /**
     * Fold an operation.
     *
     * @param op       The operation.
     * @param operands The constant values of its operands, null where not constant.
     * @return One result per operation result, an empty list if the operation was updated in place,
     * or null if it could not be folded.
     */
    @Nullable List<FoldResult> fold(Operation op, List<@Nullable Attribute> operands);

    /**
     * Adapt a folder of single-result operations.
     *
     * @param folder The folder, returning null if it can't fold.
     * @return The hook.
     */
    static FoldHook single(BiFunction<Operation, List<@Nullable Attribute>, @Nullable FoldResult> folder) {
        return (op, operands) -> {
            FoldResult result = folder.apply(op, operands);
            return result == null ? null : Collections.singletonList(result);
        };
    }
}
