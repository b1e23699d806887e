package io.github.eutro.polyir.dialects.affine;

import io.github.eutro.polyir.core.diag.LogicalResult;
import io.github.eutro.polyir.core.ir.Operation;
import io.github.eutro.polyir.core.ir.Region;
import io.github.eutro.polyir.core.ir.Value;
import io.github.eutro.polyir.core.traits.Traits;
import io.github.eutro.polyir.dialects.std.StdOps;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Rules for which values may be bound to the dimensions and symbols of affine maps.
 * <p>
 * Only {@code index} values are ever valid. A symbol is a value that does not change within
 * the body of a function: one defined at its top level, a constant, or a computation over other
 * symbols. Dimensions are additionally allowed to be any block argument, such as a loop's
 * induction variable.
 */
public final class AffineValidity {
    private AffineValidity() {
    }

    /**
     * Whether a region is the body of a function-like operation.
     *
     * @param region The region.
     * @return Whether it is.
     */
    public static boolean isFunctionRegion(@Nullable Region region) {
        if (region == null) return false;
        Operation parent = region.getParentOp();
        return parent != null && parent.hasTrait(Traits.FUNCTION_LIKE);
    }

    /**
     * Whether a value is defined directly in the body of a function, as an argument of one of its
     * blocks or the result of an operation in one.
     *
     * @param value The value.
     * @return Whether it is top-level.
     */
    public static boolean isTopLevelValue(Value value) {
        return isFunctionRegion(value.getParentRegion());
    }

    public static boolean isValidDim(Value value) {
        if (!value.getType().isIndex()) return false;
        Operation def = value.getDefiningOp();
        if (def == null) {
            // any block argument, loop induction variables included
            return true;
        }
        if (isFunctionRegion(def.getParentRegion()) || def.hasTrait(Traits.CONSTANT_LIKE)) return true;
        if (def.isKind(AffineOps.APPLY)) {
            for (Value operand : def.getOperands()) {
                if (!isValidDim(operand)) return false;
            }
            return true;
        }
        if (def.isKind(StdOps.DIM)) return isTopLevelValue(def.getOperand(0));
        return false;
    }

    public static boolean isValidSymbol(Value value) {
        if (!value.getType().isIndex()) return false;
        Operation def = value.getDefiningOp();
        if (def == null) return isTopLevelValue(value);
        if (isFunctionRegion(def.getParentRegion()) || def.hasTrait(Traits.CONSTANT_LIKE)) return true;
        if (def.isKind(AffineOps.APPLY)) {
            for (Value operand : def.getOperands()) {
                if (!isValidSymbol(operand)) return false;
            }
            return true;
        }
        if (def.isKind(StdOps.DIM)) return isTopLevelValue(def.getOperand(0));
        return false;
    }

    /**
     * Whether a value may be used as a subscript of an affine memory access.
     *
     * @param value The value.
     * @return Whether it is a valid dimension or symbol.
     */
    public static boolean isValidAffineIndexOperand(Value value) {
        return isValidDim(value) || isValidSymbol(value);
    }

    /**
     * Check that the operands bound to a map are valid dimensions and symbols,
     * emitting an error on the operation if not.
     *
     * @param op       The operation.
     * @param operands The operands, dimensions first.
     * @param numDims  The number of dimensions.
     * @return The result.
     */
    public static LogicalResult verifyDimAndSymbolIdentifiers(Operation op, List<Value> operands, int numDims) {
        for (int i = 0; i < operands.size(); i++) {
            Value operand = operands.get(i);
            if (i < numDims) {
                if (!isValidDim(operand)) return op.emitOpError("operand cannot be used as a dimension id");
            } else if (!isValidSymbol(operand)) {
                return op.emitOpError("operand cannot be used as a symbol");
            }
        }
        return LogicalResult.success();
    }
}
