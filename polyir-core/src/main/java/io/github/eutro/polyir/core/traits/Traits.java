package io.github.eutro.polyir.core.traits;

import io.github.eutro.polyir.core.diag.LogicalResult;
import io.github.eutro.polyir.core.ir.Block;
import io.github.eutro.polyir.core.ir.Operation;
import io.github.eutro.polyir.core.ir.Value;
import io.github.eutro.polyir.core.ir.types.FloatType;
import io.github.eutro.polyir.core.ir.types.ShapedType;
import io.github.eutro.polyir.core.ir.types.Type;

import java.util.List;

/**
 * The standard traits operation kinds can declare.
 */
public final class Traits {
    private Traits() {
    }

    /**
     * The operation must be the last in its block, and its successor operands must match the
     * arguments of the successors, which must be in the same region.
     */
    public static final Trait IS_TERMINATOR = Trait.checked("IsTerminator", Traits::verifyIsTerminator);

    public static final Trait ZERO_OPERANDS = Trait.checked("ZeroOperands", op ->
            op.getNumOperands() != 0 ? op.emitOpError("requires zero operands") : LogicalResult.success());
    public static final Trait ONE_OPERAND = Trait.checked("OneOperand", op ->
            op.getNumOperands() != 1 ? op.emitOpError("requires a single operand") : LogicalResult.success());
    public static final Trait ZERO_RESULTS = Trait.checked("ZeroResults", op ->
            op.getNumResults() != 0 ? op.emitOpError("requires zero results") : LogicalResult.success());
    public static final Trait ONE_RESULT = Trait.checked("OneResult", op ->
            op.getNumResults() != 1 ? op.emitOpError("requires one result") : LogicalResult.success());
    public static final Trait ZERO_SUCCESSORS = Trait.checked("ZeroSuccessors", op ->
            op.getNumSuccessors() != 0 ? op.emitOpError("requires zero successors") : LogicalResult.success());

    public static final Trait SAME_TYPE_OPERANDS = Trait.checked("SameTypeOperands", Traits::verifySameTypeOperands);
    public static final Trait SAME_OPERANDS_AND_RESULT_TYPE =
            Trait.checked("SameOperandsAndResultType", Traits::verifySameOperandsAndResultType);
    public static final Trait SAME_OPERANDS_AND_RESULT_SHAPE =
            Trait.checked("SameOperandsAndResultShape", Traits::verifySameOperandsAndResultShape);
    public static final Trait SAME_OPERANDS_AND_RESULT_ELEMENT_TYPE =
            Trait.checked("SameOperandsAndResultElementType", Traits::verifySameOperandsAndResultElementType);

    public static final Trait OPERANDS_ARE_INTEGER_LIKE = Trait.checked("OperandsAreIntegerLike", op -> {
        for (Value operand : op.getOperands()) {
            if (!operand.getType().getElementTypeOrSelf().isIntOrIndex()) {
                return op.emitOpError("requires an integer or index type");
            }
        }
        return LogicalResult.success();
    });
    public static final Trait OPERANDS_ARE_FLOAT_LIKE = Trait.checked("OperandsAreFloatLike", op -> {
        for (Value operand : op.getOperands()) {
            if (!(operand.getType().getElementTypeOrSelf() instanceof FloatType)) {
                return op.emitOpError("requires a float type");
            }
        }
        return LogicalResult.success();
    });
    public static final Trait RESULTS_ARE_BOOL_LIKE = Trait.checked("ResultsAreBoolLike", op -> {
        for (Value result : op.getResults()) {
            if (!result.getType().getElementTypeOrSelf().isInteger(1)) {
                return op.emitOpError("requires a bool result type");
            }
        }
        return LogicalResult.success();
    });
    public static final Trait RESULTS_ARE_INTEGER_LIKE = Trait.checked("ResultsAreIntegerLike", op -> {
        for (Value result : op.getResults()) {
            if (!result.getType().getElementTypeOrSelf().isIntOrIndex()) {
                return op.emitOpError("requires an integer or index type");
            }
        }
        return LogicalResult.success();
    });
    public static final Trait RESULTS_ARE_FLOAT_LIKE = Trait.checked("ResultsAreFloatLike", op -> {
        for (Value result : op.getResults()) {
            if (!(result.getType().getElementTypeOrSelf() instanceof FloatType)) {
                return op.emitOpError("requires a floating point type");
            }
        }
        return LogicalResult.success();
    });

    /**
     * Operands may be reordered freely; the folder moves constants to the right.
     */
    public static final Trait COMMUTATIVE = Trait.marker("Commutative");
    public static final Trait NO_SIDE_EFFECT = Trait.marker("NoSideEffect");
    /**
     * The operation folds, with no operands, to a constant attribute.
     */
    public static final Trait CONSTANT_LIKE = Trait.marker("ConstantLike");
    /**
     * Values defined at the top level of this operation's regions are symbols to affine maps.
     */
    public static final Trait FUNCTION_LIKE = Trait.marker("FunctionLike");
    /**
     * Operations in this operation's regions may not use values defined outside it;
     * constants are materialized in its entry block.
     */
    public static final Trait ISOLATED_FROM_ABOVE = Trait.marker("IsolatedFromAbove");

    public static Trait nOperands(int n) {
        return Trait.checked("NOperands<" + n + ">", op -> op.getNumOperands() != n
                ? op.emitOpError("expected " + n + " operands, but found " + op.getNumOperands())
                : LogicalResult.success());
    }

    public static Trait atLeastNOperands(int n) {
        return Trait.checked("AtLeastNOperands<" + n + ">", op -> op.getNumOperands() < n
                ? op.emitOpError("expected " + n + " or more operands")
                : LogicalResult.success());
    }

    public static Trait nResults(int n) {
        return Trait.checked("NResults<" + n + ">", op -> op.getNumResults() != n
                ? op.emitOpError("expected " + n + " results")
                : LogicalResult.success());
    }

    public static Trait atLeastNResults(int n) {
        return Trait.checked("AtLeastNResults<" + n + ">", op -> op.getNumResults() < n
                ? op.emitOpError("expected " + n + " or more results")
                : LogicalResult.success());
    }

    public static Trait nRegions(int n) {
        return Trait.checked("NRegions<" + n + ">", op -> op.getNumRegions() != n
                ? op.emitOpError("requires " + n + " regions")
                : LogicalResult.success());
    }

    public static Trait nSuccessors(int n) {
        return Trait.checked("NSuccessors<" + n + ">", op -> op.getNumSuccessors() != n
                ? op.emitOpError("requires " + n + " successors")
                : LogicalResult.success());
    }

    static LogicalResult verifyIsTerminator(Operation op) {
        Block block = op.getBlock();
        if (block == null || block.back() != op) {
            return op.emitOpError("must be the last operation in the parent block");
        }
        for (int i = 0; i < op.getNumSuccessors(); i++) {
            Block succ = op.getSuccessor(i);
            if (succ == null) {
                return op.emitOpError("successor #" + i + " is null");
            }
            if (succ.getParent() != op.getParentRegion()) {
                return op.emitError("reference to block defined in another region");
            }
            List<Value> operands = op.getSuccessorOperands(i);
            if (operands.size() != succ.getNumArguments()) {
                return op.emitError("branch has " + operands.size()
                        + " operands, but target block has " + succ.getNumArguments());
            }
            for (int j = 0; j < operands.size(); j++) {
                Value operand = operands.get(j);
                if (operand == null || !operand.getType().equals(succ.getArgument(j).getType())) {
                    return op.emitError("type mismatch in bb argument #" + j);
                }
            }
        }
        return LogicalResult.success();
    }

    static LogicalResult verifySameTypeOperands(Operation op) {
        List<Type> types = op.getOperandTypes();
        if (types.isEmpty()) return LogicalResult.success();
        Type type = types.get(0);
        for (Type other : types) {
            if (!type.equals(other)) {
                return op.emitOpError("requires all operands to have the same type");
            }
        }
        return LogicalResult.success();
    }

    static LogicalResult verifySameOperandsAndResultType(Operation op) {
        if (op.getNumOperands() == 0) return op.emitOpError("expected 1 or more operands");
        if (op.getNumResults() == 0) return op.emitOpError("expected 1 or more results");
        Type type = op.getResult(0).getType();
        for (Type other : op.getResultTypes()) {
            if (!type.equals(other)) {
                return op.emitOpError("requires the same type for all operands and results");
            }
        }
        for (Type other : op.getOperandTypes()) {
            if (!type.equals(other)) {
                return op.emitOpError("requires the same type for all operands and results");
            }
        }
        return LogicalResult.success();
    }

    static LogicalResult verifySameOperandsAndResultShape(Operation op) {
        if (op.getNumOperands() == 0) return op.emitOpError("expected 1 or more operands");
        if (op.getNumResults() == 0) return op.emitOpError("expected 1 or more results");
        Type type = op.getOperand(0).getType();
        for (Type other : op.getResultTypes()) {
            if (!isCompatibleShape(type, other)) {
                return op.emitOpError("requires the same shape for all operands and results");
            }
        }
        for (Type other : op.getOperandTypes()) {
            if (!isCompatibleShape(type, other)) {
                return op.emitOpError("requires the same shape for all operands and results");
            }
        }
        return LogicalResult.success();
    }

    static LogicalResult verifySameOperandsAndResultElementType(Operation op) {
        if (op.getNumOperands() == 0) return op.emitOpError("expected 1 or more operands");
        if (op.getNumResults() == 0) return op.emitOpError("expected 1 or more results");
        Type type = op.getResult(0).getType().getElementTypeOrSelf();
        for (Type other : op.getResultTypes()) {
            if (!type.equals(other.getElementTypeOrSelf())) {
                return op.emitOpError("requires the same element type for all operands and results");
            }
        }
        for (Type other : op.getOperandTypes()) {
            if (!type.equals(other.getElementTypeOrSelf())) {
                return op.emitOpError("requires the same element type for all operands and results");
            }
        }
        return LogicalResult.success();
    }

    /**
     * Whether two types have compatible shapes: neither is shaped, either is unranked, or they have the
     * same rank and every dimension is equal or dynamic in one of them.
     *
     * @param a The first type.
     * @param b The second type.
     * @return Whether the shapes are compatible.
     */
    public static boolean isCompatibleShape(Type a, Type b) {
        boolean aShaped = a instanceof ShapedType;
        boolean bShaped = b instanceof ShapedType;
        if (!aShaped || !bShaped) return aShaped == bShaped;
        ShapedType sa = (ShapedType) a;
        ShapedType sb = (ShapedType) b;
        if (!sa.hasRank() || !sb.hasRank()) return true;
        if (sa.getRank() != sb.getRank()) return false;
        for (int i = 0; i < sa.getRank(); i++) {
            long da = sa.getDimSize(i);
            long db = sb.getDimSize(i);
            if (da != db && da != ShapedType.DYNAMIC_SIZE && db != ShapedType.DYNAMIC_SIZE) return false;
        }
        return true;
    }
}
