package io.github.eutro.polyir.dialects.std;

import io.github.eutro.polyir.core.builtin.BuiltinOps;
import io.github.eutro.polyir.core.diag.LogicalResult;
import io.github.eutro.polyir.core.fold.FoldHook;
import io.github.eutro.polyir.core.fold.FoldResult;
import io.github.eutro.polyir.core.fold.Matchers;
import io.github.eutro.polyir.core.ir.*;
import io.github.eutro.polyir.core.ir.attrs.Attribute;
import io.github.eutro.polyir.core.ir.attrs.FloatAttr;
import io.github.eutro.polyir.core.ir.attrs.IntegerAttr;
import io.github.eutro.polyir.core.ir.types.FunctionType;
import io.github.eutro.polyir.core.ir.types.IntegerType;
import io.github.eutro.polyir.core.ir.types.ShapedType;
import io.github.eutro.polyir.core.ir.types.Type;
import io.github.eutro.polyir.core.print.AsmPrinter;
import io.github.eutro.polyir.core.traits.Traits;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.LongBinaryOperator;

/**
 * The operations of the {@link StdDialect}.
 */
public final class StdOps {
    private StdOps() {
    }

    public static final String VALUE = "value";
    public static final String INDEX = "index";

    /**
     * Effect: returns the constant in its {@link #VALUE} attribute.
     */
    public static final OpKind CONSTANT = OpKind.builder("std.constant")
            .traits(Traits.ZERO_OPERANDS,
                    Traits.ONE_RESULT,
                    Traits.NO_SIDE_EFFECT,
                    Traits.CONSTANT_LIKE)
            .verifier(StdOps::verifyConstant)
            .folder(FoldHook.single((op, operands) -> {
                Attribute value = op.getAttr(VALUE);
                return value == null ? null : FoldResult.of(value);
            }))
            .printer(StdOps::printConstant)
            .build();

    /**
     * Effect: returns the size of dimension {@link #INDEX} of its tensor or memref operand.
     */
    public static final OpKind DIM = OpKind.builder("std.dim")
            .traits(Traits.ONE_OPERAND,
                    Traits.ONE_RESULT,
                    Traits.NO_SIDE_EFFECT)
            .verifier(StdOps::verifyDim)
            .folder(FoldHook.single(StdOps::foldDim))
            .printer((op, p) -> {
                p.append("std.dim ");
                p.printOperand(op.getOperand(0));
                p.append(", ").append(getDimIndex(op));
                p.printOptionalAttrDict(op.getAttrs(), Collections.singleton(INDEX));
                p.append(" : ");
                p.printType(op.getOperand(0).getType());
            })
            .build();

    /**
     * Effect: returns the sum of its integer operands, wrapping on overflow.
     */
    public static final OpKind ADDI = OpKind.builder("std.addi")
            .traits(Traits.nOperands(2),
                    Traits.ONE_RESULT,
                    Traits.COMMUTATIVE,
                    Traits.NO_SIDE_EFFECT,
                    Traits.SAME_OPERANDS_AND_RESULT_TYPE,
                    Traits.OPERANDS_ARE_INTEGER_LIKE)
            .folder(FoldHook.single((op, operands) -> {
                FoldResult folded = foldBinary(op, operands, Long::sum);
                if (folded != null) return folded;
                // x + 0 = x
                if (Matchers.isConstantIntValue(op.getOperand(1), 0)) return FoldResult.of(op.getOperand(0));
                if (Matchers.isConstantIntValue(op.getOperand(0), 0)) return FoldResult.of(op.getOperand(1));
                return null;
            }))
            .printer(StdOps::printBinary)
            .build();

    /**
     * Effect: returns the product of its integer operands, wrapping on overflow.
     */
    public static final OpKind MULI = OpKind.builder("std.muli")
            .traits(Traits.nOperands(2),
                    Traits.ONE_RESULT,
                    Traits.COMMUTATIVE,
                    Traits.NO_SIDE_EFFECT,
                    Traits.SAME_OPERANDS_AND_RESULT_TYPE,
                    Traits.OPERANDS_ARE_INTEGER_LIKE)
            .folder(FoldHook.single((op, operands) -> {
                FoldResult folded = foldBinary(op, operands, (a, b) -> a * b);
                if (folded != null) return folded;
                for (int i = 0; i < 2; i++) {
                    Long k = operands.get(i) instanceof IntegerAttr ? ((IntegerAttr) operands.get(i)).getValue() : null;
                    if (k == null) continue;
                    // x * 0 = 0, x * 1 = x
                    if (k == 0) return FoldResult.of(operands.get(i));
                    if (k == 1) return FoldResult.of(op.getOperand(1 - i));
                }
                return null;
            }))
            .printer(StdOps::printBinary)
            .build();

    /**
     * Control: returns its operands from the enclosing function.
     */
    public static final OpKind RETURN = OpKind.builder("std.return")
            .traits(Traits.IS_TERMINATOR,
                    Traits.ZERO_RESULTS,
                    Traits.ZERO_SUCCESSORS)
            .verifier(StdOps::verifyReturn)
            .printer((op, p) -> {
                p.append("std.return");
                if (op.getNumOperands() != 0) {
                    p.append(" ");
                    p.printOperands(op.getOperands());
                    p.append(" : ");
                    List<Type> types = op.getOperandTypes();
                    for (int i = 0; i < types.size(); i++) {
                        if (i != 0) p.append(", ");
                        p.printType(types.get(i));
                    }
                }
            })
            .build();

    /**
     * Control: an unconditional jump, passing its operands to the successor's arguments.
     */
    public static final OpKind BR = OpKind.builder("std.br")
            .traits(Traits.IS_TERMINATOR,
                    Traits.ZERO_RESULTS,
                    Traits.nSuccessors(1))
            .printer((op, p) -> {
                p.append("std.br ");
                p.printSuccessorAndUseList(op, 0);
            })
            .build();

    /**
     * Control: jumps to its first successor if its {@code i1} condition is true, or its second otherwise.
     */
    public static final OpKind COND_BR = OpKind.builder("std.cond_br")
            .traits(Traits.IS_TERMINATOR,
                    Traits.ZERO_RESULTS,
                    Traits.nSuccessors(2))
            .verifier(op -> {
                if (op.getNumNonSuccessorOperands() != 1) {
                    return op.emitOpError("expected a single condition operand");
                }
                if (!op.getOperand(0).getType().isInteger(1)) {
                    return op.emitOpError("expected condition of type i1");
                }
                return LogicalResult.success();
            })
            .canonicalizer(StdOps::simplifyConstCondBranch)
            .printer((op, p) -> {
                p.append("std.cond_br ");
                p.printOperand(op.getOperand(0));
                p.append(", ");
                p.printSuccessorAndUseList(op, 0);
                p.append(", ");
                p.printSuccessorAndUseList(op, 1);
            })
            .build();

    // builders

    public static Operation createConstant(OpBuilder builder, Location loc, Attribute value, Type type) {
        return builder.create(new OperationState(builder.getContext(), loc, CONSTANT)
                .addAttribute(VALUE, value)
                .addTypes(type));
    }

    public static Operation createConstantIndex(OpBuilder builder, Location loc, long value) {
        return createConstant(builder, loc, builder.getIndexAttr(value), builder.getIndexType());
    }

    public static Operation createDim(OpBuilder builder, Location loc, Value shaped, int index) {
        return builder.create(new OperationState(builder.getContext(), loc, DIM)
                .addOperands(shaped)
                .addAttribute(INDEX, IntegerAttr.get(builder.getIndexType(), index))
                .addTypes(builder.getIndexType()));
    }

    public static Operation createAddi(OpBuilder builder, Location loc, Value lhs, Value rhs) {
        return builder.create(new OperationState(builder.getContext(), loc, ADDI)
                .addOperands(lhs, rhs)
                .addTypes(lhs.getType()));
    }

    public static Operation createMuli(OpBuilder builder, Location loc, Value lhs, Value rhs) {
        return builder.create(new OperationState(builder.getContext(), loc, MULI)
                .addOperands(lhs, rhs)
                .addTypes(lhs.getType()));
    }

    public static Operation createReturn(OpBuilder builder, Location loc, Value... operands) {
        return builder.create(new OperationState(builder.getContext(), loc, RETURN)
                .addOperands(operands));
    }

    public static Operation createBr(OpBuilder builder, Location loc, Block dest, List<? extends Value> destOperands) {
        return builder.create(new OperationState(builder.getContext(), loc, BR)
                .addSuccessor(dest, destOperands));
    }

    public static Operation createCondBr(OpBuilder builder,
                                         Location loc,
                                         Value condition,
                                         Block trueDest,
                                         List<? extends Value> trueOperands,
                                         Block falseDest,
                                         List<? extends Value> falseOperands) {
        return builder.create(new OperationState(builder.getContext(), loc, COND_BR)
                .addOperands(condition)
                .addSuccessor(trueDest, trueOperands)
                .addSuccessor(falseDest, falseOperands));
    }

    // accessors

    public static @Nullable Attribute getConstantValue(Operation constant) {
        return constant.getAttr(VALUE);
    }

    public static long getDimIndex(Operation dim) {
        IntegerAttr attr = dim.getAttrOfType(INDEX, IntegerAttr.class);
        if (attr == null) throw new IllegalStateException("dim op has no index");
        return attr.getValue();
    }

    // constant

    private static LogicalResult verifyConstant(Operation op) {
        Attribute value = op.getAttr(VALUE);
        if (value == null) return op.emitOpError("requires a '" + VALUE + "' attribute");
        Type type = op.getResult(0).getType();
        if (type.isIntOrIndex()) {
            if (!(value instanceof IntegerAttr)) {
                return op.emitOpError("requires '" + VALUE + "' to be an integer for an integer result type");
            }
            Type attrType = ((IntegerAttr) value).getType();
            if (!attrType.equals(type)) {
                return op.emitOpError("requires attribute's type (" + attrType
                        + ") to match op's return type (" + type + ")");
            }
            return LogicalResult.success();
        }
        if (value instanceof FloatAttr) {
            Type attrType = ((FloatAttr) value).getType();
            if (!attrType.equals(type)) {
                return op.emitOpError("requires attribute's type (" + attrType
                        + ") to match op's return type (" + type + ")");
            }
            return LogicalResult.success();
        }
        return op.emitOpError("unsupported 'value' attribute: " + value);
    }

    private static void printConstant(Operation op, AsmPrinter p) {
        p.append("std.constant");
        p.printOptionalAttrDict(op.getAttrs(), Collections.singleton(VALUE));
        p.append(" ");
        Attribute value = op.getAttr(VALUE);
        if (value == null) return;
        p.printAttribute(value);
        // integer and float attributes print their own type
        if (!(value instanceof IntegerAttr) && !(value instanceof FloatAttr)) {
            p.append(" : ");
            p.printType(op.getResult(0).getType());
        }
    }

    // dim

    private static LogicalResult verifyDim(Operation op) {
        if (op.getAttrOfType(INDEX, IntegerAttr.class) == null) {
            return op.emitOpError("requires an integer attribute named '" + INDEX + "'");
        }
        Type type = op.getOperand(0).getType();
        if (!(type instanceof ShapedType)) {
            return op.emitOpError("requires an operand with tensor or memref type");
        }
        long index = getDimIndex(op);
        ShapedType shaped = (ShapedType) type;
        if (index < 0 || shaped.hasRank() && index >= shaped.getRank()) {
            return op.emitOpError("index is out of range");
        }
        if (!op.getResult(0).getType().isIndex()) {
            return op.emitOpError("result must be of type 'index'");
        }
        return LogicalResult.success();
    }

    private static @Nullable FoldResult foldDim(Operation op, List<@Nullable Attribute> operands) {
        Type type = op.getOperand(0).getType();
        if (!(type instanceof ShapedType)) return null;
        ShapedType shaped = (ShapedType) type;
        IntegerAttr index = op.getAttrOfType(INDEX, IntegerAttr.class);
        if (index == null || !shaped.hasRank() || index.getValue() < 0 || index.getValue() >= shaped.getRank()) {
            return null;
        }
        int i = (int) index.getValue();
        if (shaped.isDynamicDim(i)) return null;
        return FoldResult.of(IntegerAttr.get(op.getResult(0).getType(), shaped.getDimSize(i)));
    }

    // arithmetic

    private static @Nullable FoldResult foldBinary(Operation op,
                                                   List<@Nullable Attribute> operands,
                                                   LongBinaryOperator fn) {
        if (!(operands.get(0) instanceof IntegerAttr) || !(operands.get(1) instanceof IntegerAttr)) return null;
        long lhs = ((IntegerAttr) operands.get(0)).getValue();
        long rhs = ((IntegerAttr) operands.get(1)).getValue();
        Type type = op.getResult(0).getType();
        return FoldResult.of(IntegerAttr.get(type, truncate(fn.applyAsLong(lhs, rhs), type)));
    }

    private static long truncate(long value, Type type) {
        if (type.isIndex() || type.isInteger(64)) return value;
        int width = ((IntegerType) type).getWidth();
        if (width >= 64) return value;
        // booleans are 0 and 1, as IntegerAttr.getBool builds them
        if (width == 1) return value & 1;
        // sign-extend from the type's width
        int shift = 64 - width;
        return (value << shift) >> shift;
    }

    private static void printBinary(Operation op, AsmPrinter p) {
        p.append(op.getName()).append(" ");
        p.printOperands(op.getOperands());
        p.printOptionalAttrDict(op.getAttrs(), Collections.<String>emptySet());
        p.append(" : ");
        p.printType(op.getResult(0).getType());
    }

    // control flow

    private static LogicalResult verifyReturn(Operation op) {
        Operation parent = op.getParentOp();
        if (parent == null || !parent.isKind(BuiltinOps.FUNC)) {
            return op.emitOpError("expects parent op 'func'");
        }
        FunctionType type = BuiltinOps.getFunctionType(parent);
        if (type == null) return LogicalResult.success();
        List<Type> results = type.getResults();
        if (op.getNumOperands() != results.size()) {
            return op.emitOpError("has " + op.getNumOperands()
                    + " operands, but enclosing function returns " + results.size());
        }
        for (int i = 0; i < results.size(); i++) {
            Type operandType = op.getOperand(i).getType();
            if (!operandType.equals(results.get(i))) {
                return op.emitError("type of return operand " + i + " (" + operandType
                        + ") doesn't match function result type (" + results.get(i) + ")");
            }
        }
        return LogicalResult.success();
    }

    private static Boolean simplifyConstCondBranch(Operation op) {
        Long condition = Matchers.matchConstantInt(op.getOperand(0));
        if (condition == null) return false;
        int taken = condition != 0 ? 0 : 1;
        Block dest = op.getSuccessor(taken);
        if (dest == null) return false;
        List<Value> destOperands = new ArrayList<>(op.getSuccessorOperands(taken));
        createBr(OpBuilder.before(op), op.getLoc(), dest, destOperands);
        op.erase();
        return true;
    }
}
