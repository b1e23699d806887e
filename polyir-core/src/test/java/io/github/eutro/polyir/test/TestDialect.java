package io.github.eutro.polyir.test;

import io.github.eutro.polyir.core.diag.LogicalResult;
import io.github.eutro.polyir.core.fold.FoldHook;
import io.github.eutro.polyir.core.fold.FoldResult;
import io.github.eutro.polyir.core.fold.Matchers;
import io.github.eutro.polyir.core.ir.*;
import io.github.eutro.polyir.core.ir.attrs.Attribute;
import io.github.eutro.polyir.core.ir.attrs.IntegerAttr;
import io.github.eutro.polyir.core.ir.types.Type;
import io.github.eutro.polyir.core.traits.Traits;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * A small dialect to exercise the core with.
 */
public class TestDialect extends Dialect {
    public static final String NAMESPACE = "test";

    public static final OpKind CONSTANT = OpKind.builder("test.constant")
            .traits(Traits.ZERO_OPERANDS,
                    Traits.ONE_RESULT,
                    Traits.CONSTANT_LIKE,
                    Traits.NO_SIDE_EFFECT)
            .verifier(op -> op.getAttr("value") == null
                    ? op.emitOpError("requires a 'value' attribute")
                    : LogicalResult.success())
            .folder(FoldHook.single((op, operands) -> {
                Attribute value = op.getAttr("value");
                return value == null ? null : FoldResult.of(value);
            }))
            .printer((op, p) -> p.append("test.constant ").printAttribute(op.getAttr("value")))
            .build();

    public static final OpKind ADD = OpKind.builder("test.add")
            .traits(Traits.nOperands(2),
                    Traits.ONE_RESULT,
                    Traits.SAME_OPERANDS_AND_RESULT_TYPE,
                    Traits.COMMUTATIVE,
                    Traits.NO_SIDE_EFFECT)
            .folder(FoldHook.single(TestDialect::foldAdd))
            .canonicalizer(TestDialect::constantToRight)
            .build();

    // folds away when its operand is constant, but has no results to replace
    public static final OpKind SINK = OpKind.builder("test.sink")
            .traits(Traits.ONE_OPERAND, Traits.ZERO_RESULTS)
            .folder((op, operands) -> operands.get(0) == null ? null : Collections.<FoldResult>emptyList())
            .build();

    public static final OpKind OP = OpKind.builder("test.op")
            .build();

    public static final OpKind TERMINATOR = OpKind.builder("test.terminator")
            .traits(Traits.IS_TERMINATOR, Traits.ZERO_RESULTS)
            .build();

    public static final OpKind BR = OpKind.builder("test.br")
            .traits(Traits.IS_TERMINATOR, Traits.ZERO_RESULTS, Traits.nSuccessors(1))
            .build();

    public static final OpKind COND_BR = OpKind.builder("test.cond_br")
            .traits(Traits.IS_TERMINATOR, Traits.ZERO_RESULTS, Traits.nSuccessors(2))
            .build();

    public static final OpKind ISOLATED = OpKind.builder("test.isolated")
            .traits(Traits.nRegions(1), Traits.ISOLATED_FROM_ABOVE)
            .build();

    public TestDialect(Context context) {
        super(NAMESPACE, context);
    }

    @Override
    protected void initialize() {
        addOperations(CONSTANT, ADD, SINK, OP, TERMINATOR, BR, COND_BR, ISOLATED);
    }

    @Override
    public @Nullable Operation materializeConstant(OpBuilder builder, Attribute value, Type type, Location loc) {
        if (!(value instanceof IntegerAttr) || !((IntegerAttr) value).getType().equals(type)) return null;
        return constant(builder, (IntegerAttr) value);
    }

    private static @Nullable FoldResult foldAdd(Operation op, List<@Nullable Attribute> operands) {
        Attribute lhs = operands.get(0);
        Attribute rhs = operands.get(1);
        if (rhs instanceof IntegerAttr) {
            long r = ((IntegerAttr) rhs).getValue();
            if (lhs instanceof IntegerAttr) {
                return FoldResult.of(IntegerAttr.get(((IntegerAttr) lhs).getType(), ((IntegerAttr) lhs).getValue() + r));
            }
            if (r == 0) return FoldResult.of(op.getOperand(0));
        }
        return null;
    }

    private static boolean constantToRight(Operation op) {
        Value lhs = op.getOperand(0);
        Value rhs = op.getOperand(1);
        if (Matchers.matchConstant(lhs) == null || Matchers.matchConstant(rhs) != null) return false;
        op.setOperand(0, rhs);
        op.setOperand(1, lhs);
        return true;
    }

    public static Operation constant(OpBuilder builder, IntegerAttr value) {
        return builder.create(new OperationState(builder.getContext(), Location.UNKNOWN, CONSTANT)
                .addAttribute("value", value)
                .addTypes(value.getType()));
    }

    public static Operation constantIndex(OpBuilder builder, long value) {
        return constant(builder, builder.getIndexAttr(value));
    }

    public static Operation add(OpBuilder builder, Value lhs, Value rhs) {
        return builder.create(new OperationState(builder.getContext(), Location.UNKNOWN, ADD)
                .addOperands(lhs, rhs)
                .addTypes(lhs.getType()));
    }

    public static Operation terminator(OpBuilder builder) {
        return builder.create(new OperationState(builder.getContext(), Location.UNKNOWN, TERMINATOR));
    }
}
