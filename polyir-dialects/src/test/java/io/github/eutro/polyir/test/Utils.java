package io.github.eutro.polyir.test;

import io.github.eutro.polyir.core.affine.AffineMap;
import io.github.eutro.polyir.core.affine.AffineParser;
import io.github.eutro.polyir.core.builtin.BuiltinOps;
import io.github.eutro.polyir.core.ir.*;
import io.github.eutro.polyir.core.ir.types.FunctionType;
import io.github.eutro.polyir.core.ir.types.Type;
import io.github.eutro.polyir.dialects.affine.AffineDialect;
import io.github.eutro.polyir.dialects.affine.AffineLoops;
import io.github.eutro.polyir.dialects.affine.AffineOps;
import io.github.eutro.polyir.dialects.std.StdOps;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class Utils {
    @NotNull
    public static Context newContext() {
        Context ctx = new Context();
        ctx.loadDialect(AffineDialect::new);
        return ctx;
    }

    /**
     * Make a detached function {@code @f} taking arguments of the given types,
     * with an entry block holding only a {@code std.return}.
     */
    @NotNull
    public static Operation newFunction(Context ctx, Type... argTypes) {
        FunctionType type = FunctionType.get(Arrays.asList(argTypes), Collections.<Type>emptyList(), ctx);
        Operation func = BuiltinOps.createFunction(ctx, Location.UNKNOWN, "f", type);
        StdOps.createReturn(new OpBuilder(ctx, entry(func)), Location.UNKNOWN);
        return func;
    }

    @NotNull
    public static Block entry(Operation func) {
        return func.getRegion(0).front();
    }

    /**
     * A builder inserting before the terminator of a block.
     */
    @NotNull
    public static OpBuilder beforeEnd(Block block) {
        return OpBuilder.before(block.back());
    }

    /**
     * Add a loop from 0 to 10 to the end of a function.
     */
    @NotNull
    public static Operation addLoop(Operation func) {
        return AffineLoops.create(beforeEnd(entry(func)), Location.UNKNOWN, 0, 10, 1);
    }

    @NotNull
    public static AffineMap map(Context ctx, String source) {
        AffineMap map = AffineParser.parseAffineMap(source, ctx);
        if (map == null) throw new AssertionError("failed to parse " + source);
        return map;
    }

    @NotNull
    public static Operation apply(OpBuilder b, String map, Value... operands) {
        return AffineOps.createApply(b, Location.UNKNOWN, map(b.getContext(), map), Arrays.asList(operands));
    }

    @NotNull
    public static Operation use(OpBuilder b, Value... operands) {
        return b.create(new OperationState(b.getContext(), Location.UNKNOWN, "foo.use").addOperands(operands));
    }

    @NotNull
    public static List<Operation> opsOfKind(Operation root, OpKind kind) {
        List<Operation> ops = new ArrayList<>();
        root.walk(op -> {
            if (op.isKind(kind)) ops.add(op);
        });
        return ops;
    }
}
