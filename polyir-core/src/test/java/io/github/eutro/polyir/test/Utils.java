package io.github.eutro.polyir.test;

import io.github.eutro.polyir.core.builtin.BuiltinOps;
import io.github.eutro.polyir.core.diag.Diagnostic;
import io.github.eutro.polyir.core.ir.*;
import io.github.eutro.polyir.core.ir.types.FunctionType;
import io.github.eutro.polyir.core.ir.types.Type;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class Utils {
    @NotNull
    public static Context newContext() {
        Context ctx = new Context();
        ctx.loadDialect(TestDialect::new);
        return ctx;
    }

    /**
     * Make a detached function {@code @f} taking arguments of the given types, with an empty entry block.
     */
    @NotNull
    public static Operation newFunction(Context ctx, Type... argTypes) {
        FunctionType type = FunctionType.get(Arrays.asList(argTypes), Collections.<Type>emptyList(), ctx);
        return BuiltinOps.createFunction(ctx, Location.UNKNOWN, "f", type);
    }

    @NotNull
    public static Block entry(Operation func) {
        return func.getRegion(0).front();
    }

    @NotNull
    public static List<Operation> opsOfKind(Operation root, OpKind kind) {
        List<Operation> ops = new ArrayList<>();
        root.walk(op -> {
            if (op.isKind(kind)) ops.add(op);
        });
        return ops;
    }

    @NotNull
    public static String messageOf(List<Diagnostic> diagnostics) {
        if (diagnostics.isEmpty()) throw new AssertionError("no diagnostics emitted");
        return diagnostics.get(diagnostics.size() - 1).getMessage();
    }
}
