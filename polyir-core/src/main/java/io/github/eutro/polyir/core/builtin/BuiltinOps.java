package io.github.eutro.polyir.core.builtin;

import io.github.eutro.polyir.core.diag.LogicalResult;
import io.github.eutro.polyir.core.ir.*;
import io.github.eutro.polyir.core.ir.attrs.StringAttr;
import io.github.eutro.polyir.core.ir.attrs.TypeAttr;
import io.github.eutro.polyir.core.ir.types.FunctionType;
import io.github.eutro.polyir.core.ir.types.Type;
import io.github.eutro.polyir.core.print.AsmPrinter;
import io.github.eutro.polyir.core.traits.Traits;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class BuiltinOps {
    private BuiltinOps() {
    }

    public static final String SYM_NAME = "sym_name";
    public static final String TYPE = "type";

    /**
     * A top-level container of functions, with a single block ending in a {@link #MODULE_TERMINATOR}.
     */
    public static final OpKind MODULE = OpKind.builder("module")
            .dialect(BuiltinDialect.NAMESPACE)
            .traits(Traits.ZERO_OPERANDS,
                    Traits.ZERO_RESULTS,
                    Traits.nRegions(1),
                    Traits.ISOLATED_FROM_ABOVE)
            .verifier(BuiltinOps::verifyModule)
            .printer(BuiltinOps::printModule)
            .build();

    public static final OpKind MODULE_TERMINATOR = OpKind.builder("module_terminator")
            .dialect(BuiltinDialect.NAMESPACE)
            .traits(Traits.IS_TERMINATOR,
                    Traits.ZERO_OPERANDS,
                    Traits.ZERO_RESULTS,
                    Traits.ZERO_SUCCESSORS)
            .verifier(op -> {
                Operation parent = op.getParentOp();
                if (parent == null || !parent.isKind(MODULE)) {
                    return op.emitOpError("expects parent op 'module'");
                }
                return LogicalResult.success();
            })
            .build();

    /**
     * A function, with a {@link #SYM_NAME} and a function {@link #TYPE}. Its body is empty
     * for external functions, or starts with an entry block whose arguments are the function's.
     */
    public static final OpKind FUNC = OpKind.builder("func")
            .dialect(BuiltinDialect.NAMESPACE)
            .traits(Traits.ZERO_OPERANDS,
                    Traits.ZERO_RESULTS,
                    Traits.nRegions(1),
                    Traits.FUNCTION_LIKE,
                    Traits.ISOLATED_FROM_ABOVE)
            .verifier(BuiltinOps::verifyFunc)
            .printer(BuiltinOps::printFunc)
            .build();

    // modules

    /**
     * Create an empty module, with its body block and terminator.
     *
     * @param context The context.
     * @param loc     The location.
     * @return The module.
     */
    public static Operation createModule(Context context, Location loc) {
        Operation module = Operation.create(new OperationState(context, loc, MODULE).addRegions(1));
        module.getRegion(0).ensureTerminator(() ->
                Operation.create(new OperationState(context, loc, MODULE_TERMINATOR)));
        return module;
    }

    public static Block getModuleBody(Operation module) {
        return module.getRegion(0).front();
    }

    /**
     * Insert an operation at the end of a module, before its terminator.
     *
     * @param module The module.
     * @param op     The operation.
     */
    public static void pushBack(Operation module, Operation op) {
        Block body = getModuleBody(module);
        Operation terminator = body.getTerminator();
        if (terminator != null && terminator.isKind(MODULE_TERMINATOR)) {
            body.insertBefore(terminator, op);
        } else {
            body.addOperation(op);
        }
    }

    private static LogicalResult verifyModule(Operation op) {
        Region body = op.getRegion(0);
        if (body.getBlocks().size() != 1) {
            return op.emitOpError("expected body region to have a single block");
        }
        if (body.front().getNumArguments() != 0) {
            return op.emitOpError("expected body to have no arguments");
        }
        return LogicalResult.success();
    }

    private static void printModule(Operation op, AsmPrinter p) {
        p.append("module");
        p.printOptionalAttrDict(op.getAttrs(), Collections.<String>emptySet());
        p.append(" ");
        p.printRegion(op.getRegion(0), false, false);
    }

    // functions

    /**
     * Create a function with an entry block whose arguments match its inputs.
     *
     * @param context The context.
     * @param loc     The location.
     * @param name    The symbol name.
     * @param type    The function type.
     * @return The function.
     */
    public static Operation createFunction(Context context, Location loc, String name, FunctionType type) {
        Operation func = createExternalFunction(context, loc, name, type);
        func.getRegion(0).addBlock().addArguments(type.getInputs());
        return func;
    }

    /**
     * Create a function with an empty body.
     *
     * @param context The context.
     * @param loc     The location.
     * @param name    The symbol name.
     * @param type    The function type.
     * @return The function.
     */
    public static Operation createExternalFunction(Context context, Location loc, String name, FunctionType type) {
        return Operation.create(new OperationState(context, loc, FUNC)
                .addAttribute(SYM_NAME, StringAttr.get(name, context))
                .addAttribute(TYPE, TypeAttr.get(type))
                .addRegions(1));
    }

    public static @Nullable FunctionType getFunctionType(Operation func) {
        TypeAttr attr = func.getAttrOfType(TYPE, TypeAttr.class);
        return attr != null && attr.getValue() instanceof FunctionType ? (FunctionType) attr.getValue() : null;
    }

    public static @Nullable String getFunctionName(Operation func) {
        StringAttr attr = func.getAttrOfType(SYM_NAME, StringAttr.class);
        return attr == null ? null : attr.getValue();
    }

    public static boolean isExternal(Operation func) {
        return func.getRegion(0).isEmpty();
    }

    private static LogicalResult verifyFunc(Operation op) {
        if (getFunctionName(op) == null) {
            return op.emitOpError("requires a '" + SYM_NAME + "' string attribute");
        }
        FunctionType type = getFunctionType(op);
        if (type == null) {
            return op.emitOpError("requires a type attribute '" + TYPE + "'");
        }
        if (isExternal(op)) return LogicalResult.success();

        Block entry = op.getRegion(0).front();
        List<Type> inputs = type.getInputs();
        if (entry.getNumArguments() != inputs.size()) {
            return op.emitOpError("entry block must have " + inputs.size()
                    + " arguments to match function signature");
        }
        for (int i = 0; i < inputs.size(); i++) {
            Type argType = entry.getArgument(i).getType();
            if (!argType.equals(inputs.get(i))) {
                return op.emitOpError("type of entry block argument #" + i + "(" + argType
                        + ") must match the type of the corresponding argument in function signature("
                        + inputs.get(i) + ")");
            }
        }
        return LogicalResult.success();
    }

    private static final Set<String> FUNC_ELIDED_ATTRS = new HashSet<>(Arrays.asList(SYM_NAME, TYPE));

    private static void printFunc(Operation op, AsmPrinter p) {
        FunctionType type = getFunctionType(op);
        p.append("func @").append(getFunctionName(op)).append("(");
        if (type != null) {
            List<Type> inputs = type.getInputs();
            boolean external = isExternal(op);
            for (int i = 0; i < inputs.size(); i++) {
                if (i != 0) p.append(", ");
                if (!external) {
                    p.printOperand(op.getRegion(0).front().getArgument(i));
                    p.append(": ");
                }
                p.printType(inputs.get(i));
            }
        }
        p.append(")");
        if (type != null && !type.getResults().isEmpty()) {
            p.append(" -> ");
            if (type.getResults().size() == 1) p.printType(type.getResults().get(0));
            else p.printTypeList(type.getResults());
        }
        p.printOptionalAttrDict(op.getAttrs(), FUNC_ELIDED_ATTRS);
        if (!isExternal(op)) {
            p.append(" ");
            p.printRegion(op.getRegion(0), false, true);
        }
    }
}
