package io.github.eutro.polyir.core.print;

import io.github.eutro.polyir.core.affine.AffineMap;
import io.github.eutro.polyir.core.ext.IRExts;
import io.github.eutro.polyir.core.ir.*;
import io.github.eutro.polyir.core.ir.attrs.Attribute;
import io.github.eutro.polyir.core.ir.types.FunctionType;
import io.github.eutro.polyir.core.ir.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Prints operations in their textual form.
 * <p>
 * Operations of registered kinds with a {@link IRExts#PRINTER} hook are printed in their custom form,
 * others in the generic form:
 * <pre>
 * %0 = "dialect.name"(%a, %b)[^bb1(%c : index)] ({ ... }) {attr = value} : (index, index) -> index
 * </pre>
 * Values are named when first printed, preferring their {@link IRExts#NAME_HINT}.
 */
public final class AsmPrinter {
    private final StringBuilder sb = new StringBuilder();
    private final Map<Value, String> valueNames = new HashMap<>();
    private final Set<String> usedNames = new HashSet<>();
    private final Map<Block, String> blockNames = new HashMap<>();
    private int nextValueId;
    private int nextArgId;
    private int indent;

    public AsmPrinter() {
    }

    public static String print(Operation op) {
        AsmPrinter printer = new AsmPrinter();
        printer.printOperation(op);
        return printer.toString();
    }

    /**
     * Print an operation, with its results and nested regions.
     *
     * @param op The operation.
     */
    public void printOperation(Operation op) {
        if (op.getNumResults() != 0) {
            for (int i = 0; i < op.getNumResults(); i++) {
                if (i != 0) sb.append(", ");
                printOperand(op.getResult(i));
            }
            sb.append(" = ");
        }
        PrintHook hook = op.isRegistered() ? op.getNullable(IRExts.PRINTER) : null;
        if (hook != null) {
            hook.print(op, this);
        } else {
            printGenericOp(op);
        }
    }

    public void printGenericOp(Operation op) {
        sb.append('"').append(op.getName()).append('"').append('(');
        printOperands(op.getNonSuccessorOperands());
        sb.append(')');
        if (op.getNumSuccessors() != 0) {
            sb.append('[');
            for (int i = 0; i < op.getNumSuccessors(); i++) {
                if (i != 0) sb.append(", ");
                printSuccessorAndUseList(op, i);
            }
            sb.append(']');
        }
        if (op.getNumRegions() != 0) {
            sb.append(" (");
            for (int i = 0; i < op.getNumRegions(); i++) {
                if (i != 0) sb.append(", ");
                printRegion(op.getRegion(i), true, true);
            }
            sb.append(')');
        }
        printOptionalAttrDict(op.getAttrs(), Collections.<String>emptySet());
        sb.append(" : ");
        printFunctionalType(op.getNonSuccessorOperands(), op.getResultTypes());
    }

    private void printFunctionalType(List<Value> operands, List<Type> results) {
        sb.append('(');
        for (int i = 0; i < operands.size(); i++) {
            if (i != 0) sb.append(", ");
            printType(operands.get(i).getType());
        }
        sb.append(") -> ");
        if (results.size() == 1 && !(results.get(0) instanceof FunctionType)) {
            printType(results.get(0));
        } else {
            printTypeList(results);
        }
    }

    // values

    /**
     * Get the name of a value, naming it if it has none yet.
     *
     * @param value The value.
     * @return The name, including the leading {@code %}.
     */
    public String getValueName(Value value) {
        String name = valueNames.get(value);
        if (name != null) return name;
        String hint = value.getNullable(IRExts.NAME_HINT);
        if (hint != null) {
            name = "%" + hint;
            for (int suffix = 1; usedNames.contains(name); suffix++) {
                name = "%" + hint + "_" + suffix;
            }
        } else {
            do {
                name = value instanceof BlockArgument ? "%arg" + nextArgId++ : "%" + nextValueId++;
            } while (usedNames.contains(name));
        }
        usedNames.add(name);
        valueNames.put(value, name);
        return name;
    }

    public String getBlockName(Block block) {
        String name = blockNames.get(block);
        if (name == null) {
            name = "^bb" + blockNames.size();
            blockNames.put(block, name);
        }
        return name;
    }

    public void printOperand(@Nullable Value value) {
        sb.append(value == null ? "<<NULL>>" : getValueName(value));
    }

    public void printOperands(List<? extends Value> values) {
        for (int i = 0; i < values.size(); i++) {
            if (i != 0) sb.append(", ");
            printOperand(values.get(i));
        }
    }

    public void printSuccessorAndUseList(Operation op, int index) {
        Block successor = op.getSuccessor(index);
        sb.append(successor == null ? "<<NULL>>" : getBlockName(successor));
        List<Value> operands = op.getSuccessorOperands(index);
        if (operands.isEmpty()) return;
        sb.append('(');
        printOperands(operands);
        sb.append(" : ");
        for (int i = 0; i < operands.size(); i++) {
            if (i != 0) sb.append(", ");
            printType(operands.get(i).getType());
        }
        sb.append(')');
    }

    /**
     * Print operands bound to a map's inputs, as {@code (%d0, %d1)[%s0]}.
     * The brackets are omitted if there are no symbols.
     *
     * @param operands The operands.
     * @param numDims  How many of them are dimensions.
     */
    public void printDimAndSymbolList(List<? extends Value> operands, int numDims) {
        sb.append('(');
        printOperands(operands.subList(0, numDims));
        sb.append(')');
        if (operands.size() > numDims) {
            sb.append('[');
            printOperands(operands.subList(numDims, operands.size()));
            sb.append(']');
        }
    }

    /**
     * Print the results of a map with its inputs replaced by the names of the operands bound to them,
     * symbols marked as {@code symbol(%s)}.
     *
     * @param map      The map.
     * @param operands The operands.
     */
    public void printAffineMapOfSSAIds(AffineMap map, List<? extends Value> operands) {
        for (int i = 0; i < map.getNumResults(); i++) {
            if (i != 0) sb.append(", ");
            map.getResult(i).print(sb,
                    d -> getValueName(operands.get(d)),
                    s -> "symbol(" + getValueName(operands.get(map.getNumDims() + s)) + ")");
        }
    }

    // types and attributes

    public void printType(Type type) {
        sb.append(type);
    }

    public void printTypeList(List<? extends Type> types) {
        sb.append('(');
        for (int i = 0; i < types.size(); i++) {
            if (i != 0) sb.append(", ");
            printType(types.get(i));
        }
        sb.append(')');
    }

    public void printAttribute(Attribute attr) {
        sb.append(attr);
    }

    /**
     * Print attributes as a dictionary, {@code {a = 1 : index, b = "x"}}, unless there are none left.
     *
     * @param attrs  The attributes.
     * @param elided Names of attributes not to print.
     */
    public void printOptionalAttrDict(Map<String, Attribute> attrs, Set<String> elided) {
        boolean first = true;
        for (Map.Entry<String, Attribute> entry : attrs.entrySet()) {
            if (elided.contains(entry.getKey())) continue;
            sb.append(first ? " {" : ", ");
            first = false;
            sb.append(entry.getKey()).append(" = ");
            printAttribute(entry.getValue());
        }
        if (!first) sb.append('}');
    }

    // regions

    /**
     * Print a region in braces, its blocks and operations on their own indented lines.
     *
     * @param region               The region.
     * @param printEntryBlockArgs  Whether to print a header with the arguments of the entry block.
     * @param printBlockTerminator Whether to print the terminator of blocks with no successors.
     */
    public void printRegion(Region region, boolean printEntryBlockArgs, boolean printBlockTerminator) {
        sb.append('{');
        indent++;
        // number blocks in order, before any branch refers to them
        for (Block block : region.getBlocks()) {
            getBlockName(block);
        }
        for (Block block : region.getBlocks()) {
            boolean header = !block.isEntryBlock() || (printEntryBlockArgs && block.getNumArguments() != 0);
            if (header) {
                indent--;
                newline();
                printBlockHeader(block);
                indent++;
            }
            List<Operation> ops = block.getOperations();
            for (int i = 0; i < ops.size(); i++) {
                Operation op = ops.get(i);
                if (!printBlockTerminator && i == ops.size() - 1
                        && op.getNumSuccessors() == 0 && op.isKnownTerminator()
                        && op.getNumOperands() == 0 && op.getAttrs().isEmpty()) {
                    continue;
                }
                newline();
                printOperation(op);
            }
        }
        indent--;
        newline();
        sb.append('}');
    }

    private void printBlockHeader(Block block) {
        sb.append(getBlockName(block));
        if (block.getNumArguments() != 0) {
            sb.append('(');
            for (int i = 0; i < block.getNumArguments(); i++) {
                if (i != 0) sb.append(", ");
                BlockArgument arg = block.getArgument(i);
                printOperand(arg);
                sb.append(": ");
                printType(arg.getType());
            }
            sb.append(')');
        }
        sb.append(':');
    }

    public void newline() {
        sb.append('\n');
        for (int i = 0; i < indent; i++) sb.append("  ");
    }

    public AsmPrinter append(Object text) {
        sb.append(text);
        return this;
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
