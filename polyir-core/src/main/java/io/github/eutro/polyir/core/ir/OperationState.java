package io.github.eutro.polyir.core.ir;

import io.github.eutro.polyir.core.ir.attrs.Attribute;
import io.github.eutro.polyir.core.ir.types.Type;

import java.util.*;

/**
 * Everything needed to {@link Operation#create(OperationState) create} an operation,
 * accumulated piecewise by builders.
 * <p>
 * Successor operands live in {@link #operands} after the regular operands, each
 * successor's group preceded by a null delimiter; {@link #addSuccessor(Block, List)} does this.
 */
public final class OperationState {
    public final Context context;
    public final Location location;
    public final OperationName name;
    public final List<Value> operands = new ArrayList<>();
    public final List<Type> types = new ArrayList<>();
    public final Map<String, Attribute> attributes = new TreeMap<>();
    public final List<Block> successors = new ArrayList<>();
    public int numRegions = 0;
    public boolean resizableOperandList = false;

    public OperationState(Context context, Location location, OperationName name) {
        this.context = context;
        this.location = location;
        this.name = name;
    }

    public OperationState(Context context, Location location, OpKind kind) {
        this(context, location, kind.getOperationName());
    }

    public OperationState(Context context, Location location, String name) {
        this(context, location, OperationName.get(name, context));
    }

    public OperationState addOperands(Value... values) {
        return addOperands(Arrays.asList(values));
    }

    public OperationState addOperands(Collection<? extends Value> values) {
        for (Value value : values) {
            if (value == null) throw new IllegalArgumentException("null operand; use addSuccessor for successor operands");
            operands.add(value);
        }
        return this;
    }

    public OperationState addTypes(Type... types) {
        return addTypes(Arrays.asList(types));
    }

    public OperationState addTypes(Collection<? extends Type> types) {
        this.types.addAll(types);
        return this;
    }

    public OperationState addAttribute(String name, Attribute value) {
        attributes.put(name, value);
        return this;
    }

    public OperationState addSuccessor(Block successor, List<? extends Value> successorOperands) {
        successors.add(successor);
        operands.add(null);
        operands.addAll(successorOperands);
        return this;
    }

    public OperationState addRegions(int count) {
        numRegions += count;
        return this;
    }

    public OperationState setResizableOperandList(boolean resizable) {
        resizableOperandList = resizable;
        return this;
    }
}
