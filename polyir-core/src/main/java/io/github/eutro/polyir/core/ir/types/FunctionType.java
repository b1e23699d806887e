package io.github.eutro.polyir.core.ir.types;

import io.github.eutro.polyir.core.ir.Context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class FunctionType extends Type {
    private final List<Type> inputs;
    private final List<Type> results;

    private FunctionType(Context context, List<Type> inputs, List<Type> results) {
        super(context);
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
    }

    public static FunctionType get(List<Type> inputs, List<Type> results, Context context) {
        return context.unique(new FunctionType(context, inputs, results));
    }

    public List<Type> getInputs() {
        return inputs;
    }

    public List<Type> getResults() {
        return results;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof FunctionType)) return false;
        FunctionType that = (FunctionType) o;
        return inputs.equals(that.inputs) && results.equals(that.results);
    }

    @Override
    public int hashCode() {
        return 31 * inputs.hashCode() + results.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < inputs.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(inputs.get(i));
        }
        sb.append(") -> ");
        if (results.size() == 1 && !(results.get(0) instanceof FunctionType)) {
            return sb.append(results.get(0)).toString();
        }
        sb.append('(');
        for (int i = 0; i < results.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(results.get(i));
        }
        return sb.append(')').toString();
    }
}
