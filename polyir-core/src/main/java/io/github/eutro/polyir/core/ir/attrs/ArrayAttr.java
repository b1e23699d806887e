package io.github.eutro.polyir.core.ir.attrs;

import io.github.eutro.polyir.core.ir.Context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class ArrayAttr extends Attribute {
    private final List<Attribute> elements;

    private ArrayAttr(Context context, List<Attribute> elements) {
        super(context);
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public static ArrayAttr get(List<Attribute> elements, Context context) {
        return context.unique(new ArrayAttr(context, elements));
    }

    public List<Attribute> getValue() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ArrayAttr && ((ArrayAttr) o).elements.equals(elements);
    }

    @Override
    public int hashCode() {
        return 13 * elements.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < elements.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(elements.get(i));
        }
        return sb.append(']').toString();
    }
}
