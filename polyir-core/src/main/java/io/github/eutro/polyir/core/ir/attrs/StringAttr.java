package io.github.eutro.polyir.core.ir.attrs;

import io.github.eutro.polyir.core.ir.Context;

public final class StringAttr extends Attribute {
    private final String value;

    private StringAttr(Context context, String value) {
        super(context);
        this.value = value;
    }

    public static StringAttr get(String value, Context context) {
        return context.unique(new StringAttr(context, value));
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StringAttr && ((StringAttr) o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
