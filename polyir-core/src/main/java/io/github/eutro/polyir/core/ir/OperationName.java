package io.github.eutro.polyir.core.ir;

import org.jetbrains.annotations.Nullable;

/**
 * The name of an operation, resolved to its {@link OpKind} if that kind is registered.
 * <p>
 * Unregistered names are legal, but operations with them are opaque:
 * they have no traits, are never verified beyond their structure, and never fold.
 */
public final class OperationName {
    private final String name;
    private final @Nullable OpKind kind;

    OperationName(String name, @Nullable OpKind kind) {
        this.name = name;
        this.kind = kind;
    }

    /**
     * Resolve a name in a context.
     *
     * @param name    The full name, {@code dialect.mnemonic}.
     * @param context The context.
     * @return The operation name.
     */
    public static OperationName get(String name, Context context) {
        OpKind kind = context.lookupOpKind(name);
        if (kind != null) return kind.getOperationName();
        return context.unique(new OperationName(name, null));
    }

    public String getStringRef() {
        return name;
    }

    public @Nullable OpKind getKind() {
        return kind;
    }

    public boolean isRegistered() {
        return kind != null;
    }

    public String getDialectNamespace() {
        if (kind != null) return kind.getDialectNamespace();
        int dot = name.indexOf('.');
        return dot == -1 ? "" : name.substring(0, dot);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OperationName)) return false;
        OperationName that = (OperationName) o;
        return name.equals(that.name) && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
