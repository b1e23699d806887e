package io.github.eutro.polyir.core.ir;

import io.github.eutro.polyir.core.ext.ExtHolder;
import io.github.eutro.polyir.core.ir.attrs.Attribute;
import io.github.eutro.polyir.core.ir.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A namespace of operation kinds, loaded into a {@link Context} with
 * {@link Context#loadDialect(java.util.function.Function)}.
 */
public abstract class Dialect extends ExtHolder {
    private final String namespace;
    private final Context context;
    private final List<OpKind> operations = new ArrayList<>();

    protected Dialect(String namespace, Context context) {
        this.namespace = namespace;
        this.context = context;
    }

    /**
     * Register this dialect's operation kinds, called once when the dialect is loaded.
     */
    protected abstract void initialize();

    protected void addOperations(OpKind... kinds) {
        for (OpKind kind : kinds) {
            context.registerOpKind(this, kind);
            operations.add(kind);
        }
    }

    public String getNamespace() {
        return namespace;
    }

    public Context getContext() {
        return context;
    }

    public List<OpKind> getOperations() {
        return Collections.unmodifiableList(operations);
    }

    /**
     * Build a constant operation of this dialect producing {@code value}.
     * The default implementation materializes nothing.
     *
     * @param builder The builder to create the operation with.
     * @param value   The constant value.
     * @param type    The type of the value.
     * @param loc     The location.
     * @return The operation, with a single result, or null if this dialect can't produce the constant.
     */
    public @Nullable Operation materializeConstant(OpBuilder builder, Attribute value, Type type, Location loc) {
        return null;
    }

    /**
     * Constant fold an operation of this dialect whose kind did not fold it.
     * The default implementation folds nothing.
     *
     * @param op       The operation.
     * @param operands The constant values of the operands, null where not constant.
     * @return One attribute per result, or null on failure.
     */
    public @Nullable List<Attribute> constantFold(Operation op, List<@Nullable Attribute> operands) {
        return null;
    }

    @Override
    public String toString() {
        return namespace;
    }
}
