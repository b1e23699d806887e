package io.github.eutro.polyir.core.builtin;

import io.github.eutro.polyir.core.ir.Context;
import io.github.eutro.polyir.core.ir.Dialect;

/**
 * The dialect of modules and functions, loaded into every context.
 */
public final class BuiltinDialect extends Dialect {
    public static final String NAMESPACE = "builtin";

    public BuiltinDialect(Context context) {
        super(NAMESPACE, context);
    }

    @Override
    protected void initialize() {
        addOperations(BuiltinOps.MODULE, BuiltinOps.MODULE_TERMINATOR, BuiltinOps.FUNC);
    }
}
