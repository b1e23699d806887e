package io.github.eutro.polyir.dialects.std;

import io.github.eutro.polyir.core.ir.*;
import io.github.eutro.polyir.core.ir.attrs.Attribute;
import io.github.eutro.polyir.core.ir.attrs.FloatAttr;
import io.github.eutro.polyir.core.ir.attrs.IntegerAttr;
import io.github.eutro.polyir.core.ir.types.Type;
import org.jetbrains.annotations.Nullable;

/**
 * The standard dialect: constants, integer arithmetic, shape queries and control flow.
 */
public class StdDialect extends Dialect {
    public static final String NAMESPACE = "std";

    public StdDialect(Context context) {
        super(NAMESPACE, context);
    }

    @Override
    protected void initialize() {
        addOperations(StdOps.CONSTANT,
                StdOps.DIM,
                StdOps.ADDI,
                StdOps.MULI,
                StdOps.RETURN,
                StdOps.BR,
                StdOps.COND_BR);
    }

    @Override
    public @Nullable Operation materializeConstant(OpBuilder builder, Attribute value, Type type, Location loc) {
        if (value instanceof IntegerAttr && ((IntegerAttr) value).getType().equals(type)
                || value instanceof FloatAttr && ((FloatAttr) value).getType().equals(type)) {
            return StdOps.createConstant(builder, loc, value, type);
        }
        return null;
    }
}
