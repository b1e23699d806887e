package io.github.eutro.polyir.dialects.affine;

import io.github.eutro.polyir.core.ir.*;
import io.github.eutro.polyir.core.ir.attrs.Attribute;
import io.github.eutro.polyir.core.ir.types.Type;
import io.github.eutro.polyir.dialects.std.StdDialect;
import org.jetbrains.annotations.Nullable;

/**
 * The affine dialect: applications of affine maps, loops with affine bounds and affine memory accesses.
 * <p>
 * Loading it also loads the {@link StdDialect}, which materializes its constants.
 */
public class AffineDialect extends Dialect {
    public static final String NAMESPACE = "affine";

    private final StdDialect std;

    public AffineDialect(Context context) {
        super(NAMESPACE, context);
        std = context.loadDialect(StdDialect::new);
    }

    @Override
    protected void initialize() {
        addOperations(AffineOps.APPLY,
                AffineOps.FOR,
                AffineOps.TERMINATOR,
                AffineOps.LOAD,
                AffineOps.STORE);
    }

    @Override
    public @Nullable Operation materializeConstant(OpBuilder builder, Attribute value, Type type, Location loc) {
        return std.materializeConstant(builder, value, type, loc);
    }
}
