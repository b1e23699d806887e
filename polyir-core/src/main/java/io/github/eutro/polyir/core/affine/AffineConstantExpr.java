package io.github.eutro.polyir.core.affine;

import io.github.eutro.polyir.core.ir.Context;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.IntFunction;

public final class AffineConstantExpr extends AffineExpr {
    private final long value;

    private AffineConstantExpr(Context context, long value) {
        super(context, AffineExprKind.CONSTANT);
        this.value = value;
    }

    public static AffineConstantExpr get(long value, Context context) {
        return context.unique(new AffineConstantExpr(context, value));
    }

    public long getValue() {
        return value;
    }

    @Override
    public boolean isSymbolicOrConstant() {
        return true;
    }

    @Override
    public boolean isPureAffine() {
        return true;
    }

    @Override
    public boolean isMultipleOf(long factor) {
        return factor != 0 && value % factor == 0;
    }

    @Override
    public void walk(Consumer<AffineExpr> visitor) {
        visitor.accept(this);
    }

    @Override
    public AffineExpr replaceDimsAndSymbols(List<? extends AffineExpr> dimReplacements,
                                            List<? extends AffineExpr> symReplacements) {
        return this;
    }

    @Override
    @Nullable Long constantFold(@Nullable Long[] dims, @Nullable Long[] symbols) {
        return value;
    }

    @Override
    void print(StringBuilder sb, IntFunction<String> dimName, IntFunction<String> symName, boolean strong) {
        sb.append(value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AffineConstantExpr
                && ((AffineConstantExpr) o).value == value
                && ((AffineConstantExpr) o).getContext() == getContext();
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }
}
