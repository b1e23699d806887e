package io.github.eutro.polyir.core.affine;

import io.github.eutro.polyir.core.ir.Context;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.IntFunction;

/**
 * A reference to a dimension of an affine map, by position.
 */
public final class AffineDimExpr extends AffineExpr {
    private final int position;

    private AffineDimExpr(Context context, int position) {
        super(context, AffineExprKind.DIM_ID);
        this.position = position;
    }

    public static AffineDimExpr get(int position, Context context) {
        if (position < 0) throw new IllegalArgumentException("negative dimension position " + position);
        return context.unique(new AffineDimExpr(context, position));
    }

    public int getPosition() {
        return position;
    }

    @Override
    public boolean isSymbolicOrConstant() {
        return false;
    }

    @Override
    public boolean isPureAffine() {
        return true;
    }

    @Override
    public boolean isMultipleOf(long factor) {
        return factor == 1 || factor == -1;
    }

    @Override
    public void walk(Consumer<AffineExpr> visitor) {
        visitor.accept(this);
    }

    @Override
    public AffineExpr replaceDimsAndSymbols(List<? extends AffineExpr> dimReplacements,
                                            List<? extends AffineExpr> symReplacements) {
        return position < dimReplacements.size() ? dimReplacements.get(position) : this;
    }

    @Override
    @Nullable Long constantFold(@Nullable Long[] dims, @Nullable Long[] symbols) {
        return dims[position];
    }

    @Override
    void print(StringBuilder sb, IntFunction<String> dimName, IntFunction<String> symName, boolean strong) {
        sb.append(dimName.apply(position));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AffineDimExpr
                && ((AffineDimExpr) o).position == position
                && ((AffineDimExpr) o).getContext() == getContext();
    }

    @Override
    public int hashCode() {
        return 31 * position + 1;
    }
}
