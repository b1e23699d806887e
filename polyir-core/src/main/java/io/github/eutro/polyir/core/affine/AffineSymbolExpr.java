package io.github.eutro.polyir.core.affine;

import io.github.eutro.polyir.core.ir.Context;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.IntFunction;

/**
 * A reference to a symbol of an affine map, by position.
 */
public final class AffineSymbolExpr extends AffineExpr {
    private final int position;

    private AffineSymbolExpr(Context context, int position) {
        super(context, AffineExprKind.SYMBOL_ID);
        this.position = position;
    }

    public static AffineSymbolExpr get(int position, Context context) {
        if (position < 0) throw new IllegalArgumentException("negative symbol position " + position);
        return context.unique(new AffineSymbolExpr(context, position));
    }

    public int getPosition() {
        return position;
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
        return factor == 1 || factor == -1;
    }

    @Override
    public void walk(Consumer<AffineExpr> visitor) {
        visitor.accept(this);
    }

    @Override
    public AffineExpr replaceDimsAndSymbols(List<? extends AffineExpr> dimReplacements,
                                            List<? extends AffineExpr> symReplacements) {
        return position < symReplacements.size() ? symReplacements.get(position) : this;
    }

    @Override
    @Nullable Long constantFold(@Nullable Long[] dims, @Nullable Long[] symbols) {
        return symbols[position];
    }

    @Override
    void print(StringBuilder sb, IntFunction<String> dimName, IntFunction<String> symName, boolean strong) {
        sb.append(symName.apply(position));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AffineSymbolExpr
                && ((AffineSymbolExpr) o).position == position
                && ((AffineSymbolExpr) o).getContext() == getContext();
    }

    @Override
    public int hashCode() {
        return 31 * position + 2;
    }
}
