package io.github.eutro.polyir.core.affine;

import io.github.eutro.polyir.core.ir.Context;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.IntFunction;

/**
 * An immutable affine expression over positional dimensions and symbols.
 * <p>
 * Expressions are uniqued in their {@link Context}, so two structurally equal expressions
 * of the same context are the same object, and can be compared with {@code ==}.
 * <p>
 * The arithmetic methods ({@link #add(AffineExpr)}, {@link #mul(AffineExpr)}, ...) apply cheap local
 * simplifications as they build, keeping constants on the right-hand side; a more thorough
 * simplification is done by {@link AffineMap#simplify()}.
 */
public abstract class AffineExpr {
    private final Context context;
    private final AffineExprKind kind;

    AffineExpr(Context context, AffineExprKind kind) {
        this.context = context;
        this.kind = kind;
    }

    public static AffineDimExpr dim(int position, @NotNull Context context) {
        return AffineDimExpr.get(position, context);
    }

    public static AffineSymbolExpr symbol(int position, @NotNull Context context) {
        return AffineSymbolExpr.get(position, context);
    }

    public static AffineConstantExpr constant(long value, @NotNull Context context) {
        return AffineConstantExpr.get(value, context);
    }

    public Context getContext() {
        return context;
    }

    public AffineExprKind getKind() {
        return kind;
    }

    // queries

    /**
     * Whether this expression references no dimensions.
     *
     * @return Whether this is a function of symbols and constants only.
     */
    public abstract boolean isSymbolicOrConstant();

    /**
     * Whether this expression is affine: multiplication only by symbolic or constant factors,
     * and division or modulo only by constants.
     *
     * @return Whether this expression is pure affine.
     */
    public abstract boolean isPureAffine();

    /**
     * Whether this expression is known to be a multiple of {@code factor} for all inputs.
     *
     * @param factor The factor.
     * @return Whether it is known to be a multiple.
     */
    public abstract boolean isMultipleOf(long factor);

    public boolean isFunctionOfDim(int position) {
        boolean[] found = {false};
        walk(expr -> {
            if (expr instanceof AffineDimExpr && ((AffineDimExpr) expr).getPosition() == position) found[0] = true;
        });
        return found[0];
    }

    public boolean isFunctionOfSymbol(int position) {
        boolean[] found = {false};
        walk(expr -> {
            if (expr instanceof AffineSymbolExpr && ((AffineSymbolExpr) expr).getPosition() == position) found[0] = true;
        });
        return found[0];
    }

    /**
     * Visit every subexpression of this expression in post-order, including itself.
     *
     * @param visitor The visitor.
     */
    public abstract void walk(Consumer<AffineExpr> visitor);

    // transformation

    /**
     * Replace dimensions and symbols with other expressions. Positions past the end of
     * the respective lists are left as they are.
     *
     * @param dimReplacements The replacements for dimensions.
     * @param symReplacements The replacements for symbols.
     * @return The rewritten expression.
     */
    public abstract AffineExpr replaceDimsAndSymbols(List<? extends AffineExpr> dimReplacements,
                                                     List<? extends AffineExpr> symReplacements);

    /**
     * Substitute the results of {@code map} for the dimensions of this expression.
     * Symbols are left unchanged.
     *
     * @param map The map.
     * @return The composed expression.
     */
    public AffineExpr compose(AffineMap map) {
        return replaceDimsAndSymbols(map.getResults(), Collections.<AffineExpr>emptyList());
    }

    /**
     * Evaluate this expression.
     *
     * @param dims    The values of the dimensions.
     * @param symbols The values of the symbols.
     * @return The value.
     * @throws ArithmeticException       On division or modulo by zero.
     * @throws IndexOutOfBoundsException If a dimension or symbol has no value.
     */
    public long evaluate(long[] dims, long[] symbols) {
        Long[] boxedDims = new Long[dims.length];
        for (int i = 0; i < dims.length; i++) boxedDims[i] = dims[i];
        Long[] boxedSyms = new Long[symbols.length];
        for (int i = 0; i < symbols.length; i++) boxedSyms[i] = symbols[i];
        Long value = constantFold(boxedDims, boxedSyms);
        if (value == null) throw new IllegalStateException("unreachable");
        return value;
    }

    /**
     * Evaluate this expression with some inputs possibly unknown.
     *
     * @param dims    The values of the dimensions, null where unknown.
     * @param symbols The values of the symbols, null where unknown.
     * @return The value, or null if it depends on an unknown input.
     * @throws ArithmeticException On division or modulo by zero.
     */
    abstract @Nullable Long constantFold(@Nullable Long[] dims, @Nullable Long[] symbols);

    // arithmetic

    public AffineExpr add(AffineExpr other) {
        return simplifyAdd(this, other);
    }

    public AffineExpr add(long value) {
        return add(constant(value, context));
    }

    public AffineExpr sub(AffineExpr other) {
        return add(other.neg());
    }

    public AffineExpr sub(long value) {
        return add(constant(-value, context));
    }

    public AffineExpr neg() {
        return mul(-1);
    }

    public AffineExpr mul(AffineExpr other) {
        return simplifyMul(this, other);
    }

    public AffineExpr mul(long value) {
        return mul(constant(value, context));
    }

    public AffineExpr floorDiv(AffineExpr other) {
        return simplifyDiv(AffineExprKind.FLOOR_DIV, this, other);
    }

    public AffineExpr floorDiv(long value) {
        return floorDiv(constant(value, context));
    }

    public AffineExpr ceilDiv(AffineExpr other) {
        return simplifyDiv(AffineExprKind.CEIL_DIV, this, other);
    }

    public AffineExpr ceilDiv(long value) {
        return ceilDiv(constant(value, context));
    }

    public AffineExpr mod(AffineExpr other) {
        return simplifyMod(this, other);
    }

    public AffineExpr mod(long value) {
        return mod(constant(value, context));
    }

    static long ceilDiv(long lhs, long rhs) {
        return -Math.floorDiv(-lhs, rhs);
    }

    static long apply(AffineExprKind kind, long lhs, long rhs) {
        switch (kind) {
            case ADD:
                return lhs + rhs;
            case MUL:
                return lhs * rhs;
            case FLOOR_DIV:
                return Math.floorDiv(lhs, rhs);
            case CEIL_DIV:
                return ceilDiv(lhs, rhs);
            case MOD:
                return Math.floorMod(lhs, rhs);
            default:
                throw new IllegalArgumentException("not a binary operator: " + kind);
        }
    }

    private static @Nullable Long constValue(AffineExpr expr) {
        return expr instanceof AffineConstantExpr ? ((AffineConstantExpr) expr).getValue() : null;
    }

    private static @Nullable AffineBinaryOpExpr binary(AffineExpr expr, AffineExprKind kind) {
        return expr.kind == kind ? (AffineBinaryOpExpr) expr : null;
    }

    private static AffineExpr simplifyAdd(AffineExpr lhs, AffineExpr rhs) {
        Long lc = constValue(lhs);
        Long rc = constValue(rhs);
        if (lc != null && rc != null) return constant(lc + rc, lhs.context);

        // constants, then symbolic terms, go on the right
        if (lc != null || (lhs.isSymbolicOrConstant() && !rhs.isSymbolicOrConstant())) {
            return simplifyAdd(rhs, lhs);
        }
        if (rc != null && rc == 0) return lhs;

        AffineBinaryOpExpr lAdd = binary(lhs, AffineExprKind.ADD);
        if (lAdd != null) {
            Long lrc = constValue(lAdd.getRhs());
            if (lrc != null) {
                // (x + c1) + c2 = x + (c1 + c2)
                if (rc != null) return lAdd.getLhs().add(lrc + rc);
                // (x + c) + y = (x + y) + c
                return lAdd.getLhs().add(rhs).add(lAdd.getRhs());
            }
        }

        // c1 * x + c2 * x = (c1 + c2) * x
        AffineExpr lTerm = lhs;
        long lCoeff = 1;
        AffineBinaryOpExpr lMul = binary(lhs, AffineExprKind.MUL);
        if (lMul != null && constValue(lMul.getRhs()) != null) {
            lTerm = lMul.getLhs();
            lCoeff = constValue(lMul.getRhs());
        }
        AffineExpr rTerm = rhs;
        long rCoeff = 1;
        AffineBinaryOpExpr rMul = binary(rhs, AffineExprKind.MUL);
        if (rMul != null && constValue(rMul.getRhs()) != null) {
            rTerm = rMul.getLhs();
            rCoeff = constValue(rMul.getRhs());
        }
        if (lTerm == rTerm && rc == null) {
            return lTerm.mul(lCoeff + rCoeff);
        }

        // x + (x floordiv c) * -c = x mod c
        if (rMul != null) {
            Long mulC = constValue(rMul.getRhs());
            AffineBinaryOpExpr div = binary(rMul.getLhs(), AffineExprKind.FLOOR_DIV);
            if (mulC != null && div != null && div.getLhs() == lhs) {
                Long divC = constValue(div.getRhs());
                if (divC != null && divC > 0 && divC == -mulC) {
                    return lhs.mod(divC);
                }
            }
        }

        return AffineBinaryOpExpr.get(AffineExprKind.ADD, lhs, rhs);
    }

    private static AffineExpr simplifyMul(AffineExpr lhs, AffineExpr rhs) {
        Long lc = constValue(lhs);
        Long rc = constValue(rhs);
        if (lc != null && rc != null) return constant(lc * rc, lhs.context);

        if (lc != null || (lhs.isSymbolicOrConstant() && !rhs.isSymbolicOrConstant())) {
            return simplifyMul(rhs, lhs);
        }
        if (rc != null) {
            if (rc == 1) return lhs;
            if (rc == 0) return rhs;
        }

        AffineBinaryOpExpr lMul = binary(lhs, AffineExprKind.MUL);
        if (lMul != null) {
            Long lrc = constValue(lMul.getRhs());
            if (lrc != null) {
                // (x * c1) * c2 = x * (c1 * c2)
                if (rc != null) return lMul.getLhs().mul(lrc * rc);
                // (x * c) * y = (x * y) * c
                return lMul.getLhs().mul(rhs).mul(lMul.getRhs());
            }
        }

        return AffineBinaryOpExpr.get(AffineExprKind.MUL, lhs, rhs);
    }

    private static AffineExpr simplifyDiv(AffineExprKind kind, AffineExpr lhs, AffineExpr rhs) {
        Long lc = constValue(lhs);
        Long rc = constValue(rhs);
        if (lc != null && rc != null && rc != 0) {
            return constant(apply(kind, lc, rc), lhs.context);
        }
        if (rc != null && rc >= 1) {
            if (rc == 1) return lhs;
            // (x * c1) floordiv c2 = x * (c1 / c2) if c2 divides c1
            AffineBinaryOpExpr lMul = binary(lhs, AffineExprKind.MUL);
            if (lMul != null) {
                Long lrc = constValue(lMul.getRhs());
                if (lrc != null && lrc % rc == 0) {
                    return lMul.getLhs().mul(lrc / rc);
                }
            }
        }
        return AffineBinaryOpExpr.get(kind, lhs, rhs);
    }

    private static AffineExpr simplifyMod(AffineExpr lhs, AffineExpr rhs) {
        Long lc = constValue(lhs);
        Long rc = constValue(rhs);
        if (lc != null && rc != null && rc != 0) {
            return constant(Math.floorMod(lc, rc), lhs.context);
        }
        if (rc != null && rc >= 1) {
            if (lhs.isMultipleOf(rc)) return constant(0, lhs.context);
            // (x mod c1) mod c2 = x mod c2 if c2 divides c1
            AffineBinaryOpExpr lMod = binary(lhs, AffineExprKind.MOD);
            if (lMod != null) {
                Long lrc = constValue(lMod.getRhs());
                if (lrc != null && lrc % rc == 0) {
                    return lMod.getLhs().mod(rhs);
                }
            }
        }
        return AffineBinaryOpExpr.get(AffineExprKind.MOD, lhs, rhs);
    }

    // printing

    /**
     * Print this expression, with custom names for dimensions and symbols.
     *
     * @param sb      The builder to print to.
     * @param dimName The names of dimensions.
     * @param symName The names of symbols.
     */
    public void print(StringBuilder sb, IntFunction<String> dimName, IntFunction<String> symName) {
        print(sb, dimName, symName, false);
    }

    abstract void print(StringBuilder sb, IntFunction<String> dimName, IntFunction<String> symName, boolean strong);

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        print(sb, i -> "d" + i, i -> "s" + i);
        return sb.toString();
    }
}
