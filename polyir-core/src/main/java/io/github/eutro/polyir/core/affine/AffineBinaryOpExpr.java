package io.github.eutro.polyir.core.affine;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.IntFunction;

/**
 * A binary operation on two affine expressions.
 * <p>
 * {@link #get(AffineExprKind, AffineExpr, AffineExpr)} builds the operation exactly as given;
 * the arithmetic methods of {@link AffineExpr} should usually be preferred.
 */
public final class AffineBinaryOpExpr extends AffineExpr {
    private final AffineExpr lhs;
    private final AffineExpr rhs;

    private AffineBinaryOpExpr(AffineExprKind kind, AffineExpr lhs, AffineExpr rhs) {
        super(lhs.getContext(), kind);
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public static AffineBinaryOpExpr get(AffineExprKind kind, AffineExpr lhs, AffineExpr rhs) {
        if (!kind.isBinary()) throw new IllegalArgumentException("not a binary operator: " + kind);
        if (lhs.getContext() != rhs.getContext()) {
            throw new IllegalArgumentException("operands belong to different contexts");
        }
        return lhs.getContext().unique(new AffineBinaryOpExpr(kind, lhs, rhs));
    }

    public AffineExpr getLhs() {
        return lhs;
    }

    public AffineExpr getRhs() {
        return rhs;
    }

    @Override
    public boolean isSymbolicOrConstant() {
        return lhs.isSymbolicOrConstant() && rhs.isSymbolicOrConstant();
    }

    @Override
    public boolean isPureAffine() {
        switch (getKind()) {
            case ADD:
                return lhs.isPureAffine() && rhs.isPureAffine();
            case MUL:
                return lhs.isPureAffine() && rhs.isPureAffine()
                        && (lhs instanceof AffineConstantExpr || rhs instanceof AffineConstantExpr);
            default:
                return lhs.isPureAffine() && rhs instanceof AffineConstantExpr;
        }
    }

    @Override
    public boolean isMultipleOf(long factor) {
        if (factor == 1 || factor == -1) return true;
        switch (getKind()) {
            case ADD:
                return lhs.isMultipleOf(factor) && rhs.isMultipleOf(factor);
            case MUL:
                return lhs.isMultipleOf(factor) || rhs.isMultipleOf(factor);
            case MOD:
                return lhs.isMultipleOf(factor) && rhs.isMultipleOf(factor);
            default:
                return false;
        }
    }

    @Override
    public void walk(Consumer<AffineExpr> visitor) {
        lhs.walk(visitor);
        rhs.walk(visitor);
        visitor.accept(this);
    }

    @Override
    public AffineExpr replaceDimsAndSymbols(List<? extends AffineExpr> dimReplacements,
                                            List<? extends AffineExpr> symReplacements) {
        AffineExpr newLhs = lhs.replaceDimsAndSymbols(dimReplacements, symReplacements);
        AffineExpr newRhs = rhs.replaceDimsAndSymbols(dimReplacements, symReplacements);
        if (newLhs == lhs && newRhs == rhs) return this;
        switch (getKind()) {
            case ADD:
                return newLhs.add(newRhs);
            case MUL:
                return newLhs.mul(newRhs);
            case FLOOR_DIV:
                return newLhs.floorDiv(newRhs);
            case CEIL_DIV:
                return newLhs.ceilDiv(newRhs);
            case MOD:
                return newLhs.mod(newRhs);
            default:
                throw new IllegalStateException();
        }
    }

    @Override
    @Nullable Long constantFold(@Nullable Long[] dims, @Nullable Long[] symbols) {
        Long l = lhs.constantFold(dims, symbols);
        if (l == null) return null;
        Long r = rhs.constantFold(dims, symbols);
        if (r == null) return null;
        return apply(getKind(), l, r);
    }

    @Override
    void print(StringBuilder sb, IntFunction<String> dimName, IntFunction<String> symName, boolean strong) {
        if (strong) sb.append('(');
        if (getKind() != AffineExprKind.ADD) {
            lhs.print(sb, dimName, symName, true);
            sb.append(' ').append(getKind().getOperator()).append(' ');
            rhs.print(sb, dimName, symName, true);
        } else {
            lhs.print(sb, dimName, symName, false);
            printAddend(sb, dimName, symName);
        }
        if (strong) sb.append(')');
    }

    private void printAddend(StringBuilder sb, IntFunction<String> dimName, IntFunction<String> symName) {
        // print negated terms as subtraction
        if (rhs instanceof AffineBinaryOpExpr && rhs.getKind() == AffineExprKind.MUL) {
            AffineBinaryOpExpr mul = (AffineBinaryOpExpr) rhs;
            if (mul.rhs instanceof AffineConstantExpr) {
                long coeff = ((AffineConstantExpr) mul.rhs).getValue();
                if (coeff == -1) {
                    sb.append(" - ");
                    mul.lhs.print(sb, dimName, symName, true);
                    return;
                }
                if (coeff < -1) {
                    sb.append(" - ");
                    mul.lhs.print(sb, dimName, symName, true);
                    sb.append(" * ").append(-coeff);
                    return;
                }
            }
        }
        if (rhs instanceof AffineConstantExpr && ((AffineConstantExpr) rhs).getValue() < 0) {
            sb.append(" - ").append(-((AffineConstantExpr) rhs).getValue());
            return;
        }
        sb.append(" + ");
        rhs.print(sb, dimName, symName, false);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof AffineBinaryOpExpr)) return false;
        AffineBinaryOpExpr that = (AffineBinaryOpExpr) o;
        // operands are uniqued
        return getKind() == that.getKind() && lhs == that.lhs && rhs == that.rhs;
    }

    @Override
    public int hashCode() {
        return (getKind().hashCode() * 31 + System.identityHashCode(lhs)) * 31 + System.identityHashCode(rhs);
    }
}
