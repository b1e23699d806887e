package io.github.eutro.polyir.core.affine;

import io.github.eutro.polyir.core.ir.Context;

import java.util.*;

/**
 * Simplifies an affine expression by flattening it into a sum of coefficient-weighted atoms
 * plus a constant, and building it back up.
 * <p>
 * Atoms are the dimensions, the symbols, and any subexpression that is not linear
 * (products of non-constants, divisions and modulos), each of which is simplified first.
 * Like atoms cancel or merge, and the parts of a dividend that are multiples of a positive
 * constant divisor are split out of the division.
 */
final class AffineExprSimplifier {
    private final Context context;
    private final int numDims;
    private final int numSymbols;
    private final List<AffineExpr> opaques = new ArrayList<>();
    private final Map<AffineExpr, Integer> opaqueIds = new HashMap<>();

    private AffineExprSimplifier(Context context, int numDims, int numSymbols) {
        this.context = context;
        this.numDims = numDims;
        this.numSymbols = numSymbols;
    }

    static AffineExpr simplify(AffineExpr expr, int numDims, int numSymbols) {
        AffineExprSimplifier simplifier = new AffineExprSimplifier(expr.getContext(), numDims, numSymbols);
        return simplifier.rebuild(simplifier.flatten(expr));
    }

    private static final class LinearForm {
        // atom id -> coefficient, never zero
        final TreeMap<Integer, Long> coeffs = new TreeMap<>();
        long constant;

        static LinearForm ofConstant(long value) {
            LinearForm form = new LinearForm();
            form.constant = value;
            return form;
        }

        static LinearForm ofAtom(int id) {
            LinearForm form = new LinearForm();
            form.coeffs.put(id, 1L);
            return form;
        }

        boolean isConstant() {
            return coeffs.isEmpty();
        }

        void addScaled(LinearForm other, long scale) {
            for (Map.Entry<Integer, Long> entry : other.coeffs.entrySet()) {
                long sum = coeffs.getOrDefault(entry.getKey(), 0L) + entry.getValue() * scale;
                if (sum == 0) coeffs.remove(entry.getKey());
                else coeffs.put(entry.getKey(), sum);
            }
            constant += other.constant * scale;
        }

        LinearForm scaled(long scale) {
            LinearForm form = new LinearForm();
            form.addScaled(this, scale);
            return form;
        }
    }

    private LinearForm flatten(AffineExpr expr) {
        switch (expr.getKind()) {
            case CONSTANT:
                return LinearForm.ofConstant(((AffineConstantExpr) expr).getValue());
            case DIM_ID:
                return LinearForm.ofAtom(((AffineDimExpr) expr).getPosition());
            case SYMBOL_ID:
                return LinearForm.ofAtom(numDims + ((AffineSymbolExpr) expr).getPosition());
            default:
                break;
        }
        AffineBinaryOpExpr bin = (AffineBinaryOpExpr) expr;
        LinearForm lhs = flatten(bin.getLhs());
        LinearForm rhs = flatten(bin.getRhs());
        switch (bin.getKind()) {
            case ADD: {
                LinearForm sum = lhs.scaled(1);
                sum.addScaled(rhs, 1);
                return sum;
            }
            case MUL:
                if (rhs.isConstant()) return lhs.scaled(rhs.constant);
                if (lhs.isConstant()) return rhs.scaled(lhs.constant);
                return opaque(rebuild(lhs).mul(rebuild(rhs)));
            default:
                if (rhs.isConstant() && rhs.constant > 0) {
                    return flattenDivision(bin.getKind(), lhs, rhs.constant);
                }
                return opaque(rebuildBinary(bin.getKind(), rebuild(lhs), rebuild(rhs)));
        }
    }

    private LinearForm flattenDivision(AffineExprKind kind, LinearForm lhs, long divisor) {
        if (lhs.isConstant()) {
            return LinearForm.ofConstant(AffineExpr.apply(kind, lhs.constant, divisor));
        }
        // lhs = divisor * quotient + remainder, with every remainder coefficient in [0, divisor)
        LinearForm quotient = LinearForm.ofConstant(Math.floorDiv(lhs.constant, divisor));
        LinearForm remainder = LinearForm.ofConstant(Math.floorMod(lhs.constant, divisor));
        for (Map.Entry<Integer, Long> entry : lhs.coeffs.entrySet()) {
            long q = Math.floorDiv(entry.getValue(), divisor);
            long r = Math.floorMod(entry.getValue(), divisor);
            if (q != 0) quotient.coeffs.put(entry.getKey(), q);
            if (r != 0) remainder.coeffs.put(entry.getKey(), r);
        }

        LinearForm rest;
        if (remainder.isConstant()) {
            rest = LinearForm.ofConstant(AffineExpr.apply(kind, remainder.constant, divisor));
        } else {
            rest = opaque(rebuildBinary(kind, rebuild(remainder), AffineExpr.constant(divisor, context)));
        }
        if (kind == AffineExprKind.MOD) return rest;
        quotient.addScaled(rest, 1);
        return quotient;
    }

    private static AffineExpr rebuildBinary(AffineExprKind kind, AffineExpr lhs, AffineExpr rhs) {
        switch (kind) {
            case FLOOR_DIV:
                return lhs.floorDiv(rhs);
            case CEIL_DIV:
                return lhs.ceilDiv(rhs);
            case MOD:
                return lhs.mod(rhs);
            default:
                throw new IllegalArgumentException(kind.toString());
        }
    }

    private LinearForm opaque(AffineExpr expr) {
        // the expression may have simplified to something linear
        switch (expr.getKind()) {
            case CONSTANT:
            case DIM_ID:
            case SYMBOL_ID:
                return flatten(expr);
            default:
                break;
        }
        Integer id = opaqueIds.get(expr);
        if (id == null) {
            id = numDims + numSymbols + opaques.size();
            opaques.add(expr);
            opaqueIds.put(expr, id);
        }
        return LinearForm.ofAtom(id);
    }

    private AffineExpr atom(int id) {
        if (id < numDims) return AffineExpr.dim(id, context);
        if (id < numDims + numSymbols) return AffineExpr.symbol(id - numDims, context);
        return opaques.get(id - numDims - numSymbols);
    }

    private AffineExpr rebuild(LinearForm form) {
        AffineExpr result = null;
        for (Map.Entry<Integer, Long> entry : form.coeffs.entrySet()) {
            AffineExpr term = atom(entry.getKey()).mul(entry.getValue());
            result = result == null ? term : result.add(term);
        }
        if (result == null) return AffineExpr.constant(form.constant, context);
        return form.constant == 0 ? result : result.add(form.constant);
    }
}
