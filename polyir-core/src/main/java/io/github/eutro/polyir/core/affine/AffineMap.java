package io.github.eutro.polyir.core.affine;

import io.github.eutro.polyir.core.ir.Context;
import io.github.eutro.polyir.core.ir.attrs.Attribute;
import io.github.eutro.polyir.core.ir.attrs.IntegerAttr;
import io.github.eutro.polyir.core.ir.types.IndexType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * An immutable, uniqued list of affine expressions over {@code numDims} dimensions and
 * {@code numSymbols} symbols.
 * <p>
 * When a map is applied to a list of operands, the first {@code numDims} operands bind to
 * the dimensions and the rest bind to the symbols, in order.
 */
public final class AffineMap {
    private final Context context;
    private final int numDims;
    private final int numSymbols;
    private final List<AffineExpr> results;

    private AffineMap(Context context, int numDims, int numSymbols, List<AffineExpr> results) {
        this.context = context;
        this.numDims = numDims;
        this.numSymbols = numSymbols;
        this.results = results;
    }

    /**
     * Get a map.
     *
     * @param numDims    The number of dimensions.
     * @param numSymbols The number of symbols.
     * @param results    The result expressions.
     * @param context    The context.
     * @return The uniqued map.
     * @throws IllegalArgumentException If a result references a dimension or symbol out of range.
     */
    public static AffineMap get(int numDims, int numSymbols, @NotNull List<? extends AffineExpr> results, @NotNull Context context) {
        if (numDims < 0 || numSymbols < 0) {
            throw new IllegalArgumentException("negative dimension or symbol count");
        }
        for (AffineExpr result : results) {
            if (result.getContext() != context) {
                throw new IllegalArgumentException("result " + result + " belongs to a different context");
            }
            result.walk(expr -> {
                if (expr instanceof AffineDimExpr && ((AffineDimExpr) expr).getPosition() >= numDims) {
                    throw new IllegalArgumentException("dimension d" + ((AffineDimExpr) expr).getPosition()
                            + " out of range in map with " + numDims + " dimensions");
                }
                if (expr instanceof AffineSymbolExpr && ((AffineSymbolExpr) expr).getPosition() >= numSymbols) {
                    throw new IllegalArgumentException("symbol s" + ((AffineSymbolExpr) expr).getPosition()
                            + " out of range in map with " + numSymbols + " symbols");
                }
            });
        }
        List<AffineExpr> copy = Collections.unmodifiableList(new ArrayList<>(results));
        return context.unique(new AffineMap(context, numDims, numSymbols, copy));
    }

    public static AffineMap get(int numDims, int numSymbols, AffineExpr result, AffineExpr... moreResults) {
        List<AffineExpr> results = new ArrayList<>(moreResults.length + 1);
        results.add(result);
        results.addAll(Arrays.asList(moreResults));
        return get(numDims, numSymbols, results, result.getContext());
    }

    /**
     * Get the map with no inputs and no results.
     *
     * @param context The context.
     * @return The empty map.
     */
    public static AffineMap getEmpty(Context context) {
        return get(0, 0, Collections.<AffineExpr>emptyList(), context);
    }

    /**
     * Get a map with no inputs and a single constant result, {@code () -> (value)}.
     *
     * @param value   The constant.
     * @param context The context.
     * @return The map.
     */
    public static AffineMap getConstantMap(long value, Context context) {
        return get(0, 0, AffineExpr.constant(value, context));
    }

    public static AffineMap getMultiDimIdentityMap(int numDims, Context context) {
        List<AffineExpr> results = new ArrayList<>(numDims);
        for (int i = 0; i < numDims; i++) {
            results.add(AffineExpr.dim(i, context));
        }
        return get(numDims, 0, results, context);
    }

    /**
     * Get the map {@code ()[s0] -> (s0)}.
     *
     * @param context The context.
     * @return The map.
     */
    public static AffineMap getSymbolIdentityMap(Context context) {
        return get(0, 1, AffineExpr.symbol(0, context));
    }

    public Context getContext() {
        return context;
    }

    public int getNumDims() {
        return numDims;
    }

    public int getNumSymbols() {
        return numSymbols;
    }

    public int getNumInputs() {
        return numDims + numSymbols;
    }

    public int getNumResults() {
        return results.size();
    }

    public List<AffineExpr> getResults() {
        return results;
    }

    public AffineExpr getResult(int i) {
        return results.get(i);
    }

    public boolean isEmpty() {
        return numDims == 0 && numSymbols == 0 && results.isEmpty();
    }

    /**
     * Whether this map is {@code (d0, ..., dn) -> (d0, ..., dn)}, with no symbols.
     *
     * @return Whether this is an identity map.
     */
    public boolean isIdentity() {
        if (numSymbols != 0 || numDims != results.size()) return false;
        for (int i = 0; i < numDims; i++) {
            AffineExpr result = results.get(i);
            if (!(result instanceof AffineDimExpr) || ((AffineDimExpr) result).getPosition() != i) return false;
        }
        return true;
    }

    /**
     * Whether the results of this map are its dimensions, each exactly once, in any order.
     *
     * @return Whether this is a permutation.
     */
    public boolean isPermutation() {
        if (numSymbols != 0 || numDims != results.size()) return false;
        boolean[] seen = new boolean[numDims];
        for (AffineExpr result : results) {
            if (!(result instanceof AffineDimExpr)) return false;
            int pos = ((AffineDimExpr) result).getPosition();
            if (seen[pos]) return false;
            seen[pos] = true;
        }
        return true;
    }

    public boolean isSingleConstant() {
        return results.size() == 1 && results.get(0) instanceof AffineConstantExpr;
    }

    /**
     * Get the value of the single constant result of this map.
     *
     * @return The constant.
     * @throws IllegalStateException If this map is not a single constant.
     */
    public long getSingleConstantResult() {
        if (!isSingleConstant()) throw new IllegalStateException("map " + this + " is not a single constant");
        return ((AffineConstantExpr) results.get(0)).getValue();
    }

    public boolean isPureAffine() {
        for (AffineExpr result : results) {
            if (!result.isPureAffine()) return false;
        }
        return true;
    }

    public boolean isFunctionOfDim(int position) {
        for (AffineExpr result : results) {
            if (result.isFunctionOfDim(position)) return true;
        }
        return false;
    }

    public boolean isFunctionOfSymbol(int position) {
        for (AffineExpr result : results) {
            if (result.isFunctionOfSymbol(position)) return true;
        }
        return false;
    }

    // transformation

    /**
     * Replace the dimensions and symbols of every result, and make a map with the given input counts.
     *
     * @param dimReplacements The replacements for dimensions.
     * @param symReplacements The replacements for symbols.
     * @param numResultDims   The number of dimensions of the new map.
     * @param numResultSyms   The number of symbols of the new map.
     * @return The new map.
     */
    public AffineMap replaceDimsAndSymbols(List<? extends AffineExpr> dimReplacements,
                                           List<? extends AffineExpr> symReplacements,
                                           int numResultDims,
                                           int numResultSyms) {
        List<AffineExpr> newResults = new ArrayList<>(results.size());
        for (AffineExpr result : results) {
            newResults.add(result.replaceDimsAndSymbols(dimReplacements, symReplacements));
        }
        return get(numResultDims, numResultSyms, newResults, context);
    }

    /**
     * Compose this map with another, {@code this(other(x))}.
     * <p>
     * The result has the dimensions of {@code other}, and the symbols of this map followed by those of {@code other}.
     *
     * @param other The inner map, with as many results as this map has dimensions.
     * @return The composition.
     */
    public AffineMap compose(AffineMap other) {
        if (numDims != other.getNumResults()) {
            throw new IllegalArgumentException("composing " + this + " with " + other
                    + ": expected " + numDims + " results, got " + other.getNumResults());
        }
        int newDims = other.numDims;
        int newSyms = numSymbols + other.numSymbols;
        List<AffineExpr> dims = new ArrayList<>(newDims);
        for (int i = 0; i < newDims; i++) {
            dims.add(AffineExpr.dim(i, context));
        }
        List<AffineExpr> syms = new ArrayList<>(other.numSymbols);
        for (int i = 0; i < other.numSymbols; i++) {
            syms.add(AffineExpr.symbol(numSymbols + i, context));
        }
        AffineMap shifted = other.replaceDimsAndSymbols(dims, syms, newDims, newSyms);
        List<AffineExpr> newResults = new ArrayList<>(results.size());
        for (AffineExpr result : results) {
            newResults.add(result.compose(shifted));
        }
        return get(newDims, newSyms, newResults, context);
    }

    /**
     * Get the map made of a subset of the results of this map.
     *
     * @param resultPositions The positions of the results to keep, in order.
     * @return The map.
     */
    public AffineMap getSubMap(int... resultPositions) {
        List<AffineExpr> newResults = new ArrayList<>(resultPositions.length);
        for (int pos : resultPositions) {
            newResults.add(results.get(pos));
        }
        return get(numDims, numSymbols, newResults, context);
    }

    /**
     * Simplify every result of this map, cancelling linear terms and
     * splitting divisible parts out of divisions.
     *
     * @return The simplified map.
     */
    public AffineMap simplify() {
        List<AffineExpr> newResults = new ArrayList<>(results.size());
        for (AffineExpr result : results) {
            newResults.add(AffineExprSimplifier.simplify(result, numDims, numSymbols));
        }
        return get(numDims, numSymbols, newResults, context);
    }

    // evaluation

    /**
     * Evaluate every result of this map.
     *
     * @param operands The values of the dimensions, then the symbols.
     * @return The results.
     * @throws IllegalArgumentException If the number of operands is wrong.
     * @throws ArithmeticException      On division or modulo by zero.
     */
    public long[] evaluate(long... operands) {
        if (operands.length != getNumInputs()) {
            throw new IllegalArgumentException("expected " + getNumInputs() + " operands, got " + operands.length);
        }
        long[] dims = Arrays.copyOfRange(operands, 0, numDims);
        long[] syms = Arrays.copyOfRange(operands, numDims, operands.length);
        long[] values = new long[results.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = results.get(i).evaluate(dims, syms);
        }
        return values;
    }

    /**
     * Fold this map on constant operands.
     *
     * @param operands The constant operands, null where not constant.
     * @return The results as index attributes, or null if a result depends on a non-constant
     * operand, or divides by zero.
     */
    public @Nullable List<Attribute> constantFold(List<@Nullable Attribute> operands) {
        if (operands.size() != getNumInputs()) {
            throw new IllegalArgumentException("expected " + getNumInputs() + " operands, got " + operands.size());
        }
        Long[] dims = new Long[numDims];
        Long[] syms = new Long[numSymbols];
        for (int i = 0; i < operands.size(); i++) {
            Attribute operand = operands.get(i);
            Long value = operand instanceof IntegerAttr ? ((IntegerAttr) operand).getValue() : null;
            if (i < numDims) dims[i] = value;
            else syms[i - numDims] = value;
        }
        IndexType index = IndexType.get(context);
        List<Attribute> folded = new ArrayList<>(results.size());
        for (AffineExpr result : results) {
            Long value;
            try {
                value = result.constantFold(dims, syms);
            } catch (ArithmeticException e) {
                return null;
            }
            if (value == null) return null;
            folded.add(IntegerAttr.get(index, value));
        }
        return folded;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof AffineMap)) return false;
        AffineMap that = (AffineMap) o;
        if (context != that.context || numDims != that.numDims || numSymbols != that.numSymbols) return false;
        if (results.size() != that.results.size()) return false;
        // results are uniqued
        for (int i = 0; i < results.size(); i++) {
            if (results.get(i) != that.results.get(i)) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = numDims * 31 + numSymbols;
        for (AffineExpr result : results) {
            hash = hash * 31 + System.identityHashCode(result);
        }
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < numDims; i++) {
            if (i != 0) sb.append(", ");
            sb.append('d').append(i);
        }
        sb.append(')');
        if (numSymbols != 0) {
            sb.append('[');
            for (int i = 0; i < numSymbols; i++) {
                if (i != 0) sb.append(", ");
                sb.append('s').append(i);
            }
            sb.append(']');
        }
        sb.append(" -> (");
        for (int i = 0; i < results.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(results.get(i));
        }
        return sb.append(')').toString();
    }
}
