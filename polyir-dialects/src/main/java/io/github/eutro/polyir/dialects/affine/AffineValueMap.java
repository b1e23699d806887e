package io.github.eutro.polyir.dialects.affine;

import io.github.eutro.polyir.core.affine.AffineExpr;
import io.github.eutro.polyir.core.affine.AffineMap;
import io.github.eutro.polyir.core.ir.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An affine map together with the values bound to its dimensions and symbols.
 */
public final class AffineValueMap {
    private final AffineMap map;
    private final List<Value> operands;

    public AffineValueMap(AffineMap map, List<? extends Value> operands) {
        if (map.getNumInputs() != operands.size()) {
            throw new IllegalArgumentException("map " + map + " has " + map.getNumInputs()
                    + " inputs, but " + operands.size() + " operands were given");
        }
        this.map = map;
        this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
    }

    public AffineMap getAffineMap() {
        return map;
    }

    public List<Value> getOperands() {
        return operands;
    }

    public Value getOperand(int i) {
        return operands.get(i);
    }

    public List<Value> getDimOperands() {
        return operands.subList(0, map.getNumDims());
    }

    public List<Value> getSymbolOperands() {
        return operands.subList(map.getNumDims(), operands.size());
    }

    public int getNumDims() {
        return map.getNumDims();
    }

    public int getNumSymbols() {
        return map.getNumSymbols();
    }

    public int getNumResults() {
        return map.getNumResults();
    }

    public AffineExpr getResult(int i) {
        return map.getResult(i);
    }

    /**
     * Whether a result of this map depends on a value, through any of the inputs it is bound to.
     *
     * @param idx   The result position.
     * @param value The value.
     * @return Whether the result is a function of the value.
     */
    public boolean isFunctionOf(int idx, Value value) {
        AffineExpr result = map.getResult(idx);
        for (int i = 0; i < operands.size(); i++) {
            if (operands.get(i) != value) continue;
            if (i < map.getNumDims()
                    ? result.isFunctionOfDim(i)
                    : result.isFunctionOfSymbol(i - map.getNumDims())) {
                return true;
            }
        }
        return false;
    }

    public boolean isMultipleOf(int idx, long factor) {
        return map.getResult(idx).isMultipleOf(factor);
    }

    /**
     * Compose the affine applications that define operands into this map, one level deep.
     *
     * @return The composed map.
     * @see AffineComposition#composeAffineMapAndOperands(AffineValueMap)
     */
    public AffineValueMap compose() {
        return AffineComposition.composeAffineMapAndOperands(this);
    }

    public AffineValueMap fullyCompose() {
        return AffineComposition.fullyComposeAffineMapAndOperands(this);
    }

    public AffineValueMap canonicalize() {
        return AffineComposition.canonicalizeMapAndOperands(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AffineValueMap)) return false;
        AffineValueMap that = (AffineValueMap) o;
        if (!map.equals(that.map) || operands.size() != that.operands.size()) return false;
        for (int i = 0; i < operands.size(); i++) {
            if (operands.get(i) != that.operands.get(i)) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = map.hashCode();
        for (Value operand : operands) {
            hash = 31 * hash + System.identityHashCode(operand);
        }
        return hash;
    }

    @Override
    public String toString() {
        return map + " " + operands;
    }
}
