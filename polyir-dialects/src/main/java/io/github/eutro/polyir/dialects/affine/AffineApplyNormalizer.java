package io.github.eutro.polyir.dialects.affine;

import io.github.eutro.polyir.core.affine.AffineExpr;
import io.github.eutro.polyir.core.affine.AffineMap;
import io.github.eutro.polyir.core.ir.Context;
import io.github.eutro.polyir.core.ir.OpResult;
import io.github.eutro.polyir.core.ir.Operation;
import io.github.eutro.polyir.core.ir.Value;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composes the affine applications that define the operands of a map into the map.
 * <p>
 * Operands defined by {@link AffineOps#APPLY} are replaced by the operands of that application,
 * and its map is substituted for the dimension they were bound to. Operands bound to symbols
 * of the map that come from an application are first promoted to dimensions, so they can be
 * composed the same way.
 * <p>
 * Normalization recurses into the applications it composes, which are normalized in turn
 * only while the depth is at most the maximum. At the default maximum of 1 a single level
 * of applications is composed; {@link AffineComposition#fullyComposeAffineMapAndOperands(AffineValueMap)}
 * repeats it until no operand is an application.
 * <p>
 * In the result, the dimensions are the distinct dimension operands in order of first use,
 * and the symbols are the map's own symbols followed by those gathered from the composed applications.
 */
final class AffineApplyNormalizer {
    private static final Logger LOGGER = Logger.getLogger(AffineApplyNormalizer.class.getName());

    /**
     * How many levels of applications are composed at once.
     * Set with the {@code POLYIR_MAX_APPLY_DEPTH} environment variable.
     */
    static final int MAX_APPLY_DEPTH = readMaxApplyDepth();

    private static int readMaxApplyDepth() {
        String value = System.getenv("POLYIR_MAX_APPLY_DEPTH");
        if (value == null) return 1;
        try {
            int depth = Integer.parseInt(value.trim());
            if (depth >= 1) return depth;
        } catch (NumberFormatException ignored) {
            // reported below
        }
        LOGGER.warning("ignoring invalid POLYIR_MAX_APPLY_DEPTH '" + value + "', using 1");
        return 1;
    }

    private final Context context;
    private final List<Value> reorderedDims = new ArrayList<>();
    private final Map<Value, Integer> dimValueToPosition = new HashMap<>();
    private final List<Value> auxSymbols = new ArrayList<>();

    private AffineApplyNormalizer(Context context) {
        this.context = context;
    }

    /**
     * Normalize a map and its operands.
     *
     * @param map      The map.
     * @param operands The operands, dimensions first.
     * @param depth    The depth of this normalization, 1 at the top level.
     * @param maxDepth The maximum depth at which applications are composed.
     * @return The normalized and canonicalized map.
     */
    static AffineValueMap normalize(AffineMap map, List<? extends Value> operands, int depth, int maxDepth) {
        AffineValueMap promoted = promoteComposedSymbolsAsDims(new AffineValueMap(map, operands));
        AffineMap promotedMap = promoted.getAffineMap();
        boolean furtherCompose = depth <= maxDepth;

        AffineApplyNormalizer normalizer = new AffineApplyNormalizer(map.getContext());
        List<AffineExpr> auxiliaryExprs = new ArrayList<>(promotedMap.getNumDims());
        for (Value dim : promoted.getDimOperands()) {
            Operation def = dim.getDefiningOp();
            if (furtherCompose && def != null && def.isKind(AffineOps.APPLY)) {
                AffineValueMap nested = normalize(AffineOps.getAffineMap(def), def.getOperands(), depth + 1, maxDepth);
                auxiliaryExprs.add(normalizer.renumber(nested, ((OpResult) dim).getResultNumber()));
            } else {
                auxiliaryExprs.add(normalizer.renumberOneDim(dim));
            }
        }

        AffineMap auxiliaryMap = AffineMap.get(normalizer.reorderedDims.size(),
                normalizer.auxSymbols.size(),
                auxiliaryExprs,
                normalizer.context);
        AffineMap composed = promotedMap.compose(auxiliaryMap).simplify();

        List<Value> newOperands = new ArrayList<>(composed.getNumInputs());
        newOperands.addAll(normalizer.reorderedDims);
        newOperands.addAll(promoted.getSymbolOperands());
        newOperands.addAll(normalizer.auxSymbols);
        AffineValueMap result = AffineComposition.canonicalizeMapAndOperands(new AffineValueMap(composed, newOperands));
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("normalized " + map + " at depth " + depth + " to " + result.getAffineMap());
        }
        return result;
    }

    private AffineExpr renumberOneDim(Value value) {
        Integer position = dimValueToPosition.get(value);
        if (position == null) {
            position = reorderedDims.size();
            dimValueToPosition.put(value, position);
            reorderedDims.add(value);
        }
        return AffineExpr.dim(position, context);
    }

    /**
     * Bring a result of an already normalized map into this normalizer's numbering:
     * its dimensions are deduplicated against ours, and its symbols appended to ours.
     */
    private AffineExpr renumber(AffineValueMap other, int resultNumber) {
        AffineMap otherMap = other.getAffineMap();
        List<AffineExpr> dimRemapping = new ArrayList<>(otherMap.getNumDims());
        for (Value dim : other.getDimOperands()) {
            dimRemapping.add(renumberOneDim(dim));
        }
        List<AffineExpr> symRemapping = new ArrayList<>(otherMap.getNumSymbols());
        for (int i = 0; i < otherMap.getNumSymbols(); i++) {
            symRemapping.add(AffineExpr.symbol(auxSymbols.size() + i, context));
        }
        auxSymbols.addAll(other.getSymbolOperands());
        return otherMap.getResult(resultNumber).replaceDimsAndSymbols(dimRemapping, symRemapping);
    }

    /**
     * Turn symbols bound to the results of applications into dimensions, after the existing ones.
     */
    private static AffineValueMap promoteComposedSymbolsAsDims(AffineValueMap valueMap) {
        AffineMap map = valueMap.getAffineMap();
        List<Value> symbols = valueMap.getSymbolOperands();
        boolean any = false;
        for (Value symbol : symbols) {
            if (isApplyResult(symbol)) {
                any = true;
                break;
            }
        }
        if (!any) return valueMap;

        Context context = map.getContext();
        List<Value> newDims = new ArrayList<>(valueMap.getDimOperands());
        List<Value> newSymbols = new ArrayList<>();
        List<AffineExpr> symRemapping = new ArrayList<>(symbols.size());
        for (Value symbol : symbols) {
            if (isApplyResult(symbol)) {
                symRemapping.add(AffineExpr.dim(newDims.size(), context));
                newDims.add(symbol);
            } else {
                symRemapping.add(AffineExpr.symbol(newSymbols.size(), context));
                newSymbols.add(symbol);
            }
        }
        List<AffineExpr> dimRemapping = new ArrayList<>(map.getNumDims());
        for (int i = 0; i < map.getNumDims(); i++) {
            dimRemapping.add(AffineExpr.dim(i, context));
        }
        AffineMap newMap = map.replaceDimsAndSymbols(dimRemapping, symRemapping, newDims.size(), newSymbols.size());
        List<Value> newOperands = new ArrayList<>(newDims);
        newOperands.addAll(newSymbols);
        return new AffineValueMap(newMap, newOperands);
    }

    private static boolean isApplyResult(Value value) {
        Operation def = value.getDefiningOp();
        return def != null && def.isKind(AffineOps.APPLY);
    }
}
