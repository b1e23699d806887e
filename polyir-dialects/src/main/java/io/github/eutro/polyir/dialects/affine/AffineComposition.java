package io.github.eutro.polyir.dialects.affine;

import io.github.eutro.polyir.core.affine.AffineDimExpr;
import io.github.eutro.polyir.core.affine.AffineExpr;
import io.github.eutro.polyir.core.affine.AffineMap;
import io.github.eutro.polyir.core.affine.AffineSymbolExpr;
import io.github.eutro.polyir.core.fold.Matchers;
import io.github.eutro.polyir.core.ir.*;
import io.github.eutro.polyir.core.ir.attrs.Attribute;
import io.github.eutro.polyir.core.ir.types.MemRefType;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Composition and canonicalization of affine maps with the values bound to them.
 */
public final class AffineComposition {
    private AffineComposition() {
    }

    /**
     * Compose the applications defining the operands of a map into it, as many levels deep as
     * the {@code POLYIR_MAX_APPLY_DEPTH} environment variable allows (by default one), then
     * canonicalize the result.
     * <p>
     * The composed map computes the same values as the original for any values of the operands.
     *
     * @param map      The map.
     * @param operands The operands, dimensions first.
     * @return The composed map and its operands.
     */
    public static AffineValueMap composeAffineMapAndOperands(AffineMap map, List<? extends Value> operands) {
        return composeAffineMapAndOperands(map, operands, AffineApplyNormalizer.MAX_APPLY_DEPTH);
    }

    /**
     * Compose the applications defining the operands of a map into it, up to a given depth.
     *
     * @param map      The map.
     * @param operands The operands, dimensions first.
     * @param maxDepth How many levels of applications to compose, at least 1.
     * @return The composed map and its operands.
     */
    public static AffineValueMap composeAffineMapAndOperands(AffineMap map, List<? extends Value> operands, int maxDepth) {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be at least 1, got " + maxDepth);
        return AffineApplyNormalizer.normalize(map, operands, 1, maxDepth);
    }

    public static AffineValueMap composeAffineMapAndOperands(AffineValueMap valueMap) {
        return composeAffineMapAndOperands(valueMap.getAffineMap(), valueMap.getOperands());
    }

    /**
     * Compose applications into a map until none of its operands is defined by one.
     *
     * @param map      The map.
     * @param operands The operands, dimensions first.
     * @return The composed map and its operands.
     */
    public static AffineValueMap fullyComposeAffineMapAndOperands(AffineMap map, List<? extends Value> operands) {
        return fullyComposeAffineMapAndOperands(new AffineValueMap(map, operands));
    }

    public static AffineValueMap fullyComposeAffineMapAndOperands(AffineValueMap valueMap) {
        AffineValueMap current = valueMap;
        while (hasApplyOperand(current.getOperands())) {
            current = composeAffineMapAndOperands(current);
        }
        return current;
    }

    private static boolean hasApplyOperand(List<Value> operands) {
        for (Value operand : operands) {
            Operation def = operand.getDefiningOp();
            if (def != null && def.isKind(AffineOps.APPLY)) return true;
        }
        return false;
    }

    /**
     * Bring a map and its operands to canonical form:
     * <ul>
     *     <li>operands bound to dimensions that are valid symbols are rebound to symbols,</li>
     *     <li>constant symbols are folded into the map,</li>
     *     <li>repeated operands are bound to a single input,</li>
     *     <li>inputs the map does not use are dropped,</li>
     *     <li>and the map is simplified.</li>
     * </ul>
     *
     * @param map      The map.
     * @param operands The operands, dimensions first.
     * @return The canonical map and its operands.
     */
    public static AffineValueMap canonicalizeMapAndOperands(AffineMap map, List<? extends Value> operands) {
        return canonicalizeMapAndOperands(new AffineValueMap(map, operands));
    }

    public static AffineValueMap canonicalizeMapAndOperands(AffineValueMap valueMap) {
        if (valueMap.getOperands().isEmpty()) {
            return new AffineValueMap(valueMap.getAffineMap().simplify(), valueMap.getOperands());
        }
        AffineValueMap current = canonicalizePromotedSymbols(valueMap);
        while (true) {
            AffineValueMap next = dropUnusedAndDuplicateOperands(current);
            // simplification may have cancelled out more inputs
            if (next.getOperands().size() == current.getOperands().size()) return next;
            current = next;
        }
    }

    private static AffineValueMap canonicalizePromotedSymbols(AffineValueMap valueMap) {
        AffineMap map = valueMap.getAffineMap();
        Context context = map.getContext();
        int oldNumSyms = map.getNumSymbols();
        List<Value> resultOperands = new ArrayList<>(valueMap.getNumDims());
        List<Value> remappedSymbols = new ArrayList<>();
        List<AffineExpr> dimRemapping = new ArrayList<>(map.getNumDims());
        for (Value dim : valueMap.getDimOperands()) {
            if (AffineValidity.isValidSymbol(dim)) {
                dimRemapping.add(AffineExpr.symbol(oldNumSyms + remappedSymbols.size(), context));
                remappedSymbols.add(dim);
            } else {
                dimRemapping.add(AffineExpr.dim(resultOperands.size(), context));
                resultOperands.add(dim);
            }
        }
        if (remappedSymbols.isEmpty()) return valueMap;
        int numDims = resultOperands.size();
        resultOperands.addAll(valueMap.getSymbolOperands());
        resultOperands.addAll(remappedSymbols);
        AffineMap newMap = map.replaceDimsAndSymbols(dimRemapping,
                Collections.<AffineExpr>emptyList(),
                numDims,
                oldNumSyms + remappedSymbols.size());
        return new AffineValueMap(newMap, resultOperands);
    }

    private static AffineValueMap dropUnusedAndDuplicateOperands(AffineValueMap valueMap) {
        AffineMap map = valueMap.getAffineMap();
        Context context = map.getContext();
        boolean[] usedDims = new boolean[map.getNumDims()];
        boolean[] usedSyms = new boolean[map.getNumSymbols()];
        for (AffineExpr result : map.getResults()) {
            result.walk(expr -> {
                switch (expr.getKind()) {
                    case DIM_ID:
                        usedDims[((AffineDimExpr) expr).getPosition()] = true;
                        break;
                    case SYMBOL_ID:
                        usedSyms[((AffineSymbolExpr) expr).getPosition()] = true;
                        break;
                    default:
                        break;
                }
            });
        }

        AffineExpr unused = AffineExpr.constant(0, context);
        List<Value> resultOperands = new ArrayList<>(valueMap.getOperands().size());
        List<AffineExpr> dimRemapping = new ArrayList<>(map.getNumDims());
        Map<Value, AffineExpr> seenDims = new HashMap<>();
        for (int i = 0; i < map.getNumDims(); i++) {
            if (!usedDims[i]) {
                dimRemapping.add(unused);
                continue;
            }
            Value operand = valueMap.getOperand(i);
            AffineExpr seen = seenDims.get(operand);
            if (seen == null) {
                seen = AffineExpr.dim(resultOperands.size(), context);
                resultOperands.add(operand);
                seenDims.put(operand, seen);
            }
            dimRemapping.add(seen);
        }
        int numDims = resultOperands.size();

        List<AffineExpr> symRemapping = new ArrayList<>(map.getNumSymbols());
        Map<Value, AffineExpr> seenSymbols = new HashMap<>();
        for (int i = 0; i < map.getNumSymbols(); i++) {
            if (!usedSyms[i]) {
                symRemapping.add(unused);
                continue;
            }
            Value operand = valueMap.getOperand(map.getNumDims() + i);
            // constants in dimension positions were already rebound to symbols
            Long constant = Matchers.matchConstantInt(operand);
            if (constant != null) {
                symRemapping.add(AffineExpr.constant(constant, context));
                continue;
            }
            AffineExpr seen = seenSymbols.get(operand);
            if (seen == null) {
                seen = AffineExpr.symbol(resultOperands.size() - numDims, context);
                resultOperands.add(operand);
                seenSymbols.put(operand, seen);
            }
            symRemapping.add(seen);
        }

        AffineMap newMap = map.replaceDimsAndSymbols(dimRemapping,
                symRemapping,
                numDims,
                resultOperands.size() - numDims);
        return new AffineValueMap(newMap.simplify(), resultOperands);
    }

    /**
     * Create an application of a map, after composing the applications defining its operands into it.
     *
     * @param builder  The builder to create the application with.
     * @param loc      The location.
     * @param map      The map, with a single result.
     * @param operands The operands.
     * @return The application.
     */
    public static Operation makeComposedAffineApply(OpBuilder builder,
                                                    Location loc,
                                                    AffineMap map,
                                                    List<? extends Value> operands) {
        AffineValueMap composed = composeAffineMapAndOperands(map, operands);
        return AffineOps.createApply(builder, loc, composed.getAffineMap(), composed.getOperands());
    }

    /**
     * Get the applications from which some values are transitively computed, in depth-first pre-order.
     *
     * @param operands The values.
     * @return The applications.
     */
    public static List<Operation> getReachableAffineApplyOps(List<? extends Value> operands) {
        Set<Operation> reachable = new LinkedHashSet<>();
        Deque<Value> worklist = new ArrayDeque<>();
        for (int i = operands.size() - 1; i >= 0; i--) {
            worklist.push(operands.get(i));
        }
        while (!worklist.isEmpty()) {
            Operation def = worklist.pop().getDefiningOp();
            if (def == null || !def.isKind(AffineOps.APPLY) || !reachable.add(def)) continue;
            for (int i = def.getNumOperands() - 1; i >= 0; i--) {
                worklist.push(def.getOperand(i));
            }
        }
        return new ArrayList<>(reachable);
    }

    /**
     * Give an operation private copies of the affine computations of its operands.
     * <p>
     * If any of the applications the operands of {@code op} are computed from are also used by
     * other operations, a fully composed application is created before {@code op} for each
     * operand that is an application result, and {@code op} is made to use those instead.
     *
     * @param op The operation.
     * @return The created applications, empty if nothing was done.
     */
    public static List<Operation> createAffineComputationSlice(Operation op) {
        List<Value> subOperands = new ArrayList<>();
        for (Value operand : op.getOperands()) {
            Operation def = operand == null ? null : operand.getDefiningOp();
            if (def != null && def.isKind(AffineOps.APPLY) && !subOperands.contains(operand)) {
                subOperands.add(operand);
            }
        }
        List<Operation> applyOps = getReachableAffineApplyOps(subOperands);
        if (applyOps.isEmpty()) return Collections.emptyList();

        boolean localized = true;
        check:
        for (Operation applyOp : applyOps) {
            for (OpResult result : applyOp.getResults()) {
                for (Operation user : result.getUsers()) {
                    if (user != op) {
                        localized = false;
                        break check;
                    }
                }
            }
        }
        if (localized) return Collections.emptyList();

        OpBuilder builder = OpBuilder.before(op);
        AffineValueMap composed = fullyComposeAffineMapAndOperands(
                AffineMap.getMultiDimIdentityMap(subOperands.size(), op.getContext()),
                subOperands);
        AffineMap composedMap = composed.getAffineMap();
        List<Operation> sliceOps = new ArrayList<>(composedMap.getNumResults());
        for (AffineExpr result : composedMap.getResults()) {
            AffineMap singleResultMap = AffineMap.get(composedMap.getNumDims(),
                    composedMap.getNumSymbols(),
                    Collections.singletonList(result),
                    op.getContext());
            sliceOps.add(AffineOps.createApply(builder, op.getLoc(), singleResultMap, composed.getOperands()));
        }

        for (int i = 0; i < op.getNumOperands(); i++) {
            int j = subOperands.indexOf(op.getOperand(i));
            if (j != -1) op.setOperand(i, sliceOps.get(j).getResult(0));
        }
        return sliceOps;
    }

    public static boolean replaceAllMemRefUsesWith(Value oldMemRef, Value newMemRef) {
        return replaceAllMemRefUsesWith(oldMemRef, newMemRef,
                Collections.<Value>emptyList(), null, Collections.<Value>emptyList(), null);
    }

    /**
     * Make every affine load and store of one memref access another instead.
     * <p>
     * The indices into {@code newMemRef} are {@code extraIndices} followed by the results of
     * {@code indexRemap} applied to {@code extraOperands} and then the old indices, or just the
     * old indices if there is no remap. The new access maps are fully composed and canonicalized.
     * <p>
     * Nothing is changed if any considered use of {@code oldMemRef} is not an affine load or store.
     *
     * @param oldMemRef     The memref to replace.
     * @param newMemRef     The memref to replace it with, of the same element type.
     * @param extraIndices  Leading indices into the new memref.
     * @param indexRemap    A purely dimensional map from the extra operands and old indices to the
     *                      remaining new indices, or null for none.
     * @param extraOperands Leading operands of {@code indexRemap}.
     * @param domOpFilter   If not null, only uses in operations it dominates are replaced.
     * @return Whether the uses were replaced.
     * @throws IllegalArgumentException If the memrefs, indices and remap don't fit together.
     */
    public static boolean replaceAllMemRefUsesWith(Value oldMemRef,
                                                   Value newMemRef,
                                                   List<? extends Value> extraIndices,
                                                   @Nullable AffineMap indexRemap,
                                                   List<? extends Value> extraOperands,
                                                   @Nullable Operation domOpFilter) {
        MemRefType oldType = memRefType(oldMemRef);
        MemRefType newType = memRefType(newMemRef);
        int oldRank = oldType.getRank();
        int newRank = newType.getRank();
        if (oldType.getElementType() != newType.getElementType()) {
            throw new IllegalArgumentException("element types of " + oldType + " and " + newType + " differ");
        }
        if (indexRemap != null) {
            if (indexRemap.getNumSymbols() != 0) {
                throw new IllegalArgumentException("index remap must be purely dimensional, got " + indexRemap);
            }
            if (indexRemap.getNumInputs() != extraOperands.size() + oldRank) {
                throw new IllegalArgumentException("index remap " + indexRemap + " takes "
                        + indexRemap.getNumInputs() + " inputs, expected " + (extraOperands.size() + oldRank));
            }
            if (indexRemap.getNumResults() + extraIndices.size() != newRank) {
                throw new IllegalArgumentException("index remap " + indexRemap + " and " + extraIndices.size()
                        + " extra indices don't index " + newType);
            }
        } else if (oldRank + extraIndices.size() != newRank) {
            throw new IllegalArgumentException(extraIndices.size() + " extra indices don't turn "
                    + oldType + " indices into " + newType + " indices");
        }

        DominanceInfo domInfo = domOpFilter == null ? null : new DominanceInfo();
        List<Operation> accesses = new ArrayList<>();
        for (Operation user : new LinkedHashSet<>(oldMemRef.getUsers())) {
            if (domInfo != null && !domInfo.dominates(domOpFilter, user)) continue;
            // any other use may let the memref escape
            if (!user.isKind(AffineOps.LOAD) && !user.isKind(AffineOps.STORE)) return false;
            if (AffineOps.getMemRef(user) != oldMemRef) return false;
            accesses.add(user);
        }

        Context context = oldMemRef.getContext();
        for (Operation access : accesses) {
            OpBuilder builder = OpBuilder.before(access);
            Location loc = access.getLoc();
            List<Operation> applyOps = new ArrayList<>();

            AffineMap oldMap = AffineOps.getAffineMap(access);
            List<Value> oldMapOperands = new ArrayList<>(AffineOps.getMapOperands(access));
            List<Value> oldIndices = oldMap.isIdentity()
                    ? oldMapOperands
                    : applyEachResult(builder, loc, oldMap, oldMapOperands, applyOps);

            List<Value> remapOperands = new ArrayList<Value>(extraOperands);
            remapOperands.addAll(oldIndices);
            List<Value> remapOutputs = indexRemap == null || indexRemap.isIdentity()
                    ? remapOperands
                    : applyEachResult(builder, loc, indexRemap, remapOperands, applyOps);

            List<Value> newIndices = new ArrayList<Value>(extraIndices);
            newIndices.addAll(remapOutputs);
            AffineValueMap newAccess = canonicalizeMapAndOperands(fullyComposeAffineMapAndOperands(
                    AffineMap.getMultiDimIdentityMap(newRank, context), newIndices));
            for (int i = applyOps.size() - 1; i >= 0; i--) {
                Operation applyOp = applyOps.get(i);
                if (applyOp.getResult(0).useEmpty()) applyOp.erase();
            }

            Operation replacement;
            if (access.isKind(AffineOps.LOAD)) {
                replacement = AffineOps.createLoad(builder, loc, newMemRef,
                        newAccess.getAffineMap(), newAccess.getOperands());
                access.getResult(0).replaceAllUsesWith(replacement.getResult(0));
            } else {
                replacement = AffineOps.createStore(builder, loc, access.getOperand(0), newMemRef,
                        newAccess.getAffineMap(), newAccess.getOperands());
            }
            for (Map.Entry<String, Attribute> attr : access.getAttrs().entrySet()) {
                if (!attr.getKey().equals(AffineOps.MAP)) replacement.setAttr(attr.getKey(), attr.getValue());
            }
        }
        // the filter may be one of these
        for (Operation access : accesses) {
            access.erase();
        }
        return true;
    }

    private static List<Value> applyEachResult(OpBuilder builder,
                                               Location loc,
                                               AffineMap map,
                                               List<Value> operands,
                                               List<Operation> applyOps) {
        List<Value> results = new ArrayList<>(map.getNumResults());
        for (AffineExpr result : map.getResults()) {
            AffineMap singleResultMap = AffineMap.get(map.getNumDims(), map.getNumSymbols(),
                    Collections.singletonList(result), map.getContext());
            Operation applyOp = AffineOps.createApply(builder, loc, singleResultMap, operands);
            applyOps.add(applyOp);
            results.add(applyOp.getResult(0));
        }
        return results;
    }

    private static MemRefType memRefType(Value memref) {
        if (!(memref.getType() instanceof MemRefType)) {
            throw new IllegalArgumentException("expected a memref, got " + memref.getType());
        }
        return (MemRefType) memref.getType();
    }
}
