package io.github.eutro.polyir.dialects.affine;

import io.github.eutro.polyir.core.affine.AffineDimExpr;
import io.github.eutro.polyir.core.affine.AffineExpr;
import io.github.eutro.polyir.core.affine.AffineMap;
import io.github.eutro.polyir.core.affine.AffineSymbolExpr;
import io.github.eutro.polyir.core.diag.LogicalResult;
import io.github.eutro.polyir.core.fold.FoldHook;
import io.github.eutro.polyir.core.fold.FoldResult;
import io.github.eutro.polyir.core.ir.*;
import io.github.eutro.polyir.core.ir.attrs.AffineMapAttr;
import io.github.eutro.polyir.core.ir.attrs.Attribute;
import io.github.eutro.polyir.core.ir.types.MemRefType;
import io.github.eutro.polyir.core.ir.types.Type;
import io.github.eutro.polyir.core.print.AsmPrinter;
import io.github.eutro.polyir.core.traits.Traits;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The operations of the {@link AffineDialect}.
 * <p>
 * Loops are in {@link AffineLoops}.
 */
public final class AffineOps {
    private AffineOps() {
    }

    public static final String MAP = "map";

    /**
     * Effect: returns the single result of its {@link #MAP} applied to its operands,
     * which are bound to the dimensions then the symbols of the map.
     */
    public static final OpKind APPLY = OpKind.builder("affine.apply")
            .traits(Traits.ONE_RESULT,
                    Traits.NO_SIDE_EFFECT)
            .verifier(AffineOps::verifyApply)
            .folder(FoldHook.single(AffineOps::foldApply))
            .canonicalizer(AffineOps::simplifyAffineApply)
            .printer((op, p) -> {
                AffineMap map = getAffineMap(op);
                p.append("affine.apply ").append(map);
                p.printDimAndSymbolList(op.getOperands(), map.getNumDims());
                p.printOptionalAttrDict(op.getAttrs(), Collections.singleton(MAP));
            })
            .build();

    /**
     * Control: ends the body of an {@link #FOR} loop.
     */
    public static final OpKind TERMINATOR = OpKind.builder("affine.terminator")
            .traits(Traits.IS_TERMINATOR,
                    Traits.ZERO_OPERANDS,
                    Traits.ZERO_RESULTS,
                    Traits.ZERO_SUCCESSORS)
            .verifier(op -> {
                Operation parent = op.getParentOp();
                if (parent == null || !parent.isKind(AffineOps.FOR)) {
                    return op.emitOpError("expects parent op 'affine.for'");
                }
                return LogicalResult.success();
            })
            .printer((op, p) -> p.append("affine.terminator"))
            .build();

    /**
     * Control: runs its body for each value of the induction variable from the lower bound,
     * inclusive, to the upper bound, exclusive, in increments of the step.
     *
     * @see AffineLoops
     */
    public static final OpKind FOR = OpKind.builder("affine.for")
            .traits(Traits.ZERO_RESULTS,
                    Traits.nRegions(1))
            .verifier(AffineLoops::verify)
            .folder(AffineLoops::fold)
            .canonicalizer(AffineLoops::canonicalizeBounds)
            .printer(AffineLoops::print)
            .build();

    /**
     * Effect: reads the element of its memref operand at the subscripts computed by its {@link #MAP}.
     */
    public static final OpKind LOAD = OpKind.builder("affine.load")
            .traits(Traits.atLeastNOperands(1),
                    Traits.ONE_RESULT)
            .verifier(op -> verifyAccess(op, 1, "load"))
            .canonicalizer(op -> composeAccessMap(op, 1))
            .printer((op, p) -> {
                p.append("affine.load ");
                printAccess(op, 1, p);
            })
            .build();

    /**
     * Effect: writes its first operand to the element of its memref operand at the subscripts computed by its {@link #MAP}.
     */
    public static final OpKind STORE = OpKind.builder("affine.store")
            .traits(Traits.atLeastNOperands(2),
                    Traits.ZERO_RESULTS)
            .verifier(op -> verifyAccess(op, 2, "store"))
            .canonicalizer(op -> composeAccessMap(op, 2))
            .printer((op, p) -> {
                p.append("affine.store ");
                p.printOperand(op.getOperand(0));
                p.append(", ");
                printAccess(op, 2, p);
            })
            .build();

    // builders

    public static Operation createApply(OpBuilder builder, Location loc, AffineMap map, List<? extends Value> operands) {
        return builder.create(new OperationState(builder.getContext(), loc, APPLY)
                .addOperands(operands)
                .addAttribute(MAP, AffineMapAttr.get(map))
                .addTypes(builder.getIndexType()));
    }

    /**
     * Create a terminator, without inserting it.
     *
     * @param context The context.
     * @param loc     The location.
     * @return The terminator.
     */
    public static Operation createTerminator(Context context, Location loc) {
        return Operation.create(new OperationState(context, loc, TERMINATOR));
    }

    public static Operation createLoad(OpBuilder builder, Location loc, Value memref, List<? extends Value> indices) {
        return createLoad(builder, loc, memref,
                AffineMap.getMultiDimIdentityMap(getMemRefType(memref).getRank(), builder.getContext()),
                indices);
    }

    public static Operation createLoad(OpBuilder builder,
                                       Location loc,
                                       Value memref,
                                       AffineMap map,
                                       List<? extends Value> mapOperands) {
        checkAccessMap(memref, map, mapOperands);
        return builder.create(new OperationState(builder.getContext(), loc, LOAD)
                .addOperands(memref)
                .addOperands(mapOperands)
                .addAttribute(MAP, AffineMapAttr.get(map))
                .addTypes(getMemRefType(memref).getElementType())
                .setResizableOperandList(true));
    }

    public static Operation createStore(OpBuilder builder,
                                        Location loc,
                                        Value value,
                                        Value memref,
                                        List<? extends Value> indices) {
        return createStore(builder, loc, value, memref,
                AffineMap.getMultiDimIdentityMap(getMemRefType(memref).getRank(), builder.getContext()),
                indices);
    }

    public static Operation createStore(OpBuilder builder,
                                        Location loc,
                                        Value value,
                                        Value memref,
                                        AffineMap map,
                                        List<? extends Value> mapOperands) {
        checkAccessMap(memref, map, mapOperands);
        return builder.create(new OperationState(builder.getContext(), loc, STORE)
                .addOperands(value, memref)
                .addOperands(mapOperands)
                .addAttribute(MAP, AffineMapAttr.get(map))
                .setResizableOperandList(true));
    }

    private static MemRefType getMemRefType(Value memref) {
        if (!(memref.getType() instanceof MemRefType)) {
            throw new IllegalArgumentException("expected a memref, got " + memref.getType());
        }
        return (MemRefType) memref.getType();
    }

    private static void checkAccessMap(Value memref, AffineMap map, List<? extends Value> mapOperands) {
        if (map.getNumResults() != getMemRefType(memref).getRank()) {
            throw new IllegalArgumentException("map " + map + " does not match the rank of " + memref.getType());
        }
        if (map.getNumInputs() != mapOperands.size()) {
            throw new IllegalArgumentException("map " + map + " has " + map.getNumInputs()
                    + " inputs, but " + mapOperands.size() + " operands were given");
        }
    }

    // accessors

    /**
     * Get the map of an application, load or store.
     *
     * @param op The operation.
     * @return The map.
     * @throws IllegalStateException If the operation has no map.
     */
    public static AffineMap getAffineMap(Operation op) {
        AffineMapAttr attr = op.getAttrOfType(MAP, AffineMapAttr.class);
        if (attr == null) throw new IllegalStateException(op.getName() + " has no '" + MAP + "' attribute");
        return attr.getValue();
    }

    public static Value getMemRef(Operation access) {
        return access.getOperand(access.isKind(STORE) ? 1 : 0);
    }

    public static List<Value> getMapOperands(Operation access) {
        int start = access.isKind(STORE) ? 2 : 1;
        return access.getOperands().subList(start, access.getNumOperands());
    }

    public static AffineValueMap getAffineValueMap(Operation op) {
        return new AffineValueMap(getAffineMap(op), op.isKind(APPLY) ? op.getOperands() : getMapOperands(op));
    }

    // apply

    private static LogicalResult verifyApply(Operation op) {
        AffineMapAttr attr = op.getAttrOfType(MAP, AffineMapAttr.class);
        if (attr == null) return op.emitOpError("requires an affine map");
        AffineMap map = attr.getValue();
        if (op.getNumOperands() != map.getNumInputs()) {
            return op.emitOpError("operand count and affine map dimension and symbol count must match");
        }
        for (Type type : op.getOperandTypes()) {
            if (!type.isIndex()) return op.emitOpError("operands must be of type 'index'");
        }
        if (!op.getResult(0).getType().isIndex()) return op.emitOpError("result must be of type 'index'");
        LogicalResult operandsValid = AffineValidity.verifyDimAndSymbolIdentifiers(op, op.getOperands(), map.getNumDims());
        if (operandsValid.failed()) return operandsValid;
        if (map.getNumResults() != 1) return op.emitOpError("mapping must produce one value");
        return LogicalResult.success();
    }

    private static @Nullable FoldResult foldApply(Operation op, List<@Nullable Attribute> operands) {
        AffineMap map = getAffineMap(op);
        if (map.getNumResults() != 1) return null;
        AffineExpr expr = map.getResult(0);
        if (expr instanceof AffineDimExpr) {
            return FoldResult.of(op.getOperand(((AffineDimExpr) expr).getPosition()));
        }
        if (expr instanceof AffineSymbolExpr) {
            return FoldResult.of(op.getOperand(map.getNumDims() + ((AffineSymbolExpr) expr).getPosition()));
        }
        List<Attribute> folded = map.constantFold(operands);
        return folded == null ? null : FoldResult.of(folded.get(0));
    }

    private static Boolean simplifyAffineApply(Operation op) {
        AffineMap oldMap = getAffineMap(op);
        AffineValueMap composed = AffineComposition.composeAffineMapAndOperands(oldMap, op.getOperands());
        if (composed.getAffineMap().equals(oldMap) && sameValues(composed.getOperands(), op.getOperands())) {
            return false;
        }
        Operation replacement = createApply(OpBuilder.before(op), op.getLoc(),
                composed.getAffineMap(), composed.getOperands());
        op.replaceAllUsesWith(replacement.getResults());
        op.erase();
        return true;
    }

    static boolean sameValues(List<? extends Value> a, List<? extends Value> b) {
        if (a.size() != b.size()) return false;
        for (int i = 0; i < a.size(); i++) {
            if (a.get(i) != b.get(i)) return false;
        }
        return true;
    }

    // load and store

    private static LogicalResult verifyAccess(Operation op, int mapOperandStart, String what) {
        Value memref = op.getOperand(mapOperandStart - 1);
        if (!(memref.getType() instanceof MemRefType)) {
            return op.emitOpError("memref operand must be of memref type");
        }
        MemRefType memrefType = (MemRefType) memref.getType();
        if (op.isKind(LOAD)) {
            if (!op.getResult(0).getType().equals(memrefType.getElementType())) {
                return op.emitOpError("result type must match element type of memref");
            }
        } else if (!op.getOperand(0).getType().equals(memrefType.getElementType())) {
            return op.emitOpError("first operand must have same type memref element type");
        }

        int numIndices = op.getNumOperands() - mapOperandStart;
        AffineMapAttr attr = op.getAttrOfType(MAP, AffineMapAttr.class);
        if (attr != null) {
            AffineMap map = attr.getValue();
            if (map.getNumResults() != memrefType.getRank()) {
                return op.emitOpError("affine." + what + " affine map num results must equal memref rank");
            }
            if (map.getNumInputs() != numIndices) {
                return op.emitOpError("expects as many subscripts as affine map inputs");
            }
        } else if (memrefType.getRank() != numIndices) {
            return op.emitOpError("expects the number of subscripts to be equal to memref rank");
        }

        for (Value index : op.getOperands().subList(mapOperandStart, op.getNumOperands())) {
            if (!index.getType().isIndex()) {
                return op.emitOpError("index to " + what + " must have 'index' type");
            }
            if (!AffineValidity.isValidAffineIndexOperand(index)) {
                return op.emitOpError("index must be a dimension or symbol identifier");
            }
        }
        return LogicalResult.success();
    }

    private static Boolean composeAccessMap(Operation op, int mapOperandStart) {
        AffineMap oldMap = op.getAttrOfType(MAP, AffineMapAttr.class) == null ? null : getAffineMap(op);
        if (oldMap == null || !op.hasResizableOperandList()) return false;
        List<Value> oldOperands = op.getOperands().subList(mapOperandStart, op.getNumOperands());
        AffineValueMap composed = AffineComposition.composeAffineMapAndOperands(oldMap, oldOperands);
        if (composed.getAffineMap().equals(oldMap) && sameValues(composed.getOperands(), oldOperands)) {
            return false;
        }
        List<Value> newOperands = new ArrayList<>(op.getOperands().subList(0, mapOperandStart));
        newOperands.addAll(composed.getOperands());
        op.setAttr(MAP, AffineMapAttr.get(composed.getAffineMap()));
        op.setOperands(newOperands);
        return true;
    }

    private static void printAccess(Operation op, int mapOperandStart, AsmPrinter p) {
        Value memref = op.getOperand(mapOperandStart - 1);
        p.printOperand(memref);
        p.append("[");
        AffineMapAttr attr = op.getAttrOfType(MAP, AffineMapAttr.class);
        List<Value> indices = op.getOperands().subList(mapOperandStart, op.getNumOperands());
        if (attr != null) {
            p.printAffineMapOfSSAIds(attr.getValue(), indices);
        } else {
            p.printOperands(indices);
        }
        p.append("]");
        p.printOptionalAttrDict(op.getAttrs(), Collections.singleton(MAP));
        p.append(" : ");
        p.printType(memref.getType());
    }
}
