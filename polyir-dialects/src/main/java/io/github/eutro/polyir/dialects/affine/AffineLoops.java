package io.github.eutro.polyir.dialects.affine;

import io.github.eutro.polyir.core.affine.AffineConstantExpr;
import io.github.eutro.polyir.core.affine.AffineExpr;
import io.github.eutro.polyir.core.affine.AffineMap;
import io.github.eutro.polyir.core.affine.AffineSymbolExpr;
import io.github.eutro.polyir.core.diag.LogicalResult;
import io.github.eutro.polyir.core.fold.FoldResult;
import io.github.eutro.polyir.core.fold.Matchers;
import io.github.eutro.polyir.core.ir.*;
import io.github.eutro.polyir.core.ir.attrs.AffineMapAttr;
import io.github.eutro.polyir.core.ir.attrs.Attribute;
import io.github.eutro.polyir.core.ir.attrs.IntegerAttr;
import io.github.eutro.polyir.core.print.AsmPrinter;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.logging.Logger;

/**
 * Construction, queries and hooks of {@link AffineOps#FOR} loops.
 * <p>
 * A loop's operands are the operands of its lower bound map followed by those of its upper bound map.
 * A bound map with more than one result takes the maximum of its results as the lower bound,
 * or the minimum as the upper bound. The body is a single block, with the {@code index}
 * induction variable as its only argument, ending in an {@link AffineOps#TERMINATOR}.
 */
public final class AffineLoops {
    private static final Logger LOGGER = Logger.getLogger(AffineLoops.class.getName());

    private AffineLoops() {
    }

    public static final String LOWER_BOUND = "lower_bound";
    public static final String UPPER_BOUND = "upper_bound";
    public static final String STEP = "step";

    /**
     * Create a loop with an empty body.
     *
     * @param builder    The builder to create the loop with.
     * @param loc        The location.
     * @param lbOperands The operands of the lower bound.
     * @param lbMap      The lower bound map.
     * @param ubOperands The operands of the upper bound.
     * @param ubMap      The upper bound map.
     * @param step       The step, positive.
     * @return The loop.
     */
    public static Operation create(OpBuilder builder,
                                   Location loc,
                                   List<? extends Value> lbOperands,
                                   AffineMap lbMap,
                                   List<? extends Value> ubOperands,
                                   AffineMap ubMap,
                                   long step) {
        if (step <= 0) throw new IllegalArgumentException("step has to be a positive integer constant, got " + step);
        checkBound(lbMap, lbOperands);
        checkBound(ubMap, ubOperands);
        Context context = builder.getContext();
        Operation loop = builder.create(new OperationState(context, loc, AffineOps.FOR)
                .addOperands(lbOperands)
                .addOperands(ubOperands)
                .addAttribute(LOWER_BOUND, AffineMapAttr.get(lbMap))
                .addAttribute(UPPER_BOUND, AffineMapAttr.get(ubMap))
                .addAttribute(STEP, builder.getIndexAttr(step))
                .addRegions(1)
                .setResizableOperandList(true));
        Region body = loop.getRegion(0);
        body.addBlock().addArgument(builder.getIndexType());
        body.ensureTerminator(() -> AffineOps.createTerminator(context, loc));
        return loop;
    }

    /**
     * Create a loop with constant bounds and an empty body.
     *
     * @param builder The builder to create the loop with.
     * @param loc     The location.
     * @param lb      The lower bound.
     * @param ub      The upper bound.
     * @param step    The step, positive.
     * @return The loop.
     */
    public static Operation create(OpBuilder builder, Location loc, long lb, long ub, long step) {
        Context context = builder.getContext();
        return create(builder, loc,
                Collections.<Value>emptyList(), AffineMap.getConstantMap(lb, context),
                Collections.<Value>emptyList(), AffineMap.getConstantMap(ub, context),
                step);
    }

    private static void checkBound(AffineMap map, List<? extends Value> operands) {
        if (map.getNumInputs() != operands.size()) {
            throw new IllegalArgumentException("bound map " + map + " has " + map.getNumInputs()
                    + " inputs, but " + operands.size() + " operands were given");
        }
        if (map.getNumResults() == 0) {
            throw new IllegalArgumentException("bound map " + map + " has no results");
        }
    }

    // accessors

    public static Block getBody(Operation loop) {
        return loop.getRegion(0).front();
    }

    public static BlockArgument getInductionVar(Operation loop) {
        return getBody(loop).getArgument(0);
    }

    public static AffineMap getLowerBoundMap(Operation loop) {
        return getBoundMap(loop, LOWER_BOUND);
    }

    public static AffineMap getUpperBoundMap(Operation loop) {
        return getBoundMap(loop, UPPER_BOUND);
    }

    private static AffineMap getBoundMap(Operation loop, String name) {
        AffineMapAttr attr = loop.getAttrOfType(name, AffineMapAttr.class);
        if (attr == null) throw new IllegalStateException("loop has no '" + name + "' attribute");
        return attr.getValue();
    }

    public static List<Value> getLowerBoundOperands(Operation loop) {
        return loop.getOperands().subList(0, getLowerBoundMap(loop).getNumInputs());
    }

    public static List<Value> getUpperBoundOperands(Operation loop) {
        return loop.getOperands().subList(getLowerBoundMap(loop).getNumInputs(), loop.getNumOperands());
    }

    public static AffineValueMap getLowerBound(Operation loop) {
        return new AffineValueMap(getLowerBoundMap(loop), getLowerBoundOperands(loop));
    }

    public static AffineValueMap getUpperBound(Operation loop) {
        return new AffineValueMap(getUpperBoundMap(loop), getUpperBoundOperands(loop));
    }

    /**
     * Replace the lower bound of a loop.
     *
     * @param loop     The loop.
     * @param operands The operands of the new bound.
     * @param map      The new bound map.
     */
    public static void setLowerBound(Operation loop, List<? extends Value> operands, AffineMap map) {
        checkBound(map, operands);
        List<Value> newOperands = new ArrayList<>(operands);
        newOperands.addAll(getUpperBoundOperands(loop));
        loop.setOperands(newOperands);
        loop.setAttr(LOWER_BOUND, AffineMapAttr.get(map));
    }

    public static void setUpperBound(Operation loop, List<? extends Value> operands, AffineMap map) {
        checkBound(map, operands);
        List<Value> newOperands = new ArrayList<>(getLowerBoundOperands(loop));
        newOperands.addAll(operands);
        loop.setOperands(newOperands);
        loop.setAttr(UPPER_BOUND, AffineMapAttr.get(map));
    }

    public static boolean hasConstantLowerBound(Operation loop) {
        return getLowerBoundMap(loop).isSingleConstant();
    }

    public static boolean hasConstantUpperBound(Operation loop) {
        return getUpperBoundMap(loop).isSingleConstant();
    }

    public static boolean hasConstantBounds(Operation loop) {
        return hasConstantLowerBound(loop) && hasConstantUpperBound(loop);
    }

    public static long getConstantLowerBound(Operation loop) {
        return getLowerBoundMap(loop).getSingleConstantResult();
    }

    public static long getConstantUpperBound(Operation loop) {
        return getUpperBoundMap(loop).getSingleConstantResult();
    }

    public static void setConstantLowerBound(Operation loop, long value) {
        setLowerBound(loop, Collections.<Value>emptyList(), AffineMap.getConstantMap(value, loop.getContext()));
    }

    public static void setConstantUpperBound(Operation loop, long value) {
        setUpperBound(loop, Collections.<Value>emptyList(), AffineMap.getConstantMap(value, loop.getContext()));
    }

    public static long getStep(Operation loop) {
        IntegerAttr attr = loop.getAttrOfType(STEP, IntegerAttr.class);
        if (attr == null) throw new IllegalStateException("loop has no '" + STEP + "' attribute");
        return attr.getValue();
    }

    public static void setStep(Operation loop, long step) {
        if (step <= 0) throw new IllegalArgumentException("step has to be a positive integer constant, got " + step);
        loop.setAttr(STEP, IntegerAttr.get(loop.getContext().getIndexType(), step));
    }

    /**
     * Get how many times the body of a loop runs, if its bounds are constant.
     *
     * @param loop The loop.
     * @return The trip count, or null if the bounds are not constant.
     */
    public static @Nullable Long getConstantTripCount(Operation loop) {
        if (!hasConstantBounds(loop)) return null;
        long span = getConstantUpperBound(loop) - getConstantLowerBound(loop);
        return span <= 0 ? 0 : -Math.floorDiv(-span, getStep(loop));
    }

    public static boolean isForInductionVar(@Nullable Value value) {
        return getForInductionVarOwner(value) != null;
    }

    /**
     * Get the loop whose induction variable a value is.
     *
     * @param value The value.
     * @return The loop, or null if the value is not an induction variable.
     */
    public static @Nullable Operation getForInductionVarOwner(@Nullable Value value) {
        if (!(value instanceof BlockArgument)) return null;
        Block owner = ((BlockArgument) value).getOwner();
        Operation parent = owner.getParentOp();
        if (parent == null || !parent.isKind(AffineOps.FOR) || !owner.isEntryBlock()) return null;
        return ((BlockArgument) value).getArgNumber() == 0 ? parent : null;
    }

    // hooks

    static LogicalResult verify(Operation loop) {
        if (loop.getAttrOfType(LOWER_BOUND, AffineMapAttr.class) == null
                || loop.getAttrOfType(UPPER_BOUND, AffineMapAttr.class) == null) {
            return loop.emitOpError("requires '" + LOWER_BOUND + "' and '" + UPPER_BOUND + "' affine map attributes");
        }
        IntegerAttr step = loop.getAttrOfType(STEP, IntegerAttr.class);
        if (step == null || step.getValue() <= 0) {
            return loop.emitOpError("expected step to be representable as a positive signed integer");
        }
        Region region = loop.getRegion(0);
        if (region.getBlocks().size() != 1) {
            return loop.emitOpError("expected body region to have a single block");
        }
        Block body = region.front();
        if (body.getNumArguments() != 1 || !body.getArgument(0).getType().isIndex()) {
            return loop.emitOpError("expected body to have a single index argument for the induction variable");
        }
        if (body.isEmpty() || !body.back().isKind(AffineOps.TERMINATOR)) {
            return loop.emitOpError("expected body to end with 'affine.terminator'");
        }

        AffineMap lbMap = getLowerBoundMap(loop);
        AffineMap ubMap = getUpperBoundMap(loop);
        if (lbMap.getNumResults() == 0 || ubMap.getNumResults() == 0) {
            return loop.emitOpError("bound maps should have at least one result");
        }
        if (loop.getNumOperands() != lbMap.getNumInputs() + ubMap.getNumInputs()) {
            return loop.emitOpError("operand count must match affine map dimension and symbol count");
        }
        LogicalResult lbValid = AffineValidity.verifyDimAndSymbolIdentifiers(loop,
                getLowerBoundOperands(loop), lbMap.getNumDims());
        if (lbValid.failed()) return lbValid;
        return AffineValidity.verifyDimAndSymbolIdentifiers(loop,
                getUpperBoundOperands(loop), ubMap.getNumDims());
    }

    /**
     * Replace bounds whose operands are all constant by constant bounds, in place.
     *
     * @param loop     The loop.
     * @param operands Unused; the constants are matched per bound.
     * @return An empty list if any bound was folded, null otherwise.
     */
    static @Nullable List<FoldResult> fold(Operation loop, List<@Nullable Attribute> operands) {
        boolean folded = false;
        if (!hasConstantLowerBound(loop)) folded |= foldBound(loop, true);
        if (!hasConstantUpperBound(loop)) folded |= foldBound(loop, false);
        return folded ? Collections.<FoldResult>emptyList() : null;
    }

    private static boolean foldBound(Operation loop, boolean lower) {
        List<Value> boundOperands = lower ? getLowerBoundOperands(loop) : getUpperBoundOperands(loop);
        List<@Nullable Attribute> constants = new ArrayList<>(boundOperands.size());
        for (Value operand : boundOperands) {
            constants.add(Matchers.matchConstant(operand));
        }
        AffineMap boundMap = lower ? getLowerBoundMap(loop) : getUpperBoundMap(loop);
        List<Attribute> results = boundMap.constantFold(constants);
        if (results == null || results.isEmpty()) return false;

        long maxOrMin = ((IntegerAttr) results.get(0)).getValue();
        for (int i = 1; i < results.size(); i++) {
            long value = ((IntegerAttr) results.get(i)).getValue();
            maxOrMin = lower ? Math.max(maxOrMin, value) : Math.min(maxOrMin, value);
        }
        long bound = maxOrMin;
        LOGGER.fine(() -> "folded " + (lower ? LOWER_BOUND : UPPER_BOUND) + " " + boundMap + " to " + bound);
        if (lower) setConstantLowerBound(loop, bound);
        else setConstantUpperBound(loop, bound);
        return true;
    }

    /**
     * Compose the applications defining the operands of a loop's bounds into the bound maps,
     * and canonicalize them.
     *
     * @param loop The loop.
     * @return Whether any bound changed.
     */
    public static boolean canonicalizeBounds(Operation loop) {
        boolean changed = false;
        AffineValueMap lb = getLowerBound(loop);
        AffineValueMap newLb = AffineComposition.composeAffineMapAndOperands(lb);
        if (!newLb.equals(lb)) {
            setLowerBound(loop, newLb.getOperands(), newLb.getAffineMap());
            changed = true;
        }
        AffineValueMap ub = getUpperBound(loop);
        AffineValueMap newUb = AffineComposition.composeAffineMapAndOperands(ub);
        if (!newUb.equals(ub)) {
            setUpperBound(loop, newUb.getOperands(), newUb.getAffineMap());
            changed = true;
        }
        return changed;
    }

    private static final Set<String> ELIDED_ATTRS = new HashSet<>(Arrays.asList(LOWER_BOUND, UPPER_BOUND, STEP));

    static void print(Operation loop, AsmPrinter p) {
        p.append("affine.for ");
        p.printOperand(getInductionVar(loop));
        p.append(" = ");
        printBound(getLowerBoundMap(loop), getLowerBoundOperands(loop), "max", p);
        p.append(" to ");
        printBound(getUpperBoundMap(loop), getUpperBoundOperands(loop), "min", p);
        long step = getStep(loop);
        if (step != 1) p.append(" step ").append(step);
        p.append(" ");
        p.printRegion(loop.getRegion(0), false, false);
        p.printOptionalAttrDict(loop.getAttrs(), ELIDED_ATTRS);
    }

    private static void printBound(AffineMap map, List<Value> operands, String prefix, AsmPrinter p) {
        if (map.getNumResults() == 1) {
            AffineExpr expr = map.getResult(0);
            if (map.getNumInputs() == 0 && expr instanceof AffineConstantExpr) {
                p.append(((AffineConstantExpr) expr).getValue());
                return;
            }
            if (map.getNumDims() == 0 && map.getNumSymbols() == 1 && expr instanceof AffineSymbolExpr) {
                p.printOperand(operands.get(0));
                return;
            }
        } else {
            // multi-result bounds need the reduction spelled out
            p.append(prefix).append(" ");
        }
        p.append(map);
        p.printDimAndSymbolList(operands, map.getNumDims());
    }
}
