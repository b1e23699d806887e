package io.github.eutro.polyir.core.fold;

import io.github.eutro.polyir.core.diag.LogicalResult;
import io.github.eutro.polyir.core.ir.*;
import io.github.eutro.polyir.core.ir.attrs.Attribute;
import io.github.eutro.polyir.core.ir.types.Type;
import io.github.eutro.polyir.core.traits.Traits;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Folds operations one at a time, materializing constant results as constant operations
 * that are shared within each insertion region.
 * <p>
 * Constants are materialized at the start of the entry block of the closest enclosing region
 * whose owner is unregistered, isolated from above, or not in a block itself, and are keyed by
 * (dialect, value, type) in that region. The folder must be told with {@link #notifyRemoval(Operation)}
 * when one of its constants is erased by someone else, or it will keep handing it out.
 */
public final class OperationFolder {
    private static final Logger LOGGER = Logger.getLogger(OperationFolder.class.getName());

    private final Map<Region, Map<ConstantKey, Operation>> foldScopes = new HashMap<>();
    // for each constant this folder created, the dialects it is keyed under
    private final Map<Operation, List<@Nullable Dialect>> referencedDialects = new HashMap<>();

    public LogicalResult tryToFold(Operation op) {
        return tryToFold(op, null, null);
    }

    /**
     * Try to fold an operation, replacing its results and erasing it on success.
     * <p>
     * Operations with no results, or folded in place, are not erased.
     *
     * @param op                        The operation.
     * @param processGeneratedConstants Called for each constant operation created.
     * @param preReplaceAction          Called with the operation once folding succeeded, before anything is replaced.
     * @return Whether the operation folded.
     */
    public LogicalResult tryToFold(Operation op,
                                   @Nullable Consumer<Operation> processGeneratedConstants,
                                   @Nullable Consumer<Operation> preReplaceAction) {
        // constants of this folder are already folded
        if (referencedDialects.containsKey(op)) return LogicalResult.failure();

        List<Value> results = new ArrayList<>();
        if (foldIntoResults(op, results, processGeneratedConstants).failed()) return LogicalResult.failure();
        if (preReplaceAction != null) preReplaceAction.accept(op);

        if (results.isEmpty()) {
            LOGGER.finer(() -> "folded " + op.getName() + " in place");
            return LogicalResult.success();
        }
        for (int i = 0; i < results.size(); i++) {
            op.getResult(i).replaceAllUsesWith(results.get(i));
        }
        LOGGER.finer(() -> "folded " + op.getName() + " away");
        op.erase();
        return LogicalResult.success();
    }

    /**
     * Create an operation with a builder and try to fold it immediately.
     * <p>
     * If it folds, it is erased unless it has no results, and the folded values are returned.
     *
     * @param builder The builder.
     * @param state   The operation to create.
     * @return The values of the results of the operation.
     */
    public List<Value> createOrFold(OpBuilder builder, OperationState state) {
        Operation op = builder.create(state);
        List<Value> results = new ArrayList<>();
        if (foldIntoResults(op, results, null).failed() || results.isEmpty()) {
            return new ArrayList<Value>(op.getResults());
        }
        if (op.getNumResults() != 0) {
            op.erase();
        }
        return results;
    }

    /**
     * Tell this folder that an operation is about to be erased, dropping it
     * from the constant tables if it is one of this folder's constants.
     *
     * @param op The operation.
     */
    public void notifyRemoval(Operation op) {
        List<Dialect> dialects = referencedDialects.remove(op);
        if (dialects == null) return;
        Attribute value = Matchers.matchConstant(op);
        Region region = getInsertionRegion(op);
        Map<ConstantKey, Operation> uniqued = region == null ? null : foldScopes.get(region);
        if (uniqued == null || value == null) return;
        Type type = op.getResult(0).getType();
        for (Dialect dialect : dialects) {
            uniqued.remove(new ConstantKey(dialect, value, type));
        }
    }

    /**
     * Forget every constant, e.g. after the IR this folder was used on is thrown away.
     */
    public void clear() {
        foldScopes.clear();
        referencedDialects.clear();
    }

    private LogicalResult foldIntoResults(Operation op,
                                          List<Value> results,
                                          @Nullable Consumer<Operation> processGeneratedConstants) {
        List<Attribute> operandConstants = new ArrayList<>(op.getNumOperands());
        for (Value operand : op.getOperands()) {
            operandConstants.add(Matchers.matchConstant(operand));
        }

        if (op.hasTrait(Traits.COMMUTATIVE) && op.getNumOperands() == 2
                && operandConstants.get(0) != null && operandConstants.get(1) == null) {
            Value lhs = op.getOperand(0);
            op.setOperand(0, op.getOperand(1));
            op.setOperand(1, lhs);
            Collections.swap(operandConstants, 0, 1);
        }

        List<FoldResult> foldResults = new ArrayList<>();
        if (op.fold(operandConstants, foldResults).failed()) return LogicalResult.failure();
        if (foldResults.isEmpty()) return LogicalResult.success();
        if (foldResults.size() != op.getNumResults()) {
            throw new IllegalStateException("folder of " + op.getName() + " returned "
                    + foldResults.size() + " results, expected " + op.getNumResults());
        }

        Region region = getInsertionRegion(op);
        Block entry = region == null || region.isEmpty() ? null : region.front();
        OpBuilder builder = entry == null ? null : OpBuilder.atBlockBegin(op.getContext(), entry);
        Map<ConstantKey, Operation> uniqued = region == null ? null
                : foldScopes.computeIfAbsent(region, $ -> new HashMap<>());
        List<Operation> generated = new ArrayList<>();
        Dialect dialect = op.getDialect();

        for (int i = 0; i < foldResults.size(); i++) {
            FoldResult folded = foldResults.get(i);
            if (folded.isValue()) {
                results.add(folded.getValue());
                continue;
            }
            Operation constOp = builder == null ? null : tryGetOrCreateConstant(uniqued, dialect, builder,
                    folded.getAttribute(), op.getResult(i).getType(), op.getLoc(), generated);
            if (constOp == null) {
                for (Operation created : generated) {
                    notifyRemoval(created);
                    created.erase();
                }
                results.clear();
                return LogicalResult.failure();
            }
            results.add(constOp.getResult(0));
        }

        if (processGeneratedConstants != null) {
            for (Operation created : generated) {
                processGeneratedConstants.accept(created);
            }
        }
        return LogicalResult.success();
    }

    private @Nullable Operation tryGetOrCreateConstant(Map<ConstantKey, Operation> uniqued,
                                                       @Nullable Dialect dialect,
                                                       OpBuilder builder,
                                                       Attribute value,
                                                       Type type,
                                                       Location loc,
                                                       List<Operation> generated) {
        ConstantKey key = new ConstantKey(dialect, value, type);
        Operation existing = uniqued.get(key);
        if (existing != null) return existing;
        if (dialect == null) return null;

        Operation constOp = dialect.materializeConstant(builder, value, type, loc);
        if (constOp == null) return null;
        LOGGER.fine(() -> "materialized " + value + " as " + constOp.getName());
        generated.add(constOp);

        Dialect newDialect = constOp.getDialect();
        if (newDialect == dialect) {
            uniqued.put(key, constOp);
            referencedDialects.computeIfAbsent(constOp, $ -> new ArrayList<>()).add(dialect);
            return constOp;
        }

        // materialized in another dialect, which may already have this constant
        ConstantKey newKey = new ConstantKey(newDialect, value, type);
        Operation existingOp = uniqued.get(newKey);
        if (existingOp != null) {
            generated.remove(constOp);
            constOp.erase();
            referencedDialects.get(existingOp).add(dialect);
            uniqued.put(key, existingOp);
            return existingOp;
        }
        referencedDialects.put(constOp, new ArrayList<>(Arrays.asList(dialect, newDialect)));
        uniqued.put(key, constOp);
        uniqued.put(newKey, constOp);
        return constOp;
    }

    private static @Nullable Region getInsertionRegion(Operation op) {
        Region region = op.getParentRegion();
        while (region != null) {
            Operation parentOp = region.getParentOp();
            if (parentOp == null
                    || !parentOp.isRegistered()
                    || parentOp.hasTrait(Traits.ISOLATED_FROM_ABOVE)
                    || parentOp.getBlock() == null) {
                return region;
            }
            region = parentOp.getParentRegion();
        }
        return null;
    }

    private static final class ConstantKey {
        private final @Nullable Dialect dialect;
        private final Attribute value;
        private final Type type;

        ConstantKey(@Nullable Dialect dialect, Attribute value, Type type) {
            this.dialect = dialect;
            this.value = value;
            this.type = type;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof ConstantKey)) return false;
            ConstantKey that = (ConstantKey) o;
            return dialect == that.dialect && value.equals(that.value) && type.equals(that.type);
        }

        @Override
        public int hashCode() {
            return Objects.hash(System.identityHashCode(dialect), value, type);
        }
    }
}
