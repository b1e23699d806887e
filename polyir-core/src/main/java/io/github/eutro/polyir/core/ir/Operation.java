package io.github.eutro.polyir.core.ir;

import io.github.eutro.polyir.core.diag.Diagnostic;
import io.github.eutro.polyir.core.diag.LogicalResult;
import io.github.eutro.polyir.core.ext.DelegatingExtHolder;
import io.github.eutro.polyir.core.ext.Ext;
import io.github.eutro.polyir.core.ext.ExtContainer;
import io.github.eutro.polyir.core.ext.IRExts;
import io.github.eutro.polyir.core.fold.FoldHook;
import io.github.eutro.polyir.core.fold.FoldResult;
import io.github.eutro.polyir.core.ir.attrs.Attribute;
import io.github.eutro.polyir.core.ir.types.Type;
import io.github.eutro.polyir.core.print.AsmPrinter;
import io.github.eutro.polyir.core.traits.Trait;
import io.github.eutro.polyir.core.traits.Traits;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.function.Consumer;

/**
 * The generic IR node: a named operation with operands, results, successors,
 * nested regions and attributes.
 * <p>
 * The shape of an operation (its result count, successor count and region count) is fixed
 * when it is {@link #create(OperationState) created}. Operands can be changed one by one,
 * and the operand list can be resized only if the operation was created with a resizable one.
 * <p>
 * Successor operands are stored after the regular operands, in successor order.
 */
public final class Operation extends DelegatingExtHolder {
    public static boolean TRACK_OP_CREATIONS = System.getenv("POLYIR_TRACK_OP_CREATIONS") != null;

    public final @Nullable Throwable created = TRACK_OP_CREATIONS ? new Throwable("constructed") : null;

    private final Context context;
    private Location location;
    private final OperationName name;
    private final List<OpOperand> operands = new ArrayList<>();
    private final boolean resizableOperands;
    private final OpResult[] results;
    private final BlockOperand[] successors;
    private final int[] successorOperandCounts;
    private final Region[] regions;
    private final TreeMap<String, Attribute> attrs;

    private @Nullable Block block;
    int orderIndex = -1;
    private boolean destroyed;

    private Operation(Context context,
                      Location location,
                      OperationName name,
                      List<Type> resultTypes,
                      int numSuccessors,
                      int numRegions,
                      Map<String, Attribute> attributes,
                      boolean resizableOperands) {
        this.context = context;
        this.location = location;
        this.name = name;
        this.resizableOperands = resizableOperands;
        results = new OpResult[resultTypes.size()];
        for (int i = 0; i < results.length; i++) {
            results[i] = new OpResult(this, i, resultTypes.get(i));
        }
        successors = new BlockOperand[numSuccessors];
        successorOperandCounts = new int[numSuccessors];
        regions = new Region[numRegions];
        for (int i = 0; i < numRegions; i++) {
            regions[i] = new Region();
            regions[i].attachExt(IRExts.OWNING_OPERATION, this);
        }
        attrs = new TreeMap<>(attributes);
    }

    /**
     * Create an operation.
     *
     * @param location          The location of the operation.
     * @param name              The name of the operation.
     * @param operands          The operands; if there are successors, each successor's operands follow a null delimiter,
     *                          in successor order, after the regular operands.
     * @param resultTypes       The types of the results.
     * @param attributes        The attributes.
     * @param successors        The successor blocks.
     * @param numRegions        The number of (empty) regions to create.
     * @param resizableOperands Whether the operand list may later change size.
     * @param context           The context.
     * @return The operation, not inserted in any block.
     * @throws IllegalArgumentException If successors are given to a kind that is not a terminator,
     *                                  or the null delimiters don't match the successors.
     */
    public static Operation create(@NotNull Location location,
                                   @NotNull OperationName name,
                                   @NotNull List<? extends @Nullable Value> operands,
                                   @NotNull List<? extends Type> resultTypes,
                                   @NotNull Map<String, Attribute> attributes,
                                   @NotNull List<Block> successors,
                                   int numRegions,
                                   boolean resizableOperands,
                                   @NotNull Context context) {
        int numSuccessors = successors.size();
        OpKind kind = name.getKind();
        if (numSuccessors != 0 && kind != null && !kind.isTerminator()) {
            throw new IllegalArgumentException("successors given to non-terminator " + name);
        }
        int delimiters = 0;
        for (Value operand : operands) {
            if (operand == null) delimiters++;
        }
        if (delimiters != numSuccessors) {
            throw new IllegalArgumentException("expected " + numSuccessors
                    + " successor operand delimiters, found " + delimiters);
        }

        Operation op = new Operation(context, location, name, new ArrayList<>(resultTypes),
                numSuccessors, numRegions, attributes, resizableOperands);
        int succ = -1;
        for (Value operand : operands) {
            if (operand == null) {
                succ++;
                continue;
            }
            if (succ >= 0) op.successorOperandCounts[succ]++;
            op.operands.add(new OpOperand(op, op.operands.size(), operand));
        }
        for (int i = 0; i < numSuccessors; i++) {
            Block successor = successors.get(i);
            if (successor == null) throw new IllegalArgumentException("null successor #" + i);
            op.successors[i] = new BlockOperand(op, i, successor);
        }
        return op;
    }

    public static Operation create(OperationState state) {
        return create(state.location,
                state.name,
                state.operands,
                state.types,
                state.attributes,
                state.successors,
                state.numRegions,
                state.resizableOperandList,
                state.context);
    }

    @Override
    protected @Nullable ExtContainer getDelegate() {
        return name.getKind();
    }

    @Override
    protected boolean isDelegated(Ext<?> ext) {
        return IRExts.isKindHook(ext);
    }

    public Context getContext() {
        return context;
    }

    public Location getLoc() {
        return location;
    }

    public void setLoc(Location location) {
        this.location = location;
    }

    public OperationName getName() {
        return name;
    }

    public @Nullable OpKind getKind() {
        return name.getKind();
    }

    public boolean isKind(OpKind kind) {
        return name.getKind() == kind;
    }

    /**
     * Get the dialect of this operation, if it is loaded.
     *
     * @return The dialect, or null.
     */
    public @Nullable Dialect getDialect() {
        return context.getLoadedDialect(name.getDialectNamespace());
    }

    public boolean isRegistered() {
        return name.isRegistered();
    }

    public boolean hasTrait(Trait trait) {
        OpKind kind = name.getKind();
        return kind != null && kind.hasTrait(trait);
    }

    public boolean isKnownTerminator() {
        return hasTrait(Traits.IS_TERMINATOR);
    }

    public boolean isKnownNonTerminator() {
        OpKind kind = name.getKind();
        return kind != null && !kind.isTerminator();
    }

    // region structure

    public @Nullable Block getBlock() {
        return block;
    }

    public @Nullable Region getParentRegion() {
        return block == null ? null : block.getParent();
    }

    public @Nullable Operation getParentOp() {
        Region region = getParentRegion();
        return region == null ? null : region.getParentOp();
    }

    /**
     * Find the closest proper ancestor of this operation of a given kind.
     *
     * @param kind The kind.
     * @return The ancestor, or null if there is none.
     */
    public @Nullable Operation getParentOfKind(OpKind kind) {
        Operation op = getParentOp();
        while (op != null && !op.isKind(kind)) {
            op = op.getParentOp();
        }
        return op;
    }

    public boolean isProperAncestor(Operation other) {
        Operation op = other.getParentOp();
        while (op != null) {
            if (op == this) return true;
            op = op.getParentOp();
        }
        return false;
    }

    /**
     * Whether this operation comes before another in the same block.
     *
     * @param other The other operation.
     * @return Whether this is before other.
     * @throws IllegalArgumentException If the operations are not in the same block.
     */
    public boolean isBeforeInBlock(Operation other) {
        if (block == null || other.block != block) {
            throw new IllegalArgumentException("operations not in the same block");
        }
        if (!block.isOpOrderValid()) {
            block.recomputeOpOrder();
        }
        return orderIndex < other.orderIndex;
    }

    /**
     * Unlink this operation from its block, and insert it right before another operation.
     *
     * @param existing The operation to move before.
     */
    public void moveBefore(Operation existing) {
        Block dest = existing.getBlock();
        if (dest == null) throw new IllegalArgumentException("moving before an operation not in a block");
        if (existing == this) return;
        remove();
        dest.insertBefore(existing, this);
    }

    /**
     * Unlink this operation from its block, and append it to another block.
     *
     * @param dest The block.
     */
    public void moveToEnd(Block dest) {
        remove();
        dest.addOperation(this);
    }

    /**
     * Unlink this operation from its block without destroying it.
     */
    public void remove() {
        if (block != null) {
            block.getOperations().remove(this);
        }
    }

    /**
     * Unlink this operation from its block, if any, and destroy it.
     *
     * @throws IllegalStateException If any of its results is still used, in which case it is left in place.
     */
    public void erase() {
        checkDestroyable();
        remove();
        destroy();
    }

    /**
     * Destroy this unlinked operation, dropping all of its references and destroying everything nested in it.
     *
     * @throws IllegalStateException If the operation is still in a block, or any of its results is still used.
     */
    public void destroy() {
        if (block != null) {
            throw new IllegalStateException("operation " + name + " destroyed but still in a block", created);
        }
        if (destroyed) return;
        checkDestroyable();
        dropAllReferences();
        for (Region region : regions) {
            region.clear();
        }
        destroyed = true;
    }

    private void checkDestroyable() {
        for (OpResult result : results) {
            if (!result.useEmpty()) {
                throw new IllegalStateException("operation " + name + " destroyed but result #"
                        + result.getResultNumber() + " still has uses", created);
            }
        }
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    /**
     * Drop every operand and successor of this operation and of every operation nested in it.
     * <p>
     * Cycles through regions must be broken this way before the operations in them can be destroyed.
     */
    public void dropAllReferences() {
        for (OpOperand operand : operands) {
            operand.drop();
        }
        for (Region region : regions) {
            region.dropAllReferences();
        }
        for (BlockOperand successor : successors) {
            successor.drop();
        }
    }

    /**
     * Drop every use of every value defined by this operation, including in nested regions.
     */
    public void dropAllDefinedValueUses() {
        for (OpResult result : results) {
            result.dropAllUses();
        }
        for (Region region : regions) {
            for (Block block : region.getBlocks()) {
                block.dropAllDefinedValueUses();
            }
        }
    }

    /**
     * Visit every operation nested in this one, then this one.
     *
     * @param visitor The visitor, which may erase the operation it is given.
     */
    public void walk(Consumer<Operation> visitor) {
        for (Region region : regions) {
            region.walk(visitor);
        }
        visitor.accept(this);
    }

    // operands

    public int getNumOperands() {
        return operands.size();
    }

    public @Nullable Value getOperand(int i) {
        return operands.get(i).get();
    }

    public void setOperand(int i, @Nullable Value value) {
        operands.get(i).set(value);
    }

    public OpOperand getOpOperand(int i) {
        return operands.get(i);
    }

    public List<OpOperand> getOpOperands() {
        return Collections.unmodifiableList(operands);
    }

    /**
     * Get a live view of the operands, which can be {@link List#set(int, Object) set}.
     *
     * @return The operands.
     */
    public List<Value> getOperands() {
        return new AbstractList<Value>() {
            @Override
            public Value get(int index) {
                return getOperand(index);
            }

            @Override
            public Value set(int index, Value element) {
                Value old = getOperand(index);
                setOperand(index, element);
                return old;
            }

            @Override
            public int size() {
                return getNumOperands();
            }
        };
    }

    public List<Type> getOperandTypes() {
        List<Type> types = new ArrayList<>(operands.size());
        for (OpOperand operand : operands) {
            Value value = operand.get();
            types.add(value == null ? null : value.getType());
        }
        return types;
    }

    public boolean hasResizableOperandList() {
        return resizableOperands;
    }

    /**
     * Replace all operands of this operation, which must not have successors.
     *
     * @param newOperands The new operands.
     * @throws UnsupportedOperationException If the count changes and the operand list isn't resizable.
     */
    public void setOperands(List<? extends Value> newOperands) {
        if (successors.length != 0) {
            throw new IllegalStateException("can't reset the operands of " + name + ", which has successors");
        }
        if (newOperands.size() != operands.size() && !resizableOperands) {
            throw new UnsupportedOperationException("operand list of " + name + " is not resizable");
        }
        while (operands.size() > newOperands.size()) {
            operands.remove(operands.size() - 1).drop();
        }
        for (int i = 0; i < newOperands.size(); i++) {
            if (i < operands.size()) {
                operands.get(i).set(newOperands.get(i));
            } else {
                operands.add(new OpOperand(this, i, newOperands.get(i)));
            }
        }
    }

    /**
     * Erase one of the regular (non-successor) operands.
     *
     * @param i The index of the operand.
     */
    public void eraseOperand(int i) {
        if (!resizableOperands) {
            throw new UnsupportedOperationException("operand list of " + name + " is not resizable");
        }
        if (i >= getNumNonSuccessorOperands()) {
            throw new IllegalArgumentException("operand #" + i + " is a successor operand");
        }
        operands.remove(i).drop();
        for (int j = i; j < operands.size(); j++) {
            operands.get(j).setOperandNumber(j);
        }
    }

    /**
     * Replace every use of {@code from} by this operation with {@code to}.
     *
     * @param from The value to replace.
     * @param to   The replacement.
     */
    public void replaceUsesOfWith(Value from, Value to) {
        if (from == to) return;
        for (OpOperand operand : operands) {
            if (operand.get() == from) operand.set(to);
        }
    }

    // results

    public int getNumResults() {
        return results.length;
    }

    public OpResult getResult(int i) {
        return results[i];
    }

    public List<OpResult> getResults() {
        return Collections.unmodifiableList(Arrays.asList(results));
    }

    public List<Type> getResultTypes() {
        List<Type> types = new ArrayList<>(results.length);
        for (OpResult result : results) {
            types.add(result.getType());
        }
        return types;
    }

    /**
     * Whether no result of this operation is used.
     *
     * @return Whether the results are unused.
     */
    public boolean useEmpty() {
        for (OpResult result : results) {
            if (!result.useEmpty()) return false;
        }
        return true;
    }

    /**
     * Replace every use of this operation's results with the given values, in order.
     *
     * @param values The replacements, one per result.
     */
    public void replaceAllUsesWith(List<? extends Value> values) {
        if (values.size() != results.length) {
            throw new IllegalArgumentException("expected " + results.length + " replacement values, got " + values.size());
        }
        for (int i = 0; i < results.length; i++) {
            results[i].replaceAllUsesWith(values.get(i));
        }
    }

    // successors

    public int getNumSuccessors() {
        return successors.length;
    }

    public @Nullable Block getSuccessor(int i) {
        return successors[i].get();
    }

    public void setSuccessor(Block block, int i) {
        successors[i].set(block);
    }

    public List<Block> getSuccessors() {
        List<Block> blocks = new ArrayList<>(successors.length);
        for (BlockOperand successor : successors) {
            blocks.add(successor.get());
        }
        return blocks;
    }

    public int getNumSuccessorOperands(int i) {
        return successorOperandCounts[i];
    }

    /**
     * Get the index of the first operand passed to the given successor.
     *
     * @param i The successor.
     * @return The operand index.
     */
    public int getSuccessorOperandIndex(int i) {
        int index = operands.size();
        for (int j = i; j < successorOperandCounts.length; j++) {
            index -= successorOperandCounts[j];
        }
        return index;
    }

    /**
     * Get the operands passed to the arguments of a successor, as a live view.
     *
     * @param i The successor.
     * @return The operands.
     */
    public List<Value> getSuccessorOperands(int i) {
        int start = getSuccessorOperandIndex(i);
        return getOperands().subList(start, start + successorOperandCounts[i]);
    }

    public int getNumNonSuccessorOperands() {
        return successors.length == 0 ? operands.size() : getSuccessorOperandIndex(0);
    }

    public List<Value> getNonSuccessorOperands() {
        return getOperands().subList(0, getNumNonSuccessorOperands());
    }

    // regions

    public int getNumRegions() {
        return regions.length;
    }

    public Region getRegion(int i) {
        return regions[i];
    }

    public List<Region> getRegions() {
        return Collections.unmodifiableList(Arrays.asList(regions));
    }

    // attributes

    public SortedMap<String, Attribute> getAttrs() {
        return Collections.unmodifiableSortedMap(attrs);
    }

    public @Nullable Attribute getAttr(String name) {
        return attrs.get(name);
    }

    public <A extends Attribute> @Nullable A getAttrOfType(String name, Class<A> type) {
        Attribute attr = attrs.get(name);
        return type.isInstance(attr) ? type.cast(attr) : null;
    }

    public void setAttr(String name, @NotNull Attribute value) {
        attrs.put(name, value);
    }

    public @Nullable Attribute removeAttr(String name) {
        return attrs.remove(name);
    }

    // cloning

    /**
     * Create a copy of this operation without its regions' contents, with operands and
     * successors looked up in {@code mapper}. The results of this operation are mapped to
     * those of the copy in {@code mapper}.
     *
     * @param mapper The mapping.
     * @return The copy, with as many (empty) regions as this.
     */
    public Operation cloneWithoutRegions(IRMapping mapper) {
        List<Value> newOperands = new ArrayList<>(operands.size() + successors.length);
        int nonSuccessor = getNumNonSuccessorOperands();
        for (int i = 0; i < nonSuccessor; i++) {
            newOperands.add(mapper.lookupOrDefault(getOperand(i)));
        }
        List<Block> newSuccessors = new ArrayList<>(successors.length);
        for (int i = 0; i < successors.length; i++) {
            newSuccessors.add(mapper.lookupOrDefault(getSuccessor(i)));
            newOperands.add(null);
            for (Value operand : getSuccessorOperands(i)) {
                newOperands.add(mapper.lookupOrDefault(operand));
            }
        }
        Operation copy = create(location, name, newOperands, getResultTypes(), attrs,
                newSuccessors, regions.length, resizableOperands, context);
        for (int i = 0; i < results.length; i++) {
            mapper.map(results[i], copy.results[i]);
        }
        return copy;
    }

    /**
     * Create a deep copy of this operation, including its regions, remapping values and blocks
     * through {@code mapper}. References inside the cloned regions resolve to the copies.
     *
     * @param mapper The mapping, updated with every cloned value and block.
     * @return The copy.
     */
    public Operation clone(IRMapping mapper) {
        Operation copy = cloneWithoutRegions(mapper);
        for (int i = 0; i < regions.length; i++) {
            regions[i].cloneInto(copy.regions[i], mapper);
        }
        return copy;
    }

    public Operation clone() {
        return clone(new IRMapping());
    }

    // folding

    /**
     * Attempt to fold this operation, first with its kind's hook, then with its dialect's.
     *
     * @param constOperands The constant values of the operands, null where not constant.
     * @param results       The list to add the fold results to; left empty if the operation was updated in place.
     * @return Whether folding succeeded.
     */
    public LogicalResult fold(List<@Nullable Attribute> constOperands, List<FoldResult> results) {
        if (!name.isRegistered()) return LogicalResult.failure();
        FoldHook hook = getNullable(IRExts.FOLDER);
        if (hook != null) {
            List<FoldResult> folded = hook.fold(this, constOperands);
            if (folded != null) {
                // folding to its own results means it was updated in place
                if (!foldsToSelf(folded)) results.addAll(folded);
                return LogicalResult.success();
            }
        }
        Dialect dialect = getDialect();
        if (dialect == null) return LogicalResult.failure();
        List<Attribute> constants = dialect.constantFold(this, constOperands);
        if (constants == null) return LogicalResult.failure();
        for (Attribute constant : constants) {
            results.add(FoldResult.of(constant));
        }
        return LogicalResult.success();
    }

    private boolean foldsToSelf(List<FoldResult> folded) {
        if (folded.isEmpty() || folded.size() != results.length) return false;
        for (int i = 0; i < results.length; i++) {
            FoldResult result = folded.get(i);
            if (!result.isValue() || result.getValue() != results[i]) return false;
        }
        return true;
    }

    // diagnostics

    public LogicalResult emitError(String message) {
        return LogicalResult.failure(context.getDiagEngine().emit(Diagnostic.Severity.ERROR, location, message));
    }

    /**
     * Emit an error prefixed with the name of this operation.
     *
     * @param message The message.
     * @return A failure carrying the diagnostic.
     */
    public LogicalResult emitOpError(String message) {
        return emitError("'" + name + "' op " + message);
    }

    public Diagnostic emitWarning(String message) {
        return context.getDiagEngine().emit(Diagnostic.Severity.WARNING, location, message);
    }

    public Diagnostic emitRemark(String message) {
        return context.getDiagEngine().emit(Diagnostic.Severity.REMARK, location, message);
    }

    // exts

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == IRExts.OWNING_BLOCK) {
            return (T) block;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == IRExts.OWNING_BLOCK) {
            if (destroyed) {
                throw new IllegalStateException("inserting destroyed operation " + name, created);
            }
            if (block != null && value != block) {
                throw new IllegalStateException("operation " + name + " is already in a block", created);
            }
            block = (Block) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == IRExts.OWNING_BLOCK) {
            block = null;
            orderIndex = -1;
            return;
        }
        super.removeExt(ext);
    }

    @Override
    public String toString() {
        return AsmPrinter.print(this);
    }
}
