package io.github.eutro.polyir.core.ir;

import io.github.eutro.polyir.core.ext.Ext;
import io.github.eutro.polyir.core.ext.ExtHolder;
import io.github.eutro.polyir.core.ext.IRExts;
import io.github.eutro.polyir.core.ext.TrackedList;
import io.github.eutro.polyir.core.ir.types.Type;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.function.Consumer;

/**
 * An ordered list of {@link Operation}s with typed {@link BlockArgument}s, in a {@link Region}.
 * <p>
 * If the block is not empty, its last operation should be a terminator; this is checked by
 * verification, not by the block.
 * <p>
 * Blocks number their operations lazily, so that {@link Operation#isBeforeInBlock(Operation)}
 * is cheap between mutations.
 */
public final class Block extends ExtHolder {
    private final TrackedList<Operation> operations = new TrackedList<Operation>(new ArrayList<>()) {
        @Override
        protected void onAdded(Operation elt) {
            elt.attachExt(IRExts.OWNING_BLOCK, Block.this);
            invalidateOpOrder();
        }

        @Override
        protected void onRemoved(Operation elt) {
            elt.removeExt(IRExts.OWNING_BLOCK);
        }
    };
    private final List<BlockArgument> arguments = new ArrayList<>();
    private final Set<BlockOperand> predecessorUses = new LinkedHashSet<>();
    private @Nullable Region parent;
    private boolean orderValid = false;

    public Block() {
    }

    // parents

    public @Nullable Region getParent() {
        return parent;
    }

    public @Nullable Operation getParentOp() {
        return parent == null ? null : parent.getParentOp();
    }

    public boolean isEntryBlock() {
        return parent != null && !parent.isEmpty() && parent.front() == this;
    }

    // arguments

    public List<BlockArgument> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    public int getNumArguments() {
        return arguments.size();
    }

    public BlockArgument getArgument(int i) {
        return arguments.get(i);
    }

    public List<Type> getArgumentTypes() {
        List<Type> types = new ArrayList<>(arguments.size());
        for (BlockArgument argument : arguments) {
            types.add(argument.getType());
        }
        return types;
    }

    public BlockArgument addArgument(@NotNull Type type) {
        BlockArgument arg = new BlockArgument(this, arguments.size(), type);
        arguments.add(arg);
        return arg;
    }

    public List<BlockArgument> addArguments(List<? extends Type> types) {
        List<BlockArgument> added = new ArrayList<>(types.size());
        for (Type type : types) {
            added.add(addArgument(type));
        }
        return added;
    }

    /**
     * Erase an unused argument of this block.
     *
     * @param i The index of the argument.
     * @throws IllegalStateException If the argument is still used.
     */
    public void eraseArgument(int i) {
        BlockArgument arg = arguments.get(i);
        if (!arg.useEmpty()) {
            throw new IllegalStateException("erasing block argument #" + i + " which still has uses");
        }
        arguments.remove(i);
        for (int j = i; j < arguments.size(); j++) {
            arguments.get(j).setArgNumber(j);
        }
    }

    // operations

    /**
     * Get the operations of this block, as a mutable list. Inserting an operation that is
     * already in a block is an error.
     *
     * @return The operations.
     */
    public List<Operation> getOperations() {
        return operations;
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public Operation front() {
        if (operations.isEmpty()) throw new NoSuchElementException("empty block");
        return operations.get(0);
    }

    public Operation back() {
        if (operations.isEmpty()) throw new NoSuchElementException("empty block");
        return operations.get(operations.size() - 1);
    }

    public void addOperation(Operation op) {
        operations.add(op);
    }

    public void insertBefore(Operation existing, Operation op) {
        int index = indexOf(existing);
        if (index == -1) throw new IllegalArgumentException("operation is not in this block");
        operations.add(index, op);
    }

    public int indexOf(Operation op) {
        if (op.getBlock() != this) return -1;
        if (isOpOrderValid()) {
            int guess = op.orderIndex;
            if (guess < operations.size() && operations.get(guess) == op) return guess;
        }
        return operations.indexOf(op);
    }

    /**
     * Get the terminator of this block.
     *
     * @return The last operation, or null if the block is empty or its last operation is known not to terminate.
     */
    public @Nullable Operation getTerminator() {
        if (operations.isEmpty()) return null;
        Operation last = back();
        return last.isKnownNonTerminator() ? null : last;
    }

    /**
     * Find the operation in this block that is, or contains, the given operation.
     *
     * @param op The operation.
     * @return The ancestor in this block, or null if there is none.
     */
    public @Nullable Operation findAncestorOpInBlock(Operation op) {
        Operation current = op;
        while (current != null && current.getBlock() != this) {
            current = current.getParentOp();
        }
        return current;
    }

    public boolean isOpOrderValid() {
        return orderValid;
    }

    public void invalidateOpOrder() {
        orderValid = false;
    }

    public void recomputeOpOrder() {
        int i = 0;
        for (Operation op : operations) {
            op.orderIndex = i++;
        }
        orderValid = true;
    }

    // control flow

    public List<Block> getSuccessors() {
        Operation terminator = getTerminator();
        return terminator == null ? Collections.<Block>emptyList() : terminator.getSuccessors();
    }

    /**
     * Get the operations that branch to this block, once per edge.
     *
     * @return The predecessor terminators.
     */
    public List<Operation> getPredecessorOps() {
        List<Operation> preds = new ArrayList<>(predecessorUses.size());
        for (BlockOperand use : predecessorUses) {
            preds.add(use.getOwner());
        }
        return preds;
    }

    public boolean hasNoPredecessors() {
        return predecessorUses.isEmpty();
    }

    void addPredecessorUse(BlockOperand use) {
        predecessorUses.add(use);
    }

    void removePredecessorUse(BlockOperand use) {
        predecessorUses.remove(use);
    }

    /**
     * Split this block before an operation. That operation and everything after it
     * are moved into a new block, inserted after this one in the same region.
     *
     * @param splitBefore The first operation of the new block.
     * @return The new block.
     */
    public Block splitBlock(Operation splitBefore) {
        int index = indexOf(splitBefore);
        if (index == -1) throw new IllegalArgumentException("operation is not in this block");
        Block newBlock = new Block();
        if (parent != null) {
            List<Block> blocks = parent.getBlocks();
            blocks.add(blocks.indexOf(this) + 1, newBlock);
        }
        List<Operation> tail = new ArrayList<>(operations.subList(index, operations.size()));
        for (Operation op : tail) {
            op.moveToEnd(newBlock);
        }
        return newBlock;
    }

    // lifecycle

    public void dropAllReferences() {
        for (Operation op : operations) {
            op.dropAllReferences();
        }
    }

    public void dropAllDefinedValueUses() {
        for (BlockArgument argument : arguments) {
            argument.dropAllUses();
        }
        for (Operation op : operations) {
            op.dropAllDefinedValueUses();
        }
    }

    /**
     * Destroy every operation in this block, last to first.
     * References into and out of the operations must already have been dropped.
     */
    void clear() {
        for (int i = operations.size() - 1; i >= 0; i--) {
            operations.remove(i).destroy();
        }
    }

    /**
     * Unlink this block from its region and destroy its contents.
     */
    public void erase() {
        if (parent != null) {
            parent.getBlocks().remove(this);
        }
        dropAllReferences();
        dropAllDefinedValueUses();
        clear();
    }

    public void walk(Consumer<Operation> visitor) {
        for (Operation op : new ArrayList<>(operations)) {
            op.walk(visitor);
        }
    }

    // exts

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == IRExts.OWNING_REGION) {
            return (T) parent;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == IRExts.OWNING_REGION) {
            if (parent != null && value != parent) {
                throw new IllegalStateException("block is already in a region");
            }
            parent = (Region) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == IRExts.OWNING_REGION) {
            parent = null;
            return;
        }
        super.removeExt(ext);
    }
}
