package io.github.eutro.polyir.core.ir;

import io.github.eutro.polyir.core.ext.Ext;
import io.github.eutro.polyir.core.ext.ExtHolder;
import io.github.eutro.polyir.core.ext.IRExts;
import io.github.eutro.polyir.core.ext.TrackedList;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * An ordered list of {@link Block}s owned by an {@link Operation}. The first block is the entry block.
 */
public final class Region extends ExtHolder {
    private final TrackedList<Block> blocks = new TrackedList<Block>(new ArrayList<>()) {
        @Override
        protected void onAdded(Block elt) {
            elt.attachExt(IRExts.OWNING_REGION, Region.this);
        }

        @Override
        protected void onRemoved(Block elt) {
            elt.removeExt(IRExts.OWNING_REGION);
        }
    };
    private @Nullable Operation parentOp;

    /**
     * Create a region with no owner. Regions of operations are created with them.
     */
    public Region() {
    }

    public @Nullable Operation getParentOp() {
        return parentOp;
    }

    public List<Block> getBlocks() {
        return blocks;
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    public Block front() {
        if (blocks.isEmpty()) throw new NoSuchElementException("empty region");
        return blocks.get(0);
    }

    public Block back() {
        if (blocks.isEmpty()) throw new NoSuchElementException("empty region");
        return blocks.get(blocks.size() - 1);
    }

    /**
     * Append a new, empty block to this region.
     *
     * @return The block.
     */
    public Block addBlock() {
        Block block = new Block();
        blocks.add(block);
        return block;
    }

    /**
     * Whether this region is, or is nested inside, another.
     *
     * @param other The other region.
     * @return Whether other contains this.
     */
    public boolean isAncestor(Region other) {
        Region region = other;
        while (region != null) {
            if (region == this) return true;
            Operation op = region.getParentOp();
            region = op == null ? null : op.getParentRegion();
        }
        return false;
    }

    /**
     * Make sure this region has a block ending in a terminator.
     * <p>
     * If the region is empty, a block is created; if the last block doesn't end with
     * a known terminator, one is built and appended.
     *
     * @param buildTerminator Builds a fresh terminator.
     */
    public void ensureTerminator(Supplier<Operation> buildTerminator) {
        if (blocks.isEmpty()) {
            addBlock();
        }
        Block block = back();
        if (!block.isEmpty() && block.back().isKnownTerminator()) return;
        block.addOperation(buildTerminator.get());
    }

    /**
     * Clone the blocks of this region to the end of another, mapping blocks, block arguments
     * and operation results through {@code mapper}.
     * <p>
     * Block arguments that are already mapped are not recreated, which lets callers bind
     * them to existing values. Operands are remapped once every block is cloned, so uses of
     * values defined in blocks listed later also resolve to the copies.
     *
     * @param dest   The destination region.
     * @param mapper The mapping.
     */
    public void cloneInto(Region dest, IRMapping mapper) {
        if (dest == this) throw new IllegalArgumentException("cloning a region into itself");
        List<Block> newBlocks = new ArrayList<>(blocks.size());
        for (Block block : blocks) {
            Block newBlock = new Block();
            mapper.map(block, newBlock);
            for (BlockArgument arg : block.getArguments()) {
                if (!mapper.contains(arg)) {
                    mapper.map(arg, newBlock.addArgument(arg.getType()));
                }
            }
            newBlocks.add(newBlock);
        }
        // blocks first, so that forward branches resolve
        for (int i = 0; i < blocks.size(); i++) {
            Block newBlock = newBlocks.get(i);
            for (Operation op : blocks.get(i).getOperations()) {
                newBlock.addOperation(op.clone(mapper));
            }
        }
        // uses of values defined in blocks listed later
        for (Block newBlock : newBlocks) {
            newBlock.walk(op -> remapReferences(op, mapper));
        }
        dest.blocks.addAll(newBlocks);
    }

    private static void remapReferences(Operation op, IRMapping mapper) {
        for (int i = 0; i < op.getNumOperands(); i++) {
            Value operand = op.getOperand(i);
            Value mapped = operand == null ? null : mapper.lookupOrNull(operand);
            if (mapped != null) op.setOperand(i, mapped);
        }
        for (int i = 0; i < op.getNumSuccessors(); i++) {
            Block successor = op.getSuccessor(i);
            Block mapped = successor == null ? null : mapper.lookupOrNull(successor);
            if (mapped != null) op.setSuccessor(mapped, i);
        }
    }

    /**
     * Move the blocks of another region into this one, destroying any blocks of this one.
     *
     * @param other The region to take from.
     */
    public void takeBody(Region other) {
        clear();
        List<Block> taken = new ArrayList<>(other.blocks);
        other.blocks.clear();
        blocks.addAll(taken);
    }

    public void dropAllReferences() {
        for (Block block : blocks) {
            block.dropAllReferences();
        }
    }

    /**
     * Destroy all blocks of this region.
     */
    void clear() {
        for (Block block : blocks) {
            block.dropAllReferences();
        }
        for (Block block : blocks) {
            block.dropAllDefinedValueUses();
        }
        for (int i = blocks.size() - 1; i >= 0; i--) {
            blocks.remove(i).clear();
        }
    }

    public void walk(Consumer<Operation> visitor) {
        for (Block block : new ArrayList<>(blocks)) {
            block.walk(visitor);
        }
    }

    // exts

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == IRExts.OWNING_OPERATION) {
            return (T) parentOp;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == IRExts.OWNING_OPERATION) {
            if (parentOp != null && value != parentOp) {
                throw new IllegalStateException("region already belongs to " + parentOp.getName());
            }
            parentOp = (Operation) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == IRExts.OWNING_OPERATION) {
            throw new IllegalStateException("regions can't be detached from their operation");
        }
        super.removeExt(ext);
    }
}
