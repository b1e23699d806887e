package io.github.eutro.polyir.core.ir;

import org.jetbrains.annotations.Nullable;

/**
 * A successor edge of a terminator, tracked in the target block's predecessor set.
 */
public final class BlockOperand {
    private final Operation owner;
    private final int successorNumber;
    private @Nullable Block block;

    BlockOperand(Operation owner, int successorNumber, @Nullable Block block) {
        this.owner = owner;
        this.successorNumber = successorNumber;
        set(block);
    }

    public Operation getOwner() {
        return owner;
    }

    public int getSuccessorNumber() {
        return successorNumber;
    }

    public @Nullable Block get() {
        return block;
    }

    public void set(@Nullable Block newBlock) {
        if (block == newBlock) return;
        if (block != null) block.removePredecessorUse(this);
        block = newBlock;
        if (newBlock != null) newBlock.addPredecessorUse(this);
    }

    public void drop() {
        set(null);
    }
}
