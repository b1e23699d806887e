package io.github.eutro.polyir.core.ir;

import io.github.eutro.polyir.core.ir.types.Type;
import org.jetbrains.annotations.Nullable;

/**
 * A value defined as a parameter of a {@link Block}.
 */
public final class BlockArgument extends Value {
    private final Block owner;
    private int argNumber;

    BlockArgument(Block owner, int argNumber, Type type) {
        super(type);
        this.owner = owner;
        this.argNumber = argNumber;
    }

    public Block getOwner() {
        return owner;
    }

    public int getArgNumber() {
        return argNumber;
    }

    void setArgNumber(int argNumber) {
        this.argNumber = argNumber;
    }

    @Override
    public @Nullable Operation getDefiningOp() {
        return null;
    }

    @Override
    public Block getParentBlock() {
        return owner;
    }

    @Override
    public String toString() {
        return "<block argument #" + argNumber + " : " + getType() + ">";
    }
}
