package io.github.eutro.polyir.core.ir;

import io.github.eutro.polyir.core.ext.ExtHolder;
import io.github.eutro.polyir.core.ir.types.Type;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * An SSA value: either a {@link BlockArgument} or an {@link OpResult}.
 * <p>
 * Values are compared by identity. Each value keeps the set of {@link OpOperand}s
 * that currently refer to it, which operands maintain as they are set.
 */
public abstract class Value extends ExtHolder {
    private Type type;
    // insertion ordered so that use iteration is deterministic
    private final Set<OpOperand> uses = new LinkedHashSet<>();

    Value(@NotNull Type type) {
        this.type = type;
    }

    public Type getType() {
        return type;
    }

    public void setType(@NotNull Type type) {
        this.type = type;
    }

    public Context getContext() {
        return type.getContext();
    }

    /**
     * Get the operation that defines this value.
     *
     * @return The operation, or null if this is a block argument.
     */
    public abstract @Nullable Operation getDefiningOp();

    /**
     * Get the block this value is defined in.
     *
     * @return The block, or null if the defining operation is not in a block.
     */
    public abstract @Nullable Block getParentBlock();

    public @Nullable Region getParentRegion() {
        Block block = getParentBlock();
        return block == null ? null : block.getParent();
    }

    /**
     * Get the uses of this value. The returned collection is a snapshot,
     * so the uses may be modified while iterating it.
     *
     * @return The uses.
     */
    public List<OpOperand> getUses() {
        return new ArrayList<>(uses);
    }

    /**
     * Get the operation of every use of this value, once per use.
     *
     * @return The users.
     */
    public List<Operation> getUsers() {
        List<Operation> users = new ArrayList<>(uses.size());
        for (OpOperand use : uses) {
            users.add(use.getOwner());
        }
        return users;
    }

    public int getNumUses() {
        return uses.size();
    }

    public boolean useEmpty() {
        return uses.isEmpty();
    }

    public boolean hasOneUse() {
        return uses.size() == 1;
    }

    /**
     * Make every use of this value refer to another value instead.
     *
     * @param newValue The replacement.
     */
    public void replaceAllUsesWith(@NotNull Value newValue) {
        if (newValue == this) return;
        for (OpOperand use : getUses()) {
            use.set(newValue);
        }
    }

    /**
     * Drop every use of this value, leaving the operands empty.
     */
    public void dropAllUses() {
        for (OpOperand use : getUses()) {
            use.drop();
        }
    }

    void addUse(OpOperand use) {
        uses.add(use);
    }

    void removeUse(OpOperand use) {
        uses.remove(use);
    }
}
