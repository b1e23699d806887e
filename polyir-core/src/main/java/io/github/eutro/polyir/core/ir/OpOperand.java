package io.github.eutro.polyir.core.ir;

import org.jetbrains.annotations.Nullable;

/**
 * A use of a {@link Value} by an operation: one slot of its operand list.
 * <p>
 * Setting the operand moves it between the use sets of the old and new values,
 * so the def-use and use-def views always agree.
 */
public final class OpOperand {
    private final Operation owner;
    private int operandNumber;
    private @Nullable Value value;

    OpOperand(Operation owner, int operandNumber, @Nullable Value value) {
        this.owner = owner;
        this.operandNumber = operandNumber;
        set(value);
    }

    public Operation getOwner() {
        return owner;
    }

    public int getOperandNumber() {
        return operandNumber;
    }

    void setOperandNumber(int operandNumber) {
        this.operandNumber = operandNumber;
    }

    /**
     * Get the used value.
     *
     * @return The value, or null if this operand was dropped.
     */
    public @Nullable Value get() {
        return value;
    }

    public void set(@Nullable Value newValue) {
        if (value == newValue) return;
        if (value != null) value.removeUse(this);
        value = newValue;
        if (newValue != null) newValue.addUse(this);
    }

    /**
     * Remove this use from its value, leaving the slot empty.
     */
    public void drop() {
        set(null);
    }

    @Override
    public String toString() {
        return "operand #" + operandNumber + " of " + owner.getName();
    }
}
