package io.github.eutro.polyir.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * A substitution of values and blocks, filled in while cloning IR.
 */
public final class IRMapping {
    private final Map<Value, Value> valueMap = new HashMap<>();
    private final Map<Block, Block> blockMap = new HashMap<>();

    public void map(Value from, Value to) {
        valueMap.put(from, to);
    }

    public void map(Block from, Block to) {
        blockMap.put(from, to);
    }

    public boolean contains(Value from) {
        return valueMap.containsKey(from);
    }

    public boolean contains(Block from) {
        return blockMap.containsKey(from);
    }

    public @Nullable Value lookupOrNull(Value from) {
        return valueMap.get(from);
    }

    public @Nullable Block lookupOrNull(Block from) {
        return blockMap.get(from);
    }

    /**
     * Look up a value, returning it unchanged if it is not mapped.
     *
     * @param from The value.
     * @return The mapped value, or {@code from}.
     */
    public Value lookupOrDefault(Value from) {
        Value to = valueMap.get(from);
        return to == null ? from : to;
    }

    public Block lookupOrDefault(Block from) {
        Block to = blockMap.get(from);
        return to == null ? from : to;
    }

    public Value lookup(Value from) {
        Value to = valueMap.get(from);
        if (to == null) throw new IllegalArgumentException("value is not mapped: " + from);
        return to;
    }

    public void erase(Value from) {
        valueMap.remove(from);
    }

    public void clear() {
        valueMap.clear();
        blockMap.clear();
    }
}
