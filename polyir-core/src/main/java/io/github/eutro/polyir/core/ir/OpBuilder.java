package io.github.eutro.polyir.core.ir;

import io.github.eutro.polyir.core.affine.AffineMap;
import io.github.eutro.polyir.core.ir.attrs.AffineMapAttr;
import io.github.eutro.polyir.core.ir.attrs.IntegerAttr;
import io.github.eutro.polyir.core.ir.types.IndexType;
import io.github.eutro.polyir.core.ir.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * An operation builder, which encapsulates a position in a block
 * where operations are being inserted.
 */
public class OpBuilder {
    private final Context context;
    private @Nullable Block block;
    // null to insert at the end of the block
    private @Nullable Operation insertBefore;

    /**
     * Construct a builder that creates detached operations until an insertion point is set.
     *
     * @param context The context.
     */
    public OpBuilder(Context context) {
        this.context = context;
    }

    public OpBuilder(Context context, Block block) {
        this(context);
        setInsertionPointToEnd(block);
    }

    /**
     * Construct a builder inserting right before an operation.
     *
     * @param op The operation.
     * @return The builder.
     */
    public static OpBuilder before(Operation op) {
        OpBuilder builder = new OpBuilder(op.getContext());
        builder.setInsertionPoint(op);
        return builder;
    }

    public static OpBuilder atBlockBegin(Context context, Block block) {
        OpBuilder builder = new OpBuilder(context);
        builder.setInsertionPointToStart(block);
        return builder;
    }

    public Context getContext() {
        return context;
    }

    public @Nullable Block getInsertionBlock() {
        return block;
    }

    public void clearInsertionPoint() {
        block = null;
        insertBefore = null;
    }

    public void setInsertionPoint(Operation op) {
        Block opBlock = op.getBlock();
        if (opBlock == null) throw new IllegalArgumentException("operation is not in a block");
        block = opBlock;
        insertBefore = op;
    }

    public void setInsertionPointAfter(Operation op) {
        Block opBlock = op.getBlock();
        if (opBlock == null) throw new IllegalArgumentException("operation is not in a block");
        List<Operation> ops = opBlock.getOperations();
        int index = opBlock.indexOf(op);
        block = opBlock;
        insertBefore = index + 1 < ops.size() ? ops.get(index + 1) : null;
    }

    public void setInsertionPointToStart(Block block) {
        this.block = block;
        insertBefore = block.isEmpty() ? null : block.front();
    }

    public void setInsertionPointToEnd(Block block) {
        this.block = block;
        insertBefore = null;
    }

    /**
     * Insert an operation at the insertion point, if there is one.
     *
     * @param op The operation.
     * @return The same operation.
     */
    public Operation insert(Operation op) {
        if (block != null) {
            if (insertBefore == null) {
                block.addOperation(op);
            } else {
                block.insertBefore(insertBefore, op);
            }
        }
        return op;
    }

    public Operation create(OperationState state) {
        return insert(Operation.create(state));
    }

    /**
     * Append a new block to a region and move the insertion point to its end.
     *
     * @param parent   The region.
     * @param argTypes The types of the block arguments.
     * @return The block.
     */
    public Block createBlock(Region parent, List<? extends Type> argTypes) {
        Block newBlock = parent.addBlock();
        newBlock.addArguments(argTypes);
        setInsertionPointToEnd(newBlock);
        return newBlock;
    }

    public IndexType getIndexType() {
        return IndexType.get(context);
    }

    public IntegerAttr getIndexAttr(long value) {
        return IntegerAttr.get(getIndexType(), value);
    }

    public AffineMapAttr getAffineMapAttr(AffineMap map) {
        return AffineMapAttr.get(map);
    }
}
