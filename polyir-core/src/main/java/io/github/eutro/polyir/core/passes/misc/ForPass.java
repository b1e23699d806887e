package io.github.eutro.polyir.core.passes.misc;

import io.github.eutro.polyir.core.ir.Block;
import io.github.eutro.polyir.core.ir.OpKind;
import io.github.eutro.polyir.core.ir.Operation;
import io.github.eutro.polyir.core.ir.Region;
import io.github.eutro.polyir.core.passes.IRPass;
import io.github.eutro.polyir.core.passes.InPlaceIRPass;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Lifts passes which operate on parts of the IR into passes that operate on
 * every such part nested in an operation.
 */
public class ForPass {
    /**
     * Lift an operation pass to run on every operation nested in the root, in post-order.
     * The root itself is not visited.
     * <p>
     * If the pass is not in-place and returns a different operation, that operation takes
     * the place of the old one, which is erased after its results are replaced.
     *
     * @param pass The operation pass.
     * @return The lifted pass.
     */
    public static Ops liftOps(IRPass<Operation, Operation> pass) {
        return new Ops(pass, null);
    }

    /**
     * Lift an operation pass to run on every nested operation of a kind.
     *
     * @param pass The operation pass.
     * @param kind The kind of operations to run on.
     * @return The lifted pass.
     */
    public static Ops liftOps(IRPass<Operation, Operation> pass, OpKind kind) {
        return new Ops(pass, kind);
    }

    /**
     * Lift a block pass to run on every block nested in the root.
     *
     * @param pass The block pass.
     * @return The lifted pass.
     */
    public static Blocks liftBlocks(InPlaceIRPass<Block> pass) {
        return new Blocks(pass);
    }

    /**
     * An operation pass lifted to run on all nested operations.
     */
    public static class Ops extends AbstractForPass<Operation> {
        private final @Nullable OpKind kind;

        private Ops(IRPass<Operation, Operation> pass, @Nullable OpKind kind) {
            super(pass);
            this.kind = kind;
        }

        @Override
        List<Operation> collect(Operation root) {
            List<Operation> ops = new ArrayList<>();
            root.walk(op -> {
                if (op != root && (kind == null || op.isKind(kind))) ops.add(op);
            });
            return ops;
        }

        @Override
        boolean isLive(Operation op) {
            return !op.isDestroyed();
        }

        @Override
        void replace(Operation old, Operation replacement) {
            Block block = old.getBlock();
            if (block == null) throw new IllegalStateException("replacing an operation that is not in a block");
            if (replacement.getBlock() == null) block.insertBefore(old, replacement);
            old.replaceAllUsesWith(replacement.getResults());
            old.erase();
        }
    }

    /**
     * A block pass lifted to run on all nested blocks.
     */
    public static class Blocks extends AbstractForPass<Block> {
        private Blocks(InPlaceIRPass<Block> pass) {
            super(pass);
        }

        @Override
        List<Block> collect(Operation root) {
            List<Block> blocks = new ArrayList<>();
            root.walk(op -> {
                for (Region region : op.getRegions()) {
                    blocks.addAll(region.getBlocks());
                }
            });
            return blocks;
        }

        @Override
        boolean isLive(Block block) {
            return block.getParent() != null;
        }

        @Override
        void replace(Block old, Block replacement) {
            throw new UnsupportedOperationException("block passes must be in-place");
        }
    }

    private static abstract class AbstractForPass<T> implements InPlaceIRPass<Operation> {
        private final IRPass<T, T> pass;

        private AbstractForPass(IRPass<T, T> pass) {
            this.pass = pass;
        }

        abstract List<T> collect(Operation root);

        abstract boolean isLive(T t);

        abstract void replace(T old, T replacement);

        @Override
        public void runInPlace(Operation root) {
            // elements are collected first, the pass may erase the ones it is not visiting
            List<T> elements = collect(root);
            int i = 0;
            try {
                for (; i < elements.size(); i++) {
                    T element = elements.get(i);
                    if (!isLive(element)) continue;
                    T result = pass.run(element);
                    if (!pass.isInPlace() && result != element) {
                        replace(element, result);
                    }
                }
            } catch (RuntimeException | Error e) {
                e.addSuppressed(new RuntimeException("in element " + i));
                throw e;
            }
        }
    }
}
