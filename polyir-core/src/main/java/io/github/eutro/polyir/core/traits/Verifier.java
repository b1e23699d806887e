package io.github.eutro.polyir.core.traits;

import io.github.eutro.polyir.core.diag.Diagnostic;
import io.github.eutro.polyir.core.diag.LogicalResult;
import io.github.eutro.polyir.core.ext.IRExts;
import io.github.eutro.polyir.core.ir.*;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.function.Function;

/**
 * Checks the structural validity of operations and everything nested in them.
 * <p>
 * An operation is verified by checking its operands, then each of its kind's traits in declaration order,
 * then its kind's verification hook, then its regions. The first failure stops verification,
 * and is reported through the context's diagnostic engine.
 * <p>
 * Unregistered operations get no trait or hook checks, but their regions are still verified.
 */
public final class Verifier {
    private Verifier() {
    }

    public static LogicalResult verify(Operation op) {
        return verifyOperation(op);
    }

    private static LogicalResult verifyOperation(Operation op) {
        for (int i = 0; i < op.getNumOperands(); i++) {
            if (op.getOperand(i) == null) {
                return op.emitError("null operand found");
            }
        }

        OpKind kind = op.getKind();
        if (kind != null) {
            for (Trait trait : kind.getTraits()) {
                LogicalResult result = trait.verify(op);
                if (result.failed()) return result;
            }
            Function<Operation, LogicalResult> hook = op.getNullable(IRExts.VERIFIER);
            if (hook != null) {
                LogicalResult result = hook.apply(op);
                if (result.failed()) return result;
            }
        }

        LogicalResult dominance = verifyDominance(op);
        if (dominance.failed()) return dominance;

        for (Region region : op.getRegions()) {
            for (Block block : region.getBlocks()) {
                LogicalResult result = verifyBlock(block);
                if (result.failed()) return result;
            }
        }
        return LogicalResult.success();
    }

    private static LogicalResult verifyBlock(Block block) {
        for (BlockArgument arg : block.getArguments()) {
            if (arg.getOwner() != block) {
                return emitBlockError(block, "block argument not owned by block");
            }
        }
        if (block.isEmpty()) {
            return block.isEntryBlock()
                    ? LogicalResult.success()
                    : emitBlockError(block, "block with no terminator");
        }

        List<Operation> ops = block.getOperations();
        for (int i = 0; i < ops.size() - 1; i++) {
            Operation op = ops.get(i);
            if (op.getNumSuccessors() != 0) {
                return op.emitError("operation with block successors must terminate its parent block");
            }
            LogicalResult result = verifyOperation(op);
            if (result.failed()) return result;
        }

        Operation last = block.back();
        LogicalResult result = verifyOperation(last);
        if (result.failed()) return result;
        if (last.isKnownNonTerminator()) {
            return emitBlockError(block, "block with no terminator");
        }
        for (Block successor : last.getSuccessors()) {
            if (successor != null && successor.getParent() != block.getParent()) {
                return last.emitOpError("branching to block of a different region");
            }
        }
        return LogicalResult.success();
    }

    /**
     * Check that every operand is defined before its use in the same block, or in an
     * enclosing region that is reachable without leaving an operation isolated from above.
     * Uses across blocks of the same region are not checked.
     */
    private static LogicalResult verifyDominance(Operation op) {
        for (int i = 0; i < op.getNumOperands(); i++) {
            Value value = op.getOperand(i);
            Block defBlock = value.getParentBlock();
            if (defBlock == null) continue;
            Region defRegion = defBlock.getParent();
            Operation def = value.getDefiningOp();

            Operation current = op;
            while (true) {
                Block currentBlock = current.getBlock();
                if (currentBlock == defBlock) {
                    if (def != null && (def == current || !def.isBeforeInBlock(current))) {
                        return op.emitError("operand #" + i + " does not dominate this use");
                    }
                    break;
                }
                Region currentRegion = currentBlock == null ? null : currentBlock.getParent();
                if (currentRegion == defRegion) break;
                Operation parent = currentRegion == null ? null : currentRegion.getParentOp();
                if (parent == null) {
                    return op.emitError("operand #" + i + " does not dominate this use");
                }
                if (parent.hasTrait(Traits.ISOLATED_FROM_ABOVE)) {
                    return op.emitOpError("using value defined outside the region");
                }
                current = parent;
            }
        }
        return LogicalResult.success();
    }

    private static LogicalResult emitBlockError(Block block, String message) {
        Operation anchor = block.getParentOp();
        if (anchor == null && !block.isEmpty()) anchor = block.front();
        if (anchor == null) {
            return LogicalResult.failure(new Diagnostic(Diagnostic.Severity.ERROR, Location.UNKNOWN, message));
        }
        return anchor.emitError(message);
    }

    /**
     * Verify an operation, throwing if it is invalid.
     *
     * @param op The operation.
     * @throws VerificationException If verification fails.
     */
    public static void verifyOrThrow(Operation op) {
        LogicalResult result = verify(op);
        if (result.failed()) {
            throw new VerificationException(result.getDiagnostic());
        }
    }

    /**
     * Thrown by {@link #verifyOrThrow(Operation)} when verification fails.
     */
    public static final class VerificationException extends RuntimeException {
        private final @Nullable Diagnostic diagnostic;

        public VerificationException(@Nullable Diagnostic diagnostic) {
            super(diagnostic == null ? "verification failed" : diagnostic.toString());
            this.diagnostic = diagnostic;
        }

        public @Nullable Diagnostic getDiagnostic() {
            return diagnostic;
        }
    }
}
