package io.github.eutro.polyir.dialects.affine.passes;

import io.github.eutro.polyir.core.fold.OperationFolder;
import io.github.eutro.polyir.core.ir.Operation;
import io.github.eutro.polyir.core.passes.InPlaceIRPass;
import io.github.eutro.polyir.dialects.affine.AffineLoops;
import io.github.eutro.polyir.dialects.affine.AffineOps;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * A pass which composes the bounds of every {@link AffineOps#FOR} nested in an operation
 * with the applications their operands come from, then folds the bounds that became constant.
 */
public class FoldAffineForBounds implements InPlaceIRPass<Operation> {
    private static final Logger LOGGER = Logger.getLogger(FoldAffineForBounds.class.getName());

    public static final FoldAffineForBounds INSTANCE = new FoldAffineForBounds();

    @Override
    public void runInPlace(Operation root) {
        List<Operation> loops = new ArrayList<>();
        root.walk(op -> {
            if (op != root && op.isKind(AffineOps.FOR)) loops.add(op);
        });
        OperationFolder folder = new OperationFolder();
        int folded = 0;
        for (Operation loop : loops) {
            AffineLoops.canonicalizeBounds(loop);
            if (folder.tryToFold(loop).succeeded()) folded++;
        }
        int count = folded;
        LOGGER.fine(() -> "folded the bounds of " + count + " of " + loops.size() + " loops in " + root.getName());
    }
}
