package io.github.eutro.polyir.core.passes;

import io.github.eutro.polyir.core.fold.OperationFolder;
import io.github.eutro.polyir.core.ir.Operation;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * A pass which folds every operation nested in an operation, in post-order,
 * sharing materialized constants through a single {@link OperationFolder}.
 */
public class FoldPass implements InPlaceIRPass<Operation> {
    private static final Logger LOGGER = Logger.getLogger(FoldPass.class.getName());

    public static final FoldPass INSTANCE = new FoldPass();

    @Override
    public void runInPlace(Operation root) {
        OperationFolder folder = new OperationFolder();
        List<Operation> ops = new ArrayList<>();
        root.walk(op -> {
            if (op != root) ops.add(op);
        });
        int folded = 0;
        for (Operation op : ops) {
            if (op.isDestroyed()) continue;
            if (folder.tryToFold(op).succeeded()) folded++;
        }
        int count = folded;
        LOGGER.fine(() -> "folded " + count + " of " + ops.size() + " operations in " + root.getName());
    }
}
