package io.github.eutro.polyir.core.passes;

import io.github.eutro.polyir.core.ext.IRExts;
import io.github.eutro.polyir.core.ir.Operation;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * A pass which repeatedly applies the {@link IRExts#CANONICALIZER} hooks of nested operations
 * until none of them changes anything, or an iteration limit is reached.
 */
public class CanonicalizePass implements InPlaceIRPass<Operation> {
    private static final Logger LOGGER = Logger.getLogger(CanonicalizePass.class.getName());
    public static final int DEFAULT_MAX_ITERATIONS = 10;

    public static final CanonicalizePass INSTANCE = new CanonicalizePass(DEFAULT_MAX_ITERATIONS);

    private final int maxIterations;

    public CanonicalizePass(int maxIterations) {
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be at least 1");
        this.maxIterations = maxIterations;
    }

    @Override
    public void runInPlace(Operation root) {
        for (int iteration = 0; iteration < maxIterations; iteration++) {
            if (!runOnce(root)) {
                int n = iteration;
                LOGGER.fine(() -> "canonicalized " + root.getName() + " after " + n + " changing iterations");
                return;
            }
        }
        LOGGER.fine(() -> "canonicalization of " + root.getName() + " did not converge in "
                + maxIterations + " iterations");
    }

    private static boolean runOnce(Operation root) {
        List<Operation> ops = new ArrayList<>();
        root.walk(op -> {
            if (op != root) ops.add(op);
        });
        boolean changed = false;
        for (Operation op : ops) {
            if (op.isDestroyed() || !op.isRegistered()) continue;
            Function<Operation, Boolean> hook = op.getNullable(IRExts.CANONICALIZER);
            if (hook != null && hook.apply(op)) changed = true;
        }
        return changed;
    }
}
