package io.github.eutro.polyir.dialects.affine.passes;

import io.github.eutro.polyir.core.ir.Operation;
import io.github.eutro.polyir.core.ir.OperationState;
import io.github.eutro.polyir.core.ir.attrs.AffineMapAttr;
import io.github.eutro.polyir.core.passes.IRPass;
import io.github.eutro.polyir.core.passes.InPlaceIRPass;
import io.github.eutro.polyir.core.passes.misc.ForPass;
import io.github.eutro.polyir.dialects.affine.AffineComposition;
import io.github.eutro.polyir.dialects.affine.AffineOps;
import io.github.eutro.polyir.dialects.affine.AffineValueMap;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * A pass which composes every {@link AffineOps#APPLY} nested in an operation with the applications
 * its operands come from, until none is left using another, and erases the applications left unused.
 */
public class SimplifyAffineApplies implements InPlaceIRPass<Operation> {
    private static final Logger LOGGER = Logger.getLogger(SimplifyAffineApplies.class.getName());

    private static final int MAX_ROUNDS = 64;

    public static final SimplifyAffineApplies INSTANCE = new SimplifyAffineApplies();

    @Override
    public void runInPlace(Operation root) {
        int[] composed = {0};
        IRPass<Operation, Operation> composeOne = apply -> {
            AffineValueMap oldValueMap = AffineOps.getAffineValueMap(apply);
            AffineValueMap newValueMap = AffineComposition.composeAffineMapAndOperands(oldValueMap);
            if (newValueMap.equals(oldValueMap)) return apply;
            composed[0]++;
            return Operation.create(new OperationState(apply.getContext(), apply.getLoc(), AffineOps.APPLY)
                    .addOperands(newValueMap.getOperands())
                    .addAttribute(AffineOps.MAP, AffineMapAttr.get(newValueMap.getAffineMap()))
                    .addTypes(apply.getResult(0).getType()));
        };
        InPlaceIRPass<Operation> composeAll = ForPass.liftOps(composeOne, AffineOps.APPLY);

        int rounds = 0;
        int before;
        do {
            if (rounds == MAX_ROUNDS) {
                LOGGER.warning("composition of applications in " + root.getName()
                        + " did not converge in " + MAX_ROUNDS + " rounds");
                break;
            }
            before = composed[0];
            composeAll.runInPlace(root);
            rounds++;
        } while (composed[0] != before);
        int totalRounds = rounds;
        int erased = eraseDeadApplies(root);
        LOGGER.fine(() -> "composed " + composed[0] + " applications in " + root.getName()
                + " over " + totalRounds + " rounds, erased " + erased);
    }

    private static int eraseDeadApplies(Operation root) {
        List<Operation> applies = new ArrayList<>();
        root.walk(op -> {
            if (op != root && op.isKind(AffineOps.APPLY)) applies.add(op);
        });
        int erased = 0;
        // users come after what they use, so erasing backwards frees whole chains
        for (int i = applies.size() - 1; i >= 0; i--) {
            Operation apply = applies.get(i);
            if (apply.useEmpty()) {
                apply.erase();
                erased++;
            }
        }
        return erased;
    }
}
