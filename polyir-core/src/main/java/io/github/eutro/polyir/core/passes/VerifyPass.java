package io.github.eutro.polyir.core.passes;

import io.github.eutro.polyir.core.ir.Operation;
import io.github.eutro.polyir.core.traits.Verifier;

/**
 * A pass which verifies an operation and everything nested in it, throwing
 * a {@link Verifier.VerificationException} if it is invalid.
 */
public class VerifyPass implements InPlaceIRPass<Operation> {
    public static final VerifyPass INSTANCE = new VerifyPass();

    @Override
    public void runInPlace(Operation op) {
        Verifier.verifyOrThrow(op);
    }
}
