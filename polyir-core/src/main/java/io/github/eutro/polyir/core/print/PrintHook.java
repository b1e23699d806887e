package io.github.eutro.polyir.core.print;

import io.github.eutro.polyir.core.ir.Operation;

/**
 * Prints the custom form of an operation, after its results have been printed.
 */
@FunctionalInterface
public interface PrintHook {
    void print(Operation op, AsmPrinter printer);
}
