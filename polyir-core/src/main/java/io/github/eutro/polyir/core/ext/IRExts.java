package io.github.eutro.polyir.core.ext;

import io.github.eutro.polyir.core.fold.FoldHook;
import io.github.eutro.polyir.core.ir.Block;
import io.github.eutro.polyir.core.ir.Operation;
import io.github.eutro.polyir.core.ir.Region;
import io.github.eutro.polyir.core.print.PrintHook;
import io.github.eutro.polyir.core.diag.LogicalResult;

import java.util.function.Function;

/**
 * Exts shared by the whole IR.
 * <p>
 * The {@code OWNING_*} exts are fast-pathed into fields by the IR classes, and are
 * maintained by the containers themselves; attaching them by hand links an object
 * into a parent without the parent knowing, so don't.
 */
public class IRExts {
    public static final Ext<Block> OWNING_BLOCK = Ext.create(Block.class, "OWNING_BLOCK");
    public static final Ext<Region> OWNING_REGION = Ext.create(Region.class, "OWNING_REGION");
    public static final Ext<Operation> OWNING_OPERATION = Ext.create(Operation.class, "OWNING_OPERATION");

    /**
     * Operation kind specific verification, run after the trait checks.
     */
    public static final Ext<Function<Operation, LogicalResult>> VERIFIER = Ext.create(Function.class, "VERIFIER");
    /**
     * Operation kind specific folding.
     */
    public static final Ext<FoldHook> FOLDER = Ext.create(FoldHook.class, "FOLDER");
    /**
     * Operation kind specific custom assembly form.
     */
    public static final Ext<PrintHook> PRINTER = Ext.create(PrintHook.class, "PRINTER");
    /**
     * Operation kind specific rewrite, returning whether the IR changed.
     */
    public static final Ext<Function<Operation, Boolean>> CANONICALIZER = Ext.create(Function.class, "CANONICALIZER");

    /**
     * A preferred name for a value, used when printing.
     */
    public static final Ext<String> NAME_HINT = Ext.create(String.class, "NAME_HINT");

    /**
     * Whether an ext is one of the operation kind hooks, which operations inherit from their kind.
     *
     * @param ext The ext.
     * @return Whether it is a kind hook.
     */
    public static boolean isKindHook(Ext<?> ext) {
        return ext == VERIFIER || ext == FOLDER || ext == PRINTER || ext == CANONICALIZER;
    }

    public static <T extends ExtContainer> T named(T t, String name) {
        t.attachExt(NAME_HINT, name);
        return t;
    }
}
