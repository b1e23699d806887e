package io.github.eutro.polyir.core.ir;

import io.github.eutro.polyir.core.diag.LogicalResult;
import io.github.eutro.polyir.core.ext.ExtHolder;
import io.github.eutro.polyir.core.ext.IRExts;
import io.github.eutro.polyir.core.fold.FoldHook;
import io.github.eutro.polyir.core.print.PrintHook;
import io.github.eutro.polyir.core.traits.Trait;
import io.github.eutro.polyir.core.traits.Traits;

import java.util.*;
import java.util.function.Function;

/**
 * A kind of operation: its name, the traits it declares, and its hooks.
 * <p>
 * Hooks are stored as exts ({@link IRExts#VERIFIER}, {@link IRExts#FOLDER},
 * {@link IRExts#PRINTER}, {@link IRExts#CANONICALIZER}), which operations
 * of this kind see through delegation.
 */
public final class OpKind extends ExtHolder {
    private final String name;
    private final String dialectNamespace;
    private final List<Trait> traits;
    private final Set<Trait> traitSet;
    private final OperationName operationName;

    private OpKind(String name, String dialectNamespace, List<Trait> traits) {
        this.name = name;
        this.dialectNamespace = dialectNamespace;
        this.traits = Collections.unmodifiableList(new ArrayList<>(traits));
        this.traitSet = new HashSet<>(traits);
        this.operationName = new OperationName(name, this);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public String getDialectNamespace() {
        return dialectNamespace;
    }

    public OperationName getOperationName() {
        return operationName;
    }

    /**
     * Get the traits of this kind, in the order they are checked.
     *
     * @return The traits.
     */
    public List<Trait> getTraits() {
        return traits;
    }

    public boolean hasTrait(Trait trait) {
        return traitSet.contains(trait);
    }

    public boolean isTerminator() {
        return hasTrait(Traits.IS_TERMINATOR);
    }

    @Override
    public String toString() {
        return name;
    }

    public static final class Builder {
        private final String name;
        private String dialectNamespace;
        private final List<Trait> traits = new ArrayList<>();
        private Function<Operation, LogicalResult> verifier;
        private FoldHook folder;
        private PrintHook printer;
        private Function<Operation, Boolean> canonicalizer;

        private Builder(String name) {
            this.name = name;
            int dot = name.indexOf('.');
            dialectNamespace = dot == -1 ? "" : name.substring(0, dot);
        }

        public Builder dialect(String namespace) {
            dialectNamespace = namespace;
            return this;
        }

        public Builder traits(Trait... traits) {
            this.traits.addAll(Arrays.asList(traits));
            return this;
        }

        public Builder verifier(Function<Operation, LogicalResult> verifier) {
            this.verifier = verifier;
            return this;
        }

        public Builder folder(FoldHook folder) {
            this.folder = folder;
            return this;
        }

        public Builder printer(PrintHook printer) {
            this.printer = printer;
            return this;
        }

        public Builder canonicalizer(Function<Operation, Boolean> canonicalizer) {
            this.canonicalizer = canonicalizer;
            return this;
        }

        public OpKind build() {
            OpKind kind = new OpKind(name, dialectNamespace, traits);
            if (verifier != null) kind.attachExt(IRExts.VERIFIER, verifier);
            if (folder != null) kind.attachExt(IRExts.FOLDER, folder);
            if (printer != null) kind.attachExt(IRExts.PRINTER, printer);
            if (canonicalizer != null) kind.attachExt(IRExts.CANONICALIZER, canonicalizer);
            return kind;
        }
    }
}
