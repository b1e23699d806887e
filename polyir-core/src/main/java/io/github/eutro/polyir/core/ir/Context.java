package io.github.eutro.polyir.core.ir;

import io.github.eutro.polyir.core.builtin.BuiltinDialect;
import io.github.eutro.polyir.core.diag.DiagnosticEngine;
import io.github.eutro.polyir.core.ext.ExtHolder;
import io.github.eutro.polyir.core.ir.types.FloatType;
import io.github.eutro.polyir.core.ir.types.IndexType;
import io.github.eutro.polyir.core.ir.types.IntegerType;
import io.github.eutro.polyir.core.ir.types.NoneType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.function.Function;

/**
 * The owner of everything shared by the IR of one compilation: uniqued types,
 * attributes and affine structures, loaded dialects and their operation kinds,
 * and the diagnostic engine.
 * <p>
 * A context is not thread-safe.
 */
public final class Context extends ExtHolder {
    private final Map<Object, Object> uniqued = new HashMap<>();
    private final Map<String, Dialect> dialects = new LinkedHashMap<>();
    private final Map<String, OpKind> opKinds = new HashMap<>();
    private final DiagnosticEngine diagEngine = new DiagnosticEngine();

    public Context() {
        loadDialect(BuiltinDialect::new);
    }

    /**
     * Get the canonical instance structurally equal to {@code candidate},
     * making {@code candidate} canonical if there is none yet.
     *
     * @param candidate The candidate.
     * @param <T>       The type of the object.
     * @return The canonical instance.
     */
    @SuppressWarnings("unchecked")
    public <T> T unique(@NotNull T candidate) {
        Object existing = uniqued.putIfAbsent(candidate, candidate);
        return existing == null ? candidate : (T) existing;
    }

    /**
     * Load a dialect into this context, unless one with the same namespace is already loaded.
     *
     * @param ctor The dialect constructor.
     * @param <D>  The type of the dialect.
     * @return The loaded dialect.
     */
    @SuppressWarnings("unchecked")
    public <D extends Dialect> D loadDialect(Function<Context, D> ctor) {
        D dialect = ctor.apply(this);
        Dialect existing = dialects.get(dialect.getNamespace());
        if (existing != null) {
            if (existing.getClass() != dialect.getClass()) {
                throw new IllegalStateException("dialect namespace '" + dialect.getNamespace()
                        + "' is already taken by " + existing.getClass().getName());
            }
            return (D) existing;
        }
        dialects.put(dialect.getNamespace(), dialect);
        dialect.initialize();
        return dialect;
    }

    public @Nullable Dialect getLoadedDialect(String namespace) {
        return dialects.get(namespace);
    }

    public Collection<Dialect> getLoadedDialects() {
        return Collections.unmodifiableCollection(dialects.values());
    }

    void registerOpKind(Dialect dialect, OpKind kind) {
        if (!kind.getDialectNamespace().equals(dialect.getNamespace())) {
            throw new IllegalArgumentException("operation " + kind.getName()
                    + " does not belong to dialect " + dialect.getNamespace());
        }
        OpKind old = opKinds.putIfAbsent(kind.getName(), kind);
        if (old != null && old != kind) {
            throw new IllegalStateException("operation " + kind.getName() + " is already registered");
        }
    }

    /**
     * Look up a registered operation kind by its full name.
     *
     * @param name The name.
     * @return The kind, or null if no loaded dialect registers it.
     */
    public @Nullable OpKind lookupOpKind(String name) {
        return opKinds.get(name);
    }

    public boolean isRegistered(OpKind kind) {
        return opKinds.get(kind.getName()) == kind;
    }

    public DiagnosticEngine getDiagEngine() {
        return diagEngine;
    }

    public IndexType getIndexType() {
        return IndexType.get(this);
    }

    public IntegerType getIntegerType(int width) {
        return IntegerType.get(width, this);
    }

    public FloatType getF32Type() {
        return FloatType.get(32, this);
    }

    public NoneType getNoneType() {
        return NoneType.get(this);
    }
}
