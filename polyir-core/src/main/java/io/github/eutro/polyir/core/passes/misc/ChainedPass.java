package io.github.eutro.polyir.core.passes.misc;

import io.github.eutro.polyir.core.passes.IRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A pass which runs two others in sequence, feeding the output of the first to the second.
 * <p>
 * Nested chains are flattened, so that a failure can be reported with the index
 * of the pass in the whole chain.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final List<IRPass<Object, Object>> passes;
    private final boolean isInPlace;

    @SuppressWarnings("unchecked")
    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        List<IRPass<Object, Object>> flat = new ArrayList<>();
        for (IRPass<?, ?> pass : new IRPass<?, ?>[]{firstPass, nextPass}) {
            if (pass instanceof ChainedPass) {
                flat.addAll(((ChainedPass<?, ?, ?>) pass).passes);
            } else {
                flat.add((IRPass<Object, Object>) pass);
            }
        }
        passes = Collections.unmodifiableList(flat);
        isInPlace = firstPass.isInPlace() && nextPass.isInPlace();
    }

    public List<IRPass<Object, Object>> getPasses() {
        return passes;
    }

    @Override
    public boolean isInPlace() {
        return isInPlace;
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        Object acc = a;
        for (int i = 0; i < passes.size(); i++) {
            try {
                acc = passes.get(i).run(acc);
            } catch (RuntimeException | Error e) {
                e.addSuppressed(new RuntimeException("running pass " + i + " in chain"));
                throw e;
            }
        }
        return (C) acc;
    }
}
