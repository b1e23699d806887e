package io.github.eutro.polyir.test;

import io.github.eutro.polyir.core.affine.AffineMap;
import io.github.eutro.polyir.core.ir.*;
import io.github.eutro.polyir.core.ir.types.MemRefType;
import io.github.eutro.polyir.core.traits.Verifier;
import io.github.eutro.polyir.dialects.affine.AffineComposition;
import io.github.eutro.polyir.dialects.affine.AffineLoops;
import io.github.eutro.polyir.dialects.affine.AffineOps;
import io.github.eutro.polyir.dialects.affine.AffineValueMap;
import io.github.eutro.polyir.dialects.std.StdOps;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MemRefReplaceTest {
    private static long[] evaluate(AffineValueMap access, Map<Value, Long> values) {
        List<Value> operands = access.getOperands();
        long[] inputs = new long[operands.size()];
        for (int i = 0; i < inputs.length; i++) {
            inputs[i] = values.get(operands.get(i));
        }
        return access.getAffineMap().evaluate(inputs);
    }

    @Test
    void testReplaceLoadsAndStores() {
        Context ctx = Utils.newContext();
        MemRefType type = MemRefType.get(new long[]{10}, ctx.getF32Type(), ctx);
        Operation func = Utils.newFunction(ctx, type, type);
        Value a = Utils.entry(func).getArgument(0);
        Value b = Utils.entry(func).getArgument(1);
        Operation loop = Utils.addLoop(func);
        Value iv = AffineLoops.getInductionVar(loop);
        OpBuilder body = Utils.beforeEnd(AffineLoops.getBody(loop));
        Operation load = AffineOps.createLoad(body, Location.UNKNOWN, a, Collections.singletonList(iv));
        AffineOps.createStore(body, Location.UNKNOWN, load.getResult(0), a, Collections.singletonList(iv));

        assertTrue(AffineComposition.replaceAllMemRefUsesWith(a, b));

        assertTrue(a.useEmpty());
        List<Operation> loads = Utils.opsOfKind(func, AffineOps.LOAD);
        List<Operation> stores = Utils.opsOfKind(func, AffineOps.STORE);
        assertEquals(1, loads.size());
        assertEquals(1, stores.size());
        assertSame(b, AffineOps.getMemRef(loads.get(0)));
        assertEquals(Collections.singletonList(iv), AffineOps.getMapOperands(loads.get(0)));
        assertSame(b, AffineOps.getMemRef(stores.get(0)));
        assertSame(loads.get(0).getResult(0), stores.get(0).getOperand(0));
        assertTrue(load.isDestroyed());
        assertTrue(Verifier.verify(func).succeeded());
    }

    @Test
    void testReplaceWithRemap() {
        Context ctx = Utils.newContext();
        MemRefType oldType = MemRefType.get(new long[]{10}, ctx.getF32Type(), ctx);
        MemRefType newType = MemRefType.get(new long[]{2, 20}, ctx.getF32Type(), ctx);
        Operation func = Utils.newFunction(ctx, oldType, newType, ctx.getIndexType());
        Block entry = Utils.entry(func);
        Value a = entry.getArgument(0);
        Value b = entry.getArgument(1);
        Value n = entry.getArgument(2);
        Operation loop = Utils.addLoop(func);
        Value iv = AffineLoops.getInductionVar(loop);
        OpBuilder body = Utils.beforeEnd(AffineLoops.getBody(loop));
        // a[iv + 1]
        Operation load = AffineOps.createLoad(body, Location.UNKNOWN, a,
                Utils.map(ctx, "(d0) -> (d0 + 1)"), Collections.singletonList(iv));
        Operation user = Utils.use(body, load.getResult(0));

        // b[n, 2 * (iv + 1)]
        assertTrue(AffineComposition.replaceAllMemRefUsesWith(a, b,
                Collections.singletonList(n), Utils.map(ctx, "(d0) -> (d0 * 2)"),
                Collections.<Value>emptyList(), null));

        Operation newLoad = user.getOperand(0).getDefiningOp();
        assertNotNull(newLoad);
        assertTrue(newLoad.isKind(AffineOps.LOAD));
        assertSame(b, AffineOps.getMemRef(newLoad));
        AffineValueMap access = AffineOps.getAffineValueMap(newLoad);
        assertEquals(2, access.getAffineMap().getNumResults());
        Map<Value, Long> values = new HashMap<>();
        values.put(iv, 3L);
        values.put(n, 1L);
        assertArrayEquals(new long[]{1, 8}, evaluate(access, values));
        // the intermediate applications are gone
        assertTrue(Utils.opsOfKind(func, AffineOps.APPLY).isEmpty());
        assertTrue(Verifier.verify(func).succeeded());
    }

    @Test
    void testEscapingUse() {
        Context ctx = Utils.newContext();
        MemRefType type = MemRefType.get(new long[]{10}, ctx.getF32Type(), ctx);
        Operation func = Utils.newFunction(ctx, type, type);
        Block entry = Utils.entry(func);
        Value a = entry.getArgument(0);
        Value b = entry.getArgument(1);
        Value zero = StdOps.createConstantIndex(Utils.beforeEnd(entry), Location.UNKNOWN, 0).getResult(0);
        Operation load = AffineOps.createLoad(Utils.beforeEnd(entry), Location.UNKNOWN, a,
                Collections.singletonList(zero));
        Utils.use(Utils.beforeEnd(entry), a);

        assertFalse(AffineComposition.replaceAllMemRefUsesWith(a, b));
        assertFalse(load.isDestroyed());
        assertSame(a, AffineOps.getMemRef(load));
        assertTrue(b.useEmpty());
    }

    @Test
    void testDominanceFilter() {
        Context ctx = Utils.newContext();
        MemRefType type = MemRefType.get(new long[]{10}, ctx.getF32Type(), ctx);
        Operation func = Utils.newFunction(ctx, type, type, ctx.getIndexType());
        Block entry = Utils.entry(func);
        Value a = entry.getArgument(0);
        Value b = entry.getArgument(1);
        Value i = entry.getArgument(2);
        OpBuilder end = Utils.beforeEnd(entry);
        Operation before = AffineOps.createLoad(end, Location.UNKNOWN, a, Collections.singletonList(i));
        Operation filter = AffineOps.createLoad(end, Location.UNKNOWN, a, Collections.singletonList(i));
        Operation after = AffineOps.createLoad(end, Location.UNKNOWN, a, Collections.singletonList(i));
        Operation user = Utils.use(end, before.getResult(0), filter.getResult(0), after.getResult(0));

        assertTrue(AffineComposition.replaceAllMemRefUsesWith(a, b,
                Collections.<Value>emptyList(), null, Collections.<Value>emptyList(), filter));

        assertSame(before.getResult(0), user.getOperand(0));
        assertSame(a, AffineOps.getMemRef(before));
        assertTrue(filter.isDestroyed());
        assertTrue(after.isDestroyed());
        assertSame(b, AffineOps.getMemRef(user.getOperand(1).getDefiningOp()));
        assertSame(b, AffineOps.getMemRef(user.getOperand(2).getDefiningOp()));
        assertEquals(1, a.getNumUses());
        assertTrue(Verifier.verify(func).succeeded());
    }

    @Test
    void testMismatchedMemRefs() {
        Context ctx = Utils.newContext();
        MemRefType floats = MemRefType.get(new long[]{10}, ctx.getF32Type(), ctx);
        MemRefType ints = MemRefType.get(new long[]{10}, ctx.getIntegerType(32), ctx);
        MemRefType matrix = MemRefType.get(new long[]{10, 10}, ctx.getF32Type(), ctx);
        Operation func = Utils.newFunction(ctx, floats, ints, matrix);
        Block entry = Utils.entry(func);
        Value a = entry.getArgument(0);
        AffineMap remap = Utils.map(ctx, "(d0)[s0] -> (d0 + s0)");

        assertThrows(IllegalArgumentException.class,
                () -> AffineComposition.replaceAllMemRefUsesWith(a, entry.getArgument(1)));
        assertThrows(IllegalArgumentException.class,
                () -> AffineComposition.replaceAllMemRefUsesWith(a, entry.getArgument(2)));
        assertThrows(IllegalArgumentException.class,
                () -> AffineComposition.replaceAllMemRefUsesWith(a, entry.getArgument(2),
                        Collections.<Value>emptyList(), remap, Collections.<Value>emptyList(), null));
    }
}
