package io.github.eutro.polyir.test;

import io.github.eutro.polyir.core.affine.AffineMap;
import io.github.eutro.polyir.core.ir.*;
import io.github.eutro.polyir.core.traits.Verifier;
import io.github.eutro.polyir.dialects.affine.AffineComposition;
import io.github.eutro.polyir.dialects.affine.AffineLoops;
import io.github.eutro.polyir.dialects.affine.AffineOps;
import io.github.eutro.polyir.dialects.affine.AffineValueMap;
import io.github.eutro.polyir.dialects.std.StdOps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AffineComposeTest {
    private Context ctx;
    private Operation func;
    private Value a;
    private Value iv;
    // inserts in the body of a loop, where the induction variable is a dimension but not a symbol
    private OpBuilder body;

    @BeforeEach
    void setUp() {
        ctx = Utils.newContext();
        func = Utils.newFunction(ctx, ctx.getIndexType());
        a = Utils.entry(func).getArgument(0);
        Operation loop = Utils.addLoop(func);
        iv = AffineLoops.getInductionVar(loop);
        body = Utils.beforeEnd(AffineLoops.getBody(loop));
    }

    private AffineValueMap compose(Operation apply) {
        return AffineComposition.composeAffineMapAndOperands(AffineOps.getAffineMap(apply), apply.getOperands());
    }

    @Test
    void testSameOperandTwice() {
        Operation diff = Utils.apply(body, "(d0, d1) -> (d0 - d1)", a, a);
        AffineValueMap composed = compose(diff);
        assertEquals("() -> (0)", composed.getAffineMap().toString());
        assertTrue(composed.getOperands().isEmpty());
    }

    @Test
    void testOneLevel() {
        Operation x = Utils.apply(body, "(d0) -> (d0 + 1)", iv);
        Operation y = Utils.apply(body, "(d0) -> (d0 * 2)", x.getResult(0));

        AffineValueMap composed = compose(y);
        assertEquals("(d0) -> (d0 * 2 + 2)", composed.getAffineMap().toString());
        assertEquals(Collections.singletonList(iv), composed.getOperands());
        for (long i = -3; i <= 3; i++) {
            assertEquals((i + 1) * 2, composed.getAffineMap().evaluate(i)[0]);
        }
    }

    @Test
    void testIdempotent() {
        Operation x = Utils.apply(body, "(d0) -> (d0 floordiv 4)", iv);
        Operation y = Utils.apply(body, "(d0, d1)[s0] -> (d0 * 3 + d1 + s0)", x.getResult(0), iv, a);

        AffineValueMap once = compose(y);
        AffineValueMap twice = AffineComposition.composeAffineMapAndOperands(once);
        assertEquals(once, twice);
        assertEquals(once, once.canonicalize());
    }

    @Test
    void testAliasedOperands() {
        Operation x = Utils.apply(body, "(d0) -> (d0 * 2)", iv);
        Operation sum = Utils.apply(body, "(d0, d1) -> (d0 + d1)", x.getResult(0), iv);

        AffineValueMap composed = compose(sum);
        assertEquals("(d0) -> (d0 * 3)", composed.getAffineMap().toString());
        assertEquals(Collections.singletonList(iv), composed.getOperands());
    }

    @Test
    void testSymbolsKeptAfterDims() {
        Operation apply = Utils.apply(body, "(d0)[s0] -> (d0 + s0)", iv, a);
        AffineValueMap composed = compose(apply);
        assertEquals("(d0)[s0] -> (d0 + s0)", composed.getAffineMap().toString());
        assertEquals(Arrays.asList(iv, a), composed.getOperands());
    }

    @Test
    void testComposedSymbolOperand() {
        Operation scaled = Utils.apply(body, "()[s0] -> (s0 * 4)", a);
        Operation apply = Utils.apply(body, "(d0)[s0] -> (d0 + s0)", iv, scaled.getResult(0));

        AffineValueMap composed = compose(apply);
        assertEquals("(d0)[s0] -> (d0 + s0 * 4)", composed.getAffineMap().toString());
        assertEquals(Arrays.asList(iv, a), composed.getOperands());
    }

    @Test
    void testSymbolOrderAcrossApplications() {
        Operation first = Utils.apply(body, "(d0)[s0] -> (d0 + s0)", iv, a);
        Operation outer = Utils.apply(body, "(d0)[s0] -> (d0 * s0)", first.getResult(0), a);

        // the outer map's own symbols come before the ones composed in
        AffineValueMap composed = compose(outer);
        AffineMap map = composed.getAffineMap();
        assertEquals(1, map.getNumDims());
        assertSame(iv, composed.getOperand(0));
        for (long i = 0; i < 3; i++) {
            for (long s = 1; s < 4; s++) {
                long[] inputs = new long[composed.getOperands().size()];
                inputs[0] = i;
                for (int k = 1; k < inputs.length; k++) inputs[k] = s;
                assertEquals((i + s) * s, map.evaluate(inputs)[0]);
            }
        }
    }

    @Test
    void testConstantOperandsFolded() {
        Operation five = StdOps.createConstantIndex(Utils.beforeEnd(Utils.entry(func)), Location.UNKNOWN, 5);
        // move the constant above the loop, so it dominates the body
        five.moveBefore(Utils.entry(func).front());
        Operation apply = Utils.apply(body, "(d0, d1) -> (d0 + d1)", iv, five.getResult(0));

        AffineValueMap composed = compose(apply);
        assertEquals("(d0) -> (d0 + 5)", composed.getAffineMap().toString());
        assertEquals(Collections.singletonList(iv), composed.getOperands());
    }

    @Test
    void testDepthLimit() {
        Operation x = Utils.apply(body, "(d0) -> (d0 + 1)", iv);
        Operation y = Utils.apply(body, "(d0) -> (d0 * 2)", x.getResult(0));
        Operation z = Utils.apply(body, "(d0) -> (d0 + 3)", y.getResult(0));
        AffineMap zMap = AffineOps.getAffineMap(z);

        AffineValueMap oneLevel = AffineComposition.composeAffineMapAndOperands(zMap, z.getOperands(), 1);
        assertEquals("(d0) -> (d0 * 2 + 3)", oneLevel.getAffineMap().toString());
        assertEquals(Collections.singletonList(x.getResult(0)), oneLevel.getOperands());

        AffineValueMap twoLevels = AffineComposition.composeAffineMapAndOperands(zMap, z.getOperands(), 2);
        assertEquals("(d0) -> (d0 * 2 + 5)", twoLevels.getAffineMap().toString());
        assertEquals(Collections.singletonList(iv), twoLevels.getOperands());

        AffineValueMap full = AffineComposition.fullyComposeAffineMapAndOperands(zMap, z.getOperands());
        assertEquals(twoLevels, full);

        assertThrows(IllegalArgumentException.class,
                () -> AffineComposition.composeAffineMapAndOperands(zMap, z.getOperands(), 0));
    }

    @Test
    void testMakeComposedAffineApply() {
        Operation x = Utils.apply(body, "(d0) -> (d0 + 1)", iv);
        Operation composed = AffineComposition.makeComposedAffineApply(body, Location.UNKNOWN,
                Utils.map(ctx, "(d0) -> (d0 mod 3)"), Collections.singletonList(x.getResult(0)));

        assertEquals("(d0) -> ((d0 + 1) mod 3)", AffineOps.getAffineMap(composed).toString());
        assertSame(iv, composed.getOperand(0));
        assertTrue(Verifier.verify(func).succeeded());
    }

    @Test
    void testReachableApplies() {
        Operation x = Utils.apply(body, "(d0) -> (d0 + 1)", iv);
        Operation y = Utils.apply(body, "(d0) -> (d0 * 2)", x.getResult(0));
        Operation z = Utils.apply(body, "(d0, d1) -> (d0 + d1)", y.getResult(0), x.getResult(0));

        assertEquals(Arrays.asList(z, y, x),
                AffineComposition.getReachableAffineApplyOps(Collections.singletonList(z.getResult(0))));
        assertTrue(AffineComposition.getReachableAffineApplyOps(Collections.singletonList(iv)).isEmpty());
    }

    @Test
    void testComputationSlice() {
        Operation x = Utils.apply(body, "(d0) -> (d0 + 1)", iv);
        Operation y = Utils.apply(body, "(d0) -> (d0 * 2)", x.getResult(0));
        Operation other = Utils.use(body, x.getResult(0));
        Operation user = Utils.use(body, y.getResult(0), iv);

        List<Operation> slice = AffineComposition.createAffineComputationSlice(user);
        assertEquals(1, slice.size());
        Operation sliced = slice.get(0);
        assertEquals("(d0) -> (d0 * 2 + 2)", AffineOps.getAffineMap(sliced).toString());
        assertSame(iv, sliced.getOperand(0));
        assertSame(sliced.getResult(0), user.getOperand(0));
        assertSame(iv, user.getOperand(1));
        assertTrue(sliced.isBeforeInBlock(user));
        // the original computation is left to its other users
        assertSame(x.getResult(0), other.getOperand(0));
        assertTrue(y.getResult(0).useEmpty());
    }

    @Test
    void testComputationSliceAlreadyLocal() {
        Operation x = Utils.apply(body, "(d0) -> (d0 + 1)", iv);
        Operation user = Utils.use(body, x.getResult(0));

        assertTrue(AffineComposition.createAffineComputationSlice(user).isEmpty());
        assertSame(x.getResult(0), user.getOperand(0));
        assertTrue(AffineComposition.createAffineComputationSlice(Utils.use(body, iv)).isEmpty());
    }
}
