package io.github.eutro.polyir.test;

import io.github.eutro.polyir.core.diag.Diagnostic;
import io.github.eutro.polyir.core.diag.DiagnosticEngine;
import io.github.eutro.polyir.core.fold.OperationFolder;
import io.github.eutro.polyir.core.ir.*;
import io.github.eutro.polyir.core.ir.attrs.IntegerAttr;
import io.github.eutro.polyir.core.ir.types.MemRefType;
import io.github.eutro.polyir.core.passes.CanonicalizePass;
import io.github.eutro.polyir.core.print.AsmPrinter;
import io.github.eutro.polyir.core.traits.Verifier;
import io.github.eutro.polyir.dialects.affine.AffineLoops;
import io.github.eutro.polyir.dialects.affine.AffineOps;
import io.github.eutro.polyir.dialects.affine.passes.FoldAffineForBounds;
import io.github.eutro.polyir.dialects.affine.passes.SimplifyAffineApplies;
import io.github.eutro.polyir.dialects.std.StdOps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AffineForTest {
    private Context ctx;
    private Operation func;
    private Value a;
    private OpBuilder top;

    @BeforeEach
    void setUp() {
        ctx = Utils.newContext();
        func = Utils.newFunction(ctx, ctx.getIndexType());
        a = Utils.entry(func).getArgument(0);
        top = Utils.beforeEnd(Utils.entry(func));
    }

    private Operation loop(String lbMap, List<Value> lbOperands, String ubMap, List<Value> ubOperands) {
        return AffineLoops.create(top, Location.UNKNOWN,
                lbOperands, Utils.map(ctx, lbMap),
                ubOperands, Utils.map(ctx, ubMap),
                1);
    }

    @Test
    void testTripCount() {
        Operation stepped = AffineLoops.create(top, Location.UNKNOWN, 0, 10, 3);
        assertEquals(4L, AffineLoops.getConstantTripCount(stepped));
        assertEquals(0L, AffineLoops.getConstantTripCount(AffineLoops.create(top, Location.UNKNOWN, 5, 5, 1)));
        assertEquals(0L, AffineLoops.getConstantTripCount(AffineLoops.create(top, Location.UNKNOWN, 10, 0, 1)));

        Operation symbolic = loop("() -> (0)", Collections.<Value>emptyList(),
                "()[s0] -> (s0)", Collections.singletonList(a));
        assertNull(AffineLoops.getConstantTripCount(symbolic));
        assertTrue(AffineLoops.hasConstantLowerBound(symbolic));
        assertFalse(AffineLoops.hasConstantUpperBound(symbolic));
        assertEquals(Collections.singletonList(a), AffineLoops.getUpperBoundOperands(symbolic));
        assertTrue(AffineLoops.getLowerBoundOperands(symbolic).isEmpty());

        assertTrue(Verifier.verify(func).succeeded());
    }

    @Test
    void testStepMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> AffineLoops.create(top, Location.UNKNOWN, 0, 10, 0));
        Operation loop = AffineLoops.create(top, Location.UNKNOWN, 0, 10, 1);
        assertThrows(IllegalArgumentException.class, () -> AffineLoops.setStep(loop, -1));

        loop.setAttr(AffineLoops.STEP, IntegerAttr.get(ctx.getIndexType(), 0));
        List<Diagnostic> diags = new ArrayList<>();
        try (DiagnosticEngine.Registration ignored = ctx.getDiagEngine().collectInto(diags)) {
            assertTrue(Verifier.verify(func).failed());
        }
        assertEquals("'affine.for' op expected step to be representable as a positive signed integer",
                diags.get(diags.size() - 1).getMessage());
    }

    @Test
    void testBodyShape() {
        Operation loop = AffineLoops.create(top, Location.UNKNOWN, 0, 10, 1);
        Block body = AffineLoops.getBody(loop);
        assertEquals(1, body.getNumArguments());
        assertTrue(AffineLoops.getInductionVar(loop).getType().isIndex());
        assertTrue(body.back().isKind(AffineOps.TERMINATOR));
        assertThrows(IllegalArgumentException.class, () -> AffineLoops.setLowerBound(loop,
                Collections.<Value>emptyList(), Utils.map(ctx, "()[s0] -> (s0)")));
    }

    @Test
    void testPrinting() {
        assertEquals("affine.for %arg0 = 0 to 10 step 3 {\n}",
                AsmPrinter.print(AffineLoops.create(top, Location.UNKNOWN, 0, 10, 3)));
        assertEquals("affine.for %arg0 = 0 to %arg1 {\n}",
                AsmPrinter.print(loop("() -> (0)", Collections.<Value>emptyList(),
                        "()[s0] -> (s0)", Collections.singletonList(a))));
        assertEquals("affine.for %arg0 = 0 to min ()[s0] -> (s0, 10)()[%arg1] {\n}",
                AsmPrinter.print(loop("() -> (0)", Collections.<Value>emptyList(),
                        "()[s0] -> (s0, 10)", Collections.singletonList(a))));
        assertTrue(Verifier.verify(func).succeeded());
    }

    @Test
    void testFoldBounds() {
        Value four = StdOps.createConstantIndex(top, Location.UNKNOWN, 4).getResult(0);
        Operation loop = loop("()[s0] -> (s0 + 1)", Collections.singletonList(four),
                "()[s0] -> (s0, 7)", Collections.singletonList(four));

        OperationFolder folder = new OperationFolder();
        assertTrue(folder.tryToFold(loop).succeeded());
        // folded in place
        assertFalse(loop.isDestroyed());
        assertEquals(5, AffineLoops.getConstantLowerBound(loop));
        assertEquals(4, AffineLoops.getConstantUpperBound(loop));
        assertEquals(0, loop.getNumOperands());
        assertEquals(0L, AffineLoops.getConstantTripCount(loop));

        assertTrue(folder.tryToFold(loop).failed());
    }

    @Test
    void testCanonicalizeBounds() {
        Operation doubled = Utils.apply(top, "(d0) -> (d0 * 2)", a);
        Operation loop = loop("()[s0] -> (s0)", Collections.singletonList(doubled.getResult(0)),
                "() -> (10)", Collections.<Value>emptyList());

        assertTrue(AffineLoops.canonicalizeBounds(loop));
        assertEquals("()[s0] -> (s0 * 2)", AffineLoops.getLowerBoundMap(loop).toString());
        assertEquals(Collections.singletonList(a), AffineLoops.getLowerBoundOperands(loop));
        assertTrue(doubled.getResult(0).useEmpty());
        assertFalse(AffineLoops.canonicalizeBounds(loop));
        assertTrue(Verifier.verify(func).succeeded());
    }

    @Test
    void testFoldAffineForBoundsPass() {
        Value three = StdOps.createConstantIndex(top, Location.UNKNOWN, 3).getResult(0);
        Operation plusTwo = Utils.apply(top, "(d0) -> (d0 + 2)", three);
        Operation loop = loop("()[s0] -> (s0)", Collections.singletonList(plusTwo.getResult(0)),
                "()[s0] -> (s0)", Collections.singletonList(a));

        FoldAffineForBounds.INSTANCE.run(func);

        assertEquals(5, AffineLoops.getConstantLowerBound(loop));
        assertFalse(AffineLoops.hasConstantUpperBound(loop));
        assertEquals(Collections.singletonList(a), AffineLoops.getUpperBoundOperands(loop));
        assertTrue(Verifier.verify(func).succeeded());
    }

    @Test
    void testSimplifyAffineApplies() {
        Operation loop = AffineLoops.create(top, Location.UNKNOWN, 0, 10, 1);
        Value iv = AffineLoops.getInductionVar(loop);
        OpBuilder body = Utils.beforeEnd(AffineLoops.getBody(loop));
        Operation x = Utils.apply(body, "(d0) -> (d0 + 1)", iv);
        Operation y = Utils.apply(body, "(d0) -> (d0 * 2)", x.getResult(0));
        Operation z = Utils.apply(body, "(d0) -> (d0 + 3)", y.getResult(0));
        Operation user = Utils.use(body, z.getResult(0));

        SimplifyAffineApplies.INSTANCE.run(func);

        List<Operation> applies = Utils.opsOfKind(func, AffineOps.APPLY);
        assertEquals(1, applies.size());
        Operation left = applies.get(0);
        assertEquals("(d0) -> (d0 * 2 + 5)", AffineOps.getAffineMap(left).toString());
        assertSame(iv, left.getOperand(0));
        assertSame(left.getResult(0), user.getOperand(0));
        assertTrue(Verifier.verify(func).succeeded());
    }

    @Test
    void testLoadIndicesComposed() {
        MemRefType type = MemRefType.get(new long[]{10}, ctx.getF32Type(), ctx);
        Operation f = Utils.newFunction(ctx, type);
        Value memref = Utils.entry(f).getArgument(0);
        Operation loop = Utils.addLoop(f);
        Value iv = AffineLoops.getInductionVar(loop);
        OpBuilder body = Utils.beforeEnd(AffineLoops.getBody(loop));
        Operation next = Utils.apply(body, "(d0) -> (d0 + 1)", iv);
        Operation load = AffineOps.createLoad(body, Location.UNKNOWN, memref,
                Collections.singletonList(next.getResult(0)));
        AffineOps.createStore(body, Location.UNKNOWN, load.getResult(0), memref,
                Collections.singletonList(iv));
        assertTrue(Verifier.verify(f).succeeded());

        CanonicalizePass.INSTANCE.run(f);

        assertEquals("(d0) -> (d0 + 1)", AffineOps.getAffineMap(load).toString());
        assertEquals(Collections.singletonList(iv), AffineOps.getMapOperands(load));
        assertSame(memref, AffineOps.getMemRef(load));
        assertTrue(next.getResult(0).useEmpty());
        assertTrue(Verifier.verify(f).succeeded());
    }
}
