package io.github.eutro.polyir.test;

import io.github.eutro.polyir.core.diag.Diagnostic;
import io.github.eutro.polyir.core.diag.DiagnosticEngine;
import io.github.eutro.polyir.core.fold.Matchers;
import io.github.eutro.polyir.core.fold.OperationFolder;
import io.github.eutro.polyir.core.ir.*;
import io.github.eutro.polyir.core.ir.attrs.IntegerAttr;
import io.github.eutro.polyir.core.ir.types.IntegerType;
import io.github.eutro.polyir.core.ir.types.MemRefType;
import io.github.eutro.polyir.core.ir.types.ShapedType;
import io.github.eutro.polyir.core.passes.CanonicalizePass;
import io.github.eutro.polyir.core.traits.Verifier;
import io.github.eutro.polyir.dialects.std.StdOps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StdFoldTest {
    private Context ctx;
    private Operation func;
    private Block entry;
    private OpBuilder b;
    private OperationFolder folder;

    @BeforeEach
    void setUp() {
        ctx = Utils.newContext();
        func = Utils.newFunction(ctx, ctx.getIndexType());
        entry = Utils.entry(func);
        b = Utils.beforeEnd(entry);
        folder = new OperationFolder();
    }

    private Value constant(long value) {
        return StdOps.createConstantIndex(b, Location.UNKNOWN, value).getResult(0);
    }

    @Test
    void testApplyFoldsToConstant() {
        Operation apply = Utils.apply(b, "(d0) -> (d0 + 3)", constant(5));
        Operation user = Utils.use(b, apply.getResult(0));

        assertTrue(folder.tryToFold(apply).succeeded());
        Operation folded = user.getOperand(0).getDefiningOp();
        assertNotNull(folded);
        assertTrue(folded.isKind(StdOps.CONSTANT));
        assertEquals(8L, Matchers.matchConstantInt(user.getOperand(0)));
        assertSame(entry.front(), folded);
        assertTrue(Verifier.verify(func).succeeded());
    }

    @Test
    void testApplyOfDimFoldsToOperand() {
        Value arg = entry.getArgument(0);
        Operation apply = Utils.apply(b, "(d0, d1) -> (d1)", constant(1), arg);
        Operation user = Utils.use(b, apply.getResult(0));

        assertTrue(folder.tryToFold(apply).succeeded());
        assertSame(arg, user.getOperand(0));
    }

    @Test
    void testConstantsSharedAcrossDialects() {
        Operation apply = Utils.apply(b, "()[s0] -> (s0 * 2)", constant(4));
        Operation sum = StdOps.createAddi(b, Location.UNKNOWN, constant(3), constant(5));
        Operation user = Utils.use(b, apply.getResult(0), sum.getResult(0));

        // the affine dialect materializes its constants as std constants
        assertTrue(folder.tryToFold(apply).succeeded());
        assertTrue(folder.tryToFold(sum).succeeded());
        assertSame(user.getOperand(0), user.getOperand(1));
        assertEquals(8L, Matchers.matchConstantInt(user.getOperand(0)));
    }

    @Test
    void testNotifyRemoval() {
        Operation sum = StdOps.createAddi(b, Location.UNKNOWN, constant(1), constant(2));
        List<Operation> generated = new ArrayList<>();
        assertTrue(folder.tryToFold(sum, generated::add, null).succeeded());
        Operation three = generated.get(0);
        folder.notifyRemoval(three);
        three.erase();

        Operation again = StdOps.createAddi(b, Location.UNKNOWN, constant(2), constant(1));
        Operation user = Utils.use(b, again.getResult(0));
        assertTrue(folder.tryToFold(again).succeeded());
        Operation fresh = user.getOperand(0).getDefiningOp();
        assertNotNull(fresh);
        assertFalse(fresh.isDestroyed());
        assertEquals(3L, Matchers.matchConstantInt(user.getOperand(0)));
    }

    @Test
    void testAddiIdentities() {
        Value arg = entry.getArgument(0);
        Operation plusZero = StdOps.createAddi(b, Location.UNKNOWN, constant(0), arg);
        Operation user = Utils.use(b, plusZero.getResult(0));

        assertTrue(folder.tryToFold(plusZero).succeeded());
        assertSame(arg, user.getOperand(0));

        Operation plusOne = StdOps.createAddi(b, Location.UNKNOWN, arg, constant(1));
        assertTrue(folder.tryToFold(plusOne).failed());
    }

    @Test
    void testMuliIdentities() {
        Value arg = entry.getArgument(0);
        Operation timesOne = StdOps.createMuli(b, Location.UNKNOWN, arg, constant(1));
        Operation timesZero = StdOps.createMuli(b, Location.UNKNOWN, constant(0), arg);
        Operation user = Utils.use(b, timesOne.getResult(0), timesZero.getResult(0));

        assertTrue(folder.tryToFold(timesOne).succeeded());
        assertTrue(folder.tryToFold(timesZero).succeeded());
        assertSame(arg, user.getOperand(0));
        assertEquals(0L, Matchers.matchConstantInt(user.getOperand(1)));
    }

    @Test
    void testIntegerWrapping() {
        IntegerType i8 = ctx.getIntegerType(8);
        Value max = StdOps.createConstant(b, Location.UNKNOWN, IntegerAttr.get(i8, 127), i8).getResult(0);
        Value one = StdOps.createConstant(b, Location.UNKNOWN, IntegerAttr.get(i8, 1), i8).getResult(0);
        Operation sum = StdOps.createAddi(b, Location.UNKNOWN, max, one);
        Operation user = Utils.use(b, sum.getResult(0));

        assertTrue(folder.tryToFold(sum).succeeded());
        assertEquals(IntegerAttr.get(i8, -128), Matchers.matchConstant(user.getOperand(0)));
    }

    @Test
    void testBooleanFolding() {
        IntegerType i1 = ctx.getIntegerType(1);
        Value yes = StdOps.createConstant(b, Location.UNKNOWN, IntegerAttr.getBool(true, ctx), i1).getResult(0);
        Value no = StdOps.createConstant(b, Location.UNKNOWN, IntegerAttr.getBool(false, ctx), i1).getResult(0);
        Operation sum = StdOps.createAddi(b, Location.UNKNOWN, no, yes);
        Operation product = StdOps.createMuli(b, Location.UNKNOWN, yes, yes);
        Operation overflow = StdOps.createAddi(b, Location.UNKNOWN, yes, yes);
        Operation user = Utils.use(b, sum.getResult(0), product.getResult(0), overflow.getResult(0));

        assertTrue(folder.tryToFold(sum).succeeded());
        assertTrue(folder.tryToFold(product).succeeded());
        assertTrue(folder.tryToFold(overflow).succeeded());
        assertEquals(IntegerAttr.getBool(true, ctx), Matchers.matchConstant(user.getOperand(0)));
        assertSame(user.getOperand(0), user.getOperand(1));
        assertEquals(IntegerAttr.getBool(false, ctx), Matchers.matchConstant(user.getOperand(2)));
    }

    @Test
    void testDimFolding() {
        MemRefType type = MemRefType.get(new long[]{4, ShapedType.DYNAMIC_SIZE}, ctx.getF32Type(), ctx);
        Block block = func.getRegion(0).front();
        Value memref = block.addArgument(type);
        Operation staticDim = StdOps.createDim(b, Location.UNKNOWN, memref, 0);
        Operation dynamicDim = StdOps.createDim(b, Location.UNKNOWN, memref, 1);
        Operation user = Utils.use(b, staticDim.getResult(0), dynamicDim.getResult(0));

        assertTrue(folder.tryToFold(staticDim).succeeded());
        assertEquals(4L, Matchers.matchConstantInt(user.getOperand(0)));
        assertTrue(folder.tryToFold(dynamicDim).failed());
    }

    @Test
    void testConstCondBranch() {
        Region body = func.getRegion(0);
        Block yes = body.addBlock();
        Block no = body.addBlock();
        StdOps.createReturn(new OpBuilder(ctx, yes), Location.UNKNOWN);
        StdOps.createReturn(new OpBuilder(ctx, no), Location.UNKNOWN);
        entry.back().erase();
        OpBuilder end = new OpBuilder(ctx, entry);
        Value cond = StdOps.createConstant(end, Location.UNKNOWN,
                IntegerAttr.getBool(true, ctx), ctx.getIntegerType(1)).getResult(0);
        StdOps.createCondBr(end, Location.UNKNOWN, cond,
                yes, Collections.<Value>emptyList(),
                no, Collections.<Value>emptyList());
        assertTrue(Verifier.verify(func).succeeded());

        CanonicalizePass.INSTANCE.run(func);

        Operation terminator = entry.back();
        assertTrue(terminator.isKind(StdOps.BR));
        assertSame(yes, terminator.getSuccessor(0));
        assertTrue(no.hasNoPredecessors());
        assertTrue(Verifier.verify(func).succeeded());
    }

    @Test
    void testVerifiers() {
        Operation badConstant = StdOps.createConstant(b, Location.UNKNOWN,
                IntegerAttr.get(ctx.getIntegerType(32), 1), ctx.getIndexType());
        assertEquals("'std.constant' op requires attribute's type (i32) to match op's return type (index)",
                verifyError());
        badConstant.erase();

        entry.back().erase();
        StdOps.createReturn(new OpBuilder(ctx, entry), Location.UNKNOWN, entry.getArgument(0));
        assertEquals("'std.return' op has 1 operands, but enclosing function returns 0", verifyError());
    }

    private String verifyError() {
        List<Diagnostic> diags = new ArrayList<>();
        try (DiagnosticEngine.Registration ignored = ctx.getDiagEngine().collectInto(diags)) {
            assertTrue(Verifier.verify(func).failed());
        }
        return diags.get(diags.size() - 1).getMessage();
    }
}
