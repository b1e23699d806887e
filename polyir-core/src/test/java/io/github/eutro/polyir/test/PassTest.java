package io.github.eutro.polyir.test;

import io.github.eutro.polyir.core.builtin.BuiltinOps;
import io.github.eutro.polyir.core.fold.Matchers;
import io.github.eutro.polyir.core.ir.*;
import io.github.eutro.polyir.core.passes.*;
import io.github.eutro.polyir.core.passes.misc.ChainedPass;
import io.github.eutro.polyir.core.passes.misc.ForPass;
import io.github.eutro.polyir.core.print.AsmPrinter;
import io.github.eutro.polyir.core.traits.Verifier;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PassTest {
    @Test
    void testFoldPass() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx, ctx.getIndexType());
        Block entry = Utils.entry(func);
        OpBuilder b = new OpBuilder(ctx, entry);
        Operation c1 = TestDialect.constantIndex(b, 1);
        Operation c2 = TestDialect.constantIndex(b, 2);
        Operation c3 = TestDialect.constantIndex(b, 3);
        Operation sum12 = TestDialect.add(b, c1.getResult(0), c2.getResult(0));
        Operation sum123 = TestDialect.add(b, sum12.getResult(0), c3.getResult(0));
        Operation last = TestDialect.add(b, entry.getArgument(0), sum123.getResult(0));
        b.create(new OperationState(ctx, Location.UNKNOWN, TestDialect.OP).addOperands(last.getResult(0)));
        TestDialect.terminator(b);

        FoldPass.INSTANCE.run(func);

        assertEquals(1, Utils.opsOfKind(func, TestDialect.ADD).size());
        assertFalse(last.isDestroyed());
        assertEquals(6L, Matchers.matchConstantInt(last.getOperand(1)));
        // 1, 2, 3 and 6, the intermediate 3 shares the constant
        assertEquals(4, Utils.opsOfKind(func, TestDialect.CONSTANT).size());
        assertTrue(Verifier.verify(func).succeeded());
    }

    @Test
    void testCanonicalizePass() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx, ctx.getIndexType());
        Block entry = Utils.entry(func);
        OpBuilder b = new OpBuilder(ctx, entry);
        Operation one = TestDialect.constantIndex(b, 1);
        Operation add = TestDialect.add(b, one.getResult(0), entry.getArgument(0));
        TestDialect.terminator(b);

        CanonicalizePass.INSTANCE.run(func);
        assertSame(entry.getArgument(0), add.getOperand(0));
        assertSame(one.getResult(0), add.getOperand(1));

        // already canonical, nothing changes
        new CanonicalizePass(1).run(func);
        assertSame(entry.getArgument(0), add.getOperand(0));

        assertThrows(IllegalArgumentException.class, () -> new CanonicalizePass(0));
    }

    @Test
    void testChainedPass() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx);
        OpBuilder b = new OpBuilder(ctx, Utils.entry(func));
        Operation two = TestDialect.constantIndex(b, 2);
        TestDialect.add(b, two.getResult(0), two.getResult(0));
        TestDialect.terminator(b);

        IRPass<Operation, Operation> pipeline = VerifyPass.INSTANCE
                .then(CanonicalizePass.INSTANCE)
                .then(FoldPass.INSTANCE)
                .then(VerifyPass.INSTANCE);
        assertTrue(pipeline.isInPlace());
        assertEquals(4, ((ChainedPass<?, ?, ?>) pipeline).getPasses().size());
        assertSame(func, pipeline.run(func));
        assertTrue(Utils.opsOfKind(func, TestDialect.ADD).isEmpty());

        IRPass<Operation, String> printing = pipeline.then(AsmPrinter::print);
        assertFalse(printing.isInPlace());
        assertTrue(printing.run(func).contains("test.constant 4 : index"));
    }

    @Test
    void testChainedPassFailure() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx);
        TestDialect.constantIndex(new OpBuilder(ctx, Utils.entry(func)), 1);

        IRPass<Operation, Operation> pipeline = FoldPass.INSTANCE.then(VerifyPass.INSTANCE);
        Verifier.VerificationException e = assertThrows(Verifier.VerificationException.class,
                () -> pipeline.run(func));
        assertEquals(1, e.getSuppressed().length);
        assertEquals("running pass 1 in chain", e.getSuppressed()[0].getMessage());
    }

    @Test
    void testLiftOpsReplacing() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx, ctx.getIndexType(), ctx.getIndexType());
        Block entry = Utils.entry(func);
        OpBuilder b = new OpBuilder(ctx, entry);
        Value x = entry.getArgument(0);
        Value y = entry.getArgument(1);
        Operation add = TestDialect.add(b, x, y);
        Operation user = b.create(new OperationState(ctx, Location.UNKNOWN, TestDialect.OP)
                .addOperands(add.getResult(0)));
        TestDialect.terminator(b);

        // rebuild every add with its operands swapped
        IRPass<Operation, Operation> swap = op -> Operation.create(
                new OperationState(op.getContext(), op.getLoc(), TestDialect.ADD)
                        .addOperands(op.getOperand(1), op.getOperand(0))
                        .addTypes(op.getResultTypes()));
        ForPass.liftOps(swap, TestDialect.ADD).run(func);

        assertTrue(add.isDestroyed());
        Operation replacement = user.getOperand(0).getDefiningOp();
        assertNotNull(replacement);
        assertSame(y, replacement.getOperand(0));
        assertSame(x, replacement.getOperand(1));
        assertSame(entry, replacement.getBlock());
        assertTrue(replacement.isBeforeInBlock(user));
        assertTrue(Verifier.verify(func).succeeded());
    }

    @Test
    void testLiftOpsOnModule() {
        Context ctx = Utils.newContext();
        Operation module = BuiltinOps.createModule(ctx, Location.UNKNOWN);
        List<Operation> funcs = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            Operation func = Utils.newFunction(ctx);
            OpBuilder b = new OpBuilder(ctx, Utils.entry(func));
            Operation c = TestDialect.constantIndex(b, i);
            TestDialect.add(b, c.getResult(0), c.getResult(0));
            TestDialect.terminator(b);
            BuiltinOps.pushBack(module, func);
            funcs.add(func);
        }

        ForPass.liftOps(FoldPass.INSTANCE, BuiltinOps.FUNC).run(module);

        for (Operation func : funcs) {
            assertTrue(Utils.opsOfKind(func, TestDialect.ADD).isEmpty());
        }
        assertTrue(Verifier.verify(module).succeeded());
    }

    @Test
    void testLiftOpsFailure() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx);
        OpBuilder b = new OpBuilder(ctx, Utils.entry(func));
        TestDialect.constantIndex(b, 1);
        TestDialect.terminator(b);

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> ForPass.liftOps(op -> {
                    if (op.isKind(TestDialect.TERMINATOR)) throw new IllegalStateException("boom");
                    return op;
                }).run(func));
        assertEquals("in element 1", e.getSuppressed()[0].getMessage());
    }

    @Test
    void testLiftBlocks() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx);
        OpBuilder b = new OpBuilder(ctx, Utils.entry(func));
        Operation wrapper = b.create(new OperationState(ctx, Location.UNKNOWN, TestDialect.OP).addRegions(1));
        TestDialect.terminator(b);
        Block inner = wrapper.getRegion(0).addBlock();
        TestDialect.terminator(new OpBuilder(ctx, inner));

        List<Block> seen = new ArrayList<>();
        ForPass.liftBlocks(seen::add).run(func);

        assertEquals(2, seen.size());
        assertTrue(seen.contains(inner));
        assertTrue(seen.contains(Utils.entry(func)));
    }
}
