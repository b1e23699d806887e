package io.github.eutro.polyir.test;

import io.github.eutro.polyir.core.builtin.BuiltinOps;
import io.github.eutro.polyir.core.ir.*;
import io.github.eutro.polyir.core.ir.types.IndexType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OperationTest {
    @Test
    void testUseLists() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx, ctx.getIndexType());
        Block entry = Utils.entry(func);
        OpBuilder b = new OpBuilder(ctx, entry);
        BlockArgument arg = entry.getArgument(0);
        Operation c = TestDialect.constantIndex(b, 1);
        Operation add = TestDialect.add(b, arg, c.getResult(0));

        assertEquals(1, arg.getNumUses());
        assertTrue(c.getResult(0).hasOneUse());
        assertEquals(Collections.singletonList(add), c.getResult(0).getUsers());

        add.setOperand(1, arg);
        assertTrue(c.getResult(0).useEmpty());
        assertEquals(2, arg.getNumUses());

        arg.replaceAllUsesWith(c.getResult(0));
        assertTrue(arg.useEmpty());
        assertEquals(2, c.getResult(0).getNumUses());
        assertSame(c.getResult(0), add.getOperand(0));
        assertSame(c, add.getOperand(1).getDefiningOp());
    }

    @Test
    void testEraseStillUsed() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx);
        OpBuilder b = new OpBuilder(ctx, Utils.entry(func));
        Operation c = TestDialect.constantIndex(b, 1);
        TestDialect.add(b, c.getResult(0), c.getResult(0));

        IllegalStateException e = assertThrows(IllegalStateException.class, c::erase);
        assertTrue(e.getMessage().contains("still has uses"), e.getMessage());
        // left in place
        assertSame(Utils.entry(func), c.getBlock());
        assertFalse(c.isDestroyed());
    }

    @Test
    void testDestroyInBlock() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx);
        OpBuilder b = new OpBuilder(ctx, Utils.entry(func));
        Operation c = TestDialect.constantIndex(b, 1);

        IllegalStateException e = assertThrows(IllegalStateException.class, c::destroy);
        assertTrue(e.getMessage().contains("still in a block"), e.getMessage());

        c.erase();
        assertTrue(c.isDestroyed());
        assertTrue(Utils.entry(func).isEmpty());
    }

    @Test
    void testInsertTwice() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx);
        OpBuilder b = new OpBuilder(ctx, Utils.entry(func));
        Operation c = TestDialect.constantIndex(b, 1);
        Block other = new Block();
        assertThrows(IllegalStateException.class, () -> other.addOperation(c));
    }

    @Test
    void testFixedOperandList() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx, ctx.getIndexType());
        OpBuilder b = new OpBuilder(ctx, Utils.entry(func));
        BlockArgument arg = Utils.entry(func).getArgument(0);
        Operation add = TestDialect.add(b, arg, arg);

        assertFalse(add.hasResizableOperandList());
        assertThrows(UnsupportedOperationException.class, () -> add.eraseOperand(0));
        assertThrows(UnsupportedOperationException.class, () -> add.setOperands(Collections.singletonList(arg)));
        // same count is fine
        add.setOperands(Arrays.asList(arg, arg));
        assertEquals(2, arg.getNumUses());
    }

    @Test
    void testResizableOperandList() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx, ctx.getIndexType(), ctx.getIndexType());
        Block entry = Utils.entry(func);
        BlockArgument a = entry.getArgument(0);
        BlockArgument c = entry.getArgument(1);
        Operation op = new OpBuilder(ctx, entry).create(new OperationState(ctx, Location.UNKNOWN, TestDialect.OP)
                .addOperands(a, c)
                .setResizableOperandList(true));

        op.eraseOperand(0);
        assertEquals(1, op.getNumOperands());
        assertSame(c, op.getOperand(0));
        assertEquals(0, op.getOpOperand(0).getOperandNumber());
        assertTrue(a.useEmpty());

        op.setOperands(Arrays.asList(c, a, a));
        assertEquals(3, op.getNumOperands());
        assertEquals(2, a.getNumUses());
    }

    @Test
    void testSuccessors() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx, ctx.getIndexType());
        Block entry = Utils.entry(func);
        Block target = func.getRegion(0).addBlock();
        target.addArgument(ctx.getIndexType());
        BlockArgument arg = entry.getArgument(0);

        Operation br = new OpBuilder(ctx, entry).create(new OperationState(ctx, Location.UNKNOWN, TestDialect.BR)
                .addSuccessor(target, Collections.singletonList(arg)));

        assertEquals(1, br.getNumSuccessors());
        assertSame(target, br.getSuccessor(0));
        assertEquals(Collections.singletonList(arg), br.getSuccessorOperands(0));
        assertTrue(br.getNonSuccessorOperands().isEmpty());
        assertEquals(Collections.singletonList(br), target.getPredecessorOps());
        assertEquals(Collections.singletonList(target), entry.getSuccessors());

        br.erase();
        assertTrue(target.hasNoPredecessors());
        assertTrue(arg.useEmpty());
    }

    @Test
    void testSuccessorsOnNonTerminator() {
        Context ctx = Utils.newContext();
        Block target = new Block();
        assertThrows(IllegalArgumentException.class, () -> Operation.create(
                new OperationState(ctx, Location.UNKNOWN, TestDialect.OP)
                        .addSuccessor(target, Collections.<Value>emptyList())));
    }

    @Test
    void testOrderAndMoves() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx);
        Block entry = Utils.entry(func);
        OpBuilder b = new OpBuilder(ctx, entry);
        Operation first = TestDialect.constantIndex(b, 1);
        Operation second = TestDialect.constantIndex(b, 2);
        Operation term = TestDialect.terminator(b);

        assertTrue(first.isBeforeInBlock(second));
        second.moveBefore(first);
        assertTrue(second.isBeforeInBlock(first));
        assertEquals(Arrays.asList(second, first, term), entry.getOperations());

        Block split = entry.splitBlock(first);
        assertEquals(Collections.singletonList(second), entry.getOperations());
        assertEquals(Arrays.asList(first, term), split.getOperations());
        assertSame(split, func.getRegion(0).getBlocks().get(1));
        assertSame(split, first.getBlock());
        assertThrows(IllegalArgumentException.class, () -> first.isBeforeInBlock(second));
    }

    @Test
    void testParents() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx);
        OpBuilder b = new OpBuilder(ctx, Utils.entry(func));
        Operation isolated = b.create(new OperationState(ctx, Location.UNKNOWN, TestDialect.ISOLATED).addRegions(1));
        Block inner = isolated.getRegion(0).addBlock();
        Operation nested = TestDialect.constantIndex(new OpBuilder(ctx, inner), 3);

        assertSame(isolated, nested.getParentOp());
        assertSame(func, isolated.getParentOp());
        assertSame(func, nested.getParentOfKind(BuiltinOps.FUNC));
        assertTrue(func.isProperAncestor(nested));
        assertFalse(nested.isProperAncestor(func));
        assertTrue(func.getRegion(0).isAncestor(isolated.getRegion(0)));
        assertSame(isolated, Utils.entry(func).findAncestorOpInBlock(nested));
        assertTrue(nested.getResult(0).getType() instanceof IndexType);
    }

    @Test
    void testWalkPostOrder() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx);
        OpBuilder b = new OpBuilder(ctx, Utils.entry(func));
        Operation isolated = b.create(new OperationState(ctx, Location.UNKNOWN, TestDialect.ISOLATED).addRegions(1));
        Operation inner = TestDialect.constantIndex(new OpBuilder(ctx, isolated.getRegion(0).addBlock()), 3);
        Operation term = TestDialect.terminator(b);

        List<Operation> visited = new ArrayList<>();
        func.walk(visited::add);
        assertEquals(Arrays.asList(inner, isolated, term, func), visited);
    }

    @Test
    void testEraseRegionWithInternalUses() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx, ctx.getIndexType());
        OpBuilder b = new OpBuilder(ctx, Utils.entry(func));
        Operation c = TestDialect.constantIndex(b, 1);
        TestDialect.add(b, c.getResult(0), Utils.entry(func).getArgument(0));
        TestDialect.terminator(b);

        func.destroy();
        assertTrue(func.isDestroyed());
        assertTrue(c.isDestroyed());
    }
}
