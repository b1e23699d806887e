package io.github.eutro.polyir.test;

import io.github.eutro.polyir.core.ext.Ext;
import io.github.eutro.polyir.core.ext.ExtHolder;
import io.github.eutro.polyir.core.ext.IRExts;
import io.github.eutro.polyir.core.fold.FoldHook;
import io.github.eutro.polyir.core.ir.*;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class ExtHolderTest {
    private static final List<Ext<Object>> EXTS = Arrays.asList(
            Ext.create(Object.class, "a"),
            Ext.create(Object.class, "b"),
            Ext.create(Object.class, "c"),
            Ext.create(Object.class, "d"),
            Ext.create(Object.class, "e")
    );

    @Test
    void testExts() {
        ExtHolder eh = new ExtHolder();
        Map<Ext<Object>, Object> expected = new HashMap<>();
        for (Ext<Object> ext : EXTS) {
            Object value = new Object();
            eh.attachExt(ext, value);
            expected.put(ext, value);
        }
        for (Ext<Object> ext : EXTS) {
            assertSame(expected.get(ext), eh.getNullable(ext));
        }

        eh.removeExt(EXTS.get(0));
        assertNull(eh.getNullable(EXTS.get(0)));
        assertFalse(eh.getExt(EXTS.get(0)).isPresent());
        assertThrows(IllegalStateException.class, () -> eh.getExtOrThrow(EXTS.get(0)));
        assertSame(expected.get(EXTS.get(1)), eh.getExtOrThrow(EXTS.get(1)));

        Object computed = eh.getExtOrCompute(EXTS.get(0), Object::new);
        assertSame(computed, eh.getExtOrCompute(EXTS.get(0), Object::new));
    }

    @Test
    void testOperationsSeeKindHooks() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx);
        Operation c = TestDialect.constantIndex(new OpBuilder(ctx, Utils.entry(func)), 1);

        FoldHook kindFolder = TestDialect.CONSTANT.getNullable(IRExts.FOLDER);
        assertNotNull(kindFolder);
        assertSame(kindFolder, c.getNullable(IRExts.FOLDER));

        // exts on the operation shadow its kind's
        FoldHook never = (op, operands) -> null;
        c.attachExt(IRExts.FOLDER, never);
        assertSame(never, c.getNullable(IRExts.FOLDER));
        c.removeExt(IRExts.FOLDER);
        assertSame(kindFolder, c.getNullable(IRExts.FOLDER));

        Operation unregistered = Operation.create(new OperationState(ctx, Location.UNKNOWN, "foo.bar"));
        assertNull(unregistered.getNullable(IRExts.FOLDER));
    }

    @Test
    void testOnlyHooksAreInherited() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx);
        Operation c = TestDialect.constantIndex(new OpBuilder(ctx, Utils.entry(func)), 1);
        Ext<Object> custom = Ext.create(Object.class, "custom");
        OpKind kind = OpKind.builder("test.scratch").build();
        kind.attachExt(IRExts.NAME_HINT, "kindName");
        kind.attachExt(custom, new Object());
        Operation scratch = Operation.create(new OperationState(ctx, Location.UNKNOWN, kind));

        assertNull(scratch.getNullable(IRExts.NAME_HINT));
        assertNull(scratch.getNullable(custom));
        assertTrue(IRExts.isKindHook(IRExts.FOLDER));
        assertFalse(IRExts.isKindHook(IRExts.NAME_HINT));

        assertNull(c.getLocalNullable(IRExts.FOLDER));
        assertNotNull(c.getNullable(IRExts.FOLDER));
        IRExts.named(c, "c");
        assertEquals("c", c.getLocalNullable(IRExts.NAME_HINT));
    }

    @Test
    void testOwningBlock() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx);
        Block entry = Utils.entry(func);
        Operation op = TestDialect.terminator(new OpBuilder(ctx, entry));

        assertSame(entry, op.getNullable(IRExts.OWNING_BLOCK));
        assertSame(func, op.getParentOp());
        op.remove();
        assertNull(op.getNullable(IRExts.OWNING_BLOCK));
        assertTrue(entry.isEmpty());
    }
}
