package io.github.eutro.polyir.test;

import io.github.eutro.polyir.core.ir.*;
import io.github.eutro.polyir.core.ir.types.MemRefType;
import io.github.eutro.polyir.core.ir.types.ShapedType;
import io.github.eutro.polyir.core.print.AsmPrinter;
import io.github.eutro.polyir.dialects.affine.AffineLoops;
import io.github.eutro.polyir.dialects.affine.AffineOps;
import io.github.eutro.polyir.dialects.std.StdOps;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class PrinterTest {
    @Test
    void testLoopNest() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx, MemRefType.get(new long[]{10}, ctx.getF32Type(), ctx));
        Value memref = Utils.entry(func).getArgument(0);
        Operation loop = Utils.addLoop(func);
        Value iv = AffineLoops.getInductionVar(loop);
        OpBuilder body = Utils.beforeEnd(AffineLoops.getBody(loop));
        Operation load = AffineOps.createLoad(body, Location.UNKNOWN, memref, Collections.singletonList(iv));
        AffineOps.createStore(body, Location.UNKNOWN, load.getResult(0), memref, Collections.singletonList(iv));

        assertEquals("func @f(%arg0: memref<10xf32>) {\n" +
                "  affine.for %arg1 = 0 to 10 {\n" +
                "    %0 = affine.load %arg0[%arg1] : memref<10xf32>\n" +
                "    affine.store %0, %arg0[%arg1] : memref<10xf32>\n" +
                "  }\n" +
                "  std.return\n" +
                "}", func.toString());
    }

    @Test
    void testStdOps() {
        Context ctx = Utils.newContext();
        MemRefType dynamic = MemRefType.get(new long[]{ShapedType.DYNAMIC_SIZE}, ctx.getF32Type(), ctx);
        Operation func = Utils.newFunction(ctx, ctx.getIndexType(), dynamic);
        Block entry = Utils.entry(func);
        OpBuilder b = Utils.beforeEnd(entry);
        Operation five = StdOps.createConstantIndex(b, Location.UNKNOWN, 5);
        StdOps.createAddi(b, Location.UNKNOWN, entry.getArgument(0), five.getResult(0));
        StdOps.createDim(b, Location.UNKNOWN, entry.getArgument(1), 0);

        String printed = func.toString();
        assertTrue(printed.contains("%0 = std.constant 5 : index\n"), printed);
        assertTrue(printed.contains("%1 = std.addi %arg0, %0 : index\n"), printed);
        assertTrue(printed.contains("%2 = std.dim %arg1, 0 : memref<?xf32>\n"), printed);
        assertTrue(printed.endsWith("  std.return\n}"), printed);
    }

    @Test
    void testApplyWithSymbols() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx, ctx.getIndexType());
        Value n = Utils.entry(func).getArgument(0);
        Operation loop = Utils.addLoop(func);
        Value iv = AffineLoops.getInductionVar(loop);
        Operation apply = Utils.apply(Utils.beforeEnd(AffineLoops.getBody(loop)), "(d0)[s0] -> (d0 + s0)", iv, n);

        assertEquals("%0 = affine.apply (d0)[s0] -> (d0 + s0)(%arg0)[%arg1]", AsmPrinter.print(apply));
    }

    @Test
    void testReturnWithOperands() {
        Context ctx = Utils.newContext();
        Operation func = Utils.newFunction(ctx, ctx.getIndexType());
        Block entry = Utils.entry(func);
        entry.back().erase();
        Operation ret = StdOps.createReturn(new OpBuilder(ctx, entry), Location.UNKNOWN, entry.getArgument(0));

        assertEquals("std.return %arg0 : index", AsmPrinter.print(ret));
    }
}
