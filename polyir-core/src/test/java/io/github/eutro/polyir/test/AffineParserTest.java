package io.github.eutro.polyir.test;

import io.github.eutro.polyir.core.affine.AffineExpr;
import io.github.eutro.polyir.core.affine.AffineMap;
import io.github.eutro.polyir.core.affine.AffineParser;
import io.github.eutro.polyir.core.diag.Diagnostic;
import io.github.eutro.polyir.core.diag.DiagnosticEngine;
import io.github.eutro.polyir.core.ir.Context;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AffineParserTest {
    private Context ctx;

    @BeforeEach
    void setUp() {
        ctx = new Context();
    }

    private Diagnostic parseError(String source) {
        List<Diagnostic> diags = new ArrayList<>();
        try (DiagnosticEngine.Registration ignored = ctx.getDiagEngine().collectInto(diags)) {
            assertNull(AffineParser.parseAffineMap(source, ctx));
        }
        assertEquals(1, diags.size());
        return diags.get(0);
    }

    @Test
    void testParseMap() {
        AffineMap map = AffineParser.parseAffineMap("(d0, d1)[s0] -> (d0 + s0, d1 floordiv 2)", ctx);
        assertNotNull(map);
        assertEquals(2, map.getNumDims());
        assertEquals(1, map.getNumSymbols());
        assertEquals("(d0, d1)[s0] -> (d0 + s0, d1 floordiv 2)", map.toString());
        assertSame(map, AffineParser.parseAffineMap(map.toString(), ctx));
    }

    @Test
    void testCustomNames() {
        AffineMap map = AffineParser.parseAffineMap("(i, j)[N] -> (i * 2 + N, j mod N)", ctx);
        assertNotNull(map);
        assertEquals("(d0, d1)[s0] -> (d0 * 2 + s0, d1 mod s0)", map.toString());
    }

    @Test
    void testArithmetic() {
        assertEquals("(d0) -> (d0 - 1)", String.valueOf(AffineParser.parseAffineMap("(d0) -> (d0 - 1)", ctx)));
        assertEquals("(d0) -> (d0 * -1)", String.valueOf(AffineParser.parseAffineMap("(d0) -> (-d0)", ctx)));
        assertEquals("(d0) -> ((d0 + 1) ceildiv 4)",
                String.valueOf(AffineParser.parseAffineMap("(d0) -> ((d0 + 1) ceildiv 4)", ctx)));
        assertEquals("() -> (7)", String.valueOf(AffineParser.parseAffineMap("() -> (3 + 4)", ctx)));
        assertEquals("(d0) -> ()", String.valueOf(AffineParser.parseAffineMap("(d0) -> ()", ctx)));
        assertEquals("(d0) -> (d0 * 2)", String.valueOf(AffineParser.parseAffineMap("(d0)->(2*d0)", ctx)));
    }

    @Test
    void testParseExpr() {
        AffineExpr expr = AffineParser.parseAffineExpr("d0 mod 4 + s1", 1, 2, ctx);
        assertNotNull(expr);
        assertEquals("d0 mod 4 + s1", expr.toString());
        assertSame(AffineExpr.symbol(1, ctx), AffineParser.parseAffineExpr("s1", 0, 2, ctx));
    }

    @Test
    void testNonAffine() {
        Diagnostic diag = parseError("(d0, d1) -> (d0 * d1)");
        assertTrue(diag.getMessage().startsWith("non-affine expression"), diag.getMessage());

        diag = parseError("(d0, d1) -> (d0 floordiv d1)");
        assertTrue(diag.getMessage().contains("right operand of floordiv"), diag.getMessage());
    }

    @Test
    void testSymbolicProductsAreAffine() {
        AffineMap map = AffineParser.parseAffineMap("(d0)[s0] -> (d0 * s0, d0 mod s0)", ctx);
        assertNotNull(map);
        assertFalse(map.isPureAffine());
    }

    @Test
    void testUndeclared() {
        Diagnostic diag = parseError("(d0) -> (d1)");
        assertEquals("use of undeclared identifier 'd1'", diag.getMessage());
        assertEquals(Diagnostic.Severity.ERROR, diag.getSeverity());
        assertEquals(10, diag.getLocation().getColumn());
    }

    @Test
    void testRedefinition() {
        assertEquals("redefinition of identifier 'd0'", parseError("(d0, d0) -> (d0)").getMessage());
        assertEquals("redefinition of identifier 'x'", parseError("(x)[x] -> (x)").getMessage());
    }

    @Test
    void testMalformed() {
        assertEquals("unexpected trailing characters", parseError("(d0) -> (d0) x").getMessage());
        assertEquals("expected '->'", parseError("(d0) (d0)").getMessage());
        assertEquals("expected affine expression", parseError("(d0) -> (d0 +)").getMessage());
        assertEquals("expected dimension identifier", parseError("(mod) -> (0)").getMessage());
        assertEquals("constant too large for index", parseError("() -> (99999999999999999999)").getMessage());
    }
}
