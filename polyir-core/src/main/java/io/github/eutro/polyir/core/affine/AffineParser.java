package io.github.eutro.polyir.core.affine;

import io.github.eutro.polyir.core.diag.Diagnostic;
import io.github.eutro.polyir.core.ir.Context;
import io.github.eutro.polyir.core.ir.Location;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses affine maps and expressions in the form they are printed in,
 * e.g. {@code (d0, d1)[s0] -> (d0 + s0, d1 floordiv 2)}.
 * <p>
 * Dimensions and symbols of a map may be given any identifiers. Errors are reported
 * to the context's diagnostic engine, with the column they were found at, and
 * make the parse methods return null.
 */
public final class AffineParser {
    private static final String SOURCE_NAME = "<affine>";

    private final Context context;
    private final String source;
    private int pos;
    private final Map<String, AffineExpr> bound = new HashMap<>();
    private boolean failed;

    private AffineParser(Context context, String source) {
        this.context = context;
        this.source = source;
    }

    /**
     * Parse an affine map.
     *
     * @param source  The text.
     * @param context The context.
     * @return The map, or null if the text is malformed.
     */
    public static @Nullable AffineMap parseAffineMap(String source, Context context) {
        AffineParser parser = new AffineParser(context, source);
        AffineMap map = parser.parseMap();
        return parser.finish(map);
    }

    /**
     * Parse an affine expression, in which {@code dN} and {@code sN} name
     * dimensions and symbols.
     *
     * @param source     The text.
     * @param numDims    The number of dimensions in scope.
     * @param numSymbols The number of symbols in scope.
     * @param context    The context.
     * @return The expression, or null if the text is malformed.
     */
    public static @Nullable AffineExpr parseAffineExpr(String source, int numDims, int numSymbols, Context context) {
        AffineParser parser = new AffineParser(context, source);
        for (int i = 0; i < numDims; i++) {
            parser.bound.put("d" + i, AffineExpr.dim(i, context));
        }
        for (int i = 0; i < numSymbols; i++) {
            parser.bound.put("s" + i, AffineExpr.symbol(i, context));
        }
        AffineExpr expr = parser.parseSum();
        return parser.finish(expr);
    }

    private <T> @Nullable T finish(@Nullable T result) {
        if (failed) return null;
        skipWhitespace();
        if (pos != source.length()) {
            error("unexpected trailing characters");
            return null;
        }
        return result;
    }

    // lexing

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) pos++;
    }

    private boolean consume(String token) {
        skipWhitespace();
        if (source.startsWith(token, pos)) {
            if (isIdentStart(token.charAt(0))) {
                int end = pos + token.length();
                if (end < source.length() && isIdentPart(source.charAt(end))) return false;
            }
            pos += token.length();
            return true;
        }
        return false;
    }

    private boolean expect(String token) {
        if (consume(token)) return true;
        error("expected '" + token + "'");
        return false;
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '.';
    }

    private @Nullable String identifier() {
        skipWhitespace();
        if (pos >= source.length() || !isIdentStart(source.charAt(pos))) return null;
        int start = pos;
        while (pos < source.length() && isIdentPart(source.charAt(pos))) pos++;
        return source.substring(start, pos);
    }

    private void error(String message) {
        if (failed) return;
        failed = true;
        Location loc = Location.fileLineCol(SOURCE_NAME, 1, pos + 1);
        context.getDiagEngine().emit(Diagnostic.Severity.ERROR, loc, message);
    }

    // maps

    private @Nullable AffineMap parseMap() {
        int numDims = parseIdList("(", ")", true);
        if (numDims < 0) return null;
        int numSymbols = 0;
        skipWhitespace();
        if (source.startsWith("[", pos)) {
            numSymbols = parseIdList("[", "]", false);
            if (numSymbols < 0) return null;
        }
        if (!expect("->") || !expect("(")) return null;
        List<AffineExpr> results = new ArrayList<>();
        if (!consume(")")) {
            do {
                AffineExpr expr = parseSum();
                if (expr == null) return null;
                results.add(expr);
            } while (consume(","));
            if (!expect(")")) return null;
        }
        return AffineMap.get(numDims, numSymbols, results, context);
    }

    private int parseIdList(String open, String close, boolean dims) {
        if (!expect(open)) return -1;
        int count = 0;
        if (consume(close)) return 0;
        do {
            int start = pos;
            String name = identifier();
            if (name == null || isKeyword(name)) {
                error(dims ? "expected dimension identifier" : "expected symbol identifier");
                return -1;
            }
            if (bound.containsKey(name)) {
                pos = start;
                skipWhitespace();
                error("redefinition of identifier '" + name + "'");
                return -1;
            }
            bound.put(name, dims ? AffineExpr.dim(count, context) : AffineExpr.symbol(count, context));
            count++;
        } while (consume(","));
        return expect(close) ? count : -1;
    }

    private static boolean isKeyword(String name) {
        return name.equals("floordiv") || name.equals("ceildiv") || name.equals("mod");
    }

    // expressions

    private @Nullable AffineExpr parseSum() {
        AffineExpr lhs = parseTerm();
        while (lhs != null) {
            if (consume("+")) {
                AffineExpr rhs = parseTerm();
                if (rhs == null) return null;
                lhs = lhs.add(rhs);
            } else if (consume("-")) {
                AffineExpr rhs = parseTerm();
                if (rhs == null) return null;
                lhs = lhs.sub(rhs);
            } else {
                break;
            }
        }
        return lhs;
    }

    private @Nullable AffineExpr parseTerm() {
        AffineExpr lhs = parseUnary();
        while (lhs != null) {
            AffineExprKind kind;
            if (consume("*")) kind = AffineExprKind.MUL;
            else if (consume("floordiv")) kind = AffineExprKind.FLOOR_DIV;
            else if (consume("ceildiv")) kind = AffineExprKind.CEIL_DIV;
            else if (consume("mod")) kind = AffineExprKind.MOD;
            else break;

            AffineExpr rhs = parseUnary();
            if (rhs == null) return null;
            if (kind == AffineExprKind.MUL) {
                if (!lhs.isSymbolicOrConstant() && !rhs.isSymbolicOrConstant()) {
                    error("non-affine expression: at least one of the multiply operands "
                            + "has to be either a constant or symbolic");
                    return null;
                }
                lhs = lhs.mul(rhs);
            } else {
                if (!rhs.isSymbolicOrConstant()) {
                    error("non-affine expression: right operand of " + kind.getOperator()
                            + " has to be either a constant or symbolic");
                    return null;
                }
                switch (kind) {
                    case FLOOR_DIV:
                        lhs = lhs.floorDiv(rhs);
                        break;
                    case CEIL_DIV:
                        lhs = lhs.ceilDiv(rhs);
                        break;
                    default:
                        lhs = lhs.mod(rhs);
                        break;
                }
            }
        }
        return lhs;
    }

    private @Nullable AffineExpr parseUnary() {
        if (consume("-")) {
            AffineExpr operand = parseUnary();
            return operand == null ? null : operand.neg();
        }
        return parsePrimary();
    }

    private @Nullable AffineExpr parsePrimary() {
        skipWhitespace();
        if (pos >= source.length()) {
            error("expected affine expression");
            return null;
        }
        char c = source.charAt(pos);
        if (c == '(') {
            pos++;
            AffineExpr inner = parseSum();
            if (inner == null || !expect(")")) return null;
            return inner;
        }
        if (Character.isDigit(c)) {
            int start = pos;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) pos++;
            try {
                return AffineExpr.constant(Long.parseLong(source.substring(start, pos)), context);
            } catch (NumberFormatException e) {
                pos = start;
                error("constant too large for index");
                return null;
            }
        }
        if (isIdentStart(c)) {
            int start = pos;
            String name = identifier();
            AffineExpr expr = bound.get(name);
            if (expr == null || isKeyword(name)) {
                pos = start;
                error("use of undeclared identifier '" + name + "'");
                return null;
            }
            return expr;
        }
        error("expected affine expression");
        return null;
    }
}
