package io.github.eutro.polyir.core.affine;

public enum AffineExprKind {
    ADD("+"),
    MUL("*"),
    MOD("mod"),
    FLOOR_DIV("floordiv"),
    CEIL_DIV("ceildiv"),
    CONSTANT(null),
    DIM_ID(null),
    SYMBOL_ID(null),
    ;

    private final String operator;

    AffineExprKind(String operator) {
        this.operator = operator;
    }

    public boolean isBinary() {
        return operator != null;
    }

    /**
     * Get the token of this kind in the textual form, if it is a binary operator.
     *
     * @return The token, or null.
     */
    public String getOperator() {
        return operator;
    }
}
