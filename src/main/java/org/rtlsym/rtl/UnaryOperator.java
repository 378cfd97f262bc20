package org.rtlsym.rtl;

public enum UnaryOperator {
    BITWISE_NOT("~"),
    LOGICAL_NOT("!"),
    NEGATE("-"),
    REDUCE_AND("&"),
    REDUCE_OR("|"),
    REDUCE_XOR("^");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 结果为 1 位、与操作数宽度无关的运算。
     */
    public boolean isBooleanValued() {
        return this == LOGICAL_NOT || this == REDUCE_AND || this == REDUCE_OR || this == REDUCE_XOR;
    }
}
