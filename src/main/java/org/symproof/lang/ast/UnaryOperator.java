package org.symproof.lang.ast;

public enum UnaryOperator {

    NEG("-"),
    POS("+"),
    NOT("not"),
    INVERT("~");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
