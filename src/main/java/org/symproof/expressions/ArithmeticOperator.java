package org.symproof.expressions;

/**
 * 二元算术运算符。FLOOR_DIV 与 MOD 采用向下取整语义，只作用于 Int。
 */
public enum ArithmeticOperator {

    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    FLOOR_DIV("//"),
    MOD("%");

    private final String symbol;

    ArithmeticOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean requiresNonZeroDivisor() {
        return this == DIV || this == FLOOR_DIV || this == MOD;
    }
}
