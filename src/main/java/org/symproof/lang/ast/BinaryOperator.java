package org.symproof.lang.ast;

public enum BinaryOperator {

    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    FLOOR_DIV("//"),
    MOD("%"),
    POW("**"),
    MATMUL("@"),
    BIT_OR("|"),
    BIT_XOR("^"),
    BIT_AND("&"),
    LSHIFT("<<"),
    RSHIFT(">>");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 由运算符文本查找，增量赋值的 "+=" 去掉 "=" 后同样适用。
     */
    public static BinaryOperator fromSymbol(String symbol) {
        for (BinaryOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown binary operator: " + symbol);
    }
}
