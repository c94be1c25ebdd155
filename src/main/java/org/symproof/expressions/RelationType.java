package org.symproof.expressions;

public enum RelationType {

    /**
     * 运算符枚举
     */
    LT("<"),    // Less Than
    LE("<="),   // Less Equal
    GT(">"),    // Greater Than
    GE(">="),   // Greater Equal
    EQ("=="),   // Equal
    NE("!=");   // Not Equal

    private final String symbol;

    RelationType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 是否为序关系 (要求数值操作数)。
     */
    public boolean isOrdering() {
        return this != EQ && this != NE;
    }

    /**
     * 返回此关系类型的否定关系。
     * 例如：LT 的否定是 GE。
     */
    public RelationType negate() {
        return switch (this) {
            case LT -> GE;
            case LE -> GT;
            case GT -> LE;
            case GE -> LT;
            case EQ -> NE;
            case NE -> EQ;
        };
    }

    /**
     * 返回交换操作数后的等价关系。
     * 例如：(a < b) -> (b > a)。
     */
    public RelationType flip() {
        return switch (this) {
            case LT -> GT;
            case LE -> GE;
            case GT -> LT;
            case GE -> LE;
            case EQ -> EQ;
            case NE -> NE;
        };
    }

    /**
     * 根据 compareTo 的结果判断关系是否成立，用于常量折叠。
     * @param comparison left.compareTo(right) 的结果。
     */
    public boolean holds(int comparison) {
        return switch (this) {
            case LT -> comparison < 0;
            case LE -> comparison <= 0;
            case GT -> comparison > 0;
            case GE -> comparison >= 0;
            case EQ -> comparison == 0;
            case NE -> comparison != 0;
        };
    }
}
