package org.symproof.core;

import com.microsoft.z3.Context;

/**
 * 符号值的三种 sort。
 * INT 与 REAL 为数值 sort，BOOL 为逻辑 sort。
 */
public enum Sort {

    INT("Int"),
    REAL("Real"),
    BOOL("Bool");

    private final String symbol;

    Sort(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isNumeric() {
        return this != BOOL;
    }

    /**
     * 转换为 Z3 中对应的 sort。
     * @param ctx Z3 Context 实例。
     * @return 对应的 Z3 Sort。
     */
    public com.microsoft.z3.Sort toZ3Sort(Context ctx) {
        return switch (this) {
            case INT -> ctx.mkIntSort();
            case REAL -> ctx.mkRealSort();
            case BOOL -> ctx.mkBoolSort();
        };
    }

    @Override
    public String toString() {
        return symbol;
    }
}
