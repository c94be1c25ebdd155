package org.symproof.lang.ast;

import lombok.Getter;

/**
 * 下标 value[index]。多个下标 a[x, y] 的 index 为 TupleExpr。
 */
@Getter
public final class Subscript extends Expr {

    private final Expr value;
    private final Expr index;

    public Subscript(Expr value, Expr index, int line) {
        super(line);
        this.value = value;
        this.index = index;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitSubscript(this);
    }

    @Override
    public String toString() {
        return value + "[" + index + "]";
    }
}
