package org.symproof.lang.ast;

import lombok.Getter;

/**
 * 赋值表达式 target := value。
 */
@Getter
public final class NamedExpr extends Expr {

    private final String target;
    private final Expr value;

    public NamedExpr(String target, Expr value, int line) {
        super(line);
        this.target = target;
        this.value = value;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitNamedExpr(this);
    }

    @Override
    public String toString() {
        return "(" + target + " := " + value + ")";
    }
}
