package org.symproof.lang.ast;

import lombok.Getter;

/**
 * 条件表达式 body if test else orelse。
 */
@Getter
public final class IfExp extends Expr {

    private final Expr test;
    private final Expr body;
    private final Expr orelse;

    public IfExp(Expr test, Expr body, Expr orelse, int line) {
        super(line);
        this.test = test;
        this.body = body;
        this.orelse = orelse;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitIfExp(this);
    }

    @Override
    public String toString() {
        return "(" + body + " if " + test + " else " + orelse + ")";
    }
}
