package org.symproof.lang.ast;

import lombok.Getter;

@Getter
public final class BinaryOp extends Expr {

    private final BinaryOperator operator;
    private final Expr left;
    private final Expr right;

    public BinaryOp(BinaryOperator operator, Expr left, Expr right, int line) {
        super(line);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
