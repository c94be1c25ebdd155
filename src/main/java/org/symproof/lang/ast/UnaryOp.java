package org.symproof.lang.ast;

import lombok.Getter;

@Getter
public final class UnaryOp extends Expr {

    private final UnaryOperator operator;
    private final Expr operand;

    public UnaryOp(UnaryOperator operator, Expr operand, int line) {
        super(line);
        this.operator = operator;
        this.operand = operand;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public String toString() {
        return operator == UnaryOperator.NOT ? "(not " + operand + ")" : "(" + operator.getSymbol() + operand + ")";
    }
}
