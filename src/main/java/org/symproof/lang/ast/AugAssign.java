package org.symproof.lang.ast;

import lombok.Getter;

@Getter
public final class AugAssign extends Stmt {

    private final Expr target;
    private final BinaryOperator operator;
    private final Expr value;

    public AugAssign(Expr target, BinaryOperator operator, Expr value, int line) {
        super(line);
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitAugAssign(this, context);
    }
}
