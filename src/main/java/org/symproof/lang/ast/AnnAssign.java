package org.symproof.lang.ast;

import lombok.Getter;

/**
 * 带注解的赋值 target: annotation = value。value 可以为 null（仅声明）。
 */
@Getter
public final class AnnAssign extends Stmt {

    private final Expr target;
    private final Expr annotation;
    private final Expr value;

    public AnnAssign(Expr target, Expr annotation, Expr value, int line) {
        super(line);
        this.target = target;
        this.annotation = annotation;
        this.value = value;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitAnnAssign(this, context);
    }
}
