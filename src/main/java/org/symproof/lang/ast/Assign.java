package org.symproof.lang.ast;

import lombok.Getter;

import java.util.List;

/**
 * 赋值 t0 = t1 = ... = value。targets 至少一个。
 */
@Getter
public final class Assign extends Stmt {

    private final List<Expr> targets;
    private final Expr value;

    public Assign(List<Expr> targets, Expr value, int line) {
        super(line);
        this.targets = List.copyOf(targets);
        this.value = value;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitAssign(this, context);
    }
}
