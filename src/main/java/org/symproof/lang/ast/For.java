package org.symproof.lang.ast;

import lombok.Getter;

import java.util.List;

@Getter
public final class For extends Stmt {

    private final Expr target;
    private final Expr iterable;
    private final List<Stmt> body;
    private final List<Stmt> orelse;

    public For(Expr target, Expr iterable, List<Stmt> body, List<Stmt> orelse, int line) {
        super(line);
        this.target = target;
        this.iterable = iterable;
        this.body = List.copyOf(body);
        this.orelse = List.copyOf(orelse);
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitFor(this, context);
    }
}
