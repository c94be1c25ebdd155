package org.symproof.lang.ast;

import lombok.Getter;

import java.util.List;

@Getter
public final class While extends Stmt {

    private final Expr test;
    private final List<Stmt> body;
    private final List<Stmt> orelse;

    public While(Expr test, List<Stmt> body, List<Stmt> orelse, int line) {
        super(line);
        this.test = test;
        this.body = List.copyOf(body);
        this.orelse = List.copyOf(orelse);
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitWhile(this, context);
    }
}
