package org.symproof.lang.ast;

import lombok.Getter;

@Getter
public final class Assert extends Stmt {

    private final Expr test;
    private final Expr message;

    public Assert(Expr test, Expr message, int line) {
        super(line);
        this.test = test;
        this.message = message;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitAssert(this, context);
    }
}
