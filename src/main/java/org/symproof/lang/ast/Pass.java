package org.symproof.lang.ast;

public final class Pass extends Stmt {

    public Pass(int line) {
        super(line);
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitPass(this, context);
    }
}
