package org.symproof.lang.ast;

import lombok.Getter;

/**
 * 表达式语句，包括文档字符串。
 */
@Getter
public final class ExprStmt extends Stmt {

    private final Expr value;

    public ExprStmt(Expr value, int line) {
        super(line);
        this.value = value;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitExprStmt(this, context);
    }
}
