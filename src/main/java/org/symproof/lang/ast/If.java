package org.symproof.lang.ast;

import lombok.Getter;

import java.util.List;

/**
 * if 语句。elif 链表示为 orelse 中嵌套的单个 If。
 */
@Getter
public final class If extends Stmt {

    private final Expr test;
    private final List<Stmt> body;
    private final List<Stmt> orelse;

    public If(Expr test, List<Stmt> body, List<Stmt> orelse, int line) {
        super(line);
        this.test = test;
        this.body = List.copyOf(body);
        this.orelse = List.copyOf(orelse);
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitIf(this, context);
    }
}
