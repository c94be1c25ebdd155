package org.symproof.lang.ast;

/**
 * @param <R> 访问结果类型
 * @param <C> 随遍历传递的上下文类型
 */
public interface StmtVisitor<R, C> {

    R visitReturn(Return stmt, C context);

    R visitAssign(Assign stmt, C context);

    R visitAnnAssign(AnnAssign stmt, C context);

    R visitAugAssign(AugAssign stmt, C context);

    R visitIf(If stmt, C context);

    R visitFor(For stmt, C context);

    R visitWhile(While stmt, C context);

    R visitAssert(Assert stmt, C context);

    R visitPass(Pass stmt, C context);

    R visitExprStmt(ExprStmt stmt, C context);

    R visitUnsupported(UnsupportedStmt stmt, C context);
}
