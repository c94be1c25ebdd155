package org.symproof.lang.ast;

/**
 * 语句节点。变体集合是封闭的，通过 {@link StmtVisitor} 穷尽分派。
 */
public abstract class Stmt extends Node {

    protected Stmt(int line) {
        super(line);
    }

    public abstract <R, C> R accept(StmtVisitor<R, C> visitor, C context);
}
