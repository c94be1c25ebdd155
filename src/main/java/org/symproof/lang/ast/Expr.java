package org.symproof.lang.ast;

/**
 * 表达式节点。变体集合是封闭的，通过 {@link ExprVisitor} 穷尽分派。
 */
public abstract class Expr extends Node {

    protected Expr(int line) {
        super(line);
    }

    public abstract <R> R accept(ExprVisitor<R> visitor);
}
