package org.symproof.lang.ast;

import lombok.Getter;

/**
 * 可以解析但不在可翻译子集内的表达式，例如 lambda、列表、推导式、yield、await、切片。
 * kind 是用于报错的构造名。
 */
@Getter
public final class UnsupportedExpr extends Expr {

    private final String kind;

    public UnsupportedExpr(String kind, int line) {
        super(line);
        this.kind = kind;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnsupported(this);
    }

    @Override
    public String toString() {
        return "<" + kind + ">";
    }
}
