package org.symproof.lang.ast;

import lombok.Getter;

/**
 * 星号展开 *value。
 */
@Getter
public final class Starred extends Expr {

    private final Expr value;

    public Starred(Expr value, int line) {
        super(line);
        this.value = value;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitStarred(this);
    }

    @Override
    public String toString() {
        return "*" + value;
    }
}
