package org.symproof.lang.ast;

import lombok.Getter;

/**
 * 标识符引用，包括 True、False、None。
 */
@Getter
public final class Name extends Expr {

    private final String id;

    public Name(String id, int line) {
        super(line);
        this.id = id;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitName(this);
    }

    @Override
    public String toString() {
        return id;
    }
}
