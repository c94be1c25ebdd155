package org.symproof.lang.ast;

import lombok.Getter;

@Getter
public final class Attribute extends Expr {

    private final Expr value;
    private final String attribute;

    public Attribute(Expr value, String attribute, int line) {
        super(line);
        this.value = value;
        this.attribute = attribute;
    }

    /**
     * 纯名字链 (a.b.c) 的点分路径；否则为 null。
     */
    public String dottedPath() {
        if (value instanceof Name name) {
            return name.getId() + "." + attribute;
        }
        if (value instanceof Attribute inner) {
            String prefix = inner.dottedPath();
            return prefix == null ? null : prefix + "." + attribute;
        }
        return null;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitAttribute(this);
    }

    @Override
    public String toString() {
        return value + "." + attribute;
    }
}
