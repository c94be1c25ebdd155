package org.symproof.lang.ast;

import lombok.Getter;

@Getter
public final class StringLiteral extends Expr {

    private final String value;

    public StringLiteral(String value, int line) {
        super(line);
        this.value = value;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitString(this);
    }

    @Override
    public String toString() {
        return "'" + value + "'";
    }
}
