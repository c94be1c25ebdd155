package org.symproof.lang.ast;

import lombok.Getter;
import org.symproof.utils.Rational;

/**
 * 数字字面量。整数字面量的值是整数；带小数点或指数的是浮点字面量。
 */
@Getter
public final class NumberLiteral extends Expr {

    private final String text;
    private final Rational value;
    private final boolean floating;

    public NumberLiteral(String text, Rational value, boolean floating, int line) {
        super(line);
        this.text = text;
        this.value = value;
        this.floating = floating;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }

    @Override
    public String toString() {
        return text;
    }
}
