package org.symproof.lang.ast;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * and / or 链，至少两个操作数。
 */
@Getter
public final class BoolOp extends Expr {

    private final BoolOperator operator;
    private final List<Expr> values;

    public BoolOp(BoolOperator operator, List<Expr> values, int line) {
        super(line);
        this.operator = operator;
        this.values = List.copyOf(values);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBoolOp(this);
    }

    @Override
    public String toString() {
        String sep = operator == BoolOperator.AND ? " and " : " or ";
        return values.stream().map(Expr::toString).collect(Collectors.joining(sep, "(", ")"));
    }
}
