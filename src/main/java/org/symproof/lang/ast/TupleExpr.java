package org.symproof.lang.ast;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

@Getter
public final class TupleExpr extends Expr {

    private final List<Expr> elements;

    public TupleExpr(List<Expr> elements, int line) {
        super(line);
        this.elements = List.copyOf(elements);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitTuple(this);
    }

    @Override
    public String toString() {
        if (elements.size() == 1) {
            return "(" + elements.get(0) + ",)";
        }
        return elements.stream().map(Expr::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
