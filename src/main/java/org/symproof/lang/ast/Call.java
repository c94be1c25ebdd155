package org.symproof.lang.ast;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

@Getter
public final class Call extends Expr {

    private final Expr function;
    private final List<Expr> arguments;
    private final List<Keyword> keywords;

    public Call(Expr function, List<Expr> arguments, List<Keyword> keywords, int line) {
        super(line);
        this.function = function;
        this.arguments = List.copyOf(arguments);
        this.keywords = List.copyOf(keywords);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        arguments.forEach(a -> parts.add(a.toString()));
        keywords.forEach(k -> parts.add(k.toString()));
        return function + "(" + String.join(", ", parts) + ")";
    }
}
