package org.symproof.lang.ast;

import lombok.Getter;

import java.util.List;

/**
 * 比较链 left op0 c0 op1 c1 ...，operators 与 comparators 等长。
 */
@Getter
public final class Compare extends Expr {

    private final Expr left;
    private final List<CompareOperator> operators;
    private final List<Expr> comparators;

    public Compare(Expr left, List<CompareOperator> operators, List<Expr> comparators, int line) {
        super(line);
        if (operators.size() != comparators.size() || operators.isEmpty()) {
            throw new IllegalArgumentException("Comparison chain needs matching operators and operands");
        }
        this.left = left;
        this.operators = List.copyOf(operators);
        this.comparators = List.copyOf(comparators);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCompare(this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(").append(left);
        for (int i = 0; i < operators.size(); i++) {
            sb.append(' ').append(operators.get(i).getSymbol()).append(' ').append(comparators.get(i));
        }
        return sb.append(')').toString();
    }
}
