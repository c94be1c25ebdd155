package org.symproof.expressions.terms;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.symproof.symbolic.Z3VariableManager;

import java.util.List;
import java.util.Objects;

/**
 * 数值取负。
 */
@Getter
public final class Negation extends Term {

    private final Term operand;

    private Negation(Term operand) {
        super(operand.getSort(), Objects.hash("Negation", operand));
        this.operand = operand;
    }

    public static Negation of(Term operand) {
        Objects.requireNonNull(operand, "Operand cannot be null");
        if (!operand.getSort().isNumeric()) {
            throw new IllegalArgumentException("Negation requires a numeric operand, got " + operand.getSort());
        }
        return new Negation(operand);
    }

    @Override
    public List<Term> children() {
        return List.of(operand);
    }

    @Override
    public Expr<?> toZ3Expr(Context ctx, Z3VariableManager varManager) {
        return ctx.mkUnaryMinus((ArithExpr) varManager.encode(operand));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Negation that && hashCode() == that.hashCode() && operand.equals(that.operand);
    }

    @Override
    public String toString() {
        return "-" + wrap(operand);
    }
}
