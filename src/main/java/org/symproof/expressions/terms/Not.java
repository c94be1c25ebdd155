package org.symproof.expressions.terms;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.symproof.core.Sort;
import org.symproof.symbolic.Z3VariableManager;

import java.util.List;
import java.util.Objects;

@Getter
public final class Not extends Term {

    private final Term operand;

    private Not(Term operand) {
        super(Sort.BOOL, Objects.hash("Not", operand));
        this.operand = operand;
    }

    public static Not of(Term operand) {
        Objects.requireNonNull(operand, "Operand cannot be null");
        if (!operand.isFormula()) {
            throw new IllegalArgumentException("Not requires a formula, got " + operand.getSort());
        }
        return new Not(operand);
    }

    @Override
    public List<Term> children() {
        return List.of(operand);
    }

    @Override
    protected boolean isAtomic() {
        return true;
    }

    @Override
    public Expr<?> toZ3Expr(Context ctx, Z3VariableManager varManager) {
        return ctx.mkNot((BoolExpr) varManager.encode(operand));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Not that && hashCode() == that.hashCode() && operand.equals(that.operand);
    }

    @Override
    public String toString() {
        return "Not(" + operand + ")";
    }
}
