package org.symproof.expressions.terms;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.symproof.symbolic.Z3VariableManager;

import java.util.List;
import java.util.Objects;

/**
 * if-then-else 项，也是分支合并时的 phi 表达式。两个分支 sort 相同。
 */
@Getter
public final class Conditional extends Term {

    private final Term condition;
    private final Term thenTerm;
    private final Term elseTerm;

    private Conditional(Term condition, Term thenTerm, Term elseTerm) {
        super(thenTerm.getSort(), Objects.hash("Conditional", condition, thenTerm, elseTerm));
        this.condition = condition;
        this.thenTerm = thenTerm;
        this.elseTerm = elseTerm;
    }

    public static Conditional of(Term condition, Term thenTerm, Term elseTerm) {
        Objects.requireNonNull(condition, "Condition cannot be null");
        Objects.requireNonNull(thenTerm, "Then branch cannot be null");
        Objects.requireNonNull(elseTerm, "Else branch cannot be null");
        if (!condition.isFormula()) {
            throw new IllegalArgumentException("Condition must be a formula, got " + condition.getSort());
        }
        if (thenTerm.getSort() != elseTerm.getSort()) {
            throw new IllegalArgumentException("Branches must share a sort: "
                    + thenTerm.getSort() + " vs " + elseTerm.getSort());
        }
        return new Conditional(condition, thenTerm, elseTerm);
    }

    @Override
    public List<Term> children() {
        return List.of(condition, thenTerm, elseTerm);
    }

    @Override
    protected boolean isAtomic() {
        return true;
    }

    @Override
    public Expr<?> toZ3Expr(Context ctx, Z3VariableManager varManager) {
        return ctx.mkITE((BoolExpr) varManager.encode(condition),
                (Expr) varManager.encode(thenTerm), (Expr) varManager.encode(elseTerm));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Conditional that)) {
            return false;
        }
        return hashCode() == that.hashCode() && condition.equals(that.condition)
                && thenTerm.equals(that.thenTerm) && elseTerm.equals(that.elseTerm);
    }

    @Override
    public String toString() {
        return "If(" + condition + ", " + thenTerm + ", " + elseTerm + ")";
    }
}
