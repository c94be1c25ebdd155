package org.symproof.expressions.terms;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.symproof.core.Sort;
import org.symproof.symbolic.Z3VariableManager;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 逻辑连接词。AND/OR 至少两个操作数，IMPLIES 恰好两个。
 */
@Getter
public final class Connective extends Term {

    public enum Kind {
        AND("And"),
        OR("Or"),
        IMPLIES("Implies");

        private final String display;

        Kind(String display) {
            this.display = display;
        }
    }

    private final Kind kind;
    private final List<Term> operands;

    private Connective(Kind kind, List<Term> operands) {
        super(Sort.BOOL, Objects.hash("Connective", kind, operands));
        this.kind = kind;
        this.operands = operands;
    }

    public static Connective of(Kind kind, List<Term> operands) {
        Objects.requireNonNull(kind, "Connective kind cannot be null");
        List<Term> copy = List.copyOf(operands);
        if (copy.size() < 2 || (kind == Kind.IMPLIES && copy.size() != 2)) {
            throw new IllegalArgumentException(kind + " got " + copy.size() + " operands");
        }
        for (Term operand : copy) {
            if (!operand.isFormula()) {
                throw new IllegalArgumentException(kind + " operand is not a formula: " + operand.getSort());
            }
        }
        return new Connective(kind, copy);
    }

    @Override
    public List<Term> children() {
        return operands;
    }

    @Override
    protected boolean isAtomic() {
        return true;
    }

    @Override
    public Expr<?> toZ3Expr(Context ctx, Z3VariableManager varManager) {
        BoolExpr[] encoded = new BoolExpr[operands.size()];
        for (int i = 0; i < encoded.length; i++) {
            encoded[i] = (BoolExpr) varManager.encode(operands.get(i));
        }
        return switch (kind) {
            case AND -> ctx.mkAnd(encoded);
            case OR -> ctx.mkOr(encoded);
            case IMPLIES -> ctx.mkImplies(encoded[0], encoded[1]);
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Connective that)) {
            return false;
        }
        return hashCode() == that.hashCode() && kind == that.kind && operands.equals(that.operands);
    }

    @Override
    public String toString() {
        return operands.stream().map(Term::toString).collect(Collectors.joining(", ", kind.display + "(", ")"));
    }
}
