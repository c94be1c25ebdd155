package org.symproof.expressions.terms;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.RealExpr;
import lombok.Getter;
import org.symproof.core.Sort;
import org.symproof.symbolic.Z3VariableManager;

import java.util.List;
import java.util.Objects;

/**
 * Int 与 Real 之间的转换。TO_INT 为向下取整。
 */
@Getter
public final class Conversion extends Term {

    public enum Kind {
        TO_REAL(Sort.INT, Sort.REAL, "ToReal"),
        TO_INT(Sort.REAL, Sort.INT, "ToInt");

        private final Sort from;
        private final Sort to;
        private final String display;

        Kind(Sort from, Sort to, String display) {
            this.from = from;
            this.to = to;
            this.display = display;
        }
    }

    private final Kind kind;
    private final Term operand;

    private Conversion(Kind kind, Term operand) {
        super(kind.to, Objects.hash("Conversion", kind, operand));
        this.kind = kind;
        this.operand = operand;
    }

    public static Conversion of(Kind kind, Term operand) {
        Objects.requireNonNull(kind, "Conversion kind cannot be null");
        Objects.requireNonNull(operand, "Operand cannot be null");
        if (operand.getSort() != kind.from) {
            throw new IllegalArgumentException(kind.display + " expects " + kind.from + ", got " + operand.getSort());
        }
        return new Conversion(kind, operand);
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
        Expr<?> encoded = varManager.encode(operand);
        return switch (kind) {
            case TO_REAL -> ctx.mkInt2Real((IntExpr) encoded);
            case TO_INT -> ctx.mkReal2Int((RealExpr) encoded);
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Conversion that && hashCode() == that.hashCode()
                && kind == that.kind && operand.equals(that.operand);
    }

    @Override
    public String toString() {
        return kind.display + "(" + operand + ")";
    }
}
