package org.symproof.expressions.terms;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.symproof.core.Sort;
import org.symproof.expressions.RelationType;
import org.symproof.symbolic.Z3VariableManager;

import java.util.List;
import java.util.Objects;

/**
 * 关系原子 left rel right。两侧 sort 相同；序关系要求数值 sort。
 */
@Getter
public final class Comparison extends Term {

    private final RelationType relation;
    private final Term left;
    private final Term right;

    private Comparison(RelationType relation, Term left, Term right) {
        super(Sort.BOOL, Objects.hash("Comparison", relation, left, right));
        this.relation = relation;
        this.left = left;
        this.right = right;
    }

    public static Comparison of(RelationType relation, Term left, Term right) {
        Objects.requireNonNull(relation, "Relation cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
        if (left.getSort() != right.getSort()) {
            throw new IllegalArgumentException("Comparison operands must share a sort: "
                    + left.getSort() + " vs " + right.getSort());
        }
        if (relation.isOrdering() && !left.getSort().isNumeric()) {
            throw new IllegalArgumentException("Ordering comparison requires numeric operands");
        }
        return new Comparison(relation, left, right);
    }

    @Override
    public List<Term> children() {
        return List.of(left, right);
    }

    @Override
    public Expr<?> toZ3Expr(Context ctx, Z3VariableManager varManager) {
        Expr l = varManager.encode(left);
        Expr r = varManager.encode(right);
        return switch (relation) {
            case LT -> ctx.mkLt((ArithExpr) l, (ArithExpr) r);
            case LE -> ctx.mkLe((ArithExpr) l, (ArithExpr) r);
            case GT -> ctx.mkGt((ArithExpr) l, (ArithExpr) r);
            case GE -> ctx.mkGe((ArithExpr) l, (ArithExpr) r);
            case EQ -> ctx.mkEq(l, r);
            case NE -> ctx.mkNot(ctx.mkEq(l, r));
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Comparison that)) {
            return false;
        }
        return hashCode() == that.hashCode() && relation == that.relation
                && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public String toString() {
        return wrap(left) + " " + relation.getSymbol() + " " + wrap(right);
    }
}
