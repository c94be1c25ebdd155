package org.symproof.expressions.terms;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;
import lombok.Getter;
import org.symproof.core.Sort;
import org.symproof.expressions.ArithmeticOperator;
import org.symproof.symbolic.Z3VariableManager;

import java.util.List;
import java.util.Objects;

/**
 * 二元算术。两个操作数 sort 相同；DIV 只作用于 REAL，FLOOR_DIV 与 MOD 只作用于 INT，
 * 且按向下取整语义编码 (-7 // 2 == -4, -7 % 2 == 1)。
 */
@Getter
public final class Arithmetic extends Term {

    private final ArithmeticOperator operator;
    private final Term left;
    private final Term right;

    private Arithmetic(ArithmeticOperator operator, Term left, Term right) {
        super(left.getSort(), Objects.hash("Arithmetic", operator, left, right));
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public static Arithmetic of(ArithmeticOperator operator, Term left, Term right) {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
        if (!left.getSort().isNumeric() || left.getSort() != right.getSort()) {
            throw new IllegalArgumentException("Arithmetic operands must share a numeric sort: "
                    + left.getSort() + " " + operator.getSymbol() + " " + right.getSort());
        }
        if (operator == ArithmeticOperator.DIV && left.getSort() != Sort.REAL) {
            throw new IllegalArgumentException("True division requires Real operands");
        }
        if ((operator == ArithmeticOperator.FLOOR_DIV || operator == ArithmeticOperator.MOD)
                && left.getSort() != Sort.INT) {
            throw new IllegalArgumentException(operator.getSymbol() + " requires Int operands");
        }
        return new Arithmetic(operator, left, right);
    }

    @Override
    public List<Term> children() {
        return List.of(left, right);
    }

    private boolean hasPositiveLiteralDivisor() {
        return right instanceof Numeral numeral && numeral.getValue().signum() > 0;
    }

    @Override
    public Expr<?> toZ3Expr(Context ctx, Z3VariableManager varManager) {
        ArithExpr a = (ArithExpr) varManager.encode(left);
        ArithExpr b = (ArithExpr) varManager.encode(right);
        return switch (operator) {
            case ADD -> ctx.mkAdd(a, b);
            case SUB -> ctx.mkSub(a, b);
            case MUL -> ctx.mkMul(a, b);
            case DIV -> ctx.mkDiv(a, b);
            case FLOOR_DIV -> floorDiv(ctx, (IntExpr) a, (IntExpr) b);
            case MOD -> {
                if (hasPositiveLiteralDivisor()) {
                    yield ctx.mkMod((IntExpr) a, (IntExpr) b);
                }
                // a % b == a - b * (a // b)
                yield ctx.mkSub(a, ctx.mkMul(b, floorDiv(ctx, (IntExpr) a, (IntExpr) b)));
            }
        };
    }

    private Expr floorDiv(Context ctx, IntExpr a, IntExpr b) {
        // Z3 的整数除法对正除数即为向下取整
        if (hasPositiveLiteralDivisor()) {
            return ctx.mkDiv(a, b);
        }
        return ctx.mkITE(ctx.mkGt(b, ctx.mkInt(0)),
                ctx.mkDiv(a, b),
                ctx.mkDiv(ctx.mkUnaryMinus(a), ctx.mkUnaryMinus(b)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Arithmetic that)) {
            return false;
        }
        return hashCode() == that.hashCode() && operator == that.operator
                && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public String toString() {
        return wrap(left) + " " + operator.getSymbol() + " " + wrap(right);
    }
}
