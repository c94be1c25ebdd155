package org.symproof.expressions.terms;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.symproof.core.Sort;
import org.symproof.symbolic.Z3VariableManager;
import org.symproof.utils.Rational;

import java.util.List;
import java.util.Objects;

/**
 * 精确数值常量。INT 常量的值必须是整数。
 */
@Getter
public final class Numeral extends Term {

    private final Rational value;

    private Numeral(Sort sort, Rational value) {
        super(sort, Objects.hash("Numeral", sort, value));
        this.value = value;
    }

    public static Numeral of(Sort sort, Rational value) {
        Objects.requireNonNull(value, "Numeral value cannot be null");
        if (sort == null || !sort.isNumeric()) {
            throw new IllegalArgumentException("Numeral requires a numeric sort, got " + sort);
        }
        if (sort == Sort.INT && !value.isInteger()) {
            throw new IllegalArgumentException("Int numeral must be integral: " + value);
        }
        return new Numeral(sort, value);
    }

    public static Numeral ofInt(long value) {
        return new Numeral(Sort.INT, Rational.valueOf(value));
    }

    public static Numeral ofReal(Rational value) {
        return of(Sort.REAL, value);
    }

    @Override
    public List<Term> children() {
        return List.of();
    }

    @Override
    protected boolean isAtomic() {
        return value.signum() >= 0;
    }

    @Override
    public Expr<?> toZ3Expr(Context ctx, Z3VariableManager varManager) {
        if (getSort() == Sort.INT) {
            return ctx.mkInt(value.getNumerator().toString());
        }
        return value.toZ3Real(ctx);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Numeral that)) {
            return false;
        }
        return getSort() == that.getSort() && value.equals(that.value);
    }

    @Override
    public String toString() {
        if (getSort() == Sort.REAL && value.isInteger()) {
            return value + ".0";
        }
        return value.toString();
    }
}
