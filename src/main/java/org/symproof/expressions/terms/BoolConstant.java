package org.symproof.expressions.terms;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import org.symproof.core.Sort;
import org.symproof.symbolic.Z3VariableManager;

import java.util.List;

public final class BoolConstant extends Term {

    public static final BoolConstant TRUE = new BoolConstant(true);
    public static final BoolConstant FALSE = new BoolConstant(false);

    private final boolean value;

    private BoolConstant(boolean value) {
        super(Sort.BOOL, Boolean.hashCode(value) * 31 + 7);
        this.value = value;
    }

    public static BoolConstant of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public List<Term> children() {
        return List.of();
    }

    @Override
    protected boolean isAtomic() {
        return true;
    }

    @Override
    public Expr<?> toZ3Expr(Context ctx, Z3VariableManager varManager) {
        return ctx.mkBool(value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BoolConstant that && that.value == value;
    }

    @Override
    public String toString() {
        return value ? "True" : "False";
    }
}
