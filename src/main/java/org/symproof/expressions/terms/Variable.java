package org.symproof.expressions.terms;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.symproof.core.Sort;
import org.symproof.symbolic.Z3VariableManager;

import java.util.List;
import java.util.Objects;

/**
 * 具名符号常量。同名变量必须具有相同的 sort。
 */
@Getter
public final class Variable extends Term {

    private final String name;

    private Variable(String name, Sort sort) {
        super(sort, Objects.hash("Variable", name, sort));
        this.name = name;
    }

    public static Variable of(String name, Sort sort) {
        Objects.requireNonNull(name, "Variable name cannot be null");
        Objects.requireNonNull(sort, "Variable sort cannot be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Variable name cannot be empty");
        }
        return new Variable(name, sort);
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
        return varManager.getZ3Var(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Variable that)) {
            return false;
        }
        return getSort() == that.getSort() && name.equals(that.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
