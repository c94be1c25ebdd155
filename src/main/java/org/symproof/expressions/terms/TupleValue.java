package org.symproof.expressions.terms;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.symproof.core.Sort;
import org.symproof.symbolic.Z3VariableManager;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 元组值。在求解器中表示为一个 Int 身份常量，各元素通过访问器公理
 * tuple_get_i(identity) == element_i 关联；翻译器同时保留元素列表以便解包和下标。
 */
@Getter
public final class TupleValue extends Term {

    private final Variable identity;
    private final List<Term> elements;

    private TupleValue(Variable identity, List<Term> elements) {
        super(Sort.INT, Objects.hash("Tuple", identity, elements));
        this.identity = identity;
        this.elements = elements;
    }

    public static TupleValue of(Variable identity, List<Term> elements) {
        Objects.requireNonNull(identity, "Tuple identity cannot be null");
        if (identity.getSort() != Sort.INT) {
            throw new IllegalArgumentException("Tuple identity must be an Int variable");
        }
        List<Term> copy = List.copyOf(elements);
        if (copy.size() < 2) {
            throw new IllegalArgumentException("Tuple needs at least two elements, got " + copy.size());
        }
        return new TupleValue(identity, copy);
    }

    public int size() {
        return elements.size();
    }

    public Term get(int index) {
        return elements.get(index);
    }

    @Override
    public List<Term> children() {
        return elements;
    }

    @Override
    protected boolean isAtomic() {
        return true;
    }

    @Override
    public Expr<?> toZ3Expr(Context ctx, Z3VariableManager varManager) {
        return varManager.encode(identity);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof TupleValue that && hashCode() == that.hashCode()
                && identity.equals(that.identity) && elements.equals(that.elements);
    }

    @Override
    public String toString() {
        return elements.stream().map(Term::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
