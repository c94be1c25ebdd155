package org.symproof.contract;

import lombok.Getter;
import org.symproof.expressions.Formulas;
import org.symproof.expressions.terms.Term;
import org.symproof.translate.TranslationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * 附加在类型注解上的细化约束，展开为关于某个变量的一个或多个公式。
 * 描述字符串同时用于展示和缓存指纹，例如 "Gt(0)"。
 */
public final class Refinement {

    @Getter
    private final String description;
    private final List<Function<Term, Term>> constraints;

    private Refinement(String description, List<Function<Term, Term>> constraints) {
        this.description = description;
        this.constraints = List.copyOf(constraints);
    }

    public static Refinement gt(Number bound) {
        Objects.requireNonNull(bound, "Bound cannot be null");
        return new Refinement("Gt(" + bound + ")", List.of(v -> Formulas.gt(v, bound)));
    }

    public static Refinement ge(Number bound) {
        Objects.requireNonNull(bound, "Bound cannot be null");
        return new Refinement("Ge(" + bound + ")", List.of(v -> Formulas.ge(v, bound)));
    }

    public static Refinement lt(Number bound) {
        Objects.requireNonNull(bound, "Bound cannot be null");
        return new Refinement("Lt(" + bound + ")", List.of(v -> Formulas.lt(v, bound)));
    }

    public static Refinement le(Number bound) {
        Objects.requireNonNull(bound, "Bound cannot be null");
        return new Refinement("Le(" + bound + ")", List.of(v -> Formulas.le(v, bound)));
    }

    /**
     * 闭区间 [lo, hi]，展开为两个公式。
     */
    public static Refinement between(Number lo, Number hi) {
        Objects.requireNonNull(lo, "Lower bound cannot be null");
        Objects.requireNonNull(hi, "Upper bound cannot be null");
        return new Refinement("Between(" + lo + ", " + hi + ")",
                List.of(v -> Formulas.ge(v, lo), v -> Formulas.le(v, hi)));
    }

    public static Refinement notEq(Number value) {
        Objects.requireNonNull(value, "Value cannot be null");
        return new Refinement("NotEq(" + value + ")", List.of(v -> Formulas.ne(v, value)));
    }

    /**
     * 任意谓词细化。description 应唯一地描述该谓词，它参与缓存键的计算。
     */
    public static Refinement predicate(String description, Function<Term, Term> predicate) {
        Objects.requireNonNull(description, "Description cannot be null");
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        return new Refinement(description, List.of(predicate));
    }

    /**
     * 展开为关于 subject 的公式列表。
     * @throws TranslationException 谓词没有返回公式。
     */
    public List<Term> expand(Term subject) {
        List<Term> formulas = new ArrayList<>(constraints.size());
        for (Function<Term, Term> constraint : constraints) {
            Term formula = constraint.apply(subject);
            if (formula == null || !formula.isFormula()) {
                throw new TranslationException("Refinement " + description + " did not produce a formula");
            }
            formulas.add(formula);
        }
        return formulas;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Refinement that && description.equals(that.description);
    }

    @Override
    public int hashCode() {
        return description.hashCode();
    }

    @Override
    public String toString() {
        return description;
    }
}
