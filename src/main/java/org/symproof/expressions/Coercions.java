package org.symproof.expressions;

import org.apache.commons.lang3.tuple.Pair;
import org.symproof.core.Sort;
import org.symproof.expressions.terms.Term;

/**
 * sort 转换规则：相同 sort 直接通过；Int 与 Real 混用时提升为 Real；
 * Bool 与数值混用时转为 Int (0/1)。
 */
public final class Coercions {

    private Coercions() {
    }

    /**
     * 把两个 term 转换到共同的 sort。
     */
    public static Pair<Term, Term> unify(Term a, Term b) {
        Sort sa = a.getSort();
        Sort sb = b.getSort();
        if (sa == sb) {
            return Pair.of(a, b);
        }
        if (sa == Sort.BOOL) {
            return unify(toNumeric(a), b);
        }
        if (sb == Sort.BOOL) {
            return unify(a, toNumeric(b));
        }
        if (sa.isNumeric() && sb.isNumeric()) {
            return Pair.of(Formulas.toReal(a), Formulas.toReal(b));
        }
        throw new SortMismatchException("Cannot unify sorts " + sa + " and " + sb);
    }

    /**
     * 数值化：Bool 变为 If(b, 1, 0)，数值不变。
     */
    public static Term toNumeric(Term term) {
        if (term.getSort() == Sort.BOOL) {
            return Formulas.ite(term, Formulas.num(1), Formulas.num(0));
        }
        return term;
    }

    /**
     * 按 target sort 做隐式转换。只允许拓宽：Int→Real，Bool→Int/Real。
     */
    public static Term coerceTo(Term term, Sort target) {
        Sort source = term.getSort();
        if (source == target) {
            return term;
        }
        if (target == Sort.REAL) {
            return Formulas.toReal(term);
        }
        if (target == Sort.INT && source == Sort.BOOL) {
            return toNumeric(term);
        }
        throw new SortMismatchException("Cannot coerce " + source + " to " + target);
    }

    /**
     * 真值：公式不变，数值 x 变为 x != 0。
     */
    public static Term truthy(Term term) {
        if (term.isFormula()) {
            return term;
        }
        return Formulas.ne(term, Formulas.zero(term.getSort()));
    }

    /**
     * 要求 term 为公式。
     * @param what 出错时用于描述该 term 的来源。
     */
    public static Term requireFormula(Term term, String what) {
        if (term == null || !term.isFormula()) {
            throw new SortMismatchException(what + " must be a formula, got "
                    + (term == null ? "null" : "a term of sort " + term.getSort()));
        }
        return term;
    }
}
