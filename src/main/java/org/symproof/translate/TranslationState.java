package org.symproof.translate;

import org.symproof.core.Sort;
import org.symproof.expressions.Formulas;
import org.symproof.expressions.terms.Term;
import org.symproof.expressions.terms.Variable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 一次翻译过程中累积的事实：假设、证明义务、安全义务、警告与 caveat，以及新变量计数器。
 */
final class TranslationState {

    final List<Term> assumptions = new ArrayList<>();
    final List<Term> obligations = new ArrayList<>();
    final List<Term> safetyObligations = new ArrayList<>();
    final List<String> warnings = new ArrayList<>();
    final Set<String> caveats = new LinkedHashSet<>();
    private final Map<String, Integer> counters = new HashMap<>();
    private final Set<String> introducedConstants = new LinkedHashSet<>();

    /**
     * 生成形如 __prefix_N 的新变量，不会与源码中的名字冲突。
     */
    Variable fresh(String prefix, Sort sort) {
        int n = counters.merge(prefix, 1, Integer::sum) - 1;
        return Formulas.var("__" + prefix + "_" + n, sort);
    }

    void assume(Term fact) {
        if (!fact.equals(Formulas.TRUE)) {
            assumptions.add(fact);
        }
    }

    void oblige(Term fact) {
        if (!fact.equals(Formulas.TRUE)) {
            obligations.add(fact);
        }
    }

    void requireSafe(Term fact) {
        if (!fact.equals(Formulas.TRUE)) {
            safetyObligations.add(fact);
        }
    }

    /**
     * 第一次引入某个命名常量时返回 true，用于只添加一次其界限假设。
     */
    boolean introduce(String constant) {
        return introducedConstants.add(constant);
    }
}
