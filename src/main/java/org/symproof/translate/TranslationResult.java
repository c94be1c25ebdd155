package org.symproof.translate;

import lombok.Getter;
import org.symproof.expressions.terms.Term;

import java.util.List;
import java.util.Optional;

/**
 * 翻译结果。
 * returnGuard 是函数返回所在路径的条件：结构上为 True 表示每条路径都返回，
 * 否则调用方需要把它作为证明义务。returnExpr 为空表示没有任何可达的 return。
 */
@Getter
public final class TranslationResult {

    private final Term returnExpr;
    private final Term returnGuard;
    private final List<Term> assumptions;
    private final List<Term> obligations;
    private final List<Term> safetyObligations;
    private final List<String> warnings;
    private final List<String> caveats;
    private final SymbolicEnvironment environment;

    TranslationResult(Term returnExpr, Term returnGuard, List<Term> assumptions, List<Term> obligations,
                      List<Term> safetyObligations, List<String> warnings, List<String> caveats,
                      SymbolicEnvironment environment) {
        this.returnExpr = returnExpr;
        this.returnGuard = returnGuard;
        this.assumptions = List.copyOf(assumptions);
        this.obligations = List.copyOf(obligations);
        this.safetyObligations = List.copyOf(safetyObligations);
        this.warnings = List.copyOf(warnings);
        this.caveats = List.copyOf(caveats);
        this.environment = environment;
    }

    public Optional<Term> getReturnExpr() {
        return Optional.ofNullable(returnExpr);
    }

    public boolean hasReturn() {
        return returnExpr != null;
    }
}
