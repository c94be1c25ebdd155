package org.symproof.translate;

import org.symproof.core.Sort;
import org.symproof.expressions.Formulas;
import org.symproof.expressions.FunctionSymbol;
import org.symproof.expressions.terms.Term;
import org.symproof.expressions.terms.Variable;

import java.util.List;

/**
 * math 模块的常量与超越函数。
 * 常量 pi、e 是带有理数界限的符号常量；sqrt、exp、log、sin 是未解释函数，
 * 其公理在每个应用处实例化为假设，定义域条件作为安全义务。
 */
final class MathLibrary {

    private static final FunctionSymbol SQRT = unary("math_sqrt");
    private static final FunctionSymbol EXP = unary("math_exp");
    private static final FunctionSymbol LOG = unary("math_log");
    private static final FunctionSymbol SIN = unary("math_sin");

    private final TranslationState state;

    MathLibrary(TranslationState state) {
        this.state = state;
    }

    private static FunctionSymbol unary(String name) {
        return FunctionSymbol.of(name, List.of(Sort.REAL), Sort.REAL);
    }

    Term constant(String path, int line) {
        return switch (path) {
            case "math.pi" -> bounded("math_pi", "3.14159", "3.14160");
            case "math.e" -> bounded("math_e", "2.71828", "2.71829");
            default -> throw new TranslationException("Unsupported attribute access '" + path + "'", line);
        };
    }

    private Term bounded(String name, String lower, String upper) {
        Variable c = Formulas.realVar(name);
        if (state.introduce(name)) {
            state.assume(Formulas.and(Formulas.gt(c, Formulas.real(lower)), Formulas.lt(c, Formulas.real(upper))));
        }
        return c;
    }

    Term call(String path, List<Term> args, Term pathCondition, int line) {
        if (args.size() != 1) {
            throw new TranslationException(path + "() takes exactly one argument, got " + args.size(), line);
        }
        Term x = Formulas.toReal(args.get(0));
        switch (path) {
            case "math.sqrt": {
                state.requireSafe(Formulas.implies(pathCondition, Formulas.ge(x, 0)));
                Term r = Formulas.apply(SQRT, x);
                state.assume(Formulas.ge(r, 0));
                state.assume(Formulas.implies(Formulas.ge(x, 0), Formulas.eq(Formulas.mul(r, r), x)));
                return r;
            }
            case "math.exp": {
                Term r = Formulas.apply(EXP, x);
                state.assume(Formulas.gt(r, 0));
                state.assume(Formulas.ge(r, Formulas.add(x, 1)));
                return r;
            }
            case "math.log": {
                state.requireSafe(Formulas.implies(pathCondition, Formulas.gt(x, 0)));
                Term r = Formulas.apply(LOG, x);
                state.assume(Formulas.implies(Formulas.gt(x, 0), Formulas.le(r, Formulas.sub(x, 1))));
                state.assume(Formulas.implies(Formulas.eq(x, 1), Formulas.eq(r, 0)));
                return r;
            }
            case "math.sin": {
                Term r = Formulas.apply(SIN, x);
                state.assume(Formulas.and(Formulas.ge(r, -1), Formulas.le(r, 1)));
                return r;
            }
            default:
                throw new TranslationException("Unsupported math function '" + path + "'", line);
        }
    }
}
