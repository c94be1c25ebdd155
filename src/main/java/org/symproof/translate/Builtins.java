package org.symproof.translate;

import org.symproof.core.Sort;
import org.symproof.expressions.Formulas;
import org.symproof.expressions.terms.Numeral;
import org.symproof.expressions.terms.Term;
import org.symproof.expressions.terms.TupleValue;
import org.symproof.expressions.terms.Variable;
import org.symproof.utils.Rational;

import java.util.List;
import java.util.Set;

/**
 * 内建函数 min、max、abs、pow、bool、int、float、len、round 的编码。
 */
final class Builtins {

    private static final Set<String> NAMES = Set.of(
            "min", "max", "abs", "pow", "bool", "int", "float", "len", "round");

    private final TranslationState state;

    Builtins(TranslationState state) {
        this.state = state;
    }

    static boolean isBuiltin(String name) {
        return NAMES.contains(name);
    }

    Term call(String name, List<Term> args, int line) {
        return switch (name) {
            case "min" -> fold(name, args, line, true);
            case "max" -> fold(name, args, line, false);
            case "abs" -> Formulas.abs(single(name, args, line));
            case "pow" -> {
                if (args.size() != 2) {
                    throw new TranslationException("pow() takes exactly two arguments", line);
                }
                yield Formulas.pow(args.get(0), constantExponent(args.get(1), line));
            }
            case "bool" -> args.isEmpty() ? Formulas.FALSE : Formulas.truthy(single(name, args, line));
            case "int" -> Formulas.truncate(single(name, args, line));
            case "float" -> args.isEmpty() ? Formulas.real("0") : Formulas.toReal(single(name, args, line));
            case "len" -> length(args, line);
            case "round" -> round(args, line);
            default -> throw new TranslationException("Unknown function '" + name + "'", line);
        };
    }

    /**
     * 取出常量整数指数，必须在 0 到 3 之间。
     */
    static int constantExponent(Term exponent, int line) {
        if (exponent instanceof Numeral n && n.getSort() == Sort.INT && n.getValue().signum() >= 0
                && n.getValue().compareTo(Rational.valueOf(3)) <= 0) {
            return n.getValue().getNumerator().intValueExact();
        }
        throw new TranslationException("Only constant integer exponents 0-3 supported for **", line);
    }

    private static Term single(String name, List<Term> args, int line) {
        if (args.size() != 1) {
            throw new TranslationException(name + "() takes exactly one argument, got " + args.size(), line);
        }
        Term arg = args.get(0);
        if (arg instanceof TupleValue) {
            throw new TranslationException(name + "() of a tuple is not supported", line);
        }
        return arg;
    }

    private static Term fold(String name, List<Term> args, int line, boolean minimum) {
        List<Term> operands = args;
        if (args.size() == 1) {
            if (!(args.get(0) instanceof TupleValue tuple)) {
                throw new TranslationException(name + "() of a single non-tuple argument is not supported", line);
            }
            operands = tuple.getElements();
        }
        if (operands.isEmpty()) {
            throw new TranslationException(name + "() expects at least one argument", line);
        }
        Term result = operands.get(0);
        for (Term next : operands.subList(1, operands.size())) {
            result = minimum ? Formulas.min(result, next) : Formulas.max(result, next);
        }
        return result;
    }

    /**
     * len(x)：长度未知，只知道非负。
     */
    private Term length(List<Term> args, int line) {
        if (args.size() != 1) {
            throw new TranslationException("len() takes exactly one argument, got " + args.size(), line);
        }
        if (args.get(0) instanceof TupleValue tuple) {
            return Formulas.num(tuple.size());
        }
        Variable n = state.fresh("len", Sort.INT);
        state.assume(Formulas.ge(n, 0));
        return n;
    }

    /**
     * round(x)：新的整数 r，满足 |r - x| <= 1/2。
     */
    private Term round(List<Term> args, int line) {
        if (args.size() == 2) {
            throw new TranslationException("round() with ndigits is not supported", line);
        }
        Term x = single("round", args, line);
        if (x.getSort() != Sort.REAL) {
            return Formulas.truncate(x);
        }
        Variable r = state.fresh("round", Sort.INT);
        Term diff = Formulas.sub(r, x);
        state.assume(Formulas.and(Formulas.ge(diff, Formulas.real("-1/2")), Formulas.le(diff, Formulas.real("1/2"))));
        return r;
    }
}
