package org.symproof.contract;

import org.symproof.expressions.terms.Term;

import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * 前置或后置条件谓词：把参数（后置条件时再加上返回值）对应的 term 映射为公式。
 * 谓词体通过 {@link org.symproof.expressions.Formulas} 显式构造公式。
 * 固定元数的谓词会在验证前做元数检查；变元谓词不检查。
 */
@FunctionalInterface
public interface ContractPredicate {

    int VARIADIC = -1;

    Term apply(List<Term> arguments);

    /**
     * 谓词期望的实参个数，{@link #VARIADIC} 表示任意个数。
     */
    default int arity() {
        return VARIADIC;
    }

    default boolean isVariadic() {
        return arity() == VARIADIC;
    }

    static ContractPredicate of(Function<Term, Term> body) {
        Objects.requireNonNull(body, "Predicate body cannot be null");
        return new FixedArity(1, args -> body.apply(args.get(0)));
    }

    static ContractPredicate of(BiFunction<Term, Term, Term> body) {
        Objects.requireNonNull(body, "Predicate body cannot be null");
        return new FixedArity(2, args -> body.apply(args.get(0), args.get(1)));
    }

    static ContractPredicate of(Ternary body) {
        Objects.requireNonNull(body, "Predicate body cannot be null");
        return new FixedArity(3, args -> body.apply(args.get(0), args.get(1), args.get(2)));
    }

    static ContractPredicate of(Quaternary body) {
        Objects.requireNonNull(body, "Predicate body cannot be null");
        return new FixedArity(4, args -> body.apply(args.get(0), args.get(1), args.get(2), args.get(3)));
    }

    static ContractPredicate of(Quinary body) {
        Objects.requireNonNull(body, "Predicate body cannot be null");
        return new FixedArity(5, args -> body.apply(args.get(0), args.get(1), args.get(2), args.get(3), args.get(4)));
    }

    /**
     * 接受任意个数实参的谓词。
     */
    static ContractPredicate variadic(Function<List<Term>, Term> body) {
        Objects.requireNonNull(body, "Predicate body cannot be null");
        return body::apply;
    }

    @FunctionalInterface
    interface Ternary {
        Term apply(Term a, Term b, Term c);
    }

    @FunctionalInterface
    interface Quaternary {
        Term apply(Term a, Term b, Term c, Term d);
    }

    @FunctionalInterface
    interface Quinary {
        Term apply(Term a, Term b, Term c, Term d, Term e);
    }

    final class FixedArity implements ContractPredicate {

        private final int arity;
        private final Function<List<Term>, Term> body;

        private FixedArity(int arity, Function<List<Term>, Term> body) {
            this.arity = arity;
            this.body = body;
        }

        @Override
        public Term apply(List<Term> arguments) {
            if (arguments.size() != arity) {
                throw new IllegalArgumentException("Predicate expects " + arity + " arguments, got " + arguments.size());
            }
            return body.apply(arguments);
        }

        @Override
        public int arity() {
            return arity;
        }
    }
}
