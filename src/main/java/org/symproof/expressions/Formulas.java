package org.symproof.expressions;

import org.apache.commons.lang3.tuple.Pair;
import org.symproof.core.Sort;
import org.symproof.expressions.terms.Arithmetic;
import org.symproof.expressions.terms.Application;
import org.symproof.expressions.terms.BoolConstant;
import org.symproof.expressions.terms.Comparison;
import org.symproof.expressions.terms.Conditional;
import org.symproof.expressions.terms.Connective;
import org.symproof.expressions.terms.Conversion;
import org.symproof.expressions.terms.Negation;
import org.symproof.expressions.terms.Not;
import org.symproof.expressions.terms.Numeral;
import org.symproof.expressions.terms.Term;
import org.symproof.expressions.terms.TupleValue;
import org.symproof.expressions.terms.Variable;
import org.symproof.utils.Rational;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 构造符号 term 的入口。契约谓词通过这里显式地构造公式，例如
 * {@code and(ge(x, 0), le(x, hi))}。
 * 所有工厂都会先按 {@link Coercions} 统一 sort，再做常量折叠，
 * 因此结构上恒假的条件会直接折叠成 {@link #FALSE}。
 */
public final class Formulas {

    public static final BoolConstant TRUE = BoolConstant.TRUE;
    public static final BoolConstant FALSE = BoolConstant.FALSE;

    private Formulas() {
    }

    // ========== 原子 ==========

    public static Term bool(boolean value) {
        return BoolConstant.of(value);
    }

    public static Numeral num(long value) {
        return Numeral.ofInt(value);
    }

    public static Numeral num(BigInteger value) {
        return Numeral.of(Sort.INT, Rational.valueOf(value));
    }

    public static Numeral real(Rational value) {
        return Numeral.ofReal(value);
    }

    /**
     * Real 常量，接受 "0.5"、"1/3" 形式。
     */
    public static Numeral real(String value) {
        return Numeral.ofReal(Rational.valueOf(value));
    }

    public static Numeral real(double value) {
        return Numeral.ofReal(Rational.valueOf(value));
    }

    public static Numeral zero(Sort sort) {
        return Numeral.of(sort, Rational.ZERO);
    }

    /**
     * 由 Java 数值构造常量：整型为 Int，浮点与 BigDecimal 为 Real，Boolean 为公式。
     */
    public static Term constant(Object value) {
        Objects.requireNonNull(value, "Constant cannot be null");
        if (value instanceof Boolean b) {
            return bool(b);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return num(((Number) value).longValue());
        }
        if (value instanceof BigInteger big) {
            return num(big);
        }
        if (value instanceof BigDecimal decimal) {
            return real(Rational.valueOf(decimal));
        }
        if (value instanceof Double || value instanceof Float) {
            return real(((Number) value).doubleValue());
        }
        if (value instanceof Rational rational) {
            return real(rational);
        }
        if (value instanceof Term term) {
            return term;
        }
        throw new SortMismatchException("Not a numeric or boolean constant: " + value.getClass().getSimpleName());
    }

    public static Variable var(String name, Sort sort) {
        return Variable.of(name, sort);
    }

    public static Variable intVar(String name) {
        return Variable.of(name, Sort.INT);
    }

    public static Variable realVar(String name) {
        return Variable.of(name, Sort.REAL);
    }

    public static Variable boolVar(String name) {
        return Variable.of(name, Sort.BOOL);
    }

    // ========== 算术 ==========

    public static Term add(Term a, Term b) {
        Pair<Term, Term> p = numericPair(a, b);
        Term l = p.getLeft();
        Term r = p.getRight();
        if (l instanceof Numeral x && r instanceof Numeral y) {
            return Numeral.of(l.getSort(), x.getValue().add(y.getValue()));
        }
        if (isZero(r)) {
            return l;
        }
        if (isZero(l)) {
            return r;
        }
        return Arithmetic.of(ArithmeticOperator.ADD, l, r);
    }

    public static Term add(Term a, Number b) {
        return add(a, constant(b));
    }

    public static Term sub(Term a, Term b) {
        Pair<Term, Term> p = numericPair(a, b);
        Term l = p.getLeft();
        Term r = p.getRight();
        if (l instanceof Numeral x && r instanceof Numeral y) {
            return Numeral.of(l.getSort(), x.getValue().subtract(y.getValue()));
        }
        if (isZero(r)) {
            return l;
        }
        return Arithmetic.of(ArithmeticOperator.SUB, l, r);
    }

    public static Term sub(Term a, Number b) {
        return sub(a, constant(b));
    }

    public static Term mul(Term a, Term b) {
        Pair<Term, Term> p = numericPair(a, b);
        Term l = p.getLeft();
        Term r = p.getRight();
        if (l instanceof Numeral x && r instanceof Numeral y) {
            return Numeral.of(l.getSort(), x.getValue().multiply(y.getValue()));
        }
        if (isOne(r)) {
            return l;
        }
        if (isOne(l)) {
            return r;
        }
        return Arithmetic.of(ArithmeticOperator.MUL, l, r);
    }

    public static Term mul(Term a, Number b) {
        return mul(a, constant(b));
    }

    /**
     * 真除法，结果总是 Real。除数非零由调用方负责证明。
     */
    public static Term div(Term a, Term b) {
        Term l = toReal(Coercions.toNumeric(a));
        Term r = toReal(Coercions.toNumeric(b));
        if (l instanceof Numeral x && r instanceof Numeral y && !y.getValue().isZero()) {
            return Numeral.ofReal(x.getValue().divide(y.getValue()));
        }
        if (isOne(r)) {
            return l;
        }
        return Arithmetic.of(ArithmeticOperator.DIV, l, r);
    }

    public static Term div(Term a, Number b) {
        return div(a, constant(b));
    }

    /**
     * 向下取整的整数除法。
     * @throws SortMismatchException 操作数不是 Int。
     */
    public static Term floorDiv(Term a, Term b) {
        Term l = requireInt(Coercions.toNumeric(a), "//");
        Term r = requireInt(Coercions.toNumeric(b), "//");
        if (l instanceof Numeral x && r instanceof Numeral y && !y.getValue().isZero()) {
            return Numeral.of(Sort.INT, Rational.valueOf(x.getValue().divide(y.getValue()).floor()));
        }
        if (isOne(r)) {
            return l;
        }
        return Arithmetic.of(ArithmeticOperator.FLOOR_DIV, l, r);
    }

    /**
     * 取模，结果符号与除数相同。
     * @throws SortMismatchException 操作数不是 Int。
     */
    public static Term mod(Term a, Term b) {
        Term l = requireInt(Coercions.toNumeric(a), "%");
        Term r = requireInt(Coercions.toNumeric(b), "%");
        if (l instanceof Numeral x && r instanceof Numeral y && !y.getValue().isZero()) {
            BigInteger q = x.getValue().divide(y.getValue()).floor();
            return Numeral.of(Sort.INT, x.getValue().subtract(y.getValue().multiply(Rational.valueOf(q))));
        }
        return Arithmetic.of(ArithmeticOperator.MOD, l, r);
    }

    public static Term neg(Term a) {
        Term t = Coercions.toNumeric(a);
        if (t instanceof Numeral x) {
            return Numeral.of(t.getSort(), x.getValue().negate());
        }
        if (t instanceof Negation n) {
            return n.getOperand();
        }
        return Negation.of(t);
    }

    /**
     * 常量指数的幂，指数必须在 0 到 3 之间。
     */
    public static Term pow(Term base, int exponent) {
        if (exponent < 0 || exponent > 3) {
            throw new SortMismatchException("Exponent must be a constant between 0 and 3, got " + exponent);
        }
        Term b = Coercions.toNumeric(base);
        Term result = Numeral.of(b.getSort(), Rational.ONE);
        for (int i = 0; i < exponent; i++) {
            result = mul(result, b);
        }
        return result;
    }

    // ========== 关系 ==========

    public static Term compare(RelationType relation, Term a, Term b) {
        Pair<Term, Term> p = relation.isOrdering() ? numericPair(a, b) : Coercions.unify(a, b);
        Term l = p.getLeft();
        Term r = p.getRight();
        if (l instanceof Numeral x && r instanceof Numeral y) {
            return bool(relation.holds(x.getValue().compareTo(y.getValue())));
        }
        if (l instanceof BoolConstant x && r instanceof BoolConstant y) {
            return bool(relation.holds(Boolean.compare(x.getValue(), y.getValue())));
        }
        if (l.equals(r)) {
            return bool(relation.holds(0));
        }
        return Comparison.of(relation, l, r);
    }

    public static Term lt(Term a, Term b) {
        return compare(RelationType.LT, a, b);
    }

    public static Term lt(Term a, Number b) {
        return lt(a, constant(b));
    }

    public static Term le(Term a, Term b) {
        return compare(RelationType.LE, a, b);
    }

    public static Term le(Term a, Number b) {
        return le(a, constant(b));
    }

    public static Term gt(Term a, Term b) {
        return compare(RelationType.GT, a, b);
    }

    public static Term gt(Term a, Number b) {
        return gt(a, constant(b));
    }

    public static Term ge(Term a, Term b) {
        return compare(RelationType.GE, a, b);
    }

    public static Term ge(Term a, Number b) {
        return ge(a, constant(b));
    }

    public static Term eq(Term a, Term b) {
        return compare(RelationType.EQ, a, b);
    }

    public static Term eq(Term a, Number b) {
        return eq(a, constant(b));
    }

    public static Term ne(Term a, Term b) {
        return compare(RelationType.NE, a, b);
    }

    public static Term ne(Term a, Number b) {
        return ne(a, constant(b));
    }

    // ========== 逻辑 ==========

    public static Term and(Term... operands) {
        return and(Arrays.asList(operands));
    }

    public static Term and(List<Term> operands) {
        List<Term> kept = new ArrayList<>();
        for (Term operand : operands) {
            Term f = Coercions.requireFormula(operand, "Conjunct");
            if (f.equals(FALSE)) {
                return FALSE;
            }
            if (f instanceof Connective c && c.getKind() == Connective.Kind.AND) {
                kept.addAll(c.getOperands());
            } else if (!f.equals(TRUE)) {
                kept.add(f);
            }
        }
        return switch (kept.size()) {
            case 0 -> TRUE;
            case 1 -> kept.get(0);
            default -> Connective.of(Connective.Kind.AND, kept);
        };
    }

    public static Term or(Term... operands) {
        return or(Arrays.asList(operands));
    }

    public static Term or(List<Term> operands) {
        List<Term> kept = new ArrayList<>();
        for (Term operand : operands) {
            Term f = Coercions.requireFormula(operand, "Disjunct");
            if (f.equals(TRUE)) {
                return TRUE;
            }
            if (f instanceof Connective c && c.getKind() == Connective.Kind.OR) {
                kept.addAll(c.getOperands());
            } else if (!f.equals(FALSE)) {
                kept.add(f);
            }
        }
        return switch (kept.size()) {
            case 0 -> FALSE;
            case 1 -> kept.get(0);
            default -> Connective.of(Connective.Kind.OR, kept);
        };
    }

    public static Term not(Term operand) {
        Term f = Coercions.requireFormula(operand, "Negated term");
        if (f instanceof BoolConstant b) {
            return bool(!b.getValue());
        }
        if (f instanceof Not n) {
            return n.getOperand();
        }
        if (f instanceof Comparison c) {
            return Comparison.of(c.getRelation().negate(), c.getLeft(), c.getRight());
        }
        return Not.of(f);
    }

    public static Term implies(Term antecedent, Term consequent) {
        Term a = Coercions.requireFormula(antecedent, "Antecedent");
        Term c = Coercions.requireFormula(consequent, "Consequent");
        if (a.equals(TRUE)) {
            return c;
        }
        if (a.equals(FALSE) || c.equals(TRUE)) {
            return TRUE;
        }
        if (c.equals(FALSE)) {
            return not(a);
        }
        if (a.equals(c)) {
            return TRUE;
        }
        return Connective.of(Connective.Kind.IMPLIES, List.of(a, c));
    }

    /**
     * if-then-else，分支先统一 sort。
     */
    public static Term ite(Term condition, Term thenTerm, Term elseTerm) {
        Term c = Coercions.requireFormula(condition, "Condition");
        Pair<Term, Term> p = Coercions.unify(thenTerm, elseTerm);
        Term t = p.getLeft();
        Term e = p.getRight();
        if (c.equals(TRUE) || t.equals(e)) {
            return t;
        }
        if (c.equals(FALSE)) {
            return e;
        }
        if (t.equals(TRUE) && e.equals(FALSE)) {
            return c;
        }
        if (t.equals(FALSE) && e.equals(TRUE)) {
            return not(c);
        }
        return Conditional.of(c, t, e);
    }

    // ========== 转换 ==========

    public static Term toReal(Term a) {
        Term t = Coercions.toNumeric(a);
        if (t.getSort() == Sort.REAL) {
            return t;
        }
        if (t instanceof Numeral x) {
            return Numeral.ofReal(x.getValue());
        }
        return Conversion.of(Conversion.Kind.TO_REAL, t);
    }

    /**
     * 向下取整到 Int。
     */
    public static Term toInt(Term a) {
        Term t = Coercions.toNumeric(a);
        if (t.getSort() == Sort.INT) {
            return t;
        }
        if (t instanceof Numeral x) {
            return Numeral.of(Sort.INT, Rational.valueOf(x.getValue().floor()));
        }
        if (t instanceof Conversion c && c.getKind() == Conversion.Kind.TO_REAL) {
            return c.getOperand();
        }
        return Conversion.of(Conversion.Kind.TO_INT, t);
    }

    /**
     * 向零截断到 Int。
     */
    public static Term truncate(Term a) {
        Term t = Coercions.toNumeric(a);
        if (t.getSort() == Sort.INT) {
            return t;
        }
        if (t instanceof Numeral x) {
            return Numeral.of(Sort.INT, Rational.valueOf(x.getValue().truncate()));
        }
        return ite(ge(t, 0), toInt(t), neg(toInt(neg(t))));
    }

    // ========== 内建函数 ==========

    public static Term min(Term a, Term b) {
        Pair<Term, Term> p = numericPair(a, b);
        return ite(le(p.getLeft(), p.getRight()), p.getLeft(), p.getRight());
    }

    public static Term max(Term a, Term b) {
        Pair<Term, Term> p = numericPair(a, b);
        return ite(ge(p.getLeft(), p.getRight()), p.getLeft(), p.getRight());
    }

    public static Term abs(Term a) {
        Term t = Coercions.toNumeric(a);
        return ite(ge(t, 0), t, neg(t));
    }

    // ========== 函数与元组 ==========

    public static Term apply(FunctionSymbol symbol, Term... arguments) {
        return apply(symbol, Arrays.asList(arguments));
    }

    /**
     * 应用未解释函数，实参按定义域做隐式转换。
     */
    public static Term apply(FunctionSymbol symbol, List<Term> arguments) {
        if (arguments.size() != symbol.arity()) {
            throw new SortMismatchException(symbol.getName() + " expects " + symbol.arity()
                    + " arguments, got " + arguments.size());
        }
        List<Term> coerced = new ArrayList<>(arguments.size());
        for (int i = 0; i < arguments.size(); i++) {
            coerced.add(Coercions.coerceTo(arguments.get(i), symbol.getDomain().get(i)));
        }
        return Application.of(symbol, coerced);
    }

    /**
     * 元组第 index 个元素的访问器符号 tuple_get_index : Int -> Real。
     */
    public static FunctionSymbol tupleAccessor(int index) {
        return FunctionSymbol.of("tuple_get_" + index, Collections.singletonList(Sort.INT), Sort.REAL);
    }

    /**
     * 元组的第 index 个元素。对已知的 TupleValue 直接返回元素，
     * 否则为访问器的应用。
     */
    public static Term element(Term tuple, int index) {
        if (tuple instanceof TupleValue t) {
            if (index < 0 || index >= t.size()) {
                throw new SortMismatchException("Tuple index " + index + " out of range for size " + t.size());
            }
            return t.get(index);
        }
        return apply(tupleAccessor(index), tuple);
    }

    /**
     * 条件语境下的真值：数值 x 视为 x != 0。
     */
    public static Term truthy(Term a) {
        return Coercions.truthy(a);
    }

    // ========== 辅助 ==========

    private static Pair<Term, Term> numericPair(Term a, Term b) {
        return Coercions.unify(Coercions.toNumeric(a), Coercions.toNumeric(b));
    }

    private static Term requireInt(Term t, String operator) {
        if (t.getSort() != Sort.INT) {
            throw new SortMismatchException("Operator " + operator + " requires Int operands, got " + t.getSort());
        }
        return t;
    }

    private static boolean isZero(Term t) {
        return t instanceof Numeral n && n.getValue().isZero();
    }

    private static boolean isOne(Term t) {
        return t instanceof Numeral n && n.getValue().equals(Rational.ONE);
    }
}
