package org.symproof.contract;

import lombok.Getter;
import org.symproof.core.Sort;
import org.symproof.expressions.Formulas;
import org.symproof.expressions.terms.Term;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TreeSet;

/**
 * 已验证函数的契约，供调用方做模块化验证：调用处前置条件成为证明义务，
 * 后置条件成为假设。parameterSorts 为 null 时按前置/后置条件的元数推断，参数默认为 Real。
 */
@Getter
public final class Contract {

    private static final List<Integer> SAMPLE_ARITIES = List.of(1, 2, 3);

    private final ContractPredicate precondition;
    private final ContractPredicate postcondition;
    private final Sort returnSort;
    private final List<Sort> parameterSorts;

    private Contract(ContractPredicate precondition, ContractPredicate postcondition,
                     Sort returnSort, List<Sort> parameterSorts) {
        this.precondition = precondition;
        this.postcondition = postcondition;
        this.returnSort = returnSort;
        this.parameterSorts = parameterSorts == null ? null : List.copyOf(parameterSorts);
    }

    public static Contract of(ContractPredicate precondition, ContractPredicate postcondition, Sort returnSort) {
        return of(precondition, postcondition, returnSort, null);
    }

    public static Contract of(ContractPredicate precondition, ContractPredicate postcondition,
                              Sort returnSort, List<Sort> parameterSorts) {
        Objects.requireNonNull(returnSort, "Return sort cannot be null");
        if (returnSort == Sort.BOOL) {
            throw new IllegalArgumentException("Contract return sort must be numeric");
        }
        return new Contract(precondition, postcondition, returnSort, parameterSorts);
    }

    /**
     * 调用点实参个数对应的参数 sort 列表。
     */
    public List<Sort> parameterSortsFor(int argumentCount) {
        if (parameterSorts != null) {
            return parameterSorts;
        }
        List<Sort> sorts = new ArrayList<>(argumentCount);
        for (int i = 0; i < argumentCount; i++) {
            sorts.add(Sort.REAL);
        }
        return sorts;
    }

    /**
     * 声明的参数个数；无法确定时返回 -1。
     */
    public int declaredArity() {
        if (parameterSorts != null) {
            return parameterSorts.size();
        }
        if (precondition != null && !precondition.isVariadic()) {
            return precondition.arity();
        }
        if (postcondition != null && !postcondition.isVariadic()) {
            return postcondition.arity() - 1;
        }
        return ContractPredicate.VARIADIC;
    }

    /**
     * 结构指纹：把前置/后置条件作用于占位变量 $0..$n-1 与 $r 后的渲染结果。
     * 元数不定的契约在若干个固定元数上渲染。
     */
    public String fingerprint() {
        return fingerprint(List.of());
    }

    /**
     * 同 {@link #fingerprint()}，元数不定时按给定的调用点实参个数渲染。
     * @param callArities 调用方各调用点的实参个数；为空时使用 1 到 3。
     */
    public String fingerprint(Collection<Integer> callArities) {
        int arity = declaredArity();
        if (arity >= 0) {
            return fingerprintAt(arity);
        }
        Set<Integer> arities = new TreeSet<>(callArities.isEmpty() ? SAMPLE_ARITIES : callArities);
        StringJoiner joiner = new StringJoiner(" || ", "variadic{", "}");
        for (int n : arities) {
            joiner.add(n + ":" + fingerprintAt(n));
        }
        return joiner.toString();
    }

    private String fingerprintAt(int arity) {
        List<Sort> sorts = parameterSortsFor(arity);
        List<Term> args = new ArrayList<>();
        for (int i = 0; i < arity; i++) {
            args.add(Formulas.var("$" + i, sorts.get(i)));
        }
        StringBuilder sb = new StringBuilder();
        sb.append(sorts).append("->").append(returnSort);
        sb.append("|pre:").append(render(precondition, args));
        List<Term> withResult = new ArrayList<>(args);
        withResult.add(Formulas.var("$r", returnSort));
        sb.append("|post:").append(render(postcondition, withResult));
        return sb.toString();
    }

    private static String render(ContractPredicate predicate, List<Term> args) {
        if (predicate == null) {
            return "-";
        }
        try {
            return String.valueOf(predicate.apply(args));
        } catch (RuntimeException e) {
            return "error:" + e.getClass().getSimpleName() + ":" + e.getMessage();
        }
    }
}
