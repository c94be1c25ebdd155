package org.symproof.expressions.terms;

import lombok.Getter;
import org.symproof.core.Sort;
import org.symproof.expressions.ToZ3Expr;

import java.util.List;

/**
 * 符号值的不可变表达式树的基类。
 * 每个节点在构造时计算结构哈希；equals 为结构相等。
 * 公式即 sort 为 BOOL 的 term。
 */
public abstract class Term implements ToZ3Expr {

    @Getter
    private final Sort sort;
    private final int hashCode;

    protected Term(Sort sort, int structuralHash) {
        this.sort = sort;
        this.hashCode = structuralHash;
    }

    public boolean isFormula() {
        return sort == Sort.BOOL;
    }

    /**
     * 直接子节点。叶子返回空列表。
     */
    public abstract List<Term> children();

    /**
     * 渲染时不需要括号的节点。
     */
    protected boolean isAtomic() {
        return false;
    }

    /**
     * 展开成树后节点数不超过 limit 时返回 toString()，否则返回摘要。
     * 循环展开得到的项是共享子项的 DAG，直接 toString 可能是指数长度。
     */
    public String render(int limit) {
        int size = countUpTo(this, limit + 1);
        if (size <= limit) {
            return toString();
        }
        return "<" + sort + " term with more than " + limit + " nodes>";
    }

    private static int countUpTo(Term term, int budget) {
        int count = 1;
        for (Term child : term.children()) {
            if (count >= budget) {
                break;
            }
            count += countUpTo(child, budget - count);
        }
        return count;
    }

    protected static String wrap(Term term) {
        return term.isAtomic() ? term.toString() : "(" + term + ")";
    }

    @Override
    public final int hashCode() {
        return hashCode;
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract String toString();
}
