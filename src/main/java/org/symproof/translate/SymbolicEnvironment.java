package org.symproof.translate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symproof.expressions.terms.Term;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 变量名到符号值的不可变映射。每个活跃名字恰好绑定一个 term；
 * bind 返回新环境，分支之间因此天然隔离。
 */
public final class SymbolicEnvironment {

    private static final Logger logger = LoggerFactory.getLogger(SymbolicEnvironment.class);

    private static final SymbolicEnvironment EMPTY = new SymbolicEnvironment(Map.of());

    private final Map<String, Term> bindings;

    private SymbolicEnvironment(Map<String, Term> bindings) {
        this.bindings = bindings;
    }

    public static SymbolicEnvironment empty() {
        return EMPTY;
    }

    public static SymbolicEnvironment of(Map<String, ? extends Term> bindings) {
        return new SymbolicEnvironment(Collections.unmodifiableMap(new LinkedHashMap<>(bindings)));
    }

    /**
     * @return 绑定的 term，未绑定时为 null。
     */
    public Term lookup(String name) {
        return bindings.get(name);
    }

    public boolean isBound(String name) {
        return bindings.containsKey(name);
    }

    public SymbolicEnvironment bind(String name, Term value) {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(value, "Bound value cannot be null");
        Map<String, Term> copy = new LinkedHashMap<>(bindings);
        copy.put(name, value);
        logger.debug("绑定 {}", name);
        return new SymbolicEnvironment(Collections.unmodifiableMap(copy));
    }

    public Set<String> names() {
        return bindings.keySet();
    }

    public Map<String, Term> asMap() {
        return bindings;
    }

    /**
     * 合并两个分支的环境：两边都绑定且值不同的名字得到 phi 值
     * merger(condition, 本环境的值, other 的值)；只在一边绑定的名字保留该值并通过 oneSided 报告。
     * @param condition 选择本环境的条件。
     */
    public SymbolicEnvironment merge(Term condition, SymbolicEnvironment other, ValueMerger merger,
                                     Consumer<String> oneSided) {
        if (this == other) {
            return this;
        }
        Map<String, Term> merged = new LinkedHashMap<>();
        for (Map.Entry<String, Term> entry : bindings.entrySet()) {
            String name = entry.getKey();
            Term mine = entry.getValue();
            Term theirs = other.bindings.get(name);
            if (theirs == null) {
                oneSided.accept(name);
                merged.put(name, mine);
            } else if (mine == theirs || mine.equals(theirs)) {
                merged.put(name, mine);
            } else {
                merged.put(name, merger.merge(condition, mine, theirs));
            }
        }
        for (Map.Entry<String, Term> entry : other.bindings.entrySet()) {
            if (!bindings.containsKey(entry.getKey())) {
                oneSided.accept(entry.getKey());
                merged.put(entry.getKey(), entry.getValue());
            }
        }
        return new SymbolicEnvironment(Collections.unmodifiableMap(merged));
    }

    @FunctionalInterface
    public interface ValueMerger {
        Term merge(Term condition, Term whenTrue, Term whenFalse);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SymbolicEnvironment that && bindings.equals(that.bindings);
    }

    @Override
    public int hashCode() {
        return bindings.hashCode();
    }

    @Override
    public String toString() {
        return "Env" + bindings.keySet();
    }
}
