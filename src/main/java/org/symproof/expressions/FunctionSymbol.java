package org.symproof.expressions;

import lombok.Getter;
import org.symproof.core.Sort;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 未解释函数符号：名字、定义域 sort 列表与值域 sort。
 */
@Getter
public final class FunctionSymbol {

    private final String name;
    private final List<Sort> domain;
    private final Sort range;
    private final int hashCode;

    private FunctionSymbol(String name, List<Sort> domain, Sort range) {
        this.name = name;
        this.domain = List.copyOf(domain);
        this.range = range;
        this.hashCode = Objects.hash(name, this.domain, range);
    }

    public static FunctionSymbol of(String name, List<Sort> domain, Sort range) {
        Objects.requireNonNull(name, "Function name cannot be null");
        Objects.requireNonNull(domain, "Function domain cannot be null");
        Objects.requireNonNull(range, "Function range cannot be null");
        return new FunctionSymbol(name, domain, range);
    }

    public int arity() {
        return domain.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FunctionSymbol that)) {
            return false;
        }
        return name.equals(that.name) && domain.equals(that.domain) && range == that.range;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return name + domain.stream().map(Sort::getSymbol).collect(Collectors.joining(", ", ": (", ")"))
                + " -> " + range;
    }
}
