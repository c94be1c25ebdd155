package org.symproof.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symproof.expressions.terms.Variable;

import java.util.Objects;

/**
 * 被验证函数的一个形式参数：名字、位置与解析出的 sort。
 */
@Getter
public final class Parameter implements Comparable<Parameter> {

    private static final Logger logger = LoggerFactory.getLogger(Parameter.class);

    private final String name;
    private final int position;
    private final Sort sort;
    private final int hashCode;

    private Parameter(String name, int position, Sort sort) {
        this.name = name;
        this.position = position;
        this.sort = sort;
        this.hashCode = Objects.hash(name, position, sort);
    }

    public static Parameter of(String name, int position, Sort sort) {
        Objects.requireNonNull(name, "Parameter name cannot be null");
        Objects.requireNonNull(sort, "Parameter sort cannot be null");
        if (position < 0) {
            throw new IllegalArgumentException("Parameter position must be non-negative: " + position);
        }
        logger.debug("创建了一个Parameter: {} : {} (位置 {})", name, sort, position);
        return new Parameter(name, position, sort);
    }

    /**
     * 该参数对应的符号变量。
     */
    public Variable toVariable() {
        return Variable.of(name, sort);
    }

    @Override
    public int compareTo(Parameter o) {
        return Integer.compare(this.position, o.position);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Parameter parameter = (Parameter) o;
        return position == parameter.position && name.equals(parameter.name) && sort == parameter.sort;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return name + ": " + sort;
    }
}
