package org.symproof.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 反例：参数名（以及 {@value #RETURN_KEY}）到具体标量的映射，保持参数顺序。
 * 标量只有 Long、Double、Boolean、BigInteger 与 String 几种形式，
 * 构造时会把 Integer/Float 等规范化，使 JSON 往返后仍然 equals。
 * @author Ayalyt
 */
public final class Counterexample {

    private static final Logger logger = LoggerFactory.getLogger(Counterexample.class);

    /** 返回值在反例中的键 */
    public static final String RETURN_KEY = "__return__";

    private final Map<String, Object> values;

    private Counterexample(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * 工厂方法：从 Map 创建 Counterexample 实例。
     * @param values 名字到标量值的映射，迭代顺序被保留。
     */
    @JsonCreator
    public static Counterexample of(Map<String, ?> values) {
        Objects.requireNonNull(values, "Counterexample values cannot be null");
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            normalized.put(entry.getKey(), normalize(entry.getValue()));
        }
        logger.debug("创建 Counterexample: {}", normalized);
        return new Counterexample(normalized);
    }

    private static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof BigInteger big && big.bitLength() < Long.SIZE) {
            return big.longValue();
        }
        if (value == null || value instanceof Long || value instanceof Double
                || value instanceof Boolean || value instanceof BigInteger || value instanceof String) {
            return value;
        }
        return value.toString();
    }

    @JsonValue
    public Map<String, Object> getValues() {
        return values;
    }

    /**
     * 获取指定名字的值。
     * @throws IllegalArgumentException 名字不在反例中。
     */
    public Object getValue(String name) {
        if (!values.containsKey(name)) {
            logger.error("尝试获取不存在的反例值：'{}' 不存在于 {} 中。", name, this);
            throw new IllegalArgumentException("'" + name + "' is not part of the counterexample");
        }
        return values.get(name);
    }

    public Object getReturnValue() {
        return values.get(RETURN_KEY);
    }

    public boolean hasReturnValue() {
        return values.containsKey(RETURN_KEY);
    }

    /**
     * 不含返回值的参数部分。
     */
    public Map<String, Object> getArguments() {
        Map<String, Object> arguments = new LinkedHashMap<>(values);
        arguments.remove(RETURN_KEY);
        return arguments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Counterexample that = (Counterexample) o;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return render(values);
    }

    public static String render(Map<String, ?> values) {
        return values.entrySet().stream()
                .map(e -> "'" + e.getKey() + "': " + renderScalar(e.getValue()))
                .collect(Collectors.joining(", ", "{", "}"));
    }

    public static String renderScalar(Object value) {
        if (value instanceof String) {
            return "'" + value + "'";
        }
        if (value instanceof Boolean b) {
            return b ? "True" : "False";
        }
        return String.valueOf(value);
    }
}
