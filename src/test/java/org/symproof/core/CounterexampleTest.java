package org.symproof.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CounterexampleTest {

    private static Counterexample sample() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("x", 3);
        values.put("flag", true);
        values.put("y", 0.5f);
        values.put(Counterexample.RETURN_KEY, BigInteger.valueOf(-3));
        return Counterexample.of(values);
    }

    @Test
    @DisplayName("标量被规范化为 Long/Double，小 BigInteger 变为 Long")
    void testNormalization() {
        Counterexample ce = sample();

        assertAll(
                () -> assertEquals(3L, ce.getValue("x")),
                () -> assertEquals(Boolean.TRUE, ce.getValue("flag")),
                () -> assertEquals(0.5, ce.getValue("y")),
                () -> assertEquals(-3L, ce.getReturnValue()),
                () -> assertTrue(ce.hasReturnValue())
        );
    }

    @Test
    @DisplayName("参数部分不含返回值且保持顺序")
    void testArguments() {
        assertEquals(java.util.List.of("x", "flag", "y"), new java.util.ArrayList<>(sample().getArguments().keySet()));
    }

    @Test
    @DisplayName("渲染为字典形式")
    void testToString() {
        assertEquals("{'x': 3, 'flag': True, 'y': 0.5, '__return__': -3}", sample().toString());
    }

    @Test
    @DisplayName("不存在的名字抛出 IllegalArgumentException")
    void testMissingValue() {
        assertThrows(IllegalArgumentException.class, () -> sample().getValue("z"));
    }

    @Test
    @DisplayName("Integer 与 Long 构造的反例相等")
    void testEqualityAcrossBoxedTypes() {
        assertEquals(Counterexample.of(Map.of("x", 1)), Counterexample.of(Map.of("x", 1L)));
    }
}
