package org.symproof.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class RationalTest {

    @Nested
    @DisplayName("构造与规范化")
    class ConstructionTests {

        @Test
        @DisplayName("分数约分且分母为正 (4/-6 => -2/3)")
        void testNormalization() {
            Rational r = Rational.valueOf(4, -6);

            assertAll("4/-6 should normalize to -2/3",
                    () -> assertEquals(BigInteger.valueOf(-2), r.getNumerator()),
                    () -> assertEquals(BigInteger.valueOf(3), r.getDenominator()),
                    () -> assertEquals("-2/3", r.toString())
            );
        }

        @Test
        @DisplayName("常用值复用常量实例")
        void testCachedConstants() {
            assertAll(
                    () -> assertSame(Rational.ZERO, Rational.valueOf(0, 7)),
                    () -> assertSame(Rational.ONE, Rational.valueOf(3, 3)),
                    () -> assertSame(Rational.HALF, Rational.valueOf(2, 4))
            );
        }

        @Test
        @DisplayName("分母为 0 时抛出 ArithmeticException")
        void testZeroDenominator() {
            assertThrows(ArithmeticException.class, () -> Rational.valueOf(1, 0));
        }

        @Test
        @DisplayName("double 按最短十进制表示转换 (0.1 => 1/10)")
        void testFromDouble() {
            assertEquals(Rational.valueOf(1, 10), Rational.valueOf(0.1));
        }

        @ParameterizedTest(name = "\"{0}\" => {1}")
        @CsvSource({
                "3, 3",
                "-1/3, -1/3",
                "0.25, 1/4",
                "1e3, 1000",
                "1_000, 1000"
        })
        @DisplayName("字符串解析")
        void testParse(String text, String expected) {
            assertEquals(expected, Rational.valueOf(text).toString());
        }

        @Test
        @DisplayName("非法字符串抛出 NumberFormatException")
        void testParseInvalid() {
            assertAll(
                    () -> assertThrows(NumberFormatException.class, () -> Rational.valueOf("abc")),
                    () -> assertThrows(NumberFormatException.class, () -> Rational.valueOf("1/")),
                    () -> assertThrows(NumberFormatException.class, () -> Rational.valueOf(" "))
            );
        }
    }

    @Nested
    @DisplayName("算术与取整")
    class ArithmeticTests {

        @Test
        @DisplayName("四则运算保持精确")
        void testExactArithmetic() {
            Rational third = Rational.valueOf(1, 3);
            Rational sixth = Rational.valueOf(1, 6);

            assertAll(
                    () -> assertEquals(Rational.HALF, third.add(sixth)),
                    () -> assertEquals(sixth, third.subtract(sixth)),
                    () -> assertEquals(Rational.valueOf(1, 18), third.multiply(sixth)),
                    () -> assertEquals(Rational.valueOf(2), third.divide(sixth)),
                    () -> assertEquals(Rational.valueOf(-1, 3), third.negate())
            );
        }

        @Test
        @DisplayName("floor 向下取整，truncate 向零截断")
        void testFloorAndTruncate() {
            Rational negative = Rational.valueOf(-7, 2);
            Rational positive = Rational.valueOf(7, 2);

            assertAll(
                    () -> assertEquals(BigInteger.valueOf(-4), negative.floor()),
                    () -> assertEquals(BigInteger.valueOf(-3), negative.truncate()),
                    () -> assertEquals(BigInteger.valueOf(3), positive.floor()),
                    () -> assertEquals(BigInteger.valueOf(3), positive.truncate())
            );
        }

        @Test
        @DisplayName("比较与 double 转换")
        void testCompareAndDouble() {
            Rational third = Rational.valueOf(1, 3);

            assertAll(
                    () -> assertTrue(third.compareTo(Rational.HALF) < 0),
                    () -> assertEquals(0, Rational.valueOf(2, 6).compareTo(third)),
                    () -> assertEquals(1.0 / 3, third.doubleValue(), 1e-15),
                    () -> assertEquals(Rational.valueOf(1, 9), third.pow(2))
            );
        }
    }
}
