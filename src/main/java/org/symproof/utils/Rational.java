package org.symproof.utils;

import com.microsoft.z3.Context;
import com.microsoft.z3.RatNum;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * 精确有理数，始终保持约分且分母为正。
 * 只表示有限值：分母为 0 的构造直接抛出 ArithmeticException。
 * 此类是不可变的。
 * @author Ayalyt
 */
public final class Rational implements Comparable<Rational> {

    private static final Logger logger = LoggerFactory.getLogger(Rational.class);

    private static final BigInteger BIG_INT_TWO = BigInteger.valueOf(2);

    @Getter
    private final BigInteger numerator;
    @Getter
    private final BigInteger denominator;

    private volatile int hash;

    // 常用常量
    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE); // 0/1
    public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);   // 1/1
    public static final Rational HALF = new Rational(BigInteger.ONE, BIG_INT_TWO);    // 1/2

    private Rational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    // ========== 工厂方法 ==========

    public static Rational valueOf(long numerator) {
        if (numerator == 0L) {
            return ZERO;
        }
        if (numerator == 1L) {
            return ONE;
        }
        return new Rational(BigInteger.valueOf(numerator), BigInteger.ONE);
    }

    public static Rational valueOf(BigInteger numerator) {
        return valueOf(numerator, BigInteger.ONE);
    }

    public static Rational valueOf(long numerator, long denominator) {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Rational valueOf(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "Numerator cannot be null");
        Objects.requireNonNull(denominator, "Denominator cannot be null");
        if (denominator.signum() == 0) {
            logger.error("尝试创建分母为 0 的 Rational: {} / 0", numerator);
            throw new ArithmeticException("Rational with zero denominator: " + numerator + "/0");
        }
        if (numerator.signum() == 0) {
            return ZERO;
        }
        // 分母总是正数
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        if (numerator.equals(denominator)) {
            return ONE;
        }
        BigInteger commonDivisor = numerator.gcd(denominator);
        if (!commonDivisor.equals(BigInteger.ONE)) {
            numerator = numerator.divide(commonDivisor);
            denominator = denominator.divide(commonDivisor);
        }
        if (numerator.equals(BigInteger.ONE) && denominator.equals(BIG_INT_TWO)) {
            return HALF;
        }
        return new Rational(numerator, denominator);
    }

    /**
     * 由十进制的 BigDecimal 精确转换。
     */
    public static Rational valueOf(BigDecimal value) {
        int scale = value.scale();
        if (scale <= 0) {
            return valueOf(value.unscaledValue().multiply(BigInteger.TEN.pow(-scale)));
        }
        return valueOf(value.unscaledValue(), BigInteger.TEN.pow(scale));
    }

    /**
     * 由 double 转换。使用 Double.toString 的最短十进制表示，
     * 因此 0.1 得到 1/10 而不是其二进制近似值。
     */
    public static Rational valueOf(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ArithmeticException("Rational cannot represent " + value);
        }
        return valueOf(new BigDecimal(Double.toString(value)));
    }

    /**
     * 解析 "3", "-1/3", "0.25", "1e3" 形式的字符串。
     */
    public static Rational valueOf(String s) {
        if (s == null || s.trim().isEmpty()) {
            throw new NumberFormatException("输入非法");
        }
        s = s.trim().replace("_", "");
        if (s.contains("/")) {
            String[] parts = s.split("/", 2);
            if (parts[0].isEmpty() || parts[1].isEmpty()) {
                throw new NumberFormatException("无效分数格式: " + s);
            }
            try {
                return valueOf(new BigInteger(parts[0].trim()), new BigInteger(parts[1].trim()));
            } catch (NumberFormatException e) {
                throw new NumberFormatException("分数" + s + "的数字无效: " + e.getMessage());
            }
        }
        try {
            return valueOf(new BigDecimal(s));
        } catch (NumberFormatException e) {
            throw new NumberFormatException("无效数字格式: " + s);
        }
    }

    // ========== 基础运算 ==========

    public Rational add(Rational other) {
        if (this.isZero()) {
            return other;
        }
        if (other.isZero()) {
            return this;
        }
        BigInteger newNum = numerator.multiply(other.denominator).add(other.numerator.multiply(denominator));
        return valueOf(newNum, denominator.multiply(other.denominator));
    }

    public Rational subtract(Rational other) {
        return this.add(other.negate());
    }

    public Rational multiply(Rational other) {
        if (this.isZero() || other.isZero()) {
            return ZERO;
        }
        return valueOf(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    public Rational divide(Rational other) {
        if (other.isZero()) {
            logger.error("Rational 除以零: {} / 0", this);
            throw new ArithmeticException("Division by zero: " + this + " / 0");
        }
        return valueOf(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
    }

    public Rational negate() {
        if (isZero()) {
            return ZERO;
        }
        return valueOf(numerator.negate(), denominator);
    }

    public Rational abs() {
        return numerator.signum() >= 0 ? this : negate();
    }

    /**
     * 向下取整 (floor)。
     */
    public BigInteger floor() {
        BigInteger[] qr = numerator.divideAndRemainder(denominator);
        if (qr[1].signum() < 0) {
            return qr[0].subtract(BigInteger.ONE);
        }
        return qr[0];
    }

    /**
     * 向零截断。
     */
    public BigInteger truncate() {
        return numerator.divide(denominator);
    }

    /**
     * 整数的幂，指数必须非负。
     */
    public Rational pow(int exponent) {
        if (exponent < 0) {
            throw new IllegalArgumentException("Negative exponent: " + exponent);
        }
        return valueOf(numerator.pow(exponent), denominator.pow(exponent));
    }

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    public boolean isInteger() {
        return denominator.equals(BigInteger.ONE);
    }

    public int signum() {
        return numerator.signum();
    }

    /**
     * 转换为 double 值.
     * 注意：对于非常大或非常小的有理数可能会丢失精度。
     * @return double 值
     */
    public double doubleValue() {
        if (isZero()) {
            return 0.0;
        }
        if (isInteger()) {
            return numerator.doubleValue();
        }
        int precision = Math.max(40, Math.max(numerator.bitLength(), denominator.bitLength()) + 10);
        return new BigDecimal(numerator).divide(new BigDecimal(denominator), precision, RoundingMode.HALF_EVEN).doubleValue();
    }

    /**
     * 从 Z3 的 RatNum 值读取。
     */
    public static Rational fromZ3(RatNum value) {
        return valueOf(value.getBigIntNumerator(), value.getBigIntDenominator());
    }

    /**
     * 转换为 Z3 实数常量。
     * @param ctx Z3 Context 实例。
     */
    public com.microsoft.z3.RatNum toZ3Real(Context ctx) {
        return ctx.mkReal(this.toString());
    }

    // ========== 对象基础方法 ==========

    @Override
    public int compareTo(Rational other) {
        BigInteger ad = this.numerator.multiply(other.denominator);
        BigInteger cb = other.numerator.multiply(this.denominator);
        return ad.compareTo(cb);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rational that)) {
            return false;
        }
        return this.numerator.equals(that.numerator) && this.denominator.equals(that.denominator);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Objects.hash(numerator, denominator);
            if (h == 0) {
                h = 1;
            }
            hash = h;
        }
        return h;
    }

    @Override
    public String toString() {
        if (isZero()) {
            return "0";
        }
        if (isInteger()) {
            return numerator.toString();
        }
        // 分数
        return numerator + "/" + denominator;
    }
}
