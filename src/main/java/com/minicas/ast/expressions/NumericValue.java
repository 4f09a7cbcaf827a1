package com.minicas.ast.expressions;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/**
 * NumericValue - 常量节点的数值
 *
 * 两种表示:
 * - 整数: BigInteger,任意精度,加法/乘法/非负整数次幂保持精确
 * - 实数: double,IEEE 754
 *
 * 类型提升规则:
 * - 整数 op 整数 → 整数
 * - 任一操作数为实数 → 实数
 * - 整数的负整数次幂 → 实数(2^-1 = 0.5,不截断)
 *
 * 设计原则:
 * - 不可变对象
 * - 幂运算结果不是有限实数时返回 {@link Optional#empty()},由调用方保留原表达式,不抛异常
 */
public final class NumericValue {

    /** 精确整数幂结果允许的最大位数(估算值) */
    private static final long MAX_EXACT_POWER_BITS = 1L << 20;

    public static final NumericValue ZERO = new NumericValue(BigInteger.ZERO, 0.0);

    public static final NumericValue ONE = new NumericValue(BigInteger.ONE, 0.0);

    public static final NumericValue MINUS_ONE = new NumericValue(BigInteger.ONE.negate(), 0.0);

    /** 整数值,实数时为null */
    private final BigInteger integer;

    /** 实数值,仅在integer为null时有效 */
    private final double real;

    private NumericValue(BigInteger integer, double real) {
        this.integer = integer;
        this.real = real;
    }

    public static NumericValue ofInteger(long value) {
        return ofInteger(BigInteger.valueOf(value));
    }

    public static NumericValue ofInteger(BigInteger value) {
        return new NumericValue(Objects.requireNonNull(value, "value"), 0.0);
    }

    public static NumericValue ofReal(double value) {
        return new NumericValue(null, value);
    }

    /**
     * 从Java数值类型转换
     *
     * Byte/Short/Integer/Long/BigInteger 视为整数,Float/Double 视为实数,
     * BigDecimal 没有小数部分时视为整数,否则视为实数。
     *
     * @param number 数值
     * @return 对应的NumericValue
     * @throws IllegalArgumentException 不支持的Number子类
     */
    public static NumericValue of(Number number) {
        Objects.requireNonNull(number, "number");

        if (number instanceof Integer || number instanceof Long
                || number instanceof Short || number instanceof Byte) {
            return ofInteger(number.longValue());
        }
        if (number instanceof BigInteger) {
            return ofInteger((BigInteger) number);
        }
        if (number instanceof Double || number instanceof Float) {
            return ofReal(number.doubleValue());
        }
        if (number instanceof BigDecimal) {
            BigDecimal decimal = (BigDecimal) number;
            try {
                return ofInteger(decimal.toBigIntegerExact());
            } catch (ArithmeticException e) {
                return ofReal(decimal.doubleValue());
            }
        }

        throw new IllegalArgumentException("Unsupported numeric type: " + number.getClass().getName());
    }

    public boolean isInteger() {
        return integer != null;
    }

    /**
     * 是否为零(不区分整数与实数,0.0 也是零)
     */
    public boolean isZero() {
        return isInteger() ? integer.signum() == 0 : real == 0.0;
    }

    /**
     * 是否为一(不区分整数与实数,1.0 也是一)
     */
    public boolean isOne() {
        return isInteger() ? integer.equals(BigInteger.ONE) : real == 1.0;
    }

    public NumericValue add(NumericValue other) {
        if (isInteger() && other.isInteger()) {
            return ofInteger(integer.add(other.integer));
        }
        return ofReal(doubleValue() + other.doubleValue());
    }

    public NumericValue multiply(NumericValue other) {
        if (isInteger() && other.isInteger()) {
            return ofInteger(integer.multiply(other.integer));
        }
        return ofReal(doubleValue() * other.doubleValue());
    }

    /**
     * 幂运算
     *
     * @param exponent 指数
     * @return 结果;0的负数次幂、负数的小数次幂、溢出等无法得到有限实数时返回empty
     */
    public Optional<NumericValue> power(NumericValue exponent) {
        if (isInteger() && exponent.isInteger()) {
            if (exponent.integer.signum() >= 0) {
                return exactPower(exponent.integer);
            }
            if (integer.signum() == 0) {
                return Optional.empty();
            }
        }

        double result = Math.pow(doubleValue(), exponent.doubleValue());
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            return Optional.empty();
        }
        return Optional.of(ofReal(result));
    }

    private Optional<NumericValue> exactPower(BigInteger exponent) {
        if (integer.signum() == 0 || integer.abs().equals(BigInteger.ONE)) {
            // 0, 1, -1 的任意次幂都很小,只需要指数的奇偶性
            if (integer.signum() == 0) {
                return Optional.of(exponent.signum() == 0 ? ONE : ZERO);
            }
            boolean negative = integer.signum() < 0 && exponent.testBit(0);
            return Optional.of(negative ? MINUS_ONE : ONE);
        }

        if (exponent.bitLength() > 31
                || (long) integer.bitLength() * exponent.longValue() > MAX_EXACT_POWER_BITS) {
            return Optional.empty();
        }
        return Optional.of(ofInteger(integer.pow(exponent.intValue())));
    }

    public double doubleValue() {
        return isInteger() ? integer.doubleValue() : real;
    }

    /**
     * 转换为Java数值类型
     *
     * @return 整数时返回BigInteger,实数时返回Double
     */
    public Number toNumber() {
        return isInteger() ? integer : Double.valueOf(real);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NumericValue)) {
            return false;
        }
        NumericValue that = (NumericValue) o;
        if (isInteger() != that.isInteger()) {
            return false;
        }
        return isInteger() ? integer.equals(that.integer) : Double.compare(real, that.real) == 0;
    }

    @Override
    public int hashCode() {
        return isInteger() ? integer.hashCode() : Double.hashCode(real);
    }

    @Override
    public String toString() {
        return isInteger() ? integer.toString() : Double.toString(real);
    }
}
