package org.smtbridge.utils;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 有理数字面量的精确值，始终以最简分数保存，分母为正。
 * 只表示有限值：字面量不会是无穷或 NaN。
 * 此类是不可变的。
 */
public final class Rational implements Comparable<Rational> {
    private static final Logger logger = LoggerFactory.getLogger(Rational.class);
    private static final ConcurrentHashMap<List<BigInteger>, Rational> CACHE = new ConcurrentHashMap<>(256);

    private static final BigInteger BIG_INT_ONE = BigInteger.ONE;
    private static final BigInteger BIG_INT_TEN = BigInteger.TEN;

    @Getter
    private final BigInteger numerator;
    @Getter
    private final BigInteger denominator;

    private volatile int hash;

    public static final Rational ZERO = new Rational(BigInteger.ZERO, BIG_INT_ONE);
    public static final Rational ONE = new Rational(BIG_INT_ONE, BIG_INT_ONE);
    public static final Rational HALF = new Rational(BIG_INT_ONE, BigInteger.valueOf(2));

    static {
        CACHE.put(ZERO.getCacheKey(), ZERO);
        CACHE.put(ONE.getCacheKey(), ONE);
        CACHE.put(HALF.getCacheKey(), HALF);
        for (int i = -16; i <= 16; i++) {
            if (i != 0 && i != 1) {
                Rational r = new Rational(BigInteger.valueOf(i), BIG_INT_ONE);
                CACHE.put(r.getCacheKey(), r);
            }
        }
    }

    private Rational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
        logger.debug("创建了一个Rational: {} / {}", numerator, denominator);
    }

    // ========== 工厂方法 ==========

    public static Rational valueOf(BigInteger numerator) {
        return valueOf(numerator, BIG_INT_ONE);
    }

    public static Rational valueOf(long numerator) {
        return valueOf(BigInteger.valueOf(numerator), BIG_INT_ONE);
    }

    public static Rational valueOf(long numerator, long denominator) {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Rational valueOf(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "Rational-valueOf: numerator 不能为 null");
        Objects.requireNonNull(denominator, "Rational-valueOf: denominator 不能为 null");
        Contracts.require(denominator.signum() != 0, "Rational-valueOf: 分母为 0 的字面量 {}/{}", numerator, denominator);

        if (numerator.signum() == 0) {
            return ZERO;
        }
        // 分母总是正数
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger commonDivisor = numerator.gcd(denominator);
        if (!commonDivisor.equals(BIG_INT_ONE)) {
            numerator = numerator.divide(commonDivisor);
            denominator = denominator.divide(commonDivisor);
        }

        List<BigInteger> key = List.of(numerator, denominator);
        Rational cached = CACHE.get(key);
        if (cached != null) {
            logger.debug("从缓存命中: {}/{}", numerator, denominator);
            return cached;
        }
        Rational result = new Rational(numerator, denominator);
        if (shouldCache(result)) {
            CACHE.put(key, result);
        }
        return result;
    }

    /**
     * 解析 "a/b"、整数或十进制小数形式的字面量。
     * @throws NumberFormatException 如果格式无效。
     */
    public static Rational valueOf(String s) {
        if (s == null || s.trim().isEmpty()) {
            throw new NumberFormatException("输入非法");
        }
        s = s.trim();

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
            BigDecimal bd = new BigDecimal(s);
            int scale = bd.scale();
            if (scale <= 0) {
                return valueOf(bd.unscaledValue().multiply(BIG_INT_TEN.pow(-scale)));
            }
            return valueOf(bd.unscaledValue(), BIG_INT_TEN.pow(scale));
        } catch (NumberFormatException e) {
            throw new NumberFormatException("无效数字格式: " + s);
        }
    }

    // ========== 查询 ==========

    /**
     *  判断该rational是否是整数
     */
    public boolean isInteger() {
        return this.denominator.equals(BIG_INT_ONE);
    }

    public int signum() {
        return numerator.signum();
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

    private List<BigInteger> getCacheKey() {
        return List.of(this.numerator, this.denominator);
    }

    /**
     * 只缓存位长较小的值，避免大字面量撑满缓存。
     */
    private static boolean shouldCache(Rational r) {
        int numBitLength = r.numerator.abs().bitLength();
        int denBitLength = r.denominator.bitLength();
        return (numBitLength + denBitLength) < 64;
    }

    @Override
    public String toString() {
        if (isInteger()) {
            return this.numerator.toString();
        }
        return this.numerator + "/" + this.denominator;
    }
}
