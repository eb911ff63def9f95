package org.smtbridge.core;

import lombok.Getter;
import org.smtbridge.utils.Rational;

import java.util.Objects;

/**
 * 常量字面量的类型，携带字面量的精确值，例如 {@code 3} 或 {@code 1/2}。
 */
@Getter
public final class RationalNumberType extends Type {

    private final Rational value;

    private RationalNumberType(Rational value) {
        this.value = Objects.requireNonNull(value, "RationalNumberType-构造函数: value 不能为 null");
    }

    public static RationalNumberType of(Rational value) {
        return new RationalNumberType(value);
    }

    public static RationalNumberType of(long value) {
        return new RationalNumberType(Rational.valueOf(value));
    }

    /**
     * @return 如果字面量的值不是整数则返回 true。
     */
    public boolean isFractional() {
        return !value.isInteger();
    }

    @Override
    public Category getCategory() {
        return Category.RATIONAL_NUMBER;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return value.equals(((RationalNumberType) obj).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Category.RATIONAL_NUMBER, value);
    }

    @Override
    public String toString() {
        return "rational_const " + value;
    }
}
