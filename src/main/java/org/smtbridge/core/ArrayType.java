package org.smtbridge.core;

import lombok.Getter;
import org.smtbridge.utils.Contracts;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * 定长或动态数组 T[n] / T[]。
 */
@Getter
public final class ArrayType extends Type {

    private final Type baseType;
    // 动态数组为空
    private final OptionalInt length;

    private ArrayType(Type baseType, OptionalInt length) {
        this.baseType = Objects.requireNonNull(baseType, "ArrayType-构造函数: baseType 不能为 null");
        this.length = Objects.requireNonNull(length, "ArrayType-构造函数: length 不能为 null");
        Contracts.require(length.isEmpty() || length.getAsInt() >= 0, "ArrayType-构造函数: 非法长度 {}", length);
    }

    public static ArrayType dynamic(Type baseType) {
        return new ArrayType(baseType, OptionalInt.empty());
    }

    public static ArrayType fixed(Type baseType, int length) {
        return new ArrayType(baseType, OptionalInt.of(length));
    }

    public boolean isDynamicallySized() {
        return length.isEmpty();
    }

    @Override
    public Category getCategory() {
        return Category.ARRAY;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        ArrayType other = (ArrayType) obj;
        return baseType.equals(other.baseType) && length.equals(other.length);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Category.ARRAY, baseType, length);
    }

    @Override
    public String toString() {
        return baseType + "[" + (length.isPresent() ? String.valueOf(length.getAsInt()) : "") + "]";
    }
}
