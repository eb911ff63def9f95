package org.smtbridge.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 键值映射 mapping(K => V)。值类型可以再次是映射。
 */
@Getter
public final class MappingType extends Type {

    private final Type keyType;
    private final Type valueType;
    private final int hashCode;

    private MappingType(Type keyType, Type valueType) {
        this.keyType = Objects.requireNonNull(keyType, "MappingType-构造函数: keyType 不能为 null");
        this.valueType = Objects.requireNonNull(valueType, "MappingType-构造函数: valueType 不能为 null");
        this.hashCode = Objects.hash(Category.MAPPING, keyType, valueType);
    }

    public static MappingType of(Type keyType, Type valueType) {
        return new MappingType(keyType, valueType);
    }

    @Override
    public Category getCategory() {
        return Category.MAPPING;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        MappingType other = (MappingType) obj;
        return keyType.equals(other.keyType) && valueType.equals(other.valueType);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "mapping(" + keyType + " => " + valueType + ")";
    }
}
