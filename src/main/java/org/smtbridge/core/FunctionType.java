package org.smtbridge.core;

import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 可调用签名：有序的参数类型列表和有序的返回类型列表。
 * 返回类型可以有多个（元组返回），是否支持由使用方决定。
 */
@Getter
public final class FunctionType extends Type {

    private final List<Type> parameterTypes;
    private final List<Type> returnParameterTypes;
    private final int hashCode;

    private FunctionType(List<Type> parameterTypes, List<Type> returnParameterTypes) {
        Objects.requireNonNull(parameterTypes, "FunctionType-构造函数: parameterTypes 不能为 null");
        Objects.requireNonNull(returnParameterTypes, "FunctionType-构造函数: returnParameterTypes 不能为 null");
        // List.copyOf 拒绝 null 元素
        this.parameterTypes = List.copyOf(parameterTypes);
        this.returnParameterTypes = List.copyOf(returnParameterTypes);
        this.hashCode = Objects.hash(Category.FUNCTION, this.parameterTypes, this.returnParameterTypes);
    }

    public static FunctionType of(List<Type> parameterTypes, List<Type> returnParameterTypes) {
        return new FunctionType(parameterTypes, returnParameterTypes);
    }

    @Override
    public Category getCategory() {
        return Category.FUNCTION;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        FunctionType other = (FunctionType) obj;
        return parameterTypes.equals(other.parameterTypes)
                && returnParameterTypes.equals(other.returnParameterTypes);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        String params = parameterTypes.stream().map(Type::toString).collect(Collectors.joining(","));
        String returns = returnParameterTypes.stream().map(Type::toString).collect(Collectors.joining(","));
        return "function (" + params + ") returns (" + returns + ")";
    }
}
