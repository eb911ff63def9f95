package org.smtbridge.core;

import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Getter
public final class TupleType extends Type {

    private final List<Type> components;

    private TupleType(List<Type> components) {
        Objects.requireNonNull(components, "TupleType-构造函数: components 不能为 null");
        this.components = List.copyOf(components);
    }

    public static TupleType of(List<Type> components) {
        return new TupleType(components);
    }

    @Override
    public Category getCategory() {
        return Category.TUPLE;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return components.equals(((TupleType) obj).components);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Category.TUPLE, components);
    }

    @Override
    public String toString() {
        return "tuple(" + components.stream().map(Type::toString).collect(Collectors.joining(",")) + ")";
    }
}
