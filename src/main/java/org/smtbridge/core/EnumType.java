package org.smtbridge.core;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.smtbridge.utils.Contracts;

import java.util.List;
import java.util.Objects;

@Getter
public final class EnumType extends Type {

    private final String name;
    private final List<String> members;

    private EnumType(String name, List<String> members) {
        Contracts.require(StringUtils.isNotBlank(name), "EnumType-构造函数: 枚举名不能为空");
        Objects.requireNonNull(members, "EnumType-构造函数: members 不能为 null");
        this.name = name;
        this.members = List.copyOf(members);
    }

    public static EnumType of(String name, List<String> members) {
        return new EnumType(name, members);
    }

    @Override
    public Category getCategory() {
        return Category.ENUM;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        EnumType other = (EnumType) obj;
        return name.equals(other.name) && members.equals(other.members);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Category.ENUM, name, members);
    }

    @Override
    public String toString() {
        return "enum " + name;
    }
}
