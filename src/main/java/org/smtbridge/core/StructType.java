package org.smtbridge.core;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.smtbridge.utils.Contracts;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 具名结构体，成员按声明顺序保存。
 */
@Getter
public final class StructType extends Type {

    private final String name;
    private final Map<String, Type> members;

    private StructType(String name, Map<String, Type> members) {
        Contracts.require(StringUtils.isNotBlank(name), "StructType-构造函数: 结构体名不能为空");
        Objects.requireNonNull(members, "StructType-构造函数: members 不能为 null");
        this.name = name;
        this.members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
    }

    public static StructType of(String name, Map<String, Type> members) {
        return new StructType(name, members);
    }

    @Override
    public Category getCategory() {
        return Category.STRUCT;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        StructType other = (StructType) obj;
        return name.equals(other.name) && members.equals(other.members);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Category.STRUCT, name, members);
    }

    @Override
    public String toString() {
        return "struct " + name + " {" + members.entrySet().stream()
                .map(e -> e.getValue() + " " + e.getKey())
                .collect(Collectors.joining("; ")) + "}";
    }
}
