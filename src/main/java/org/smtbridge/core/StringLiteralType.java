package org.smtbridge.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 字符串字面量的类型，携带字面量本身。
 */
@Getter
public final class StringLiteralType extends Type {

    private final String value;

    private StringLiteralType(String value) {
        this.value = Objects.requireNonNull(value, "StringLiteralType-构造函数: value 不能为 null");
    }

    public static StringLiteralType of(String value) {
        return new StringLiteralType(value);
    }

    @Override
    public Category getCategory() {
        return Category.STRING_LITERAL;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return value.equals(((StringLiteralType) obj).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Category.STRING_LITERAL, value);
    }

    @Override
    public String toString() {
        return "literal_string \"" + value + "\"";
    }
}
