package org.smtbridge.core;

/**
 * 宿主类型的类别标签。各类别互斥，并覆盖宿主类型系统的全部类型。
 * 新增常量后，{@code CategoryTaxonomy} 中的穷尽 switch 会在编译期要求为其归类。
 */
public enum Category {

    INTEGER("integer"),
    RATIONAL_NUMBER("rational_const"),
    FIXED_BYTES("fixed_bytes"),
    ADDRESS("address"),
    BOOL("bool"),
    MAPPING("mapping"),
    FUNCTION("function"),
    // 以下类别不被求解器直接建模
    STRUCT("struct"),
    ARRAY("array"),
    TUPLE("tuple"),
    CONTRACT("contract"),
    ENUM("enum"),
    STRING_LITERAL("string_literal");

    private final String symbol;

    Category(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
