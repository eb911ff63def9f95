package org.smtbridge.translation;

import org.smtbridge.core.Category;
import org.smtbridge.core.Type;
import org.smtbridge.smt.Kind;

import java.util.Objects;

/**
 * 类型类别的分类。其他组件只通过这里的谓词判断类别。
 * 所有方法都是纯函数。
 * @author Ayalyt
 */
public final class CategoryTaxonomy {

    /**
     * 类别所属的语义组。
     */
    enum Group {
        NUMBER,
        BOOL,
        MAPPING,
        FUNCTION,
        UNSUPPORTED
    }

    private CategoryTaxonomy() {
    }

    // 不写 default：新增 Category 常量时此处无法通过编译
    static Group groupOf(Category category) {
        Objects.requireNonNull(category, "CategoryTaxonomy: category 不能为 null");
        return switch (category) {
            case INTEGER, RATIONAL_NUMBER, FIXED_BYTES, ADDRESS -> Group.NUMBER;
            case BOOL -> Group.BOOL;
            case MAPPING -> Group.MAPPING;
            case FUNCTION -> Group.FUNCTION;
            case STRUCT, ARRAY, TUPLE, CONTRACT, ENUM, STRING_LITERAL -> Group.UNSUPPORTED;
        };
    }

    public static boolean isInteger(Category category) {
        return category == Category.INTEGER;
    }

    public static boolean isRational(Category category) {
        return category == Category.RATIONAL_NUMBER;
    }

    public static boolean isFixedBytes(Category category) {
        return category == Category.FIXED_BYTES;
    }

    public static boolean isAddress(Category category) {
        return category == Category.ADDRESS;
    }

    public static boolean isNumber(Category category) {
        return groupOf(category) == Group.NUMBER;
    }

    public static boolean isBool(Category category) {
        return groupOf(category) == Group.BOOL;
    }

    public static boolean isFunction(Category category) {
        return groupOf(category) == Group.FUNCTION;
    }

    public static boolean isMapping(Category category) {
        return groupOf(category) == Group.MAPPING;
    }

    /**
     * 数值、布尔、函数和映射类别可以被求解器建模，其余类别只能抽象。
     */
    public static boolean isSupportedType(Category category) {
        return groupOf(category) != Group.UNSUPPORTED;
    }

    public static boolean isSupportedType(Type type) {
        Objects.requireNonNull(type, "CategoryTaxonomy: type 不能为 null");
        return isSupportedType(type.getCategory());
    }

    /**
     * 类别对应的求解器排序种类。不支持的类别按 Int 抽象。
     */
    public static Kind smtKind(Category category) {
        return switch (groupOf(category)) {
            case NUMBER, UNSUPPORTED -> Kind.INT;
            case BOOL -> Kind.BOOL;
            case MAPPING -> Kind.ARRAY;
            case FUNCTION -> Kind.FUNCTION;
        };
    }
}
