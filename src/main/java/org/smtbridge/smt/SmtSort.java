package org.smtbridge.smt;

import com.microsoft.z3.Context;
import com.microsoft.z3.Sort;
import lombok.Getter;

import java.util.Objects;

/**
 * 求解器侧的类型描述（排序）。
 * 基础排序 Int 与 Bool 以共享常量给出；复合排序见 {@link SmtFunctionSort} 与 {@link SmtArraySort}。
 * 所有实例都是不可变的值对象。
 * @author Ayalyt
 */
@Getter
public class SmtSort implements ToZ3Sort {

    public static final SmtSort INT = new SmtSort(Kind.INT);
    public static final SmtSort BOOL = new SmtSort(Kind.BOOL);

    private final Kind kind;

    protected SmtSort(Kind kind) {
        this.kind = Objects.requireNonNull(kind, "SmtSort-构造函数: kind 不能为 null");
    }

    @Override
    public Sort toZ3Sort(Context ctx) {
        return switch (kind) {
            case INT -> ctx.mkIntSort();
            case BOOL -> ctx.mkBoolSort();
            // 复合排序由子类覆盖
            case FUNCTION, ARRAY -> throw new IllegalStateException("复合排序必须由子类转换: " + kind);
        };
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return kind == ((SmtSort) obj).kind;
    }

    @Override
    public int hashCode() {
        return kind.hashCode();
    }

    @Override
    public String toString() {
        return switch (kind) {
            case INT -> "Int";
            case BOOL -> "Bool";
            case FUNCTION -> "Function";
            case ARRAY -> "Array";
        };
    }
}
