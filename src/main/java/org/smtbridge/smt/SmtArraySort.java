package org.smtbridge.smt;

import com.microsoft.z3.Context;
import com.microsoft.z3.Sort;
import lombok.Getter;

import java.util.Objects;

/**
 * 数组排序 Array(domain, range)，用于建模映射。
 */
@Getter
public final class SmtArraySort extends SmtSort {

    private final SmtSort domain;
    private final SmtSort range;
    private final int hashCode;

    public SmtArraySort(SmtSort domain, SmtSort range) {
        super(Kind.ARRAY);
        this.domain = Objects.requireNonNull(domain, "SmtArraySort-构造函数: domain 不能为 null");
        this.range = Objects.requireNonNull(range, "SmtArraySort-构造函数: range 不能为 null");
        this.hashCode = Objects.hash(Kind.ARRAY, domain, range);
    }

    @Override
    public Sort toZ3Sort(Context ctx) {
        return ctx.mkArraySort(domain.toZ3Sort(ctx), range.toZ3Sort(ctx));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        SmtArraySort other = (SmtArraySort) obj;
        return domain.equals(other.domain) && range.equals(other.range);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "Array(" + domain + ", " + range + ")";
    }
}
