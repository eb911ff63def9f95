package org.smtbridge.smt;

import com.microsoft.z3.Context;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Sort;
import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 函数排序 Function(domain..., codomain)。
 * 单独声明时对应 Z3 的函数符号 ({@link #toZ3FuncDecl})；
 * 作为其他排序的组成部分时（例如映射的值类型）按柯里化编码为嵌套数组 p1 -> (p2 -> ... -> ret)。
 */
@Getter
public final class SmtFunctionSort extends SmtSort {

    private final List<SmtSort> domain;
    private final SmtSort codomain;
    private final int hashCode;

    public SmtFunctionSort(List<SmtSort> domain, SmtSort codomain) {
        super(Kind.FUNCTION);
        Objects.requireNonNull(domain, "SmtFunctionSort-构造函数: domain 不能为 null");
        this.domain = List.copyOf(domain);
        this.codomain = Objects.requireNonNull(codomain, "SmtFunctionSort-构造函数: codomain 不能为 null");
        this.hashCode = Objects.hash(Kind.FUNCTION, this.domain, codomain);
    }

    /**
     * 柯里化的数组编码；零元函数即其返回排序。
     */
    @Override
    public Sort toZ3Sort(Context ctx) {
        Sort result = codomain.toZ3Sort(ctx);
        for (int i = domain.size() - 1; i >= 0; i--) {
            result = ctx.mkArraySort(domain.get(i).toZ3Sort(ctx), result);
        }
        return result;
    }

    /**
     * 声明一个以此排序为签名的未解释函数。
     * @param ctx Z3 Context 实例。
     * @param name 函数符号名。
     */
    public FuncDecl<?> toZ3FuncDecl(Context ctx, String name) {
        Sort[] z3Domain = domain.stream().map(s -> s.toZ3Sort(ctx)).toArray(Sort[]::new);
        return ctx.mkFuncDecl(name, z3Domain, codomain.toZ3Sort(ctx));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        SmtFunctionSort other = (SmtFunctionSort) obj;
        return domain.equals(other.domain) && codomain.equals(other.codomain);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "Function([" + domain.stream().map(SmtSort::toString).collect(Collectors.joining(", ")) + "], " + codomain + ")";
    }
}
