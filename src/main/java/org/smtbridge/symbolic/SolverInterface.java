package org.smtbridge.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import org.smtbridge.smt.SmtFunctionSort;
import org.smtbridge.smt.SmtSort;

import java.util.List;

/**
 * 求解器上下文：符号表加断言日志。
 * 由外层验证引擎持有，本层只在单次调用期间使用，不跨调用保存引用。
 * 不是线程安全的，每个验证线程应使用各自的实例。
 */
public interface SolverInterface {

    /**
     * @return 用于构造表达式的 Z3 Context。
     */
    Context getContext();

    /**
     * 声明（或取回已声明的）常量。
     * @param name 唯一名称。
     * @param sort 非函数排序。
     * @return 对应的 Z3 常量。
     * @throws org.smtbridge.utils.ContractViolationException 如果同名常量已以不同排序声明。
     */
    Expr<?> newVariable(String name, SmtSort sort);

    /**
     * 声明（或取回已声明的）未解释函数。
     */
    FuncDecl<?> newFunction(String name, SmtFunctionSort sort);

    /**
     * 追加一条断言。已有断言不会被删除或替换。
     */
    void addAssertion(BoolExpr assertion);

    /**
     * @return 迄今追加的全部断言，按追加顺序。
     */
    List<BoolExpr> getAssertions();
}
