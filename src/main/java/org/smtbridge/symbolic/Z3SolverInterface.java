package org.smtbridge.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Solver;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.smtbridge.smt.Kind;
import org.smtbridge.smt.SmtFunctionSort;
import org.smtbridge.smt.SmtSort;
import org.smtbridge.utils.Contracts;
import org.smtbridge.utils.TranslatorOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 基于 Z3 的 {@link SolverInterface} 实现。
 * 负责维护名称到 Z3 常量/函数的映射，确保每个名称在 Context 中只对应一个排序。
 * 使用 HashMap 存储映射，实例不在线程间共享。
 * @author Ayalyt
 */
public class Z3SolverInterface implements SolverInterface, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3SolverInterface.class);

    @Getter
    private final Context context;
    @Getter
    private final Solver solver;
    // 自行创建的 Context 在 close 时释放；外部传入的由调用者释放
    private final boolean ownsContext;
    private final boolean logAssertions;

    private final Map<String, SmtSort> declaredSorts;
    private final Map<String, Expr<?>> constants;
    private final Map<String, FuncDecl<?>> functions;
    private final List<BoolExpr> assertions;

    /**
     * 创建并持有一个新的 Z3 Context。
     */
    public Z3SolverInterface(TranslatorOptions options) {
        this(new Context(), true, options);
    }

    public Z3SolverInterface() {
        this(TranslatorOptions.defaults());
    }

    /**
     * 使用调用者持有的 Context。close 不会释放它。
     */
    public Z3SolverInterface(Context context, TranslatorOptions options) {
        this(context, false, options);
    }

    private Z3SolverInterface(Context context, boolean ownsContext, TranslatorOptions options) {
        this.context = Objects.requireNonNull(context, "Z3 Context cannot be null.");
        Objects.requireNonNull(options, "TranslatorOptions cannot be null.");
        this.solver = context.mkSolver();
        this.ownsContext = ownsContext;
        this.logAssertions = options.isLogAssertions();
        this.declaredSorts = new HashMap<>();
        this.constants = new HashMap<>();
        this.functions = new HashMap<>();
        this.assertions = new ArrayList<>();
        logger.debug("Z3SolverInterface 初始化完成，ownsContext={}", ownsContext);
    }

    @Override
    public Expr<?> newVariable(String name, SmtSort sort) {
        Objects.requireNonNull(sort, "Z3SolverInterface-newVariable: sort 不能为 null");
        Contracts.require(sort.getKind() != Kind.FUNCTION,
                "Z3SolverInterface-newVariable: 函数排序 {} 应通过 newFunction 声明: {}", sort, name);
        checkDeclaration(name, sort);
        return constants.computeIfAbsent(name, n -> {
            logger.debug("声明 Z3 常量: {} : {}", n, sort);
            return context.mkConst(n, sort.toZ3Sort(context));
        });
    }

    @Override
    public FuncDecl<?> newFunction(String name, SmtFunctionSort sort) {
        Objects.requireNonNull(sort, "Z3SolverInterface-newFunction: sort 不能为 null");
        checkDeclaration(name, sort);
        return functions.computeIfAbsent(name, n -> {
            logger.debug("声明 Z3 函数: {} : {}", n, sort);
            return sort.toZ3FuncDecl(context, n);
        });
    }

    private void checkDeclaration(String name, SmtSort sort) {
        Contracts.require(StringUtils.isNotBlank(name), "Z3SolverInterface: 符号名不能为空");
        SmtSort previous = declaredSorts.putIfAbsent(name, sort);
        Contracts.require(previous == null || previous.equals(sort),
                "Z3SolverInterface: 符号 {} 已声明为 {}，不能再声明为 {}", name, previous, sort);
    }

    @Override
    public void addAssertion(BoolExpr assertion) {
        Objects.requireNonNull(assertion, "Z3SolverInterface-addAssertion: assertion 不能为 null");
        solver.add(assertion);
        assertions.add(assertion);
        if (logAssertions) {
            logger.info("断言 Z3 约束: {}", assertion);
        } else {
            logger.debug("断言 Z3 约束: {}", assertion);
        }
    }

    @Override
    public List<BoolExpr> getAssertions() {
        return Collections.unmodifiableList(new ArrayList<>(assertions));
    }

    /**
     * @return 名称是否已在此上下文中声明。
     */
    public boolean isDeclared(String name) {
        return declaredSorts.containsKey(name);
    }

    @Override
    public void close() {
        if (ownsContext) {
            logger.debug("释放 Z3 Context");
            context.close();
        }
    }
}
