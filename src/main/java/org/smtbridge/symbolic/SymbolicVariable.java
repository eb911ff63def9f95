package org.smtbridge.symbolic;

import com.microsoft.z3.Expr;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.smtbridge.core.Type;
import org.smtbridge.smt.SmtSort;
import org.smtbridge.utils.Contracts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 代表一个程序值的求解器侧符号变量。
 * 每个 SSA 版本对应一个名为 {@code uniqueName + separator + index} 的 Z3 常量，
 * 创建时声明第 0 个版本；后续版本由验证引擎通过 {@link #increaseIndex} 推进。
 * 变量的排序在整个生命周期内不变，也不保存求解器上下文的引用。
 * @author Ayalyt
 */
@Getter
public abstract class SymbolicVariable {

    private static final Logger logger = LoggerFactory.getLogger(SymbolicVariable.class);

    private final String uniqueName;
    // 规范化后的类型
    private final Type type;
    private final SmtSort sort;
    // 为 true 表示此变量只是原类型的不精确抽象
    private final boolean abstracted;
    private final String ssaSeparator;

    private int index;
    private Expr<?> currentValue;

    protected SymbolicVariable(Type type, SmtSort sort, String uniqueName, boolean abstracted,
                               String ssaSeparator, SolverInterface solver) {
        this.type = Objects.requireNonNull(type, "SymbolicVariable-构造函数: type 不能为 null");
        this.sort = Objects.requireNonNull(sort, "SymbolicVariable-构造函数: sort 不能为 null");
        Contracts.require(StringUtils.isNotBlank(uniqueName), "SymbolicVariable-构造函数: uniqueName 不能为空");
        Objects.requireNonNull(solver, "SymbolicVariable-构造函数: solver 不能为 null");
        this.uniqueName = uniqueName;
        this.abstracted = abstracted;
        this.ssaSeparator = Objects.requireNonNull(ssaSeparator, "SymbolicVariable-构造函数: ssaSeparator 不能为 null");
        this.index = 0;
        this.currentValue = solver.newVariable(nameAtIndex(0), sort);
    }

    /**
     * @return 当前 SSA 版本的符号名。
     */
    public String getCurrentName() {
        return nameAtIndex(index);
    }

    /**
     * 取第 i 个 SSA 版本的值。
     * @throws org.smtbridge.utils.ContractViolationException 如果 i 为负或超过当前版本。
     */
    public Expr<?> valueAtIndex(int i, SolverInterface solver) {
        Contracts.require(i >= 0 && i <= index, "SymbolicVariable: {} 没有版本 {}，当前版本为 {}", uniqueName, i, index);
        return solver.newVariable(nameAtIndex(i), sort);
    }

    /**
     * 推进到下一个 SSA 版本并返回新的当前值。
     */
    public Expr<?> increaseIndex(SolverInterface solver) {
        Objects.requireNonNull(solver, "SymbolicVariable-increaseIndex: solver 不能为 null");
        index++;
        currentValue = solver.newVariable(nameAtIndex(index), sort);
        logger.debug("符号变量 {} 推进到版本 {}", uniqueName, index);
        return currentValue;
    }

    private String nameAtIndex(int i) {
        return uniqueName + ssaSeparator + i;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + getCurrentName() + " : " + type
                + (abstracted ? ", abstracted" : "") + "}";
    }
}
