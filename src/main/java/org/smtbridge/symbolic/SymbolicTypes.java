package org.smtbridge.symbolic;

import com.microsoft.z3.Expr;
import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.smtbridge.core.Category;
import org.smtbridge.core.Type;
import org.smtbridge.smt.Kind;
import org.smtbridge.smt.SmtSort;
import org.smtbridge.translation.CategoryTaxonomy;
import org.smtbridge.translation.SortTranslator;
import org.smtbridge.translation.TypeNormalizer;
import org.smtbridge.utils.TranslatorOptions;

import java.util.List;
import java.util.Objects;

/**
 * 验证引擎使用的入口：类型到排序的翻译、符号变量的创建与初值约束。
 * 求解器上下文作为参数逐次传入，此对象本身不持有任何求解器状态。
 * @author Ayalyt
 */
public final class SymbolicTypes {

    @Getter
    private final TranslatorOptions options;
    private final SortTranslator sortTranslator;
    private final SymbolicVariableFactory variableFactory;

    public SymbolicTypes(TranslatorOptions options) {
        this.options = Objects.requireNonNull(options, "SymbolicTypes-构造函数: options 不能为 null");
        this.sortTranslator = new SortTranslator(options);
        this.variableFactory = new SymbolicVariableFactory(sortTranslator, options);
    }

    /**
     * 使用 classpath 配置与系统属性构造。
     */
    public SymbolicTypes() {
        this(TranslatorOptions.load());
    }

    public SmtSort smtSort(Type type) {
        return sortTranslator.sortOf(type);
    }

    public List<SmtSort> smtSorts(List<? extends Type> types) {
        return sortTranslator.sortOf(types);
    }

    public Kind smtKind(Category category) {
        return CategoryTaxonomy.smtKind(category);
    }

    public boolean isSupportedType(Type type) {
        return CategoryTaxonomy.isSupportedType(type);
    }

    public Type normalize(Type type) {
        return TypeNormalizer.normalize(type);
    }

    public Pair<Boolean, SymbolicVariable> newSymbolicVariable(Type type, String uniqueName, SolverInterface solver) {
        return variableFactory.newSymbolicVariable(type, uniqueName, solver);
    }

    public void setSymbolicZeroValue(SymbolicVariable variable, SolverInterface solver) {
        ValueConstraintInstaller.setZeroValue(variable, solver);
    }

    public void setSymbolicZeroValue(Expr<?> expr, Type type, SolverInterface solver) {
        ValueConstraintInstaller.setZeroValue(expr, type, solver);
    }

    public void setSymbolicUnknownValue(SymbolicVariable variable, SolverInterface solver) {
        ValueConstraintInstaller.setUnknownValue(variable, solver);
    }

    public void setSymbolicUnknownValue(Expr<?> expr, Type type, SolverInterface solver) {
        ValueConstraintInstaller.setUnknownValue(expr, type, solver);
    }
}
