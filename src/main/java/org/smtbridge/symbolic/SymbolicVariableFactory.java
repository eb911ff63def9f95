package org.smtbridge.symbolic;

import org.apache.commons.lang3.tuple.Pair;
import org.smtbridge.core.Category;
import org.smtbridge.core.FixedBytesType;
import org.smtbridge.core.IntegerType;
import org.smtbridge.core.MappingType;
import org.smtbridge.core.RationalNumberType;
import org.smtbridge.core.Type;
import org.smtbridge.translation.SortTranslator;
import org.smtbridge.translation.TypeNormalizer;
import org.smtbridge.utils.Contracts;
import org.smtbridge.utils.TranslatorOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

import static org.smtbridge.translation.CategoryTaxonomy.*;

/**
 * 根据类型创建形状正确的符号变量。
 * 无法精确建模的类型一律抽象为有符号 256 位整数变量，并在结果中标记 abstracted。
 * @author Ayalyt
 */
public final class SymbolicVariableFactory {

    private static final Logger logger = LoggerFactory.getLogger(SymbolicVariableFactory.class);

    public static final int ABSTRACT_BITS = 256;

    private final SortTranslator sortTranslator;
    private final String ssaSeparator;

    public SymbolicVariableFactory(SortTranslator sortTranslator, TranslatorOptions options) {
        this.sortTranslator = Objects.requireNonNull(sortTranslator, "SymbolicVariableFactory-构造函数: sortTranslator 不能为 null");
        Objects.requireNonNull(options, "SymbolicVariableFactory-构造函数: options 不能为 null");
        this.ssaSeparator = options.getSsaSeparator();
    }

    /**
     * 创建符号变量，并在求解器上下文中声明其第 0 个版本。
     * 判断顺序有意义：规范化后不受支持的类型必须先于各类别分支被拦截。
     *
     * @param type 类型检查器产出的原始类型。
     * @param uniqueName 变量的唯一名称。
     * @param solver 本次调用使用的求解器上下文。
     * @return (是否被抽象, 符号变量)。
     * @throws org.smtbridge.utils.ContractViolationException 如果某个受支持的类别没有对应分支。
     */
    public Pair<Boolean, SymbolicVariable> newSymbolicVariable(Type type, String uniqueName, SolverInterface solver) {
        Objects.requireNonNull(type, "SymbolicVariableFactory: type 不能为 null");
        Objects.requireNonNull(solver, "SymbolicVariableFactory: solver 不能为 null");

        Type normalized = TypeNormalizer.normalize(type);
        Category category = type.getCategory();

        boolean abstracted = false;
        SymbolicVariable variable;
        if (!isSupportedType(normalized.getCategory())) {
            logger.warn("类型 {} 不受支持，变量 {} 抽象为 int{}", type, uniqueName, ABSTRACT_BITS);
            abstracted = true;
            variable = abstractVariable(uniqueName, solver);
        } else if (isBool(category)) {
            variable = new SymbolicBoolVariable(uniqueName, ssaSeparator, solver);
        } else if (isFunction(category)) {
            // 函数值不作为求解器函数建模，只有其排序被结构化计算
            abstracted = true;
            variable = abstractVariable(uniqueName, solver);
        } else if (isInteger(category)) {
            variable = new SymbolicIntVariable((IntegerType) normalized, uniqueName, false, ssaSeparator, solver);
        } else if (isFixedBytes(category)) {
            variable = new SymbolicFixedBytesVariable(((FixedBytesType) type).getNumBytes(), uniqueName, ssaSeparator, solver);
        } else if (isAddress(category)) {
            variable = new SymbolicAddressVariable(uniqueName, ssaSeparator, solver);
        } else if (isRational(category)) {
            if (((RationalNumberType) type).isFractional()) {
                logger.warn("分数字面量 {} 无法精确表示，变量 {} 抽象为 int{}", type, uniqueName, ABSTRACT_BITS);
                abstracted = true;
                variable = abstractVariable(uniqueName, solver);
            } else {
                variable = new SymbolicIntVariable((IntegerType) normalized, uniqueName, false, ssaSeparator, solver);
            }
        } else if (isMapping(category)) {
            MappingType mappingType = (MappingType) type;
            variable = new SymbolicMappingVariable(mappingType, sortTranslator.sortOf(mappingType), uniqueName, ssaSeparator, solver);
        } else {
            throw Contracts.violation("SymbolicVariableFactory: 受支持的类别 {} 没有对应的符号变量 ({})", category, type);
        }

        logger.info("创建符号变量 {}，类型 {}，abstracted={}", variable, type, abstracted);
        return Pair.of(abstracted, variable);
    }

    private SymbolicIntVariable abstractVariable(String uniqueName, SolverInterface solver) {
        return new SymbolicIntVariable(IntegerType.signed(ABSTRACT_BITS), uniqueName, true, ssaSeparator, solver);
    }
}
