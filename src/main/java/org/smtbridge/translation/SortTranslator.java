package org.smtbridge.translation;

import org.smtbridge.core.FunctionType;
import org.smtbridge.core.MappingType;
import org.smtbridge.core.Type;
import org.smtbridge.smt.SmtArraySort;
import org.smtbridge.smt.SmtFunctionSort;
import org.smtbridge.smt.SmtSort;
import org.smtbridge.utils.Contracts;
import org.smtbridge.utils.TranslatorOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 计算宿主类型对应的求解器排序。
 * 函数与映射递归地计算参数、返回、键和值的排序；不支持的类型退化为 Int。
 * 递归深度受 {@link TranslatorOptions#getMaxNestingDepth()} 限制。
 * @author Ayalyt
 */
public final class SortTranslator {

    private static final Logger logger = LoggerFactory.getLogger(SortTranslator.class);

    private final int maxNestingDepth;

    public SortTranslator(TranslatorOptions options) {
        Objects.requireNonNull(options, "SortTranslator-构造函数: options 不能为 null");
        this.maxNestingDepth = options.getMaxNestingDepth();
    }

    public SortTranslator() {
        this(TranslatorOptions.defaults());
    }

    /**
     * @param type 宿主类型。
     * @return 对应的排序。
     * @throws org.smtbridge.utils.ContractViolationException 如果函数类型的返回类型不是恰好一个，或嵌套超过最大深度。
     */
    public SmtSort sortOf(Type type) {
        return sortOf(type, 0);
    }

    /**
     * 逐元素计算排序，保持顺序与长度。
     */
    public List<SmtSort> sortOf(List<? extends Type> types) {
        return sortOf(types, 0);
    }

    private List<SmtSort> sortOf(List<? extends Type> types, int depth) {
        Objects.requireNonNull(types, "SortTranslator: types 不能为 null");
        List<SmtSort> sorts = new ArrayList<>(types.size());
        for (Type type : types) {
            sorts.add(sortOf(type, depth));
        }
        return sorts;
    }

    private SmtSort sortOf(Type type, int depth) {
        Objects.requireNonNull(type, "SortTranslator: type 不能为 null");
        Contracts.require(depth <= maxNestingDepth,
                "SortTranslator: 类型嵌套超过最大深度 {}，疑似自引用类型: {}", maxNestingDepth, type);

        SmtSort sort = switch (CategoryTaxonomy.smtKind(type.getCategory())) {
            case INT -> SmtSort.INT;
            case BOOL -> SmtSort.BOOL;
            case FUNCTION -> {
                FunctionType functionType = (FunctionType) type;
                List<SmtSort> parameterSorts = sortOf(functionType.getParameterTypes(), depth + 1);
                List<Type> returnTypes = functionType.getReturnParameterTypes();
                // 元组返回尚未支持
                Contracts.require(returnTypes.size() == 1,
                        "SortTranslator: 函数类型必须恰好有一个返回类型，实际为 {}: {}", returnTypes.size(), type);
                yield new SmtFunctionSort(parameterSorts, sortOf(returnTypes.get(0), depth + 1));
            }
            case ARRAY -> {
                MappingType mappingType = (MappingType) type;
                yield new SmtArraySort(sortOf(mappingType.getKeyType(), depth + 1),
                        sortOf(mappingType.getValueType(), depth + 1));
            }
        };
        if (!CategoryTaxonomy.isSupportedType(type)) {
            logger.debug("类型 {} 不受支持，排序按 Int 抽象", type);
        }
        return sort;
    }
}
