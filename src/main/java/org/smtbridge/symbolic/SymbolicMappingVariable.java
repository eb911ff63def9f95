package org.smtbridge.symbolic;

import com.microsoft.z3.ArrayExpr;
import lombok.Getter;
import org.smtbridge.core.MappingType;
import org.smtbridge.core.Type;
import org.smtbridge.smt.Kind;
import org.smtbridge.smt.SmtSort;
import org.smtbridge.translation.TypeNormalizer;
import org.smtbridge.utils.Contracts;

/**
 * 映射符号变量，以 Z3 数组建模。
 * 键和值类型在构造时规范化，嵌套映射的内层保持原样。
 */
@Getter
public class SymbolicMappingVariable extends SymbolicVariable {

    private final Type keyType;
    private final Type valueType;

    public SymbolicMappingVariable(MappingType type, SmtSort sort, String uniqueName,
                                   String ssaSeparator, SolverInterface solver) {
        super(type, sort, uniqueName, false, ssaSeparator, solver);
        Contracts.require(sort.getKind() == Kind.ARRAY, "SymbolicMappingVariable: 映射 {} 的排序必须是数组，实际为 {}", type, sort);
        this.keyType = TypeNormalizer.normalize(type.getKeyType());
        this.valueType = TypeNormalizer.normalize(type.getValueType());
    }

    public MappingType getMappingType() {
        return (MappingType) getType();
    }

    @Override
    public ArrayExpr<?, ?> getCurrentValue() {
        return (ArrayExpr<?, ?>) super.getCurrentValue();
    }
}
