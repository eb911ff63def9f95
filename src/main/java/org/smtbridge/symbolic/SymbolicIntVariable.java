package org.smtbridge.symbolic;

import com.microsoft.z3.IntExpr;
import org.smtbridge.core.IntegerType;
import org.smtbridge.smt.SmtSort;

import java.util.Objects;

/**
 * 整数符号变量，取值范围由其 {@link IntegerType} 的位宽与符号决定。
 */
public class SymbolicIntVariable extends SymbolicVariable {

    public SymbolicIntVariable(IntegerType type, String uniqueName, boolean abstracted,
                               String ssaSeparator, SolverInterface solver) {
        super(Objects.requireNonNull(type, "SymbolicIntVariable-构造函数: type 不能为 null"),
                SmtSort.INT, uniqueName, abstracted, ssaSeparator, solver);
    }

    public IntegerType getIntegerType() {
        return (IntegerType) getType();
    }

    @Override
    public IntExpr getCurrentValue() {
        return (IntExpr) super.getCurrentValue();
    }

    @Override
    public IntExpr increaseIndex(SolverInterface solver) {
        return (IntExpr) super.increaseIndex(solver);
    }
}
