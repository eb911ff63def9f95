package org.smtbridge.symbolic;

import com.microsoft.z3.BoolExpr;
import org.smtbridge.core.BoolType;
import org.smtbridge.smt.SmtSort;

public class SymbolicBoolVariable extends SymbolicVariable {

    public SymbolicBoolVariable(String uniqueName, String ssaSeparator, SolverInterface solver) {
        super(BoolType.INSTANCE, SmtSort.BOOL, uniqueName, false, ssaSeparator, solver);
    }

    @Override
    public BoolExpr getCurrentValue() {
        return (BoolExpr) super.getCurrentValue();
    }

    @Override
    public BoolExpr increaseIndex(SolverInterface solver) {
        return (BoolExpr) super.increaseIndex(solver);
    }
}
