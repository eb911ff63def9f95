package org.smtbridge.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;
import org.smtbridge.core.IntegerType;
import org.smtbridge.core.Type;
import org.smtbridge.utils.Contracts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

import static org.smtbridge.translation.CategoryTaxonomy.isBool;
import static org.smtbridge.translation.CategoryTaxonomy.isInteger;

/**
 * 向求解器追加初值约束。
 * 零值：整数 == 0，布尔 == false；未知值：整数落在其位宽与符号决定的范围内。
 * 其余类别不追加任何断言。每个变量版本只应调用一次。
 */
public final class ValueConstraintInstaller {

    private static final Logger logger = LoggerFactory.getLogger(ValueConstraintInstaller.class);

    private ValueConstraintInstaller() {
    }

    public static void setZeroValue(SymbolicVariable variable, SolverInterface solver) {
        Objects.requireNonNull(variable, "ValueConstraintInstaller: variable 不能为 null");
        setZeroValue(variable.getCurrentValue(), variable.getType(), solver);
    }

    public static void setZeroValue(Expr<?> expr, Type type, SolverInterface solver) {
        Objects.requireNonNull(expr, "ValueConstraintInstaller: expr 不能为 null");
        Objects.requireNonNull(type, "ValueConstraintInstaller: type 不能为 null");
        Context ctx = solver.getContext();
        if (isInteger(type.getCategory())) {
            solver.addAssertion(ctx.mkEq(asInt(expr, type), ctx.mkInt(0)));
        } else if (isBool(type.getCategory())) {
            solver.addAssertion(ctx.mkEq(asBool(expr, type), ctx.mkFalse()));
        } else {
            logger.debug("类型 {} 没有零值约束", type);
        }
    }

    public static void setUnknownValue(SymbolicVariable variable, SolverInterface solver) {
        Objects.requireNonNull(variable, "ValueConstraintInstaller: variable 不能为 null");
        setUnknownValue(variable.getCurrentValue(), variable.getType(), solver);
    }

    public static void setUnknownValue(Expr<?> expr, Type type, SolverInterface solver) {
        Objects.requireNonNull(expr, "ValueConstraintInstaller: expr 不能为 null");
        Objects.requireNonNull(type, "ValueConstraintInstaller: type 不能为 null");
        if (!isInteger(type.getCategory())) {
            logger.debug("类型 {} 的未知值不受约束", type);
            return;
        }
        Context ctx = solver.getContext();
        IntegerType intType = (IntegerType) type;
        IntExpr intExpr = asInt(expr, type);
        solver.addAssertion(ctx.mkGe(intExpr, ctx.mkInt(intType.minValue().toString())));
        solver.addAssertion(ctx.mkLe(intExpr, ctx.mkInt(intType.maxValue().toString())));
    }

    private static IntExpr asInt(Expr<?> expr, Type type) {
        Contracts.require(expr instanceof IntExpr, "ValueConstraintInstaller: 类型 {} 的表达式 {} 不是整数表达式", type, expr);
        return (IntExpr) expr;
    }

    private static BoolExpr asBool(Expr<?> expr, Type type) {
        Contracts.require(expr instanceof BoolExpr, "ValueConstraintInstaller: 类型 {} 的表达式 {} 不是布尔表达式", type, expr);
        return (BoolExpr) expr;
    }
}
