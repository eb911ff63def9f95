package org.smtbridge.symbolic;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.smtbridge.core.*;
import org.smtbridge.smt.Kind;
import org.smtbridge.smt.SmtArraySort;
import org.smtbridge.smt.SmtFunctionSort;
import org.smtbridge.smt.SmtSort;
import org.smtbridge.utils.ContractViolationException;
import org.smtbridge.utils.Rational;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 以验证引擎的视角走一遍入口 API。
 */
class SymbolicTypesTest {

    private final SymbolicTypes symbolicTypes = new SymbolicTypes();
    private Z3SolverInterface solver;

    @BeforeEach
    void setUp() {
        solver = new Z3SolverInterface(symbolicTypes.getOptions());
    }

    @AfterEach
    void tearDown() {
        solver.close();
    }

    @Test
    @DisplayName("address: uint160, AddressVariable, 排序 Int, 未知值两条范围断言")
    void testAddressScenario() {
        Pair<Boolean, SymbolicVariable> result = symbolicTypes.newSymbolicVariable(AddressType.INSTANCE, "sender", solver);
        symbolicTypes.setSymbolicUnknownValue(result.getRight(), solver);

        assertAll(
                () -> assertEquals(IntegerType.unsigned(160), symbolicTypes.normalize(AddressType.INSTANCE)),
                () -> assertInstanceOf(SymbolicAddressVariable.class, result.getRight()),
                () -> assertEquals(SmtSort.INT, symbolicTypes.smtSort(AddressType.INSTANCE)),
                () -> assertEquals(2, solver.getAssertions().size())
        );
    }

    @Test
    @DisplayName("mapping: Array(Int, Bool)，零值和未知值都不追加断言")
    void testMappingScenario() {
        MappingType type = MappingType.of(IntegerType.unsigned(256), BoolType.INSTANCE);

        SymbolicVariable variable = symbolicTypes.newSymbolicVariable(type, "balances", solver).getRight();
        symbolicTypes.setSymbolicZeroValue(variable, solver);
        symbolicTypes.setSymbolicUnknownValue(variable, solver);

        assertAll(
                () -> assertEquals(new SmtArraySort(SmtSort.INT, SmtSort.BOOL), symbolicTypes.smtSort(type)),
                () -> assertInstanceOf(SymbolicMappingVariable.class, variable),
                () -> assertTrue(solver.getAssertions().isEmpty())
        );
    }

    @Test
    @DisplayName("struct: 抽象为 int256，排序 Int")
    void testStructScenario() {
        Type struct = StructType.of("Order", Map.of("amount", IntegerType.unsigned(128)));

        Pair<Boolean, SymbolicVariable> result = symbolicTypes.newSymbolicVariable(struct, "order", solver);

        assertAll(
                () -> assertTrue(result.getLeft()),
                () -> assertFalse(symbolicTypes.isSupportedType(struct)),
                () -> assertEquals(IntegerType.signed(256), result.getRight().getType()),
                () -> assertEquals(SmtSort.INT, result.getRight().getSort())
        );
    }

    @Test
    @DisplayName("function: 单返回值得到函数排序，两个返回值是契约违反")
    void testFunctionScenario() {
        Type single = FunctionType.of(List.of(IntegerType.unsigned(256)), List.of(BoolType.INSTANCE));
        Type pair = FunctionType.of(List.of(IntegerType.unsigned(256)), List.of(IntegerType.unsigned(256), BoolType.INSTANCE));

        assertAll(
                () -> assertEquals(new SmtFunctionSort(List.of(SmtSort.INT), SmtSort.BOOL), symbolicTypes.smtSort(single)),
                () -> assertThrows(ContractViolationException.class, () -> symbolicTypes.smtSort(pair)),
                () -> assertEquals(Kind.FUNCTION, symbolicTypes.smtKind(Category.FUNCTION))
        );
    }

    @Test
    @DisplayName("分数字面量: 排序为 Int，但变量被抽象并按 int256 约束")
    void testFractionalRationalScenario() {
        Type third = RationalNumberType.of(Rational.valueOf(1, 3));

        Pair<Boolean, SymbolicVariable> result = symbolicTypes.newSymbolicVariable(third, "c", solver);
        symbolicTypes.setSymbolicZeroValue(result.getRight().getCurrentValue(), result.getRight().getType(), solver);
        symbolicTypes.setSymbolicUnknownValue(result.getRight().getCurrentValue(), result.getRight().getType(), solver);

        assertAll(
                () -> assertEquals(SmtSort.INT, symbolicTypes.smtSort(third)),
                () -> assertTrue(result.getLeft()),
                () -> assertTrue(result.getRight().isAbstracted()),
                () -> assertEquals(3, solver.getAssertions().size())
        );
    }

    @Test
    void testVectorizedSorts() {
        assertEquals(List.of(SmtSort.INT, SmtSort.BOOL),
                symbolicTypes.smtSorts(List.of(FixedBytesType.of(1), BoolType.INSTANCE)));
    }
}
