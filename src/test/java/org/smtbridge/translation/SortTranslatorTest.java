package org.smtbridge.translation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.smtbridge.core.*;
import org.smtbridge.smt.SmtArraySort;
import org.smtbridge.smt.SmtFunctionSort;
import org.smtbridge.smt.SmtSort;
import org.smtbridge.utils.ContractViolationException;
import org.smtbridge.utils.Rational;
import org.smtbridge.utils.TranslatorOptions;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SortTranslatorTest {

    private final SortTranslator translator = new SortTranslator();

    @Nested
    @DisplayName("基础排序 (Base Sorts)")
    class BaseSortTests {

        @Test
        void testNumericCategoriesAreInt() {
            assertAll(
                    () -> assertEquals(SmtSort.INT, translator.sortOf(IntegerType.unsigned(256))),
                    () -> assertEquals(SmtSort.INT, translator.sortOf(AddressType.INSTANCE)),
                    () -> assertEquals(SmtSort.INT, translator.sortOf(FixedBytesType.of(4))),
                    () -> assertEquals(SmtSort.INT, translator.sortOf(RationalNumberType.of(Rational.valueOf(1, 2))))
            );
        }

        @Test
        void testBool() {
            assertEquals(SmtSort.BOOL, translator.sortOf(BoolType.INSTANCE));
        }

        @Test
        @DisplayName("不支持的类型退化为 Int")
        void testUnsupportedFallsBackToInt() {
            assertAll(
                    () -> assertEquals(SmtSort.INT, translator.sortOf(StructType.of("S", Map.of("b", BoolType.INSTANCE)))),
                    () -> assertEquals(SmtSort.INT, translator.sortOf(ArrayType.fixed(BoolType.INSTANCE, 2))),
                    () -> assertEquals(SmtSort.INT, translator.sortOf(ContractType.of("Token"))),
                    () -> assertEquals(SmtSort.INT, translator.sortOf(EnumType.of("Color", List.of("RED"))))
            );
        }
    }

    @Nested
    @DisplayName("映射 (Mappings)")
    class MappingTests {

        @Test
        @DisplayName("mapping(uint256 => bool) => Array(Int, Bool)")
        void testFlatMapping() {
            Type mapping = MappingType.of(IntegerType.unsigned(256), BoolType.INSTANCE);

            assertEquals(new SmtArraySort(SmtSort.INT, SmtSort.BOOL), translator.sortOf(mapping));
        }

        @Test
        @DisplayName("两层嵌套: mapping(uint => mapping(address => bool))")
        void testNestedMapping() {
            Type inner = MappingType.of(AddressType.INSTANCE, BoolType.INSTANCE);
            Type outer = MappingType.of(IntegerType.unsigned(256), inner);

            SmtSort expected = new SmtArraySort(SmtSort.INT, new SmtArraySort(SmtSort.INT, SmtSort.BOOL));
            assertAll(
                    () -> assertEquals(expected, translator.sortOf(outer)),
                    () -> assertEquals(new SmtArraySort(translator.sortOf(IntegerType.unsigned(256)), translator.sortOf(inner)),
                            translator.sortOf(outer))
            );
        }

        @Test
        @DisplayName("三层嵌套，值类型为 bytes32")
        void testThreeLevels() {
            Type type = MappingType.of(AddressType.INSTANCE,
                    MappingType.of(AddressType.INSTANCE,
                            MappingType.of(BoolType.INSTANCE, FixedBytesType.of(32))));

            SmtSort expected = new SmtArraySort(SmtSort.INT,
                    new SmtArraySort(SmtSort.INT, new SmtArraySort(SmtSort.BOOL, SmtSort.INT)));
            assertEquals(expected, translator.sortOf(type));
        }
    }

    @Nested
    @DisplayName("函数 (Functions)")
    class FunctionTests {

        @Test
        @DisplayName("function(uint256) returns (bool) => Function([Int], Bool)")
        void testSingleReturn() {
            Type function = FunctionType.of(List.of(IntegerType.unsigned(256)), List.of(BoolType.INSTANCE));

            assertEquals(new SmtFunctionSort(List.of(SmtSort.INT), SmtSort.BOOL), translator.sortOf(function));
        }

        @Test
        @DisplayName("多个返回类型是契约违反")
        void testTupleReturn_ShouldThrow() {
            Type function = FunctionType.of(List.of(IntegerType.unsigned(256)),
                    List.of(IntegerType.unsigned(256), BoolType.INSTANCE));

            assertThrows(ContractViolationException.class, () -> translator.sortOf(function));
        }

        @Test
        @DisplayName("没有返回类型也是契约违反")
        void testNoReturn_ShouldThrow() {
            Type function = FunctionType.of(List.of(), List.of());

            assertThrows(ContractViolationException.class, () -> translator.sortOf(function));
        }

        @Test
        @DisplayName("映射值可以是函数类型")
        void testFunctionAsMappingValue() {
            Type function = FunctionType.of(List.of(AddressType.INSTANCE), List.of(IntegerType.unsigned(8)));
            Type mapping = MappingType.of(IntegerType.unsigned(256), function);

            assertEquals(new SmtArraySort(SmtSort.INT, new SmtFunctionSort(List.of(SmtSort.INT), SmtSort.INT)),
                    translator.sortOf(mapping));
        }
    }

    @Test
    @DisplayName("向量形式逐元素映射，保持顺序和长度")
    void testVectorized() {
        List<Type> types = List.of(BoolType.INSTANCE, AddressType.INSTANCE,
                MappingType.of(BoolType.INSTANCE, BoolType.INSTANCE));

        assertEquals(List.of(SmtSort.BOOL, SmtSort.INT, new SmtArraySort(SmtSort.BOOL, SmtSort.BOOL)),
                translator.sortOf(types));
        assertTrue(translator.sortOf(List.of()).isEmpty());
    }

    @Test
    @DisplayName("超过最大嵌套深度时抛出契约违反而不是栈溢出")
    void testDepthGuard() {
        SortTranslator shallow = new SortTranslator(TranslatorOptions.defaults().withMaxNestingDepth(3));
        Type depth3 = nest(3);
        Type depth4 = nest(4);

        assertAll(
                () -> assertDoesNotThrow(() -> shallow.sortOf(depth3)),
                () -> assertThrows(ContractViolationException.class, () -> shallow.sortOf(depth4)),
                () -> assertDoesNotThrow(() -> translator.sortOf(nest(TranslatorOptions.DEFAULT_MAX_DEPTH)))
        );
    }

    /**
     * 构造 levels 层嵌套的 mapping(uint256 => ... => bool)。
     */
    private static Type nest(int levels) {
        Type type = BoolType.INSTANCE;
        for (int i = 0; i < levels; i++) {
            type = MappingType.of(IntegerType.unsigned(256), type);
        }
        return type;
    }
}
