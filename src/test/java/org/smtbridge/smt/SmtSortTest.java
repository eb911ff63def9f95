package org.smtbridge.smt;

import com.microsoft.z3.ArraySort;
import com.microsoft.z3.Context;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Sort;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class SmtSortTest {

    private Context ctx;

    @BeforeAll
    void setUp() {
        ctx = new Context();
    }

    @AfterAll
    void tearDown() {
        if (ctx != null) {
            ctx.close();
        }
    }

    @Nested
    @DisplayName("值语义 (Value Semantics)")
    class EqualityTests {

        @Test
        void testCompositeSortsEqualByStructure() {
            SmtSort a1 = new SmtArraySort(SmtSort.INT, new SmtArraySort(SmtSort.INT, SmtSort.BOOL));
            SmtSort a2 = new SmtArraySort(SmtSort.INT, new SmtArraySort(SmtSort.INT, SmtSort.BOOL));
            SmtSort f1 = new SmtFunctionSort(List.of(SmtSort.INT), SmtSort.BOOL);
            SmtSort f2 = new SmtFunctionSort(List.of(SmtSort.INT), SmtSort.BOOL);

            assertAll(
                    () -> assertEquals(a1, a2),
                    () -> assertEquals(a1.hashCode(), a2.hashCode()),
                    () -> assertEquals(f1, f2),
                    () -> assertNotEquals(f1, new SmtFunctionSort(List.of(SmtSort.BOOL), SmtSort.BOOL)),
                    () -> assertNotEquals(SmtSort.INT, SmtSort.BOOL),
                    () -> assertEquals(Kind.ARRAY, a1.getKind()),
                    () -> assertEquals("Array(Int, Array(Int, Bool))", a1.toString()),
                    () -> assertEquals("Function([Int], Bool)", f1.toString())
            );
        }
    }

    @Nested
    @DisplayName("Z3 转换 (Z3 Conversion)")
    class Z3ConversionTests {

        @Test
        void testBaseSorts() {
            assertAll(
                    () -> assertEquals(ctx.mkIntSort(), SmtSort.INT.toZ3Sort(ctx)),
                    () -> assertEquals(ctx.mkBoolSort(), SmtSort.BOOL.toZ3Sort(ctx))
            );
        }

        @Test
        void testArraySort() {
            Sort z3 = new SmtArraySort(SmtSort.INT, SmtSort.BOOL).toZ3Sort(ctx);

            assertEquals(ctx.mkArraySort(ctx.mkIntSort(), ctx.mkBoolSort()), z3);
        }

        @Test
        @DisplayName("作为排序使用的函数排序按柯里化数组编码")
        void testFunctionSortAsCurriedArray() {
            SmtFunctionSort binary = new SmtFunctionSort(List.of(SmtSort.INT, SmtSort.BOOL), SmtSort.INT);
            SmtFunctionSort nullary = new SmtFunctionSort(List.of(), SmtSort.BOOL);

            Sort expected = ctx.mkArraySort(ctx.mkIntSort(), ctx.mkArraySort(ctx.mkBoolSort(), ctx.mkIntSort()));
            assertAll(
                    () -> assertEquals(expected, binary.toZ3Sort(ctx)),
                    () -> assertTrue(binary.toZ3Sort(ctx) instanceof ArraySort),
                    () -> assertEquals(ctx.mkBoolSort(), nullary.toZ3Sort(ctx))
            );
        }

        @Test
        void testFunctionDeclaration() {
            SmtFunctionSort sort = new SmtFunctionSort(List.of(SmtSort.INT, SmtSort.INT), SmtSort.BOOL);

            FuncDecl<?> f = sort.toZ3FuncDecl(ctx, "f");

            assertAll(
                    () -> assertEquals(2, f.getDomainSize()),
                    () -> assertEquals(ctx.mkBoolSort(), f.getRange()),
                    () -> assertEquals("f", f.getName().toString())
            );
        }
    }
}
