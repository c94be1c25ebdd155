package org.symproof.contract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.symproof.core.Sort;
import org.symproof.lang.ast.Expr;
import org.symproof.lang.parser.Parser;
import org.symproof.lang.parser.SourceText;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TypeResolverTest {

    private final TypeResolver resolver = new TypeResolver();

    private static Expr annotation(String text) {
        String source = "def f(x: " + text + "):\n    return x\n";
        return Parser.parseFunction(SourceText.canonicalize(source)).getParams().get(0).getAnnotation();
    }

    private static List<String> descriptions(TypeAnnotation type) {
        return type.getRefinements().stream().map(Refinement::getDescription).toList();
    }

    @Nested
    @DisplayName("基础类型")
    class BaseTypeTests {

        @ParameterizedTest(name = "{0} => {1}")
        @CsvSource({
                "int, INT",
                "float, REAL",
                "bool, BOOL"
        })
        @DisplayName("基础类型映射到 sort")
        void testBaseTypes(String text, Sort expected) {
            TypeAnnotation type = resolver.resolve(annotation(text));
            assertAll(
                    () -> assertEquals(expected, type.getSort()),
                    () -> assertFalse(type.isRefined())
            );
        }

        @Test
        @DisplayName("没有注解按 float 处理")
        void testMissingAnnotation() {
            assertSame(TypeAnnotation.REAL, resolver.resolve(null));
        }

        @Test
        @DisplayName("未知类型抛出 UnsupportedTypeException")
        void testUnknownType() {
            UnsupportedTypeException e = assertThrows(UnsupportedTypeException.class,
                    () -> resolver.resolve(annotation("str")));
            assertTrue(e.getMessage().contains("No sort for type annotation 'str'"));
        }
    }

    @Nested
    @DisplayName("细化类型")
    class RefinedTypeTests {

        @Test
        @DisplayName("Annotated 收集所有标记")
        void testAnnotated() {
            TypeAnnotation type = resolver.resolve(annotation("Annotated[int, Gt(0), Le(10)]"));

            assertAll(
                    () -> assertEquals(Sort.INT, type.getSort()),
                    () -> assertEquals(List.of("Gt(0)", "Le(10)"), descriptions(type)),
                    () -> assertEquals("Annotated[int, Gt(0), Le(10)]", type.toString())
            );
        }

        @Test
        @DisplayName("浮点和负数边界")
        void testBounds() {
            TypeAnnotation type = resolver.resolve(annotation("Annotated[float, Between(-1, 0.5)]"));

            assertEquals(List.of("Between(-1, 0.5)"), descriptions(type));
        }

        @Test
        @DisplayName("限定名 typing.Annotated 同样被识别")
        void testQualifiedNames() {
            TypeAnnotation type = resolver.resolve(annotation("typing.Annotated[float, annotated_types.Ge(0)]"));

            assertAll(
                    () -> assertEquals(Sort.REAL, type.getSort()),
                    () -> assertEquals(List.of("Ge(0)"), descriptions(type))
            );
        }

        @Test
        @DisplayName("内置别名和嵌套 Annotated")
        void testAliases() {
            TypeAnnotation positive = resolver.resolve(annotation("Positive"));
            TypeAnnotation nested = resolver.resolve(annotation("Annotated[Positive, Lt(100)]"));

            assertAll(
                    () -> assertEquals(Sort.REAL, positive.getSort()),
                    () -> assertEquals(List.of("Gt(0)"), descriptions(positive)),
                    () -> assertEquals(List.of("Gt(0)", "Lt(100)"), descriptions(nested)),
                    () -> assertEquals(List.of("Between(0, 1)"),
                            descriptions(resolver.resolve(annotation("UnitInterval"))))
            );
        }

        @Test
        @DisplayName("调用方注册的别名优先")
        void testCustomAlias() {
            TypeResolver custom = new TypeResolver(Map.of(
                    "Percent", TypeAnnotation.of(Sort.INT, Refinement.between(0, 100)),
                    "Positive", TypeAnnotation.of(Sort.INT, Refinement.gt(0))));

            assertAll(
                    () -> assertEquals(Sort.INT, custom.resolve(annotation("Percent")).getSort()),
                    () -> assertEquals(Sort.INT, custom.resolve(annotation("Positive")).getSort())
            );
        }

        @Test
        @DisplayName("标记参数个数错误或不是常量")
        void testBadMarkers() {
            assertAll(
                    () -> assertThrows(UnsupportedTypeException.class,
                            () -> resolver.resolve(annotation("Annotated[int, Between(1)]"))),
                    () -> assertThrows(UnsupportedTypeException.class,
                            () -> resolver.resolve(annotation("Annotated[int, Gt(y)]"))),
                    () -> assertThrows(UnsupportedTypeException.class,
                            () -> resolver.resolve(annotation("Annotated[int]")))
            );
        }
    }

    @Test
    @DisplayName("细化展开为公式")
    void testRefinementExpansion() {
        TypeAnnotation type = TypeAnnotation.of(Sort.REAL, Refinement.between(0, new BigDecimal("2.5")));
        var x = org.symproof.expressions.Formulas.realVar("x");

        assertEquals(List.of(
                org.symproof.expressions.Formulas.ge(x, 0),
                org.symproof.expressions.Formulas.le(x, new BigDecimal("2.5"))), type.constraintsOn(x));
    }
}
