package org.symproof.lang.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.symproof.lang.ast.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParserTest {

    private static FunctionDef parse(String source) {
        return Parser.parseFunction(SourceText.canonicalize(source));
    }

    private static Expr returnValue(FunctionDef f, int index) {
        return ((Return) f.getBody().get(index)).getValue();
    }

    @Nested
    @DisplayName("函数头")
    class HeaderTests {

        @Test
        @DisplayName("解析名字、带注解的参数和返回注解")
        void testSignature() {
            FunctionDef f = parse("""
                    def clamp(x: int, lo: int = 0, *rest, **opts) -> int:
                        return x
                    """);
            List<Param> params = f.getParams();

            assertAll("signature of clamp",
                    () -> assertEquals("clamp", f.getName()),
                    () -> assertEquals(4, params.size()),
                    () -> assertEquals(Param.Kind.POSITIONAL, params.get(0).getKind()),
                    () -> assertInstanceOf(Name.class, params.get(0).getAnnotation()),
                    () -> assertNotNull(params.get(1).getDefaultValue()),
                    () -> assertEquals(Param.Kind.VAR_POSITIONAL, params.get(2).getKind()),
                    () -> assertEquals(Param.Kind.VAR_KEYWORD, params.get(3).getKind()),
                    () -> assertEquals("int", ((Name) f.getReturns()).getId()),
                    () -> assertFalse(f.isAsync())
            );
        }

        @Test
        @DisplayName("装饰器被跳过，async 被记录")
        void testDecoratorsAndAsync() {
            FunctionDef f = parse("""
                    @cached
                    @other(1)
                    async def fetch(x):
                        return x
                    """);

            assertAll(
                    () -> assertEquals("fetch", f.getName()),
                    () -> assertTrue(f.isAsync()),
                    () -> assertEquals(3, f.getLine())
            );
        }

        @Test
        @DisplayName("公共缩进被去除")
        void testIndentedSource() {
            String source = "    def f(x):\n        return x + 1\n";
            assertEquals("f", parse(source).getName());
        }

        @Test
        @DisplayName("规范形式忽略空行的缩进与行尾换行")
        void testCanonicalForm() {
            String nested = "\r\n        def inc(x: int) -> int:\r\n\r\n            y = x  \r\n            return y + 1\r\n    ";

            assertAll(
                    () -> assertEquals("def inc(x: int) -> int:\n\n    y = x\n    return y + 1\n",
                            SourceText.canonicalize(nested)),
                    () -> assertEquals(SourceText.canonicalize("def inc(x: int) -> int:\n\n    y = x\n    return y + 1"),
                            SourceText.canonicalize(nested)),
                    () -> assertEquals(3, parse(nested).getBody().get(0).getLine())
            );
        }
    }

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("elif 变为嵌套在 else 中的 If")
        void testElif() {
            FunctionDef f = parse("""
                    def sign(x):
                        if x > 0:
                            return 1
                        elif x < 0:
                            return -1
                        else:
                            return 0
                    """);
            If outer = (If) f.getBody().get(0);

            assertAll(
                    () -> assertEquals(1, outer.getOrelse().size()),
                    () -> assertInstanceOf(If.class, outer.getOrelse().get(0)),
                    () -> assertEquals(1, ((If) outer.getOrelse().get(0)).getOrelse().size()),
                    () -> assertEquals(2, outer.getLine())
            );
        }

        @Test
        @DisplayName("for/while 循环及其 else 子句")
        void testLoops() {
            FunctionDef f = parse("""
                    def loops(n):
                        total = 0
                        for i in range(10):
                            total += i
                        else:
                            pass
                        while n > 0:
                            n -= 1
                        return total
                    """);
            For loop = (For) f.getBody().get(1);
            While whileLoop = (While) f.getBody().get(2);

            assertAll(
                    () -> assertEquals("i", ((Name) loop.getTarget()).getId()),
                    () -> assertInstanceOf(Call.class, loop.getIterable()),
                    () -> assertInstanceOf(AugAssign.class, loop.getBody().get(0)),
                    () -> assertEquals(1, loop.getOrelse().size()),
                    () -> assertInstanceOf(Compare.class, whileLoop.getTest()),
                    () -> assertTrue(whileLoop.getOrelse().isEmpty())
            );
        }

        @Test
        @DisplayName("元组解包赋值与带注解赋值")
        void testAssignments() {
            FunctionDef f = parse("""
                    def swap(a, b):
                        a, b = b, a
                        c: float = a
                        return c
                    """);
            Assign assign = (Assign) f.getBody().get(0);

            assertAll(
                    () -> assertEquals(1, assign.getTargets().size()),
                    () -> assertInstanceOf(TupleExpr.class, assign.getTargets().get(0)),
                    () -> assertInstanceOf(TupleExpr.class, assign.getValue()),
                    () -> assertInstanceOf(AnnAssign.class, f.getBody().get(1))
            );
        }

        @Test
        @DisplayName("子集外的语句被解析为 UnsupportedStmt")
        void testUnsupportedStatements() {
            FunctionDef f = parse("""
                    def risky(x):
                        try:
                            y = 1 / x
                        except ZeroDivisionError:
                            y = 0
                        with open(x) as fh:
                            pass
                        raise ValueError(x)
                    """);

            assertAll(
                    () -> assertEquals(3, f.getBody().size()),
                    () -> assertEquals("try", ((UnsupportedStmt) f.getBody().get(0)).getKeyword()),
                    () -> assertEquals("with", ((UnsupportedStmt) f.getBody().get(1)).getKeyword()),
                    () -> assertEquals("raise", ((UnsupportedStmt) f.getBody().get(2)).getKeyword())
            );
        }

        @Test
        @DisplayName("裸 return 的值为 null")
        void testBareReturn() {
            assertNull(returnValue(parse("def f():\n    return\n"), 0));
        }
    }

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("一元负号的优先级低于 **")
        void testPowerPrecedence() {
            Expr e = returnValue(parse("def f(x):\n    return -x ** 2\n"), 0);

            assertInstanceOf(UnaryOp.class, e);
            UnaryOp neg = (UnaryOp) e;
            assertAll(
                    () -> assertEquals(UnaryOperator.NEG, neg.getOperator()),
                    () -> assertInstanceOf(BinaryOp.class, neg.getOperand()),
                    () -> assertEquals(BinaryOperator.POW, ((BinaryOp) neg.getOperand()).getOperator())
            );
        }

        @Test
        @DisplayName("乘法优先于加法，左结合")
        void testArithmeticPrecedence() {
            BinaryOp e = (BinaryOp) returnValue(parse("def f(a, b, c):\n    return a - b * c - 1\n"), 0);

            assertAll(
                    () -> assertEquals(BinaryOperator.SUB, e.getOperator()),
                    () -> assertInstanceOf(BinaryOp.class, e.getLeft()),
                    () -> assertEquals(BinaryOperator.MUL,
                            ((BinaryOp) ((BinaryOp) e.getLeft()).getRight()).getOperator())
            );
        }

        @Test
        @DisplayName("链式比较保存所有运算符")
        void testChainedComparison() {
            Compare c = (Compare) returnValue(parse("def f(a, x, b):\n    return a <= x < b\n"), 0);

            assertAll(
                    () -> assertEquals(List.of(CompareOperator.LE, CompareOperator.LT), c.getOperators()),
                    () -> assertEquals(2, c.getComparators().size())
            );
        }

        @Test
        @DisplayName("数字字面量：整数、浮点和十六进制")
        void testNumbers() {
            FunctionDef f = parse("""
                    def f():
                        a = 1_000
                        b = 2.5
                        c = 0xff
                        return a
                    """);
            NumberLiteral a = (NumberLiteral) ((Assign) f.getBody().get(0)).getValue();
            NumberLiteral b = (NumberLiteral) ((Assign) f.getBody().get(1)).getValue();
            NumberLiteral c = (NumberLiteral) ((Assign) f.getBody().get(2)).getValue();

            assertAll(
                    () -> assertEquals("1000", a.getValue().toString()),
                    () -> assertFalse(a.isFloating()),
                    () -> assertEquals("5/2", b.getValue().toString()),
                    () -> assertTrue(b.isFloating()),
                    () -> assertEquals("255", c.getValue().toString())
            );
        }

        @Test
        @DisplayName("条件表达式、海象运算符和关键字参数")
        void testMiscExpressions() {
            FunctionDef f = parse("""
                    def f(x):
                        if (y := x + 1) > 0:
                            return y if y > 2 else round(y, ndigits=2)
                        return 0
                    """);
            If stmt = (If) f.getBody().get(0);
            Compare test = (Compare) stmt.getTest();
            IfExp ifExp = (IfExp) ((Return) stmt.getBody().get(0)).getValue();
            Call call = (Call) ifExp.getOrelse();

            assertAll(
                    () -> assertInstanceOf(NamedExpr.class, test.getLeft()),
                    () -> assertEquals("y", ((NamedExpr) test.getLeft()).getTarget()),
                    () -> assertEquals(1, call.getArguments().size()),
                    () -> assertEquals("ndigits", call.getKeywords().get(0).getName())
            );
        }

        @Test
        @DisplayName("切片、推导式和 lambda 被解析为 UnsupportedExpr")
        void testUnsupportedExpressions() {
            FunctionDef f = parse("""
                    def f(xs):
                        a = xs[1:2]
                        b = [x for x in xs]
                        c = lambda y: y
                        return sum(x for x in xs)
                    """);

            assertAll(
                    () -> assertEquals("slice",
                            ((UnsupportedExpr) ((Subscript) ((Assign) f.getBody().get(0)).getValue()).getIndex()).getKind()),
                    () -> assertEquals("list comprehension",
                            ((UnsupportedExpr) ((Assign) f.getBody().get(1)).getValue()).getKind()),
                    () -> assertEquals("lambda",
                            ((UnsupportedExpr) ((Assign) f.getBody().get(2)).getValue()).getKind()),
                    () -> assertEquals("generator expression",
                            ((UnsupportedExpr) ((Call) returnValue(f, 3)).getArguments().get(0)).getKind())
            );
        }
    }

    @Nested
    @DisplayName("名字收集")
    class ReferencedNamesTests {

        @Test
        @DisplayName("记录按名字调用的函数在各调用点的实参个数")
        void testCallArities() {
            FunctionDef f = parse("""
                    def f(x, y):
                        if g(x) > g(x, y):
                            return math.sqrt(h())
                        return g(x)
                    """);

            assertAll(
                    () -> assertEquals(List.of(1, 2), List.copyOf(ReferencedNames.callArities(f).get("g"))),
                    () -> assertEquals(List.of(0), List.copyOf(ReferencedNames.callArities(f).get("h"))),
                    () -> assertFalse(ReferencedNames.callArities(f).containsKey("math.sqrt")),
                    () -> assertTrue(ReferencedNames.of(f).containsAll(List.of("g", "x", "y", "h", "math")))
            );
        }
    }

    @Nested
    @DisplayName("语法错误")
    class ErrorTests {

        @Test
        @DisplayName("不是函数定义")
        void testNotAFunction() {
            SourceSyntaxException e = assertThrows(SourceSyntaxException.class, () -> parse("x = 1\n"));
            assertAll(
                    () -> assertTrue(e.getMessage().contains("Expected a function definition")),
                    () -> assertEquals(1, e.getLine())
            );
        }

        @Test
        @DisplayName("函数定义后还有内容")
        void testTrailingContent() {
            SourceSyntaxException e = assertThrows(SourceSyntaxException.class,
                    () -> parse("def f(x):\n    return x\nprint(1)\n"));
            assertAll(
                    () -> assertTrue(e.getMessage().contains("Unexpected content after the function definition")),
                    () -> assertEquals(3, e.getLine())
            );
        }

        @Test
        @DisplayName("缺少冒号和未闭合的字符串")
        void testMalformed() {
            assertAll(
                    () -> assertThrows(SourceSyntaxException.class, () -> parse("def f(x)\n    return x\n")),
                    () -> assertThrows(SourceSyntaxException.class, () -> parse("def f(x):\n    return 'abc\n"))
            );
        }
    }
}
