package org.symproof.translate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.symproof.contract.Contract;
import org.symproof.contract.ContractPredicate;
import org.symproof.core.Sort;
import org.symproof.expressions.terms.Application;
import org.symproof.expressions.terms.Conditional;
import org.symproof.expressions.terms.Term;
import org.symproof.expressions.terms.Variable;
import org.symproof.lang.ast.FunctionDef;
import org.symproof.lang.parser.Parser;
import org.symproof.lang.parser.SourceText;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.symproof.expressions.Formulas.*;

class TranslatorTest {

    private final Variable x = intVar("x");

    private static FunctionDef parse(String source) {
        return Parser.parseFunction(SourceText.canonicalize(source));
    }

    private TranslationResult translate(String source) {
        return translate(source, Map.of("x", x), Translator.DEFAULT_MAX_UNROLL);
    }

    private TranslationResult translate(String source, Map<String, ? extends Term> params, int maxUnroll) {
        return new Translator(Map.of(), Map.of(), maxUnroll).translate(parse(source), params);
    }

    private TranslationException translationError(String source) {
        return assertThrows(TranslationException.class, () -> translate(source));
    }

    @Nested
    @DisplayName("顺序语句与返回")
    class StraightLineTests {

        @Test
        @DisplayName("赋值在环境中传递")
        void testAssignments() {
            TranslationResult result = translate("""
                    def f(x):
                        y = x + 1
                        return y * 2
                    """);

            assertAll(
                    () -> assertEquals(mul(add(x, 1), 2), result.getReturnExpr().orElseThrow()),
                    () -> assertSame(TRUE, result.getReturnGuard()),
                    () -> assertTrue(result.getAssumptions().isEmpty())
            );
        }

        @Test
        @DisplayName("return 之后的语句不再翻译")
        void testDeadCodeAfterReturn() {
            TranslationResult result = translate("""
                    def f(x):
                        return x
                        y = undefined_name
                    """);

            assertEquals(x, result.getReturnExpr().orElseThrow());
        }

        @Test
        @DisplayName("外部常量与 assert")
        void testExternalsAndAssert() {
            Translator translator = new Translator(Map.of(), Map.of("LIMIT", num(10)), Translator.DEFAULT_MAX_UNROLL);
            TranslationResult result = translator.translate(parse("""
                    def f(x):
                        assert x > 0
                        return x + LIMIT
                    """), Map.of("x", x));

            assertAll(
                    () -> assertEquals(add(x, 10), result.getReturnExpr().orElseThrow()),
                    () -> assertEquals(List.of(gt(x, 0)), result.getAssumptions())
            );
        }

        @Test
        @DisplayName("文档字符串被忽略，没有 return 时返回值为空")
        void testNoReturn() {
            TranslationResult result = translate("""
                    def f(x):
                        \"\"\"Does nothing.\"\"\"
                        y = x
                    """);

            assertAll(
                    () -> assertFalse(result.hasReturn()),
                    () -> assertSame(FALSE, result.getReturnGuard()),
                    () -> assertEquals(x, result.getEnvironment().lookup("y"))
            );
        }

        @Test
        @DisplayName("元组打包、解包和下标")
        void testTuples() {
            TranslationResult unpacked = translate("""
                    def f(x):
                        a, b = x, x + 1
                        return b - a
                    """);
            TranslationResult indexed = translate("""
                    def f(x):
                        t = (x, x + 1)
                        return t[-1]
                    """);

            assertAll(
                    () -> assertEquals(sub(add(x, 1), x), unpacked.getReturnExpr().orElseThrow()),
                    () -> assertEquals(2, unpacked.getAssumptions().size()),
                    () -> assertEquals(add(x, 1), indexed.getReturnExpr().orElseThrow())
            );
        }

        @Test
        @DisplayName("海象运算符在条件中绑定变量")
        void testWalrus() {
            TranslationResult result = translate("""
                    def f(x):
                        if (y := x * 2) > 4:
                            return y
                        return 0
                    """);
            Term doubled = mul(x, 2);

            assertEquals(ite(gt(doubled, 4), doubled, num(0)), result.getReturnExpr().orElseThrow());
        }
    }

    @Nested
    @DisplayName("条件语句")
    class ConditionalTests {

        @Test
        @DisplayName("不含 return 的 if 合并为 phi 值")
        void testPhiMerge() {
            TranslationResult result = translate("""
                    def f(x):
                        if x > 0:
                            y = 1
                        else:
                            y = 2
                        return y
                    """);

            assertAll(
                    () -> assertInstanceOf(Conditional.class, result.getReturnExpr().orElseThrow()),
                    () -> assertEquals(ite(gt(x, 0), num(1), num(2)), result.getReturnExpr().orElseThrow()),
                    () -> assertTrue(result.getWarnings().isEmpty())
            );
        }

        @Test
        @DisplayName("提前返回：后续语句只在未返回的路径上生效")
        void testEarlyReturn() {
            TranslationResult result = translate("""
                    def f(x):
                        if x < 0:
                            return -x
                        return x
                    """);

            assertAll(
                    () -> assertEquals(ite(lt(x, 0), neg(x), x), result.getReturnExpr().orElseThrow()),
                    () -> assertSame(TRUE, result.getReturnGuard())
            );
        }

        @Test
        @DisplayName("只有一个分支返回时守卫为该分支条件")
        void testOneSidedReturn() {
            TranslationResult result = translate("""
                    def f(x):
                        if x > 0:
                            return 1
                    """);

            assertAll(
                    () -> assertEquals(gt(x, 0), result.getReturnGuard()),
                    () -> assertEquals(num(1), result.getReturnExpr().orElseThrow())
            );
        }

        @Test
        @DisplayName("只在一个分支绑定的变量产生警告")
        void testOneSidedBinding() {
            TranslationResult result = translate("""
                    def f(x):
                        if x > 0:
                            y = 1
                        return x
                    """);

            assertEquals(List.of("Variable 'y' is bound on only one branch of the conditional at line 2"),
                    result.getWarnings());
        }
    }

    @Nested
    @DisplayName("循环")
    class LoopTests {

        @Test
        @DisplayName("常量 for 循环被完全折叠")
        void testConstantSum() {
            TranslationResult result = translate("""
                    def f(x):
                        total = 0
                        for i in range(4):
                            total += i
                        return total
                    """);

            assertAll(
                    () -> assertEquals(num(6), result.getReturnExpr().orElseThrow()),
                    () -> assertEquals(num(3), result.getEnvironment().lookup("i"))
            );
        }

        @Test
        @DisplayName("range(0) 不改变环境，range 的步长可以为负")
        void testEmptyAndNegativeRanges() {
            TranslationResult empty = translate("""
                    def f(x):
                        for i in range(0):
                            x = 1
                        return x
                    """);
            TranslationResult countdown = translate("""
                    def f(x):
                        total = 0
                        for i in range(5, 0, -2):
                            total += i
                        return total
                    """);

            assertAll(
                    () -> assertEquals(x, empty.getReturnExpr().orElseThrow()),
                    () -> assertFalse(empty.getEnvironment().isBound("i")),
                    () -> assertEquals(num(9), countdown.getReturnExpr().orElseThrow())
            );
        }

        @Test
        @DisplayName("超过展开上限的 for 循环被拒绝")
        void testUnrollCeiling() {
            TranslationException e = translationError("""
                    def f(x):
                        for i in range(1000):
                            x += i
                        return x
                    """);

            assertAll(
                    () -> assertTrue(e.getMessage().contains("1000")),
                    () -> assertTrue(e.getMessage().contains("256")),
                    () -> assertEquals(2, e.getLine())
            );
        }

        @Test
        @DisplayName("循环中的有条件 return 不会停止展开")
        void testGatedReturnInLoop() {
            TranslationResult result = translate("""
                    def f(x):
                        for i in range(3):
                            if x == i:
                                return i
                        return -1
                    """);

            assertAll(
                    () -> assertSame(TRUE, result.getReturnGuard()),
                    () -> assertInstanceOf(Conditional.class, result.getReturnExpr().orElseThrow())
            );
        }

        @Test
        @DisplayName("结构上终止的 while 循环没有 caveat")
        void testTerminatingWhile() {
            TranslationResult result = translate("""
                    def f(x):
                        n = 3
                        while n > 0:
                            n -= 1
                        return n
                    """);

            assertAll(
                    () -> assertEquals(num(0), result.getReturnExpr().orElseThrow()),
                    () -> assertTrue(result.getCaveats().isEmpty())
            );
        }

        @Test
        @DisplayName("达到上限的 while 循环被假设终止并记录 caveat")
        void testSymbolicWhile() {
            TranslationResult result = translate("""
                    def f(x):
                        while x > 0:
                            x = x - 1
                        return x
                    """, Map.of("x", x), 3);

            assertAll(
                    () -> assertEquals(List.of("while-loop at line 2 assumed to terminate within 3 iterations"),
                            result.getCaveats()),
                    () -> assertEquals(1, result.getAssumptions().size())
            );
        }
    }

    @Nested
    @DisplayName("证明义务")
    class ObligationTests {

        @Test
        @DisplayName("除法产生除数非零的安全义务")
        void testDivisionSafety() {
            TranslationResult result = translate("""
                    def f(x):
                        return 10 / x
                    """);

            assertEquals(List.of(ne(x, 0)), result.getSafetyObligations());
        }

        @Test
        @DisplayName("路径条件已保证除数非零时义务消失")
        void testGuardedDivision() {
            TranslationResult result = translate("""
                    def f(x):
                        if x != 0:
                            return 1 / x
                        return 0
                    """);

            assertTrue(result.getSafetyObligations().isEmpty());
        }

        @Test
        @DisplayName("契约调用：前置条件为义务，后置条件为假设")
        void testContractCall() {
            Variable r = realVar("r");
            Contract half = Contract.of(
                    ContractPredicate.of(a -> ge(a, 0)),
                    ContractPredicate.of((Term a, Term res) -> eq(mul(res, 2), a)),
                    Sort.REAL);
            Translator translator = new Translator(Map.of("half", half), Map.of(), Translator.DEFAULT_MAX_UNROLL);
            TranslationResult result = translator.translate(parse("""
                    def f(r):
                        return half(r)
                    """), Map.of("r", r));

            assertAll(
                    () -> assertInstanceOf(Application.class, result.getReturnExpr().orElseThrow()),
                    () -> assertEquals(List.of(ge(r, 0)), result.getObligations()),
                    () -> assertEquals(1, result.getAssumptions().size())
            );
        }

        @Test
        @DisplayName("契约调用的实参个数必须匹配")
        void testContractArity() {
            Contract one = Contract.of(ContractPredicate.of(a -> ge(a, 0)), null, Sort.REAL);
            Translator translator = new Translator(Map.of("g", one), Map.of(), Translator.DEFAULT_MAX_UNROLL);

            TranslationException e = assertThrows(TranslationException.class,
                    () -> translator.translate(parse("def f(x):\n    return g(x, x)\n"), Map.of("x", x)));
            assertTrue(e.getMessage().contains("Function 'g' expects 1 argument(s), got 2"));
        }
    }

    @Nested
    @DisplayName("不支持的构造")
    class RejectionTests {

        @Test
        @DisplayName("错误消息指明不支持的构造")
        void testMessages() {
            assertAll(
                    () -> assertTrue(translationError("def f(x):\n    return\n").getMessage()
                            .contains("Bare return without a value is not supported")),
                    () -> assertTrue(translationError("def f(x):\n    return round(x, ndigits=2)\n").getMessage()
                            .contains("Keyword arguments are not supported in call to 'round'")),
                    () -> assertTrue(translationError("def f(x):\n    return foo(x)\n").getMessage()
                            .contains("Unknown function 'foo'")),
                    () -> assertTrue(translationError("def f(x):\n    a, b, c = x, x\n    return a\n").getMessage()
                            .contains("Cannot unpack 2 values into 3 targets")),
                    () -> assertTrue(translationError("def f(x):\n    return y\n").getMessage()
                            .contains("Undefined variable: y")),
                    () -> assertTrue(translationError("def f(x):\n    for i in xs:\n        pass\n    return x\n")
                            .getMessage().contains("Only 'for i in range(N)' loops are supported")),
                    () -> assertTrue(translationError("def f(x):\n    return ~x\n").getMessage()
                            .contains("Unsupported unary op: ~"))
            );
        }

        @Test
        @DisplayName("不支持的语句带行号")
        void testUnsupportedStatement() {
            TranslationException e = translationError("""
                    def f(x):
                        y = x
                        try:
                            y = 1
                        except Exception:
                            pass
                        return y
                    """);

            assertAll(
                    () -> assertEquals("Unsupported statement: 'try'", e.getMessage()),
                    () -> assertEquals(3, e.getLine()),
                    () -> assertEquals("Unsupported statement: 'try' (line 3)", e.describe())
            );
        }

        @Test
        @DisplayName("Real 操作数的整除与取模被拒绝")
        void testIntegerOnlyOperators() {
            Map<String, Term> realParam = Map.of("x", realVar("x"));

            assertAll(
                    () -> assertThrows(TranslationException.class,
                            () -> translate("def f(x):\n    return x // 2\n", realParam, 256)),
                    () -> assertThrows(TranslationException.class,
                            () -> translate("def f(x):\n    return x % 2\n", realParam, 256))
            );
        }

        @Test
        @DisplayName("async 函数和负的展开上限")
        void testAsyncAndInvalidCeiling() {
            assertAll(
                    () -> assertThrows(TranslationException.class,
                            () -> translate("async def f(x):\n    return x\n")),
                    () -> assertThrows(IllegalArgumentException.class,
                            () -> new Translator(Map.of(), Map.of(), -1))
            );
        }
    }
}
