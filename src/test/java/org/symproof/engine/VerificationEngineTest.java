package org.symproof.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.symproof.contract.Contract;
import org.symproof.contract.ContractPredicate;
import org.symproof.core.Counterexample;
import org.symproof.core.Sort;
import org.symproof.expressions.terms.Term;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.symproof.expressions.Formulas.*;

class VerificationEngineTest {

    private VerifierContext context;
    private VerificationEngine engine;

    private static final String CLAMP = """
            def clamp(x: float, lo: float, hi: float) -> float:
                if x < lo:
                    return lo
                if x > hi:
                    return hi
                return x
            """;

    private static final ContractPredicate CLAMP_PRE = ContractPredicate.of((x, lo, hi) -> le(lo, hi));
    private static final ContractPredicate CLAMP_POST =
            ContractPredicate.of((x, lo, hi, r) -> and(ge(r, lo), le(r, hi)));

    @BeforeEach
    void setUp() {
        context = VerifierContext.defaults();
        engine = new VerificationEngine(context);
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Nested
    @DisplayName("基本判定")
    class VerdictTests {

        @Test
        @DisplayName("clamp 的两种写法都能被证明")
        void testClamp() {
            ProofCertificate branching = engine.verify(VerifiableFunction.fromSource(CLAMP), CLAMP_PRE, CLAMP_POST);
            ProofCertificate builtin = engine.verify(VerifiableFunction.fromSource("""
                    def clamp(x: float, lo: float, hi: float) -> float:
                        return max(lo, min(x, hi))
                    """), CLAMP_PRE, CLAMP_POST);

            assertAll("both forms of clamp",
                    () -> assertEquals(Status.VERIFIED, branching.getStatus(), branching::explain),
                    () -> assertEquals(Status.VERIFIED, builtin.getStatus(), builtin::explain),
                    () -> assertEquals(java.util.List.of("lo <= hi"), branching.getPreconditions()),
                    () -> assertEquals(java.util.List.of("And(result >= lo, result <= hi)"), branching.getPostconditions()),
                    () -> assertTrue(branching.getSolverVersion().startsWith("z3-")),
                    () -> assertEquals("[Q.E.D.] clamp", branching.toString())
            );
        }

        @Test
        @DisplayName("错误的后置条件得到具体的反例")
        void testCounterexample() {
            ProofCertificate cert = engine.verify(VerifiableFunction.fromSource("""
                    def negate(x: int) -> int:
                        return -x
                    """), ContractPredicate.of(x -> gt(x, 0)), ContractPredicate.of((Term x, Term r) -> gt(r, 0)));
            Counterexample ce = cert.getCounterexample();

            assertAll("negate cannot stay positive",
                    () -> assertEquals(Status.COUNTEREXAMPLE, cert.getStatus()),
                    () -> assertNotNull(ce),
                    () -> assertTrue((Long) ce.getValue("x") > 0),
                    () -> assertTrue((Long) ce.getReturnValue() <= 0),
                    () -> assertTrue(cert.getMessage().startsWith("Counterexample: {'x': "))
            );
        }

        @Test
        @DisplayName("Real 参数的反例是有理数")
        void testRationalCounterexample() {
            ProofCertificate cert = engine.verify(VerifiableFunction.fromSource("""
                    def triple(x: float) -> float:
                        return 3 * x
                    """), null, ContractPredicate.of((Term x, Term r) -> ne(r, 1)));

            assertAll(
                    () -> assertEquals(Status.COUNTEREXAMPLE, cert.getStatus()),
                    () -> assertEquals(1.0 / 3, (Double) cert.getCounterexample().getValue("x"), 1e-9)
            );
        }

        @Test
        @DisplayName("同一个函数，正确的性质得到证明")
        void testIdentity() {
            VerifiableFunction identity = VerifiableFunction.fromSource("def identity(x: int) -> int:\n    return x\n");

            assertAll(
                    () -> assertTrue(engine.verify(identity, null,
                            ContractPredicate.of((Term x, Term r) -> eq(r, x))).isVerified()),
                    () -> assertEquals(Status.COUNTEREXAMPLE, engine.verify(identity, null,
                            ContractPredicate.of((Term x, Term r) -> gt(r, 0))).getStatus())
            );
        }

        @Test
        @DisplayName("注解的细化约束成为前提和目标")
        void testRefinedAnnotations() {
            ProofCertificate cert = engine.verify(VerifiableFunction.fromSource("""
                    def inc(x: Annotated[int, Ge(0)]) -> Annotated[int, Gt(0)]:
                        return x + 1
                    """), null, null);

            assertAll(
                    () -> assertEquals(Status.VERIFIED, cert.getStatus(), cert::explain),
                    () -> assertEquals(java.util.List.of("x >= 0"), cert.getPreconditions()),
                    () -> assertEquals(java.util.List.of("result > 0"), cert.getPostconditions())
            );
        }

        @Test
        @DisplayName("没有后置条件时跳过")
        void testNothingToProve() {
            ProofCertificate cert = engine.verify(VerifiableFunction.fromSource("def f(x):\n    return x\n"), null, null);

            assertAll(
                    () -> assertEquals(Status.SKIPPED, cert.getStatus()),
                    () -> assertEquals("No postcondition: nothing to prove", cert.getMessage())
            );
        }
    }

    @Nested
    @DisplayName("路径与安全性")
    class PathTests {

        @Test
        @DisplayName("不是每条路径都返回时得到反例")
        void testOneSidedReturn() {
            ProofCertificate cert = engine.verify(VerifiableFunction.fromSource("""
                    def pos(x: int) -> int:
                        if x > 0:
                            return x
                    """), null, ContractPredicate.of((Term x, Term r) -> ge(r, 0)));

            assertAll(
                    () -> assertEquals(Status.COUNTEREXAMPLE, cert.getStatus()),
                    () -> assertTrue((Long) cert.getCounterexample().getValue("x") <= 0),
                    () -> assertTrue(cert.getPostconditions().stream()
                            .anyMatch(p -> p.startsWith("returns on every path: "))),
                    () -> assertFalse(cert.getCounterexample().hasReturnValue()),
                    () -> assertTrue(cert.getMessage().endsWith("(no return on this path: 'returns on every path' violated)")),
                    () -> assertTrue(cert.toPrompt().contains("-> no return"))
            );
        }

        @Test
        @DisplayName("后置条件被违反时反例带有返回值")
        void testViolatedPostconditionKeepsReturn() {
            ProofCertificate cert = engine.verify(VerifiableFunction.fromSource("""
                    def pos(x: int) -> int:
                        if x > 0:
                            return x
                        return -1
                    """), null, ContractPredicate.of((Term x, Term r) -> ge(r, 0)));

            assertAll(
                    () -> assertEquals(Status.COUNTEREXAMPLE, cert.getStatus()),
                    () -> assertEquals(-1L, cert.getCounterexample().getReturnValue()),
                    () -> assertFalse(cert.getMessage().contains("no return"))
            );
        }

        @Test
        @DisplayName("除数可能为 0 不改变结论，记录为 caveat")
        void testDivisionSafety() {
            ProofCertificate cert = engine.verify(VerifiableFunction.fromSource("""
                    def inverse(x: float) -> float:
                        return 1 / x
                    """), null, ContractPredicate.of((Term x, Term r) -> TRUE));

            assertAll(
                    () -> assertEquals(Status.VERIFIED, cert.getStatus(), cert::explain),
                    () -> assertEquals(java.util.List.of("safety obligation may fail: x != 0.0"), cert.getCaveats()),
                    () -> assertTrue(cert.getPostconditions().stream().noneMatch(p -> p.startsWith("safety")))
            );
        }

        @Test
        @DisplayName("乘以零的除法仍满足后置条件")
        void testZeroTimesQuotient() {
            ProofCertificate cert = engine.verify(VerifiableFunction.fromSource("""
                    def f(a: float, b: float) -> float:
                        return 0 * (a / b)
                    """), null, ContractPredicate.of((Term a, Term b, Term r) -> eq(r, 0)));

            assertAll(
                    () -> assertEquals(Status.VERIFIED, cert.getStatus(), cert::explain),
                    () -> assertEquals(java.util.List.of("safety obligation may fail: b != 0.0"), cert.getCaveats())
            );
        }

        @Test
        @DisplayName("除数受条件保护时没有 caveat")
        void testGuardedDivision() {
            ProofCertificate cert = engine.verify(VerifiableFunction.fromSource("""
                    def inverse(x: float) -> float:
                        if x != 0:
                            return 1 / x
                        return 0.0
                    """), null, ContractPredicate.of((Term x, Term r) -> TRUE));

            assertAll(
                    () -> assertEquals(Status.VERIFIED, cert.getStatus(), cert::explain),
                    () -> assertTrue(cert.getCaveats().isEmpty())
            );
        }

        @Test
        @DisplayName("循环中的提前返回")
        void testFirstAbove() {
            ProofCertificate cert = engine.verify(VerifiableFunction.fromSource("""
                    def first_above(x: int) -> int:
                        for i in range(5):
                            if i > x:
                                return i
                        return 5
                    """), null, ContractPredicate.of((Term x, Term r) ->
                    and(ge(r, 0), le(r, 5), or(gt(r, x), eq(r, 5)))));

            assertEquals(Status.VERIFIED, cert.getStatus(), cert::explain);
        }

        @Test
        @DisplayName("while 循环在展开上限内终止时带 caveat 通过")
        void testCountdown() {
            VerificationEngine shallow = new VerificationEngine(VerifierContext.builder().maxUnroll(20).build());
            ProofCertificate cert = shallow.verify(VerifiableFunction.fromSource("""
                    def countdown(n: int) -> int:
                        while n > 0:
                            n = n - 1
                        return n
                    """), ContractPredicate.of(n -> and(ge(n, 0), le(n, 10))),
                    ContractPredicate.of((Term n, Term r) -> eq(r, 0)));

            assertAll(
                    () -> assertEquals(Status.VERIFIED, cert.getStatus(), cert::explain),
                    () -> assertEquals(java.util.List.of("while-loop at line 2 assumed to terminate within 20 iterations"),
                            cert.getCaveats())
            );
        }
    }

    @Nested
    @DisplayName("翻译错误与跳过")
    class ErrorTests {

        @Test
        @DisplayName("超过展开上限的 for 循环")
        void testUnrollCeiling() {
            ProofCertificate cert = engine.verify(VerifiableFunction.fromSource("""
                    def big(x: int) -> int:
                        for i in range(1000):
                            x = x + 1
                        return x
                    """), null, ContractPredicate.of((Term x, Term r) -> ge(r, x)));

            assertAll(
                    () -> assertEquals(Status.TRANSLATION_ERROR, cert.getStatus()),
                    () -> assertTrue(cert.getMessage().contains("256")),
                    () -> assertTrue(cert.getMessage().endsWith("(line 2)"))
            );
        }

        @Test
        @DisplayName("后置条件没有返回公式")
        void testNonFormulaPostcondition() {
            ProofCertificate cert = engine.verify(VerifiableFunction.fromSource("def f(x):\n    return x\n"),
                    null, ContractPredicate.of((Term x, Term r) -> add(r, 1)));

            assertAll(
                    () -> assertEquals(Status.TRANSLATION_ERROR, cert.getStatus()),
                    () -> assertTrue(cert.getMessage().contains("expected a formula"))
            );
        }

        @Test
        @DisplayName("抛出异常的谓词是翻译错误")
        void testThrowingPredicates() {
            VerifiableFunction identity = VerifiableFunction.fromSource("def identity(x: int) -> int:\n    return x\n");
            ContractPredicate boom = ContractPredicate.of(x -> {
                throw new IllegalStateException("boom");
            });
            ProofCertificate badPre = engine.verify(identity, boom, ContractPredicate.of((Term x, Term r) -> eq(r, x)));
            ProofCertificate badPost = engine.verify(identity, null, ContractPredicate.of((Term x, Term r) -> {
                throw new IllegalStateException("bang");
            }));

            assertAll(
                    () -> assertEquals(Status.TRANSLATION_ERROR, badPre.getStatus()),
                    () -> assertEquals("Precondition error: boom", badPre.getMessage()),
                    () -> assertEquals(Status.TRANSLATION_ERROR, badPost.getStatus()),
                    () -> assertEquals("Postcondition error: bang", badPost.getMessage())
            );
        }

        @Test
        @DisplayName("契约元数与函数参数个数不符")
        void testArityMismatch() {
            ProofCertificate cert = engine.verify(VerifiableFunction.fromSource("def f(x):\n    return x\n"),
                    ContractPredicate.of((Term a, Term b) -> le(a, b)), null);

            assertAll(
                    () -> assertEquals(Status.TRANSLATION_ERROR, cert.getStatus()),
                    () -> assertEquals("pre contract for 'f' takes 2 argument(s), expected 1", cert.getMessage())
            );
        }

        @Test
        @DisplayName("语法错误、async 与无源码的函数")
        void testUnverifiableFunctions() {
            ProofCertificate syntax = engine.verify(VerifiableFunction.fromSource("def f(x)\n    return x\n"), null, null);
            ProofCertificate async = engine.verify(VerifiableFunction.fromSource("async def f(x):\n    return x\n"), null,
                    ContractPredicate.of((Term x, Term r) -> eq(r, x)));
            ProofCertificate opaque = engine.verify(VerifiableFunction.opaque("sqrt", "built-in"), null, null);

            assertAll(
                    () -> assertEquals(Status.TRANSLATION_ERROR, syntax.getStatus()),
                    () -> assertTrue(syntax.getMessage().startsWith("Syntax error: ")),
                    () -> assertEquals(Status.SKIPPED, async.getStatus()),
                    () -> assertEquals(Status.SKIPPED, opaque.getStatus()),
                    () -> assertEquals("Cannot get source: built-in", opaque.getMessage()),
                    () -> assertEquals("", opaque.getSourceHash())
            );
        }

        @Test
        @DisplayName("生成器实参给出具体的不支持原因")
        void testGeneratorArgument() {
            ProofCertificate cert = engine.verify(VerifiableFunction.fromSource("""
                    def total(x: int) -> int:
                        return sum(i for i in range(x))
                    """), null, ContractPredicate.of((Term x, Term r) -> ge(r, 0)));

            assertAll(
                    () -> assertEquals(Status.TRANSLATION_ERROR, cert.getStatus()),
                    () -> assertEquals("Unsupported expression: generator expression (line 2)", cert.getMessage())
            );
        }

        @Test
        @DisplayName("缩进的嵌套函数源码可以验证")
        void testIndentedSource() {
            ProofCertificate cert = engine.verify(
                    VerifiableFunction.fromSource("    def inc(x: int) -> int:\n        return x + 1\n"),
                    null, ContractPredicate.of((Term x, Term r) -> gt(r, x)));

            assertEquals(Status.VERIFIED, cert.getStatus(), cert::explain);
        }

        @Test
        @DisplayName("可变参数不支持")
        void testVariadic() {
            ProofCertificate cert = engine.verify(VerifiableFunction.fromSource("def f(*xs):\n    return 0\n"), null, null);

            assertAll(
                    () -> assertEquals(Status.TRANSLATION_ERROR, cert.getStatus()),
                    () -> assertEquals("Variadic parameter '*xs' is not supported", cert.getMessage())
            );
        }

        @Test
        @DisplayName("verifyOrThrow 在未通过时抛出")
        void testVerifyOrThrow() {
            VerifiableFunction identity = VerifiableFunction.fromSource("def identity(x: int) -> int:\n    return x\n");

            VerificationException e = assertThrows(VerificationException.class, () -> engine.verifyOrThrow(identity,
                    null, ContractPredicate.of((Term x, Term r) -> gt(r, x))));
            assertAll(
                    () -> assertEquals(Status.COUNTEREXAMPLE, e.getCertificate().getStatus()),
                    () -> assertTrue(e.getMessage().startsWith("Verification of 'identity' failed: ")),
                    () -> assertTrue(engine.verifyOrThrow(identity, null,
                            ContractPredicate.of((Term x, Term r) -> eq(r, x))).isVerified())
            );
        }
    }

    @Nested
    @DisplayName("组合与外部常量")
    class CompositionTests {

        private final Contract safeHalf = Contract.of(
                ContractPredicate.of(a -> ge(a, 0)),
                ContractPredicate.of((Term a, Term r) -> and(ge(r, 0), le(r, a))),
                Sort.REAL);

        private final VerifiableFunction quarter = VerifiableFunction.fromSource("""
                def quarter(x: float) -> float:
                    return safe_half(safe_half(x))
                """);

        @Test
        @DisplayName("通过契约调用已验证的函数")
        void testContractComposition() {
            ProofCertificate cert = engine.verify(quarter, ContractPredicate.of(x -> ge(x, 0)),
                    ContractPredicate.of((Term x, Term r) -> and(ge(r, 0), le(r, x))), Map.of("safe_half", safeHalf));

            assertEquals(Status.VERIFIED, cert.getStatus(), cert::explain);
        }

        @Test
        @DisplayName("调用点不满足被调函数的前置条件")
        void testCalleePreconditionViolated() {
            ProofCertificate cert = engine.verify(quarter, null,
                    ContractPredicate.of((Term x, Term r) -> TRUE), Map.of("safe_half", safeHalf));

            assertAll(
                    () -> assertEquals(Status.COUNTEREXAMPLE, cert.getStatus()),
                    () -> assertTrue((Double) cert.getCounterexample().getValue("x") < 0),
                    () -> assertTrue(cert.getPostconditions().stream().anyMatch(p -> p.startsWith("obligation: ")))
            );
        }

        @Test
        @DisplayName("变元谓词作用于全部参数与返回值")
        void testVariadicPredicates() {
            VerifiableFunction sum = VerifiableFunction.fromSource("""
                    def total(a: int, b: int) -> int:
                        return a + b
                    """);
            ContractPredicate allNonNegative = ContractPredicate.variadic(args -> and(
                    args.stream().map(a -> ge(a, 0)).toArray(Term[]::new)));
            ContractPredicate resultBelowSum = ContractPredicate.variadic(args ->
                    le(args.get(args.size() - 1), add(args.get(0), args.get(1))));

            ProofCertificate cert = engine.verify(sum, allNonNegative, resultBelowSum);

            assertAll(
                    () -> assertEquals(Status.VERIFIED, cert.getStatus(), cert::explain),
                    () -> assertEquals(java.util.List.of("And(a >= 0, b >= 0)"), cert.getPreconditions())
            );
        }

        @Test
        @DisplayName("不同的变元契约不共用缓存项")
        void testVariadicContractsSeparateCache() {
            VerifiableFunction caller = VerifiableFunction.fromSource("""
                    def h(x: float) -> float:
                        return g(x)
                    """);
            ContractPredicate nonNegative = ContractPredicate.of((Term x, Term r) -> ge(r, 0));
            Contract lastNonNegative = Contract.of(null,
                    ContractPredicate.variadic(args -> ge(args.get(args.size() - 1), 0)), Sort.REAL);
            Contract lastNegative = Contract.of(null,
                    ContractPredicate.variadic(args -> lt(args.get(args.size() - 1), 0)), Sort.REAL);

            ProofCertificate proved = engine.verify(caller, null, nonNegative, Map.of("g", lastNonNegative));
            ProofCertificate refuted = engine.verify(caller, null, nonNegative, Map.of("g", lastNegative));

            assertAll(
                    () -> assertEquals(Status.VERIFIED, proved.getStatus(), proved::explain),
                    () -> assertEquals(Status.COUNTEREXAMPLE, refuted.getStatus(), refuted::explain),
                    () -> assertNotSame(proved, refuted),
                    () -> assertEquals(2, context.getMemoryCache().size())
            );
        }

        @Test
        @DisplayName("没有契约的调用是翻译错误")
        void testMissingContract() {
            ProofCertificate cert = engine.verify(quarter, ContractPredicate.of(x -> ge(x, 0)),
                    ContractPredicate.of((Term x, Term r) -> le(r, x)));

            assertAll(
                    () -> assertEquals(Status.TRANSLATION_ERROR, cert.getStatus()),
                    () -> assertTrue(cert.getMessage().contains("Unknown function 'safe_half'"))
            );
        }

        @Test
        @DisplayName("模块常量与闭包常量，闭包优先")
        void testExternalConstants() {
            VerifiableFunction cap = VerifiableFunction.fromSource("""
                    def cap(x: int) -> int:
                        return min(x, LIMIT)
                    """);
            ContractPredicate atMostTen = ContractPredicate.of((Term x, Term r) -> le(r, 10));

            assertAll(
                    () -> assertEquals(Status.VERIFIED,
                            engine.verify(cap.withGlobal("LIMIT", 10), null, atMostTen).getStatus()),
                    () -> assertEquals(Status.VERIFIED,
                            engine.verify(cap.withGlobal("LIMIT", 100).withClosure("LIMIT", 10), null, atMostTen).getStatus()),
                    () -> assertEquals(Status.COUNTEREXAMPLE,
                            engine.verify(cap.withGlobal("LIMIT", 100), null, atMostTen).getStatus()),
                    () -> assertTrue(engine.verify(cap, null, atMostTen).getMessage()
                            .contains("Undefined variable: LIMIT"))
            );
        }
    }

    @Nested
    @DisplayName("缓存")
    class CacheTests {

        @Test
        @DisplayName("相同的请求命中内存缓存，清空后重新求解")
        void testMemoryCache() {
            VerifiableFunction clamp = VerifiableFunction.fromSource(CLAMP);
            ProofCertificate first = engine.verify(clamp, CLAMP_PRE, CLAMP_POST);
            ProofCertificate second = engine.verify(VerifiableFunction.fromSource(CLAMP),
                    ContractPredicate.of((x, lo, hi) -> le(lo, hi)),
                    ContractPredicate.of((x, lo, hi, r) -> and(ge(r, lo), le(r, hi))));

            engine.clearCache();
            ProofCertificate third = engine.verify(clamp, CLAMP_PRE, CLAMP_POST);

            assertAll(
                    () -> assertSame(first, second),
                    () -> assertNotSame(first, third),
                    () -> assertEquals(first.getStatus(), third.getStatus())
            );
        }

        @Test
        @DisplayName("不同的后置条件不共用缓存项")
        void testDistinctKeys() {
            VerifiableFunction identity = VerifiableFunction.fromSource("def identity(x: int) -> int:\n    return x\n");
            ProofCertificate proved = engine.verify(identity, null, ContractPredicate.of((Term x, Term r) -> eq(r, x)));
            ProofCertificate refuted = engine.verify(identity, null, ContractPredicate.of((Term x, Term r) -> ne(r, x)));

            assertAll(
                    () -> assertEquals(Status.VERIFIED, proved.getStatus()),
                    () -> assertEquals(Status.COUNTEREXAMPLE, refuted.getStatus()),
                    () -> assertEquals(2, context.getMemoryCache().size())
            );
        }

        @Test
        @DisplayName("持久缓存跨上下文复用证书")
        void testDiskCache(@TempDir Path directory) throws IOException {
            VerifiableFunction clamp = VerifiableFunction.fromSource(CLAMP);
            ProofCertificate first;
            try (VerifierContext writer = VerifierContext.builder().cacheDirectory(directory).build()) {
                first = new VerificationEngine(writer).verify(clamp, CLAMP_PRE, CLAMP_POST);
            }
            long files;
            try (Stream<Path> listing = Files.list(directory)) {
                files = listing.filter(p -> p.toString().endsWith(".json")).count();
            }
            ProofCertificate second;
            try (VerifierContext reader = VerifierContext.builder().cacheDirectory(directory).build()) {
                second = new VerificationEngine(reader).verify(clamp, CLAMP_PRE, CLAMP_POST);
            }

            assertAll(
                    () -> assertEquals(1, files),
                    () -> assertNotSame(first, second),
                    () -> assertEquals(first, second)
            );
        }
    }
}
