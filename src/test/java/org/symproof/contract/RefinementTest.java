package org.symproof.contract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.symproof.core.Sort;
import org.symproof.expressions.terms.Term;
import org.symproof.expressions.terms.Variable;
import org.symproof.translate.TranslationException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.symproof.expressions.Formulas.*;

class RefinementTest {

    private final Variable x = intVar("x");

    @Test
    @DisplayName("比较类细化展开为单个公式")
    void testSimpleRefinements() {
        assertAll(
                () -> assertEquals(List.of(gt(x, 0)), Refinement.gt(0).expand(x)),
                () -> assertEquals(List.of(ne(x, 3)), Refinement.notEq(3).expand(x)),
                () -> assertEquals(List.of(ge(x, 1), le(x, 9)), Refinement.between(1, 9).expand(x))
        );
    }

    @Test
    @DisplayName("描述相同的细化相等")
    void testEquality() {
        assertAll(
                () -> assertEquals(Refinement.gt(0), Refinement.gt(0)),
                () -> assertNotEquals(Refinement.gt(0), Refinement.ge(0)),
                () -> assertEquals("Lt(5)", Refinement.lt(5).toString())
        );
    }

    @Test
    @DisplayName("谓词没有返回公式时抛出 TranslationException")
    void testNonFormulaPredicate() {
        Refinement bad = Refinement.predicate("Double", v -> add(v, v));

        TranslationException e = assertThrows(TranslationException.class, () -> bad.expand(x));
        assertTrue(e.getMessage().contains("Refinement Double did not produce a formula"));
    }

    @Test
    @DisplayName("契约的元数与指纹")
    void testContractFingerprint() {
        Contract contract = Contract.of(
                org.symproof.contract.ContractPredicate.of(a -> ge(a, 0)),
                org.symproof.contract.ContractPredicate.of((Term a, Term r) -> le(r, a)),
                Sort.REAL);

        assertAll(
                () -> assertEquals(1, contract.declaredArity()),
                () -> assertEquals(List.of(Sort.REAL), contract.parameterSortsFor(1)),
                () -> assertEquals("[Real]->Real|pre:$0 >= 0.0|post:$r <= $0", contract.fingerprint()),
                () -> assertThrows(IllegalArgumentException.class,
                        () -> Contract.of(null, null, Sort.BOOL))
        );
    }

    @Test
    @DisplayName("变元契约按调用点元数计算指纹")
    void testVariadicContractFingerprint() {
        Contract nonNegative = Contract.of(null,
                ContractPredicate.variadic(args -> ge(args.get(args.size() - 1), 0)), Sort.REAL);
        Contract negative = Contract.of(null,
                ContractPredicate.variadic(args -> lt(args.get(args.size() - 1), 0)), Sort.REAL);

        assertAll(
                () -> assertEquals(ContractPredicate.VARIADIC, nonNegative.declaredArity()),
                () -> assertEquals("variadic{1:[Real]->Real|pre:-|post:$r >= 0.0}",
                        nonNegative.fingerprint(List.of(1))),
                () -> assertEquals("variadic{1:[Real]->Real|pre:-|post:$r < 0.0}",
                        negative.fingerprint(List.of(1))),
                () -> assertNotEquals(nonNegative.fingerprint(), negative.fingerprint()),
                () -> assertNotEquals(nonNegative.fingerprint(List.of(1)), nonNegative.fingerprint(List.of(1, 2)))
        );
    }
}
