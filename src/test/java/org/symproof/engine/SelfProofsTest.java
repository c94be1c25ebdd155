package org.symproof.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SelfProofsTest {

    @Test
    @DisplayName("内置的自证函数全部通过")
    void testAllVerified() {
        try (VerifierContext context = VerifierContext.defaults()) {
            Map<String, ProofCertificate> certificates = SelfProofs.verifyAll(new VerificationEngine(context));

            assertEquals(SelfProofs.functions().size(), certificates.size());
            assertAll(certificates.values().stream().map(cert ->
                    (Executable) () -> assertEquals(Status.VERIFIED, cert.getStatus(), cert::explain)));
        }
    }

    @Test
    @DisplayName("自证函数的名字取自源码")
    void testFunctionNames() {
        assertAll(
                () -> assertEquals("builtin_min", SelfProofs.functions().get(0).getName()),
                () -> assertTrue(SelfProofs.functions().stream().allMatch(VerifiableFunction::hasSource))
        );
    }
}
