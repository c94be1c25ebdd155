package org.symproof.engine;

import lombok.Getter;

/**
 * 验证未通过时由 {@link VerificationEngine#verifyOrThrow} 抛出，携带证书。
 */
@Getter
public class VerificationException extends RuntimeException {

    private final ProofCertificate certificate;

    public VerificationException(ProofCertificate certificate) {
        super("Verification of '" + certificate.getFunctionName() + "' failed: " + certificate);
        this.certificate = certificate;
    }
}
