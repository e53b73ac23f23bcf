package com.statute.ledger.audit;

/**
 * Thrown when a hash chain fails verification. Never retried: the chain is evidence and a
 * broken one needs external investigation.
 */
public class ChainIntegrityException extends RuntimeException {

    private final VerificationResult verification;

    public ChainIntegrityException(VerificationResult verification) {
        super(verification.describe());
        this.verification = verification;
    }

    public VerificationResult getVerification() {
        return verification;
    }
}
