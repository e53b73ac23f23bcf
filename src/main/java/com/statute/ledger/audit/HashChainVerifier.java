package com.statute.ledger.audit;

import java.util.List;
import java.util.Objects;

/**
 * Replays a sequence of audit records and reports the first position where the content hash
 * or the link to the predecessor does not hold. Stateless; works on any snapshot.
 */
public final class HashChainVerifier {

    private HashChainVerifier() {}

    public static VerificationResult verify(List<AuditRecord> records) {
        String expectedPrevious = null;
        for (int i = 0; i < records.size(); i++) {
            AuditRecord record = records.get(i);
            if (!record.recordHash().equals(CanonicalPayload.hash(record))) {
                return VerificationResult.broken(i, VerificationResult.Failure.HASH_MISMATCH, record.id(), records.size());
            }
            if (!Objects.equals(record.previousHash(), expectedPrevious)) {
                return VerificationResult.broken(i, VerificationResult.Failure.LINK_MISMATCH, record.id(), records.size());
            }
            expectedPrevious = record.recordHash();
        }
        return VerificationResult.intact(records.size());
    }
}
