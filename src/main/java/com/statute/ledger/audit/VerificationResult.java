package com.statute.ledger.audit;

import java.util.Optional;
import java.util.UUID;

/**
 * Outcome of walking a hash chain.
 *
 * @param valid             whether every record checked out
 * @param firstBrokenIndex  position of the first failing record, or -1 when valid
 * @param failure           which check failed first at that position, or null when valid
 * @param brokenRecordId    id of the first failing record, or null when valid
 * @param checkedRecords    number of records in the verified snapshot
 */
public record VerificationResult(
        boolean valid,
        int firstBrokenIndex,
        Failure failure,
        UUID brokenRecordId,
        int checkedRecords
) {

    public enum Failure {
        /** Stored record hash does not match the hash of the record's content. */
        HASH_MISMATCH,
        /** Stored previous hash does not match the preceding record's hash. */
        LINK_MISMATCH
    }

    public static VerificationResult intact(int checkedRecords) {
        return new VerificationResult(true, -1, null, null, checkedRecords);
    }

    public static VerificationResult broken(int index, Failure failure, UUID recordId, int checkedRecords) {
        return new VerificationResult(false, index, failure, recordId, checkedRecords);
    }

    public Optional<Integer> brokenIndex() {
        return valid ? Optional.empty() : Optional.of(firstBrokenIndex);
    }

    public String describe() {
        if (valid) {
            return "Hash chain intact (" + checkedRecords + " records)";
        }
        return "Hash chain broken at index " + firstBrokenIndex + " (" + failure + ", record " + brokenRecordId + ")";
    }
}
