package com.statute.ledger.core.model;

/**
 * A problem found by {@link Statute#validate()}.
 */
public record ValidationIssue(Code code, String message) {

    public enum Code {
        INVALID_ID,
        EXPIRY_BEFORE_EFFECTIVE,
        EMPTY_EFFECT_DESCRIPTION
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
