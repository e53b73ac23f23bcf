package com.statute.ledger.registry;

/**
 * Thrown when a statute id is registered twice and the registry's {@link DuplicatePolicy} does not allow it.
 */
public class DuplicateStatuteException extends RuntimeException {

    private final String statuteId;

    public DuplicateStatuteException(String statuteId, String message) {
        super(message);
        this.statuteId = statuteId;
    }

    public String getStatuteId() {
        return statuteId;
    }
}
