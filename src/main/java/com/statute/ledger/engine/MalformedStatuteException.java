package com.statute.ledger.engine;

/**
 * Thrown when a statute cannot be evaluated as configured: it has no preconditions and no
 * discretion text, so neither "always applies" nor "needs a human" can be assumed.
 */
public class MalformedStatuteException extends RuntimeException {

    private final String statuteId;

    public MalformedStatuteException(String statuteId, String message) {
        super(message);
        this.statuteId = statuteId;
    }

    public String getStatuteId() {
        return statuteId;
    }
}
