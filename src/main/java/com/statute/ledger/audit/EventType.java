package com.statute.ledger.audit;

/**
 * Types of auditable events.
 */
public enum EventType {
    AUTOMATIC_DECISION,
    DISCRETIONARY_REVIEW,
    HUMAN_OVERRIDE,
    APPEAL,
    STATUTE_MODIFIED,
    SIMULATION_RUN
}
