package com.statute.ledger.core.model;

/**
 * Kinds of relationship a subject can have with another entity.
 */
public enum RelationshipType {
    PARENT_CHILD,
    SPOUSE,
    EMPLOYMENT,
    GUARDIAN,
    BUSINESS_OWNER,
    CONTRACTUAL
}
