package com.statute.ledger.core.model;

/**
 * Types of legal effect a statute produces when it applies.
 */
public enum EffectType {
    GRANT,
    REVOKE,
    OBLIGATION,
    PROHIBITION,
    MONETARY_TRANSFER,
    STATUS_CHANGE,
    CUSTOM
}
