package com.statute.ledger.core.model;

import java.time.LocalDate;

/**
 * Period during which a statute is in force. Both ends are optional and inclusive.
 */
public record TemporalValidity(LocalDate effectiveDate, LocalDate expiryDate) {

    public static TemporalValidity unbounded() {
        return new TemporalValidity(null, null);
    }

    public TemporalValidity withEffectiveDate(LocalDate date) {
        return new TemporalValidity(date, expiryDate);
    }

    public TemporalValidity withExpiryDate(LocalDate date) {
        return new TemporalValidity(effectiveDate, date);
    }

    public boolean isActive(LocalDate asOf) {
        boolean afterEffective = effectiveDate == null || !asOf.isBefore(effectiveDate);
        boolean beforeExpiry = expiryDate == null || !asOf.isAfter(expiryDate);
        return afterEffective && beforeExpiry;
    }

    public boolean isConsistent() {
        return effectiveDate == null || expiryDate == null || !expiryDate.isBefore(effectiveDate);
    }
}
