package com.statute.ledger.health;

/**
 * A single named health probe.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
