package com.statute.ledger.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs registered probes and folds them into one status: the worst individual status wins,
 * and each probe's result is attached as a detail under its name. A probe that throws counts
 * as DOWN.
 */
public class HealthCheckRegistry {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public HealthCheckRegistry register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
        return this;
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }
        HealthStatus worst = HealthStatus.up();
        String worstName = null;
        HealthStatus aggregate = HealthStatus.up();
        for (HealthCheck check : checks) {
            HealthStatus result = run(check);
            aggregate = aggregate.withDetail(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()));
            if (result.isWorseThan(worst)) {
                worst = result;
                worstName = check.getName();
            }
        }
        String message = worstName == null ? "OK" : worstName + ": " + worst.message();
        return new HealthStatus(worst.status(), message, aggregate.details());
    }

    public int size() {
        return checks.size();
    }

    private HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            log.warn("Health check '{}' failed", check.getName(), e);
            return HealthStatus.down("Check failed: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }
}
