package com.statute.ledger.health;

import com.statute.ledger.registry.StatuteRegistry;

/**
 * DEGRADED while the registry is empty or still accepting registrations.
 */
public class StatuteRegistryHealthCheck implements HealthCheck {

    private final StatuteRegistry registry;

    public StatuteRegistryHealthCheck(StatuteRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String getName() {
        return "statuteRegistry";
    }

    @Override
    public HealthStatus check() {
        HealthStatus base;
        if (registry.size() == 0) {
            base = HealthStatus.degraded("No statutes registered");
        } else if (!registry.isFrozen()) {
            base = HealthStatus.degraded("Registry not frozen");
        } else {
            base = HealthStatus.up();
        }
        return base
                .withDetail("statutes", registry.size())
                .withDetail("frozen", registry.isFrozen())
                .withDetail("duplicatePolicy", registry.getDuplicatePolicy().name());
    }
}
