package fr.lapetina.domainreview.domain.model;

import java.util.Objects;

/**
 * A domain record as handed over by the inventory.
 * The review engine only reads it; updated status is returned through {@link DomainReport}.
 */
public record Domain(String name, HealthStatus healthStatus) {

    public Domain {
        Objects.requireNonNull(name, "Domain name is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Domain name must not be blank");
        }
        name = name.trim();
        if (healthStatus == null) {
            healthStatus = HealthStatus.UNKNOWN;
        }
    }

    public static Domain of(String name) {
        return new Domain(name, HealthStatus.UNKNOWN);
    }

    public boolean isHealthy() {
        return healthStatus == HealthStatus.HEALTHY;
    }
}
