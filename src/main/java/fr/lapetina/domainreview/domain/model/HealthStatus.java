package fr.lapetina.domainreview.domain.model;

import java.util.Locale;

/**
 * Last-known health of a domain as recorded by the inventory.
 *
 * HEALTHY: cleared by an operator, never re-evaluated
 * BURNED: previously flagged by a review
 * FLAGGED_DNS: resolves, or resolved, to addresses with a bad reputation
 * UNKNOWN: never reviewed
 */
public enum HealthStatus {
    HEALTHY,
    BURNED,
    FLAGGED_DNS,
    UNKNOWN;

    /**
     * Parses an inventory value such as {@code "Healthy"}, {@code "flagged-dns"} or {@code "Flagged DNS"}.
     * Blank or unrecognized values map to {@link #UNKNOWN}.
     */
    public static HealthStatus parse(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String normalized = value.trim()
                .toUpperCase(Locale.ROOT)
                .replace('-', '_')
                .replace(' ', '_');
        for (HealthStatus status : values()) {
            if (status.name().equals(normalized)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
