package fr.lapetina.domainreview.domain.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Passive DNS reputation signal, reported next to the burn verdict.
 * Healthy when no historical address is flagged.
 */
public record DnsHealth(List<FlaggedAddress> flaggedAddresses) {

    private static final DnsHealth HEALTHY = new DnsHealth(List.of());

    public DnsHealth {
        flaggedAddresses = flaggedAddresses != null ? List.copyOf(flaggedAddresses) : List.of();
    }

    public static DnsHealth healthy() {
        return HEALTHY;
    }

    public static DnsHealth flagged(List<FlaggedAddress> addresses) {
        return new DnsHealth(addresses);
    }

    public boolean isHealthy() {
        return flaggedAddresses.isEmpty();
    }

    public List<String> labels() {
        return flaggedAddresses.stream().map(FlaggedAddress::label).toList();
    }

    public HealthStatus toHealthStatus() {
        return isHealthy() ? HealthStatus.HEALTHY : HealthStatus.FLAGGED_DNS;
    }

    @Override
    public String toString() {
        if (isHealthy()) {
            return "Healthy";
        }
        return flaggedAddresses.stream()
                .map(FlaggedAddress::label)
                .collect(Collectors.joining(", ", "Flagged DNS (", ")"));
    }
}
