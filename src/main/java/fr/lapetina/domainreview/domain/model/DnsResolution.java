package fr.lapetina.domainreview.domain.model;

import java.util.Objects;

/**
 * One passive DNS entry: an address the domain resolved to and when it was last seen.
 *
 * @param ipAddress    resolved address
 * @param lastResolved timestamp as reported by the source, e.g. {@code 2020-01-01 00:00:00}
 */
public record DnsResolution(String ipAddress, String lastResolved) {

    public DnsResolution {
        Objects.requireNonNull(ipAddress, "IP address is required");
        lastResolved = lastResolved != null ? lastResolved : "";
    }

    /**
     * Date part of {@link #lastResolved()}.
     */
    public String lastSeenDate() {
        String trimmed = lastResolved.trim();
        int space = trimmed.indexOf(' ');
        return space >= 0 ? trimmed.substring(0, space) : trimmed;
    }
}
