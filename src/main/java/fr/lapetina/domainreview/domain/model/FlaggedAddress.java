package fr.lapetina.domainreview.domain.model;

import java.util.Objects;

/**
 * An address from the passive DNS history whose own reputation is bad.
 *
 * @param address  IP address
 * @param lastSeen date the domain last resolved to it, {@code yyyy-MM-dd}
 */
public record FlaggedAddress(String address, String lastSeen) {

    public FlaggedAddress {
        Objects.requireNonNull(address, "Address is required");
        lastSeen = lastSeen != null ? lastSeen : "";
    }

    /**
     * Returns {@code address/lastSeen}, e.g. {@code 1.2.3.4/2020-01-01}.
     */
    public String label() {
        return lastSeen.isEmpty() ? address : address + "/" + lastSeen;
    }
}
