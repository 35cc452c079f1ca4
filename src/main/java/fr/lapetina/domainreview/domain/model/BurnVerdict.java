package fr.lapetina.domainreview.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Final verdict for one domain in one pass.
 *
 * @param burned       true when any signal disqualified the domain
 * @param explanations one human-readable reason per signal that fired, in evaluation order
 * @param dnsHealth    passive DNS reputation, reported but not part of {@code burned}
 */
public record BurnVerdict(boolean burned, List<String> explanations, DnsHealth dnsHealth) {

    public BurnVerdict {
        explanations = explanations != null ? List.copyOf(explanations) : List.of();
        Objects.requireNonNull(dnsHealth, "DNS health is required");
    }

    public String explanation() {
        return String.join(", ", explanations);
    }
}
