package fr.lapetina.domainreview.domain.model;

import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Snapshot of a malware-domain feed, taken once per pass.
 * A domain is listed when its name equals one of the feed's lines.
 */
public final class MalwareDomainList {

    private static final MalwareDomainList EMPTY = new MalwareDomainList(Set.of(), false);

    private final Set<String> domains;
    private final boolean available;

    private MalwareDomainList(Set<String> domains, boolean available) {
        this.domains = domains;
        this.available = available;
    }

    public static MalwareDomainList of(Collection<String> domains) {
        return new MalwareDomainList(Set.copyOf(domains), true);
    }

    /**
     * Parses a plaintext feed: one domain per line, blank lines and {@code #} comments skipped.
     */
    public static MalwareDomainList parse(String feed) {
        Set<String> domains = feed.lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                .collect(Collectors.toUnmodifiableSet());
        return new MalwareDomainList(domains, true);
    }

    /**
     * List used when the feed could not be downloaded: matches nothing.
     */
    public static MalwareDomainList unavailable() {
        return EMPTY;
    }

    public boolean contains(String domainName) {
        return domainName != null && domains.contains(domainName.trim());
    }

    public boolean isAvailable() {
        return available;
    }

    public int size() {
        return domains.size();
    }

    @Override
    public String toString() {
        return "MalwareDomainList{" +
                "size=" + domains.size() +
                ", available=" + available +
                '}';
    }
}
