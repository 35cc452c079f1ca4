package fr.lapetina.domainreview.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Review result for one domain: verdict, aggregated categories and the raw per-source answers.
 * Owned by the caller once returned.
 */
public record DomainReport(
        Domain domain,
        BurnVerdict verdict,
        Set<String> categories,
        List<String> badCategories,
        Map<String, SourceQueryResult> sourceResults
) {
    public DomainReport {
        Objects.requireNonNull(domain, "Domain is required");
        Objects.requireNonNull(verdict, "Verdict is required");
        categories = categories != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(categories))
                : Set.of();
        badCategories = badCategories != null ? List.copyOf(badCategories) : List.of();
        sourceResults = sourceResults != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(sourceResults))
                : Map.of();
    }

    public boolean isBurned() {
        return verdict.burned();
    }

    /**
     * Categories contributed by each source, keyed by source name in query order.
     * Sources that failed or had nothing to say map to an empty list.
     */
    public Map<String, List<String>> categoryBreakdown() {
        Map<String, List<String>> breakdown = new LinkedHashMap<>();
        sourceResults.forEach((source, result) -> breakdown.put(source, result.contributedCategories()));
        return Collections.unmodifiableMap(breakdown);
    }

    /**
     * Sources whose lookup failed, keyed by name.
     */
    public Map<String, SourceQueryResult> failedSources() {
        Map<String, SourceQueryResult> failed = new LinkedHashMap<>();
        sourceResults.forEach((source, result) -> {
            if (result.isFailed()) {
                failed.put(source, result);
            }
        });
        return Collections.unmodifiableMap(failed);
    }

    /**
     * Status the inventory should record after this review.
     */
    public HealthStatus resultingStatus() {
        if (verdict.burned()) {
            return HealthStatus.BURNED;
        }
        return verdict.dnsHealth().toHealthStatus();
    }

    public String summary() {
        StringBuilder sb = new StringBuilder()
                .append(domain.name())
                .append(": ")
                .append(verdict.burned() ? "BURNED" : "not burned");
        if (!verdict.explanations().isEmpty()) {
            sb.append(" (").append(verdict.explanation()).append(")");
        }
        sb.append(", dns=").append(verdict.dnsHealth());
        if (!badCategories.isEmpty()) {
            sb.append(", bad categories=").append(String.join(", ", badCategories));
        }
        Map<String, SourceQueryResult> failed = failedSources();
        if (!failed.isEmpty()) {
            sb.append(", failed sources=").append(String.join(", ", failed.keySet()));
        }
        return sb.toString();
    }
}
