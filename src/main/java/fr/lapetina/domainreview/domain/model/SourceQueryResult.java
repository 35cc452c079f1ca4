package fr.lapetina.domainreview.domain.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of querying one source for one domain.
 * Immutable and created fresh on every review pass.
 */
public record SourceQueryResult(
        String source,
        QueryStatus status,
        List<String> categories,
        FailureType failureType,
        String diagnostic,
        Duration latency
) {
    public SourceQueryResult {
        Objects.requireNonNull(source, "Source is required");
        Objects.requireNonNull(status, "Status is required");
        categories = categories != null ? List.copyOf(categories) : List.of();
        if (status == QueryStatus.FAILED && failureType == null) {
            failureType = FailureType.INTERNAL;
        }
        if (latency == null) {
            latency = Duration.ZERO;
        }
    }

    public static SourceQueryResult success(String source, List<String> categories) {
        return new SourceQueryResult(source, QueryStatus.SUCCESS, categories, null, null, null);
    }

    public static SourceQueryResult success(String source, List<String> categories, String diagnostic) {
        return new SourceQueryResult(source, QueryStatus.SUCCESS, categories, null, diagnostic, null);
    }

    public static SourceQueryResult uncategorized(String source) {
        return new SourceQueryResult(source, QueryStatus.UNCATEGORIZED, List.of(), null, null, null);
    }

    public static SourceQueryResult unknown(String source) {
        return new SourceQueryResult(source, QueryStatus.UNKNOWN, List.of(), null, null, null);
    }

    public static SourceQueryResult failed(String source, FailureType failureType, String reason) {
        return new SourceQueryResult(source, QueryStatus.FAILED, List.of(), failureType, reason, null);
    }

    public boolean isFailed() {
        return status == QueryStatus.FAILED;
    }

    /**
     * Categories this result contributes to the aggregate. Failed lookups contribute none.
     */
    public List<String> contributedCategories() {
        return status == QueryStatus.SUCCESS ? categories : List.of();
    }

    public SourceQueryResult withLatency(Duration latency) {
        return new SourceQueryResult(source, status, categories, failureType, diagnostic, latency);
    }

    /**
     * Short audit label, e.g. {@code "Spam, Ads"}, {@code "Uncategorized"} or {@code "Failed (TIMEOUT: timeout)"}.
     */
    public String describe() {
        return switch (status) {
            case SUCCESS -> categories.isEmpty()
                    ? (diagnostic != null ? diagnostic : "No categories")
                    : String.join(", ", categories);
            case UNCATEGORIZED -> "Uncategorized";
            case UNKNOWN -> "Unknown";
            case FAILED -> "Failed (" + failureType + ": " + diagnostic + ")";
        };
    }
}
