package fr.lapetina.domainreview.source;

import fr.lapetina.domainreview.domain.model.DnsResolution;
import fr.lapetina.domainreview.domain.model.SourceQueryResult;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Everything the primary source said about a domain.
 *
 * @param result               categories and lookup status
 * @param detectedSampleCount  malware samples downloaded from the domain and detected
 * @param detectedUrlCount     URLs on the domain that were detected
 * @param resolutions          passive DNS history
 */
public record PrimarySourceResult(
        SourceQueryResult result,
        int detectedSampleCount,
        int detectedUrlCount,
        List<DnsResolution> resolutions
) {
    public PrimarySourceResult {
        Objects.requireNonNull(result, "Result is required");
        resolutions = resolutions != null ? List.copyOf(resolutions) : List.of();
    }

    /**
     * A primary lookup that produced no report: zero detections, no history.
     */
    public static PrimarySourceResult of(SourceQueryResult result) {
        return new PrimarySourceResult(result, 0, 0, List.of());
    }

    public boolean hasDetectedSamples() {
        return detectedSampleCount > 0;
    }

    public boolean hasDetectedUrls() {
        return detectedUrlCount > 0;
    }

    public PrimarySourceResult withLatency(Duration latency) {
        return new PrimarySourceResult(result.withLatency(latency), detectedSampleCount, detectedUrlCount, resolutions);
    }
}
