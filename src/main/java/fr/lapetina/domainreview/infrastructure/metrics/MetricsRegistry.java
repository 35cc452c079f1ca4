package fr.lapetina.domainreview.infrastructure.metrics;

import fr.lapetina.domainreview.domain.model.QueryStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Lookup outcome counters per source and status
 * - Lookup latency timers per source
 * - Verdict and skip counters
 * - Prometheus exposition, exportable to a text file at the end of a pass
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> outcomeCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> verdictCounters = new ConcurrentHashMap<>();
    private final Counter skippedCounter;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);

        this.skippedCounter = Counter.builder(prefix + "_domains_skipped_total")
                .description("Domains skipped because they are marked healthy")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("domain_review");
    }

    /**
     * Counts one source lookup by outcome.
     */
    public void recordLookup(String source, QueryStatus status, Duration latency) {
        String key = source + ":" + status.name();
        outcomeCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_lookups_total")
                        .description("Source lookups by outcome")
                        .tag("source", source)
                        .tag("status", status.name())
                        .register(registry)
        ).increment();

        latencyTimers.computeIfAbsent(source, k ->
                Timer.builder(prefix + "_lookup_latency")
                        .description("Source lookup latency")
                        .tag("source", source)
                        .publishPercentiles(0.5, 0.95)
                        .register(registry)
        ).record(latency);
    }

    public void recordVerdict(boolean burned) {
        String key = Boolean.toString(burned);
        verdictCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_verdicts_total")
                        .description("Domain verdicts")
                        .tag("burned", key)
                        .register(registry)
        ).increment();
    }

    public void recordSkipped() {
        skippedCounter.increment();
    }

    public double lookupCount(String source, QueryStatus status) {
        Counter counter = outcomeCounters.get(source + ":" + status.name());
        return counter != null ? counter.count() : 0;
    }

    public double verdictCount(boolean burned) {
        Counter counter = verdictCounters.get(Boolean.toString(burned));
        return counter != null ? counter.count() : 0;
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Writes the scrape output atomically to {@code path}, for a text-file collector.
     */
    public void writeTextfile(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        Path tmp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
        Files.writeString(tmp, scrape(), StandardCharsets.UTF_8);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.info("Metrics written: path={}", path);
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
