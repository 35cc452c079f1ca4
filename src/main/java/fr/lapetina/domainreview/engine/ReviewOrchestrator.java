package fr.lapetina.domainreview.engine;

import fr.lapetina.domainreview.domain.model.Domain;
import fr.lapetina.domainreview.domain.model.DomainReport;
import fr.lapetina.domainreview.domain.model.FailureType;
import fr.lapetina.domainreview.domain.model.MalwareDomainList;
import fr.lapetina.domainreview.domain.model.SourceQueryResult;
import fr.lapetina.domainreview.infrastructure.feed.MalwareDomainFeed;
import fr.lapetina.domainreview.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.domainreview.source.PrimarySourceAdapter;
import fr.lapetina.domainreview.source.PrimarySourceResult;
import fr.lapetina.domainreview.source.SourceAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs review passes over an ordered list of domains.
 *
 * Domains are reviewed one at a time and paced by the {@link RateLimiter}. Within a domain,
 * the primary source and every category source run concurrently on worker threads, each
 * bounded by the source timeout; an expired lookup is cancelled and reported as failed
 * without affecting its siblings.
 *
 * A pass can be stopped with {@link #cancel()} or by interrupting the calling thread. The
 * reports of the domains completed so far are returned.
 */
public final class ReviewOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReviewOrchestrator.class);

    private final PrimarySourceAdapter primarySource;
    private final List<SourceAdapter> sources;
    private final MalwareDomainFeed malwareFeed;
    private final BurnDecisionEngine decisionEngine;
    private final RateLimiter rateLimiter;
    private final MetricsRegistry metrics;
    private final Duration sourceTimeout;
    private final ExecutorService workers;

    private final Object passLock = new Object();
    private Thread passThread;
    private volatile boolean cancelled;

    public ReviewOrchestrator(
            PrimarySourceAdapter primarySource,
            List<SourceAdapter> sources,
            MalwareDomainFeed malwareFeed,
            BurnDecisionEngine decisionEngine,
            RateLimiter rateLimiter,
            MetricsRegistry metrics,
            Duration sourceTimeout
    ) {
        this.primarySource = primarySource;
        this.sources = List.copyOf(sources);
        this.malwareFeed = malwareFeed;
        this.decisionEngine = decisionEngine;
        this.rateLimiter = rateLimiter;
        this.metrics = metrics;
        this.sourceTimeout = sourceTimeout;

        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "source-worker-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Reviews every domain not marked healthy, in the given order.
     *
     * @return reports keyed by domain, in review order; healthy domains are absent
     * @throws fr.lapetina.domainreview.engine.exception.MissingCredentialException
     *         before any network call when the primary source cannot be used
     */
    public Map<Domain, DomainReport> review(List<Domain> domains) {
        primarySource.checkPreconditions();

        synchronized (passLock) {
            if (passThread != null) {
                throw new IllegalStateException("A review pass is already running");
            }
            passThread = Thread.currentThread();
            cancelled = false;
        }

        Map<Domain, DomainReport> reports = new LinkedHashMap<>();
        try {
            log.info("Review pass started: domains={}, sources={}", domains.size(), sourceNames());
            MalwareDomainList malwareDomains = malwareFeed.download();

            for (int i = 0; i < domains.size(); i++) {
                if (cancelled) {
                    log.warn("Review pass cancelled: reviewed={}, remaining={}", reports.size(), domains.size() - i);
                    break;
                }
                Domain domain = domains.get(i);
                if (!decisionEngine.requiresReview(domain)) {
                    log.info("Domain skipped: domain={}, status={}", domain.name(), domain.healthStatus());
                    metrics.recordSkipped();
                    continue;
                }

                rateLimiter.markDomainStart();
                DomainReport report = reviewDomain(domain, malwareDomains);
                reports.put(domain, report);
                metrics.recordVerdict(report.isBurned());
                log.info("Domain reviewed: {}", report.summary());

                if (hasPendingReview(domains, i + 1) && !cancelled) {
                    rateLimiter.pace();
                }
            }
        } catch (InterruptedException e) {
            log.warn("Review pass interrupted: reviewed={}", reports.size());
            if (!cancelled) {
                Thread.currentThread().interrupt();
            }
        } finally {
            synchronized (passLock) {
                passThread = null;
                if (cancelled) {
                    // clear the interrupt delivered by cancel()
                    Thread.interrupted();
                }
            }
        }

        log.info("Review pass finished: reviewed={}, burned={}", reports.size(),
                reports.values().stream().filter(DomainReport::isBurned).count());
        return reports;
    }

    /**
     * Stops the running pass, interrupting in-flight waits. A domain still under review is dropped.
     */
    public void cancel() {
        synchronized (passLock) {
            cancelled = true;
            if (passThread != null) {
                passThread.interrupt();
            }
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    private DomainReport reviewDomain(Domain domain, MalwareDomainList malwareDomains) throws InterruptedException {
        String name = domain.name();
        long deadline = System.nanoTime() + sourceTimeout.toNanos();

        Future<PrimarySourceResult> primaryFuture = submit(() -> {
            long start = System.nanoTime();
            return primarySource.lookupReport(name).withLatency(Duration.ofNanos(System.nanoTime() - start));
        });
        Map<SourceAdapter, Future<SourceQueryResult>> futures = new LinkedHashMap<>();
        for (SourceAdapter source : sources) {
            futures.put(source, submit(() -> {
                long start = System.nanoTime();
                return source.query(name).withLatency(Duration.ofNanos(System.nanoTime() - start));
            }));
        }

        try {
            PrimarySourceResult primary = await(primaryFuture, deadline, primarySource.getName(), name,
                    PrimarySourceResult::of);
            metrics.recordLookup(primarySource.getName(), primary.result().status(), primary.result().latency());

            List<SourceQueryResult> results = new ArrayList<>();
            for (Map.Entry<SourceAdapter, Future<SourceQueryResult>> entry : futures.entrySet()) {
                SourceQueryResult result = await(entry.getValue(), deadline, entry.getKey().getName(), name,
                        Function.identity());
                metrics.recordLookup(result.source(), result.status(), result.latency());
                results.add(result);
            }

            DomainReport report = decisionEngine.evaluate(domain, malwareDomains, primary, results);
            if (Thread.currentThread().isInterrupted()) {
                // an IP lookup swallowed the interrupt, so the DNS health is not trustworthy
                throw new InterruptedException("Review of " + name + " interrupted");
            }
            return report;
        } catch (InterruptedException e) {
            primaryFuture.cancel(true);
            futures.values().forEach(future -> future.cancel(true));
            throw e;
        }
    }

    private <T> Future<T> submit(Callable<T> lookup) {
        return workers.submit(lookup);
    }

    private <T> T await(
            Future<T> future,
            long deadline,
            String source,
            String domainName,
            Function<SourceQueryResult, T> onFailure
    ) throws InterruptedException {
        try {
            return future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Lookup timed out: source={}, domain={}, timeoutMs={}", source, domainName, sourceTimeout.toMillis());
            return onFailure.apply(SourceQueryResult.failed(source, FailureType.TIMEOUT, "timeout")
                    .withLatency(sourceTimeout));
        } catch (ExecutionException e) {
            // adapters convert their own faults, so this is a programming error in one of them
            log.error("Lookup crashed: source={}, domain={}", source, domainName, e.getCause());
            return onFailure.apply(SourceQueryResult.failed(source, FailureType.INTERNAL,
                    String.valueOf(e.getCause())));
        }
    }

    private boolean hasPendingReview(List<Domain> domains, int from) {
        for (int i = from; i < domains.size(); i++) {
            if (decisionEngine.requiresReview(domains.get(i))) {
                return true;
            }
        }
        return false;
    }

    private List<String> sourceNames() {
        List<String> names = new ArrayList<>();
        names.add(primarySource.getName());
        sources.forEach(source -> names.add(source.getName()));
        return names;
    }

    @Override
    public void close() {
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Source workers did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Review orchestrator stopped");
    }
}
