package fr.lapetina.domainreview;

import fr.lapetina.domainreview.domain.policy.BlacklistPolicy;
import fr.lapetina.domainreview.domain.policy.CategoryNormalizer;
import fr.lapetina.domainreview.engine.BurnDecisionEngine;
import fr.lapetina.domainreview.engine.DelayPolicy;
import fr.lapetina.domainreview.engine.PassiveDnsInspector;
import fr.lapetina.domainreview.engine.RateLimiter;
import fr.lapetina.domainreview.engine.ReviewOrchestrator;
import fr.lapetina.domainreview.engine.exception.MissingCredentialException;
import fr.lapetina.domainreview.infrastructure.captcha.CaptchaSolver;
import fr.lapetina.domainreview.infrastructure.captcha.TesseractOcrEngine;
import fr.lapetina.domainreview.infrastructure.config.ConfigLoader;
import fr.lapetina.domainreview.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.domainreview.infrastructure.config.ReviewConfig;
import fr.lapetina.domainreview.infrastructure.feed.MalwareDomainFeed;
import fr.lapetina.domainreview.infrastructure.http.ReputationHttpClient;
import fr.lapetina.domainreview.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.domainreview.infrastructure.time.Sleeper;
import fr.lapetina.domainreview.source.PrimarySourceAdapter;
import fr.lapetina.domainreview.source.SourceAdapter;
import fr.lapetina.domainreview.source.SourceAdapterFactory;
import fr.lapetina.domainreview.source.SourceContext;
import fr.lapetina.domainreview.source.browser.SeleniumBrowserSessionFactory;
import fr.lapetina.domainreview.source.rest.VirusTotalAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Factory for creating a fully-wired review engine from configuration.
 * This is the primary entry point for obtaining a configured {@link ReviewOrchestrator}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ReviewEngineFactory factory = ReviewEngineFactory.create("config.yaml")) {
 *     Map<Domain, DomainReport> reports = factory.getOrchestrator().review(domains);
 * }
 * }</pre>
 */
public class ReviewEngineFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReviewEngineFactory.class);

    private final ReviewConfig config;
    private final MetricsRegistry metricsRegistry;
    private final ReputationHttpClient httpClient;
    private final List<SourceAdapter> sources;
    private final ReviewOrchestrator orchestrator;

    protected ReviewEngineFactory(ReviewConfig config, ReputationHttpClient httpClientOverride, Sleeper sleeper) {
        this.config = config;

        // Fail before anything is started
        if (!config.hasVirustotalApiKey()) {
            throw new MissingCredentialException(VirusTotalAdapter.NAME);
        }
        DelayPolicy delayPolicy = createDelayPolicy();

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        // Initialize HTTP client (allow override for testing)
        this.httpClient = httpClientOverride != null ? httpClientOverride : createHttpClient();

        SourceContext context = new SourceContext(
                config,
                httpClient,
                new CaptchaSolver(
                        httpClient,
                        new TesseractOcrEngine(config.getCaptcha().getTessdataPath(), config.getCaptcha().getLanguage()),
                        captchaWorkDir()
                ),
                new SeleniumBrowserSessionFactory(config.getBrowser()),
                sleeper
        );

        PrimarySourceAdapter primary = SourceAdapterFactory.createPrimary(context);
        this.sources = SourceAdapterFactory.createEnabled(config.getSources().getEnabled(), context);

        BurnDecisionEngine decisionEngine = new BurnDecisionEngine(
                new BlacklistPolicy(),
                new CategoryNormalizer(),
                new PassiveDnsInspector(SourceAdapterFactory.createIpReputationChecker(context))
        );

        this.orchestrator = new ReviewOrchestrator(
                primary,
                sources,
                new MalwareDomainFeed(httpClient, URI.create(config.getMalwareDomainsUrl())),
                decisionEngine,
                new RateLimiter(delayPolicy, Clock.systemUTC(), context.getSleeper()),
                metricsRegistry,
                Duration.ofMillis(config.getTimeouts().getSourceTimeoutMs())
        );

        log.info("ReviewEngineFactory initialized: primary={}, sources={}, delayPolicy={}, sleepTime={}s",
                primary.getName(), sources.stream().map(SourceAdapter::getName).toList(),
                config.getDelayPolicy(), config.getSleepTime());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static ReviewEngineFactory create(String configPath) {
        return new ReviewEngineFactory(new ConfigLoader(configPath).load(), null, Sleeper.SYSTEM);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static ReviewEngineFactory create() {
        return create("config.yaml");
    }

    public ReviewOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ReputationHttpClient getHttpClient() {
        return httpClient;
    }

    public List<SourceAdapter> getSources() {
        return sources;
    }

    public ReviewConfig getConfig() {
        return config;
    }

    private DelayPolicy createDelayPolicy() {
        try {
            return DelayPolicy.named(config.getDelayPolicy(), Duration.ofSeconds(config.getSleepTime()));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    private Path captchaWorkDir() {
        String workDir = config.getCaptcha().getWorkDir();
        return workDir != null && !workDir.isBlank()
                ? Path.of(workDir)
                : Path.of(System.getProperty("java.io.tmpdir"));
    }

    private ReputationHttpClient createHttpClient() {
        return new ReputationHttpClient(
                config.getUserAgent(),
                Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs()),
                Duration.ofMillis(config.getTimeouts().getRequestTimeoutMs()),
                config.getCircuitBreaker().getFailureThreshold(),
                Duration.ofMillis(config.getCircuitBreaker().getRecoveryMs()),
                Clock.systemUTC()
        );
    }

    @Override
    public void close() {
        log.info("Shutting down ReviewEngineFactory...");

        try {
            orchestrator.close();
        } catch (Exception e) {
            log.warn("Error closing orchestrator", e);
        }

        try {
            httpClient.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP client", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("ReviewEngineFactory shut down");
    }
}
