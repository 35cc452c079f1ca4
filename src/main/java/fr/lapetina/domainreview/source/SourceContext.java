package fr.lapetina.domainreview.source;

import fr.lapetina.domainreview.infrastructure.captcha.CaptchaSolver;
import fr.lapetina.domainreview.infrastructure.config.ReviewConfig;
import fr.lapetina.domainreview.infrastructure.http.CircuitBreaker;
import fr.lapetina.domainreview.infrastructure.http.ReputationHttpClient;
import fr.lapetina.domainreview.infrastructure.time.Sleeper;
import fr.lapetina.domainreview.source.browser.BrowserSessionFactory;

import java.net.URI;
import java.util.Objects;

/**
 * Shared collaborators handed to adapters at construction.
 * Everything here is read-mostly and safe to share across adapters.
 */
public final class SourceContext {

    private final ReviewConfig config;
    private final ReputationHttpClient httpClient;
    private final CaptchaSolver captchaSolver;
    private final BrowserSessionFactory browserSessionFactory;
    private final Sleeper sleeper;

    public SourceContext(
            ReviewConfig config,
            ReputationHttpClient httpClient,
            CaptchaSolver captchaSolver,
            BrowserSessionFactory browserSessionFactory,
            Sleeper sleeper
    ) {
        this.config = Objects.requireNonNull(config, "Config is required");
        this.httpClient = Objects.requireNonNull(httpClient, "HTTP client is required");
        this.captchaSolver = captchaSolver;
        this.browserSessionFactory = browserSessionFactory;
        this.sleeper = sleeper != null ? sleeper : Sleeper.SYSTEM;
    }

    /**
     * Returns the configured base URI of a source, or {@code defaultUri} when not overridden.
     */
    public URI endpoint(String source, String defaultUri) {
        String override = config.getSources().getEndpoints().get(source);
        String base = override != null && !override.isBlank() ? override : defaultUri;
        return URI.create(base.endsWith("/") ? base.substring(0, base.length() - 1) : base);
    }

    public CircuitBreaker circuitBreaker(String source) {
        return httpClient.getOrCreateCircuitBreaker(source);
    }

    public ReviewConfig getConfig() {
        return config;
    }

    public ReputationHttpClient getHttpClient() {
        return httpClient;
    }

    public CaptchaSolver getCaptchaSolver() {
        if (captchaSolver == null) {
            throw new IllegalStateException("No CAPTCHA solver configured");
        }
        return captchaSolver;
    }

    public BrowserSessionFactory getBrowserSessionFactory() {
        if (browserSessionFactory == null) {
            throw new IllegalStateException("No browser session factory configured");
        }
        return browserSessionFactory;
    }

    public Sleeper getSleeper() {
        return sleeper;
    }
}
