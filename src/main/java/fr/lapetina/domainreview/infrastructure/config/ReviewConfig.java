package fr.lapetina.domainreview.infrastructure.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the domain review engine.
 * Designed to be populated from YAML.
 */
public class ReviewConfig {

    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_14_0) "
            + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/70.0.3538.77 Safari/537.36";

    private int sleepTime = 20;
    private String virustotalApiKey;
    private String delayPolicy = "fixed";
    private String userAgent = DEFAULT_USER_AGENT;
    private String malwareDomainsUrl = "http://mirror1.malwaredomains.com/files/justdomains";
    private SourcesConfig sources = new SourcesConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    private BrowserConfig browser = new BrowserConfig();
    private CaptchaConfig captcha = new CaptchaConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public int getSleepTime() { return sleepTime; }
    public void setSleepTime(int sleepTime) { this.sleepTime = sleepTime; }

    public String getVirustotalApiKey() { return virustotalApiKey; }
    public void setVirustotalApiKey(String virustotalApiKey) { this.virustotalApiKey = virustotalApiKey; }

    public String getDelayPolicy() { return delayPolicy; }
    public void setDelayPolicy(String delayPolicy) { this.delayPolicy = delayPolicy; }

    public String getUserAgent() { return userAgent; }
    public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

    public String getMalwareDomainsUrl() { return malwareDomainsUrl; }
    public void setMalwareDomainsUrl(String malwareDomainsUrl) { this.malwareDomainsUrl = malwareDomainsUrl; }

    public SourcesConfig getSources() { return sources; }
    public void setSources(SourcesConfig sources) { this.sources = sources; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public CircuitBreakerConfig getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public BrowserConfig getBrowser() { return browser; }
    public void setBrowser(BrowserConfig browser) { this.browser = browser; }

    public CaptchaConfig getCaptcha() { return captcha; }
    public void setCaptcha(CaptchaConfig captcha) { this.captcha = captcha; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public boolean hasVirustotalApiKey() {
        return virustotalApiKey != null && !virustotalApiKey.isBlank();
    }

    /**
     * Source selection and endpoint overrides.
     * An empty {@code enabled} list means every registered source.
     */
    public static class SourcesConfig {
        private List<String> enabled = new ArrayList<>();
        private Map<String, String> endpoints = new LinkedHashMap<>();

        public List<String> getEnabled() { return enabled; }
        public void setEnabled(List<String> enabled) { this.enabled = enabled; }

        public Map<String, String> getEndpoints() { return endpoints; }
        public void setEndpoints(Map<String, String> endpoints) { this.endpoints = endpoints; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long connectTimeoutMs = 10000;
        private long requestTimeoutMs = 30000;
        private long sourceTimeoutMs = 60000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public long getSourceTimeoutMs() { return sourceTimeoutMs; }
        public void setSourceTimeoutMs(long sourceTimeoutMs) { this.sourceTimeoutMs = sourceTimeoutMs; }
    }

    /**
     * Per-source circuit breaker configuration.
     */
    public static class CircuitBreakerConfig {
        private int failureThreshold = 5;
        private long recoveryMs = 300000;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getRecoveryMs() { return recoveryMs; }
        public void setRecoveryMs(long recoveryMs) { this.recoveryMs = recoveryMs; }
    }

    /**
     * Headless browser configuration.
     */
    public static class BrowserConfig {
        private String geckodriverPath = "./geckodriver";
        private boolean headless = true;
        private long acceptTermsDelayMs = 2000;
        private long settleDelayMs = 5000;
        private long pageLoadTimeoutMs = 30000;

        public String getGeckodriverPath() { return geckodriverPath; }
        public void setGeckodriverPath(String geckodriverPath) { this.geckodriverPath = geckodriverPath; }

        public boolean isHeadless() { return headless; }
        public void setHeadless(boolean headless) { this.headless = headless; }

        public long getAcceptTermsDelayMs() { return acceptTermsDelayMs; }
        public void setAcceptTermsDelayMs(long acceptTermsDelayMs) { this.acceptTermsDelayMs = acceptTermsDelayMs; }

        public long getSettleDelayMs() { return settleDelayMs; }
        public void setSettleDelayMs(long settleDelayMs) { this.settleDelayMs = settleDelayMs; }

        public long getPageLoadTimeoutMs() { return pageLoadTimeoutMs; }
        public void setPageLoadTimeoutMs(long pageLoadTimeoutMs) { this.pageLoadTimeoutMs = pageLoadTimeoutMs; }
    }

    /**
     * CAPTCHA solving configuration.
     * A null {@code workDir} means the system temporary directory.
     */
    public static class CaptchaConfig {
        private String workDir;
        private String tessdataPath;
        private String language = "eng";

        public String getWorkDir() { return workDir; }
        public void setWorkDir(String workDir) { this.workDir = workDir; }

        public String getTessdataPath() { return tessdataPath; }
        public void setTessdataPath(String tessdataPath) { this.tessdataPath = tessdataPath; }

        public String getLanguage() { return language; }
        public void setLanguage(String language) { this.language = language; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "domain_review";
        private String textfilePath;

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public String getTextfilePath() { return textfilePath; }
        public void setTextfilePath(String textfilePath) { this.textfilePath = textfilePath; }
    }
}
