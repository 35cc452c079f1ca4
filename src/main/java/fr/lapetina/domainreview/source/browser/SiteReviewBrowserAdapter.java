package fr.lapetina.domainreview.source.browser;

import fr.lapetina.domainreview.domain.model.SourceQueryResult;
import fr.lapetina.domainreview.infrastructure.config.ReviewConfig;
import fr.lapetina.domainreview.infrastructure.http.CircuitBreaker;
import fr.lapetina.domainreview.infrastructure.time.Sleeper;
import fr.lapetina.domainreview.source.AbstractSourceAdapter;
import fr.lapetina.domainreview.source.SourceContext;
import fr.lapetina.domainreview.source.SourceLookupException;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Symantec (Bluecoat) Site Review, driven through a rendering browser.
 *
 * The page is a single-page app with no observable completion signal, so the adapter waits
 * fixed delays: one after the first submit, which only accepts the terms of use, and one
 * after the real submission.
 */
public final class SiteReviewBrowserAdapter extends AbstractSourceAdapter {

    public static final String NAME = "bluecoat";
    static final String DEFAULT_ENDPOINT = "https://sitereview.bluecoat.com";

    static final String SEARCH_FIELD = "txtSearch";
    static final String SUBMIT_SCRIPT = "btnLookupSubmit.click();";
    static final String CATEGORY_CLASS = "clickable-category";

    private final BrowserSessionFactory browsers;
    private final String pageUrl;
    private final Duration acceptTermsDelay;
    private final Duration settleDelay;
    private final Sleeper sleeper;

    public SiteReviewBrowserAdapter(
            BrowserSessionFactory browsers,
            String baseUrl,
            Duration acceptTermsDelay,
            Duration settleDelay,
            Sleeper sleeper,
            CircuitBreaker circuitBreaker
    ) {
        super(NAME, circuitBreaker);
        this.browsers = browsers;
        this.pageUrl = baseUrl + "/#/";
        this.acceptTermsDelay = acceptTermsDelay;
        this.settleDelay = settleDelay;
        this.sleeper = sleeper;
    }

    public SiteReviewBrowserAdapter(SourceContext context) {
        this(context.getBrowserSessionFactory(),
                context.endpoint(NAME, DEFAULT_ENDPOINT).toString(),
                Duration.ofMillis(browserConfig(context).getAcceptTermsDelayMs()),
                Duration.ofMillis(browserConfig(context).getSettleDelayMs()),
                context.getSleeper(),
                context.circuitBreaker(NAME));
    }

    @Override
    protected SourceQueryResult lookup(String domainName) throws InterruptedException, SourceLookupException {
        try (BrowserSession browser = browsers.open()) {
            browser.navigate(pageUrl);
            browser.typeInto(SEARCH_FIELD, domainName);
            browser.runScript(SUBMIT_SCRIPT);
            sleeper.sleep(acceptTermsDelay);
            browser.runScript(SUBMIT_SCRIPT);
            sleeper.sleep(settleDelay);

            Optional<String> category = browser.textOfFirstByClass(CATEGORY_CLASS);
            if (category.isEmpty()) {
                throw SourceLookupException.unexpectedPage();
            }
            String text = category.get().trim();
            if (text.isEmpty() || text.equalsIgnoreCase("Uncategorized")) {
                return uncategorized();
            }
            return success(List.of(text));
        }
    }

    private static ReviewConfig.BrowserConfig browserConfig(SourceContext context) {
        return context.getConfig().getBrowser();
    }
}
