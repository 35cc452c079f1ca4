package fr.lapetina.domainreview.source.form;

import fr.lapetina.domainreview.domain.model.FailureType;
import fr.lapetina.domainreview.domain.model.SourceQueryResult;
import fr.lapetina.domainreview.infrastructure.http.CircuitBreaker;
import fr.lapetina.domainreview.infrastructure.http.ReputationHttpClient;
import fr.lapetina.domainreview.infrastructure.http.SessionContext;
import fr.lapetina.domainreview.source.AbstractSourceAdapter;
import fr.lapetina.domainreview.source.SourceContext;
import fr.lapetina.domainreview.source.SourceLookupException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trend Micro Site Safety Center.
 *
 * Three requests share one session: the index page sets the session cookie, {@code idn.php}
 * registers the name and {@code result.php} renders the rating. When the site suspects a
 * bot it redirects the last step to a reCAPTCHA page, which cannot be solved automatically.
 */
public final class TrendMicroAdapter extends AbstractSourceAdapter {

    public static final String NAME = "trendmicro";
    static final String DEFAULT_ENDPOINT = "https://global.sitesafety.trendmicro.com";

    private final ReputationHttpClient httpClient;
    private final URI baseUri;

    public TrendMicroAdapter(ReputationHttpClient httpClient, URI baseUri, CircuitBreaker circuitBreaker) {
        super(NAME, circuitBreaker);
        this.httpClient = httpClient;
        this.baseUri = baseUri;
    }

    public TrendMicroAdapter(SourceContext context) {
        this(context.getHttpClient(), context.endpoint(NAME, DEFAULT_ENDPOINT), context.circuitBreaker(NAME));
    }

    @Override
    protected SourceQueryResult lookup(String domainName)
            throws IOException, InterruptedException, SourceLookupException {
        SessionContext session = new SessionContext(NAME + ":" + domainName);

        requireSuccess(httpClient.get(URI.create(baseUri + "/"), Map.of(), session));

        Map<String, String> registerHeaders = Map.of(
                "Accept", "*/*",
                "Origin", baseUri.toString(),
                "X-Requested-With", "XMLHttpRequest",
                "Referer", baseUri + "/index.php",
                "Accept-Language", "en-US, en;q=0.9"
        );
        requireSuccess(httpClient.postForm(URI.create(baseUri + "/lib/idn.php"),
                registerHeaders, Map.of("url", domainName), session));

        Map<String, String> resultHeaders = Map.of(
                "Accept", "text/html, application/xhtml+xml, application/xml;q=0.9, */*;q=0.8",
                "Origin", baseUri.toString(),
                "Referer", baseUri + "/index.php",
                "Accept-Language", "en-US, en;q=0.9"
        );
        Map<String, String> form = new LinkedHashMap<>();
        form.put("urlname", domainName);
        form.put("getinfo", "Check Now");
        HttpResponse<String> response = httpClient.postForm(
                URI.create(baseUri + "/result.php"), resultHeaders, form, session);

        if (response.uri().toString().contains("captcha")) {
            throw new SourceLookupException(FailureType.ANTI_BOT,
                    "redirected to reCAPTCHA, solve it manually at " + baseUri + "/captcha.php");
        }
        requireSuccess(response);

        Element rating = Jsoup.parse(response.body()).selectFirst("div.labeltitlesmallresult");
        if (rating == null || rating.text().isBlank()) {
            return uncategorized();
        }
        List<String> categories = splitLabels(rating.text());
        return categories.isEmpty() ? uncategorized() : success(categories);
    }
}
