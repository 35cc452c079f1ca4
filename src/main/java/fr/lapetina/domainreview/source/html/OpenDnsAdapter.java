package fr.lapetina.domainreview.source.html;

import fr.lapetina.domainreview.domain.model.SourceQueryResult;
import fr.lapetina.domainreview.infrastructure.http.CircuitBreaker;
import fr.lapetina.domainreview.infrastructure.http.ReputationHttpClient;
import fr.lapetina.domainreview.source.AbstractSourceAdapter;
import fr.lapetina.domainreview.source.SourceContext;
import fr.lapetina.domainreview.source.SourceLookupException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;

/**
 * OpenDNS community domain tagging. Tags are listed in the first {@code span.normal}
 * of the domain page as a comma-separated string.
 */
public final class OpenDnsAdapter extends AbstractSourceAdapter {

    public static final String NAME = "opendns";
    static final String DEFAULT_ENDPOINT = "https://domain.opendns.com";

    private final ReputationHttpClient httpClient;
    private final URI baseUri;

    public OpenDnsAdapter(ReputationHttpClient httpClient, URI baseUri, CircuitBreaker circuitBreaker) {
        super(NAME, circuitBreaker);
        this.httpClient = httpClient;
        this.baseUri = baseUri;
    }

    public OpenDnsAdapter(SourceContext context) {
        this(context.getHttpClient(), context.endpoint(NAME, DEFAULT_ENDPOINT), context.circuitBreaker(NAME));
    }

    @Override
    protected SourceQueryResult lookup(String domainName)
            throws IOException, InterruptedException, SourceLookupException {
        HttpResponse<String> response = httpClient.get(URI.create(baseUri + "/" + domainName), Map.of(), null);
        requireSuccess(response);

        Document page = Jsoup.parse(response.body(), baseUri.toString());
        Element tags = page.selectFirst("span.normal");
        if (tags == null || tags.text().isBlank()) {
            return uncategorized();
        }
        List<String> categories = splitLabels(tags.text());
        return categories.isEmpty() ? uncategorized() : success(categories);
    }
}
