package fr.lapetina.domainreview.source.rest;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.domainreview.domain.model.FailureType;
import fr.lapetina.domainreview.domain.model.SourceQueryResult;
import fr.lapetina.domainreview.infrastructure.http.CircuitBreaker;
import fr.lapetina.domainreview.infrastructure.http.ReputationHttpClient;
import fr.lapetina.domainreview.source.AbstractSourceAdapter;
import fr.lapetina.domainreview.source.SourceContext;
import fr.lapetina.domainreview.source.SourceLookupException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * IBM X-Force Exchange URL categories, through the API used by the public web UI.
 *
 * A 404 ({@code {"error":"Not found."}}) means X-Force has never seen the domain and is
 * reported as UNKNOWN, distinct from a known but uncategorized domain.
 */
public final class XForceAdapter extends AbstractSourceAdapter {

    public static final String NAME = "xforce";
    static final String DEFAULT_ENDPOINT = "https://api.xforce.ibmcloud.com";
    private static final String EXCHANGE_UI = "https://exchange.xforce.ibmcloud.com/url/";

    private final ReputationHttpClient httpClient;
    private final URI baseUri;

    public XForceAdapter(ReputationHttpClient httpClient, URI baseUri, CircuitBreaker circuitBreaker) {
        super(NAME, circuitBreaker);
        this.httpClient = httpClient;
        this.baseUri = baseUri;
    }

    public XForceAdapter(SourceContext context) {
        this(context.getHttpClient(), context.endpoint(NAME, DEFAULT_ENDPOINT), context.circuitBreaker(NAME));
    }

    @Override
    protected SourceQueryResult lookup(String domainName)
            throws IOException, InterruptedException, SourceLookupException {
        URI uri = URI.create(baseUri + "/url/" + domainName);
        Map<String, String> headers = Map.of(
                "Accept", "application/json, text/plain, */*",
                "x-ui", "XFE",
                "Origin", EXCHANGE_UI + domainName,
                "Referer", EXCHANGE_UI + domainName
        );

        HttpResponse<String> response = httpClient.get(uri, headers, null);
        if (response.statusCode() == 404) {
            return unknown();
        }
        requireSuccess(response);

        JsonNode result = parseJson(httpClient, response.body()).get("result");
        if (result == null || !result.isObject()) {
            throw new SourceLookupException(FailureType.UNEXPECTED_RESPONSE, "missing result object");
        }

        // cats maps category name to true
        List<String> categories = new ArrayList<>();
        result.path("cats").fieldNames().forEachRemaining(categories::add);
        return categories.isEmpty() ? uncategorized() : success(categories);
    }
}
