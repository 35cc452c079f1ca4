package fr.lapetina.domainreview.source.rest;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.domainreview.domain.model.SourceQueryResult;
import fr.lapetina.domainreview.infrastructure.http.CircuitBreaker;
import fr.lapetina.domainreview.infrastructure.http.ReputationHttpClient;
import fr.lapetina.domainreview.source.AbstractSourceAdapter;
import fr.lapetina.domainreview.source.SourceContext;
import fr.lapetina.domainreview.source.SourceLookupException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Cisco Talos reputation center, through the JSON endpoint its lookup page calls.
 * The endpoint checks the Referer, so the request mimics the lookup page.
 */
public final class TalosAdapter extends AbstractSourceAdapter {

    public static final String NAME = "talos";
    static final String DEFAULT_ENDPOINT = "https://talosintelligence.com";

    private final ReputationHttpClient httpClient;
    private final URI baseUri;

    public TalosAdapter(ReputationHttpClient httpClient, URI baseUri, CircuitBreaker circuitBreaker) {
        super(NAME, circuitBreaker);
        this.httpClient = httpClient;
        this.baseUri = baseUri;
    }

    public TalosAdapter(SourceContext context) {
        this(context.getHttpClient(), context.endpoint(NAME, DEFAULT_ENDPOINT), context.circuitBreaker(NAME));
    }

    @Override
    protected SourceQueryResult lookup(String domainName)
            throws IOException, InterruptedException, SourceLookupException {
        String query = URLEncoder.encode(domainName, StandardCharsets.UTF_8);
        URI uri = URI.create(baseUri + "/sb_api/query_lookup"
                + "?query=%2Fapi%2Fv2%2Fdetails%2Fdomain%2F&query_entry=" + query + "&offset=0&order=ip+asc");
        Map<String, String> headers = Map.of(
                "Referer", baseUri + "/reputation_center/lookup?search=" + query
        );

        HttpResponse<String> response = httpClient.get(uri, headers, null);
        requireSuccess(response);

        JsonNode category = parseJson(httpClient, response.body()).get("category");
        if (category == null || category.isNull()) {
            return uncategorized();
        }
        String description = category.path("description").asText("");
        if (description.isBlank()) {
            return uncategorized();
        }
        return success(List.of(description.trim()));
    }
}
