package fr.lapetina.domainreview.source.rest;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.domainreview.domain.model.DnsResolution;
import fr.lapetina.domainreview.domain.model.FailureType;
import fr.lapetina.domainreview.domain.model.SourceQueryResult;
import fr.lapetina.domainreview.engine.exception.MissingCredentialException;
import fr.lapetina.domainreview.infrastructure.http.CircuitBreaker;
import fr.lapetina.domainreview.infrastructure.http.ReputationHttpClient;
import fr.lapetina.domainreview.source.AbstractSourceAdapter;
import fr.lapetina.domainreview.source.PrimarySourceAdapter;
import fr.lapetina.domainreview.source.PrimarySourceResult;
import fr.lapetina.domainreview.source.SourceContext;
import fr.lapetina.domainreview.source.SourceLookupException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Primary source: the VirusTotal v2 domain report.
 *
 * One authenticated GET per domain. The API is case sensitive, so names are lowercased.
 * The public API allows about four requests a minute; pacing is the orchestrator's job.
 *
 * @see <a href="https://developers.virustotal.com/v2.0/reference#domain-report">domain/report</a>
 */
public final class VirusTotalAdapter extends AbstractSourceAdapter implements PrimarySourceAdapter {

    public static final String NAME = "virustotal";
    static final String DEFAULT_ENDPOINT = "https://www.virustotal.com";

    private final ReputationHttpClient httpClient;
    private final URI baseUri;
    private final String apiKey;

    public VirusTotalAdapter(
            ReputationHttpClient httpClient,
            URI baseUri,
            String apiKey,
            CircuitBreaker circuitBreaker
    ) {
        super(NAME, circuitBreaker);
        this.httpClient = httpClient;
        this.baseUri = baseUri;
        this.apiKey = apiKey;
    }

    public VirusTotalAdapter(SourceContext context) {
        this(context.getHttpClient(),
                context.endpoint(NAME, DEFAULT_ENDPOINT),
                context.getConfig().getVirustotalApiKey(),
                context.circuitBreaker(NAME));
    }

    @Override
    public void checkPreconditions() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new MissingCredentialException(NAME);
        }
    }

    @Override
    public PrimarySourceResult lookupReport(String domainName) {
        return guarded(domainName, () -> fetchReport(domainName),
                PrimarySourceResult::result, PrimarySourceResult::of);
    }

    @Override
    protected SourceQueryResult lookup(String domainName)
            throws IOException, InterruptedException, SourceLookupException {
        return fetchReport(domainName).result();
    }

    private PrimarySourceResult fetchReport(String domainName)
            throws IOException, InterruptedException, SourceLookupException {
        if (apiKey == null || apiKey.isBlank()) {
            throw new SourceLookupException(FailureType.INTERNAL, "no API key configured");
        }

        URI uri = URI.create(baseUri + "/vtapi/v2/domain/report?apikey=" + encode(apiKey)
                + "&domain=" + encode(domainName.toLowerCase(Locale.ROOT)));
        HttpResponse<String> response = httpClient.get(uri, Map.of("Accept", "application/json"), null);

        // v2 answers 204 with an empty body once the quota is used up
        if (response.statusCode() == 204) {
            throw new SourceLookupException(FailureType.RATE_LIMITED, "request rate limit exceeded");
        }
        if (response.statusCode() == 403) {
            throw new SourceLookupException(FailureType.HTTP_STATUS, "API key rejected (HTTP 403)");
        }
        requireSuccess(response);

        JsonNode root = parseJson(httpClient, response.body());

        // response_code 0: the domain is not in the dataset
        if (root.path("response_code").asInt(1) == 0) {
            return PrimarySourceResult.of(unknown());
        }

        List<String> categories = readCategories(root.get("categories"));
        SourceQueryResult result = categories.isEmpty() ? uncategorized() : success(categories);

        return new PrimarySourceResult(
                result,
                root.path("detected_downloaded_samples").size(),
                root.path("detected_urls").size(),
                readResolutions(root.path("resolutions"))
        );
    }

    /**
     * Accepts both shapes seen in the wild: a provider-to-label object and a plain array.
     */
    static List<String> readCategories(JsonNode node) {
        List<String> categories = new ArrayList<>();
        if (node == null || node.isNull()) {
            return categories;
        }
        Iterator<JsonNode> values = node.isObject() ? node.elements() : node.iterator();
        while (values.hasNext()) {
            JsonNode value = values.next();
            if (value.isTextual() && !value.asText().isBlank()) {
                categories.add(value.asText().trim());
            }
        }
        return categories;
    }

    static List<DnsResolution> readResolutions(JsonNode node) {
        List<DnsResolution> resolutions = new ArrayList<>();
        for (JsonNode entry : node) {
            String ip = entry.path("ip_address").asText("");
            if (!ip.isBlank()) {
                resolutions.add(new DnsResolution(ip, entry.path("last_resolved").asText("")));
            }
        }
        return resolutions;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
