package fr.lapetina.domainreview.source.html;

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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fortinet FortiGuard web filter lookup.
 * The category is read from the {@code og:description} meta tag of the lookup page.
 */
public final class FortiguardAdapter extends AbstractSourceAdapter {

    public static final String NAME = "fortiguard";
    static final String DEFAULT_ENDPOINT = "https://fortiguard.com";

    private static final Pattern CATEGORY = Pattern.compile("Category: (.*?)\" />", Pattern.DOTALL);

    private final ReputationHttpClient httpClient;
    private final URI baseUri;

    public FortiguardAdapter(ReputationHttpClient httpClient, URI baseUri, CircuitBreaker circuitBreaker) {
        super(NAME, circuitBreaker);
        this.httpClient = httpClient;
        this.baseUri = baseUri;
    }

    public FortiguardAdapter(SourceContext context) {
        this(context.getHttpClient(), context.endpoint(NAME, DEFAULT_ENDPOINT), context.circuitBreaker(NAME));
    }

    @Override
    protected SourceQueryResult lookup(String domainName)
            throws IOException, InterruptedException, SourceLookupException {
        URI uri = URI.create(baseUri + "/webfilter?q=" + URLEncoder.encode(domainName, StandardCharsets.UTF_8));
        Map<String, String> headers = Map.of(
                "Origin", baseUri.toString(),
                "Referer", baseUri + "/webfilter"
        );

        HttpResponse<String> response = httpClient.get(uri, headers, null);
        requireSuccess(response);

        Matcher matcher = CATEGORY.matcher(response.body());
        if (!matcher.find() || matcher.group(1).isBlank()) {
            return uncategorized();
        }
        return success(List.of(matcher.group(1).trim()));
    }
}
