package fr.lapetina.domainreview.source.form;

import fr.lapetina.domainreview.domain.model.FailureType;
import fr.lapetina.domainreview.domain.model.SourceQueryResult;
import fr.lapetina.domainreview.infrastructure.http.CircuitBreaker;
import fr.lapetina.domainreview.infrastructure.http.ReputationHttpClient;
import fr.lapetina.domainreview.infrastructure.http.SessionContext;
import fr.lapetina.domainreview.source.AbstractSourceAdapter;
import fr.lapetina.domainreview.source.SourceContext;
import fr.lapetina.domainreview.source.SourceLookupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Forcepoint (Websense) ThreatSeeker lookup on the CSI portal.
 *
 * Lookups are limited per client address and day. The home page shows the remaining
 * allowance, checked before every submission.
 */
public final class WebsenseAdapter extends AbstractSourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(WebsenseAdapter.class);

    public static final String NAME = "websense";
    static final String DEFAULT_ENDPOINT = "http://csi.websense.com";

    private static final Pattern REMAINING = Pattern.compile("reports\">(.*?) report", Pattern.DOTALL);
    private static final Pattern ACTION_CELL = Pattern.compile("<td class=\"classAction\">(.*?)</td>", Pattern.DOTALL);
    private static final int CATEGORY_CELL = 4;

    private final ReputationHttpClient httpClient;
    private final URI baseUri;

    public WebsenseAdapter(ReputationHttpClient httpClient, URI baseUri, CircuitBreaker circuitBreaker) {
        super(NAME, circuitBreaker);
        this.httpClient = httpClient;
        this.baseUri = baseUri;
    }

    public WebsenseAdapter(SourceContext context) {
        this(context.getHttpClient(), context.endpoint(NAME, DEFAULT_ENDPOINT), context.circuitBreaker(NAME));
    }

    @Override
    protected SourceQueryResult lookup(String domainName)
            throws IOException, InterruptedException, SourceLookupException {
        URI home = URI.create(baseUri + "/");
        SessionContext session = new SessionContext(NAME + ":" + domainName);

        HttpResponse<String> homePage = httpClient.get(home, Map.of(), session);
        requireSuccess(homePage);
        int remaining = remainingLookups(homePage.body());
        log.debug("Websense allowance: remaining={}", remaining);
        if (remaining <= 0) {
            throw new SourceLookupException(FailureType.QUOTA_EXHAUSTED, "no lookups remaining for today");
        }

        HttpResponse<String> response = httpClient.postForm(home, Map.of(), Map.of("LookupUrl", domainName), session);
        requireSuccess(response);

        List<String> cells = new ArrayList<>();
        Matcher matcher = ACTION_CELL.matcher(response.body());
        while (matcher.find()) {
            cells.add(matcher.group(1).trim());
        }
        if (cells.size() <= CATEGORY_CELL || cells.get(CATEGORY_CELL).isEmpty()) {
            return uncategorized();
        }
        return success(List.of(cells.get(CATEGORY_CELL)));
    }

    static int remainingLookups(String homePage) throws SourceLookupException {
        Matcher matcher = REMAINING.matcher(homePage);
        if (!matcher.find()) {
            throw SourceLookupException.unexpectedPage();
        }
        try {
            return Integer.parseInt(matcher.group(1).trim());
        } catch (NumberFormatException e) {
            throw new SourceLookupException(FailureType.UNEXPECTED_RESPONSE,
                    "unreadable lookup allowance: " + matcher.group(1).trim(), e);
        }
    }
}
