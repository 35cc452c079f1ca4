package fr.lapetina.domainreview.source.rest;

import fr.lapetina.domainreview.infrastructure.http.ReputationHttpClient;
import fr.lapetina.domainreview.source.IpReputationChecker;
import fr.lapetina.domainreview.source.SourceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpResponse;
import java.util.Map;

/**
 * IP reputation from Cymon: an address is flagged when Cymon has a page for it.
 * Any failure counts as not flagged, so an outage never flags DNS on its own. An interrupt
 * is not a failure and propagates.
 */
public final class CymonIpReputationChecker implements IpReputationChecker {

    private static final Logger log = LoggerFactory.getLogger(CymonIpReputationChecker.class);

    public static final String NAME = "cymon";
    static final String DEFAULT_ENDPOINT = "https://cymon.io";
    private static final String NOT_FOUND_MARKER = "IP Not Found";

    private final ReputationHttpClient httpClient;
    private final URI baseUri;

    public CymonIpReputationChecker(ReputationHttpClient httpClient, URI baseUri) {
        this.httpClient = httpClient;
        this.baseUri = baseUri;
    }

    public CymonIpReputationChecker(SourceContext context) {
        this(context.getHttpClient(), context.endpoint(NAME, DEFAULT_ENDPOINT));
    }

    @Override
    public boolean isFlagged(String ipAddress) throws InterruptedException {
        try {
            HttpResponse<String> response = httpClient.get(URI.create(baseUri + "/" + ipAddress), Map.of(), null);
            boolean flagged = response.statusCode() == 200 && !response.body().contains(NOT_FOUND_MARKER);
            log.debug("IP reputation checked: ip={}, status={}, flagged={}", ipAddress, response.statusCode(), flagged);
            return flagged;
        } catch (IOException | RuntimeException e) {
            log.warn("IP reputation lookup failed: ip={}, error={}", ipAddress, e.getMessage());
            return false;
        }
    }
}
