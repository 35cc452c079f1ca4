package fr.lapetina.domainreview.infrastructure.feed;

import fr.lapetina.domainreview.domain.model.MalwareDomainList;
import fr.lapetina.domainreview.infrastructure.http.ReputationHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpResponse;
import java.util.Map;

/**
 * Downloads the malware-domain list once per pass.
 *
 * An unreachable mirror is not fatal: the pass continues without the list and the
 * other signals still decide the verdicts.
 */
public class MalwareDomainFeed {

    private static final Logger log = LoggerFactory.getLogger(MalwareDomainFeed.class);

    private final ReputationHttpClient httpClient;
    private final URI feedUri;

    public MalwareDomainFeed(ReputationHttpClient httpClient, URI feedUri) {
        this.httpClient = httpClient;
        this.feedUri = feedUri;
    }

    public MalwareDomainList download() {
        try {
            HttpResponse<String> response = httpClient.get(feedUri, Map.of(), null);
            if (response.statusCode() != 200) {
                log.warn("Malware domain feed unavailable: uri={}, status={}", feedUri, response.statusCode());
                return MalwareDomainList.unavailable();
            }
            MalwareDomainList list = MalwareDomainList.parse(response.body());
            log.info("Malware domain feed loaded: uri={}, domains={}", feedUri, list.size());
            return list;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Malware domain feed download interrupted: uri={}", feedUri);
            return MalwareDomainList.unavailable();
        } catch (IOException | RuntimeException e) {
            log.warn("Malware domain feed unreachable: uri={}, error={}", feedUri, e.getMessage());
            return MalwareDomainList.unavailable();
        }
    }

    public URI getFeedUri() {
        return feedUri;
    }
}
