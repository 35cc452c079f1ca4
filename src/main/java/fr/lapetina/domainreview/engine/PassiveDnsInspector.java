package fr.lapetina.domainreview.engine;

import fr.lapetina.domainreview.domain.model.DnsHealth;
import fr.lapetina.domainreview.domain.model.DnsResolution;
import fr.lapetina.domainreview.domain.model.FlaggedAddress;
import fr.lapetina.domainreview.source.IpReputationChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Correlates a domain's passive DNS history with the reputation of each address.
 */
public final class PassiveDnsInspector {

    private static final Logger log = LoggerFactory.getLogger(PassiveDnsInspector.class);

    private final IpReputationChecker ipReputation;

    public PassiveDnsInspector(IpReputationChecker ipReputation) {
        this.ipReputation = ipReputation;
    }

    /**
     * Checks each distinct address once. The first entry for an address supplies its last-seen date.
     */
    public DnsHealth inspect(String domainName, List<DnsResolution> resolutions) throws InterruptedException {
        Map<String, DnsResolution> distinct = new LinkedHashMap<>();
        for (DnsResolution resolution : resolutions) {
            distinct.putIfAbsent(resolution.ipAddress(), resolution);
        }

        List<FlaggedAddress> flagged = new ArrayList<>();
        for (DnsResolution resolution : distinct.values()) {
            if (ipReputation.isFlagged(resolution.ipAddress())) {
                flagged.add(new FlaggedAddress(resolution.ipAddress(), resolution.lastSeenDate()));
            }
        }

        if (flagged.isEmpty()) {
            log.debug("Passive DNS clean: domain={}, addresses={}", domainName, distinct.size());
            return DnsHealth.healthy();
        }
        DnsHealth health = DnsHealth.flagged(flagged);
        log.info("Passive DNS flagged: domain={}, addresses={}", domainName, health.labels());
        return health;
    }
}
