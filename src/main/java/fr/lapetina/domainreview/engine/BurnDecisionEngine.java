package fr.lapetina.domainreview.engine;

import fr.lapetina.domainreview.domain.model.BurnVerdict;
import fr.lapetina.domainreview.domain.model.DnsHealth;
import fr.lapetina.domainreview.domain.model.Domain;
import fr.lapetina.domainreview.domain.model.DomainReport;
import fr.lapetina.domainreview.domain.model.MalwareDomainList;
import fr.lapetina.domainreview.domain.model.SourceQueryResult;
import fr.lapetina.domainreview.domain.policy.BlacklistPolicy;
import fr.lapetina.domainreview.domain.policy.CategoryNormalizer;
import fr.lapetina.domainreview.source.PrimarySourceResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combines every signal gathered for a domain into a {@link DomainReport}.
 *
 * Rules run in a fixed order and can only burn a domain, never clear it; each rule that
 * fires appends its explanation. Failed lookups simply contribute nothing. Passive DNS
 * health is reported next to the verdict and does not burn the domain.
 */
public final class BurnDecisionEngine {

    public static final String MALWARE_LIST = "Flagged by malware domain list";
    public static final String DETECTED_SAMPLE = "Tied to a VirusTotal detected malware sample";
    public static final String DETECTED_URL = "Tied to a VirusTotal detected URL";
    public static final String BAD_CATEGORY = "Tagged with a bad category";

    private final BlacklistPolicy blacklistPolicy;
    private final CategoryNormalizer categoryNormalizer;
    private final PassiveDnsInspector dnsInspector;

    public BurnDecisionEngine(
            BlacklistPolicy blacklistPolicy,
            CategoryNormalizer categoryNormalizer,
            PassiveDnsInspector dnsInspector
    ) {
        this.blacklistPolicy = blacklistPolicy;
        this.categoryNormalizer = categoryNormalizer;
        this.dnsInspector = dnsInspector;
    }

    /**
     * Operators mark a domain healthy to clear a false positive; such domains are left alone.
     */
    public boolean requiresReview(Domain domain) {
        return !domain.isHealthy();
    }

    /**
     * @param primary      the primary source's report, possibly a failed one
     * @param otherResults answers of the category sources, in query order
     */
    public DomainReport evaluate(
            Domain domain,
            MalwareDomainList malwareDomains,
            PrimarySourceResult primary,
            List<SourceQueryResult> otherResults
    ) throws InterruptedException {
        Verdict verdict = new Verdict();

        if (malwareDomains.contains(domain.name())) {
            verdict.burn(MALWARE_LIST);
        }
        if (primary.hasDetectedSamples()) {
            verdict.burn(DETECTED_SAMPLE);
        }
        if (primary.hasDetectedUrls()) {
            verdict.burn(DETECTED_URL);
        }

        DnsHealth dnsHealth = primary.resolutions().isEmpty()
                ? DnsHealth.healthy()
                : dnsInspector.inspect(domain.name(), primary.resolutions());

        List<SourceQueryResult> results = new ArrayList<>();
        results.add(primary.result());
        results.addAll(otherResults);

        Set<String> categories = categoryNormalizer.aggregate(results);
        List<String> badCategories = blacklistPolicy.badCategories(categories);
        if (!badCategories.isEmpty()) {
            verdict.burn(BAD_CATEGORY);
        }

        Map<String, SourceQueryResult> bySource = new LinkedHashMap<>();
        for (SourceQueryResult result : results) {
            bySource.put(result.source(), result);
        }

        return new DomainReport(domain, verdict.toVerdict(dnsHealth), categories, badCategories, bySource);
    }

    /**
     * Accumulates explanations; there is no way back to not burned.
     */
    private static final class Verdict {
        private boolean burned;
        private final List<String> explanations = new ArrayList<>();

        void burn(String explanation) {
            burned = true;
            explanations.add(explanation);
        }

        BurnVerdict toVerdict(DnsHealth dnsHealth) {
            return new BurnVerdict(burned, explanations, dnsHealth);
        }
    }
}
