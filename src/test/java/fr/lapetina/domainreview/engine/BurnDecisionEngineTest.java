package fr.lapetina.domainreview.engine;

import fr.lapetina.domainreview.domain.model.DnsResolution;
import fr.lapetina.domainreview.domain.model.Domain;
import fr.lapetina.domainreview.domain.model.DomainReport;
import fr.lapetina.domainreview.domain.model.FailureType;
import fr.lapetina.domainreview.domain.model.HealthStatus;
import fr.lapetina.domainreview.domain.model.MalwareDomainList;
import fr.lapetina.domainreview.domain.model.SourceQueryResult;
import fr.lapetina.domainreview.domain.policy.BlacklistPolicy;
import fr.lapetina.domainreview.domain.policy.CategoryNormalizer;
import fr.lapetina.domainreview.source.PrimarySourceResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;

class BurnDecisionEngineTest {

    private static final Domain DOMAIN = Domain.of("example.com");

    private Set<String> flaggedIps;
    private Set<String> checkedIps;
    private BurnDecisionEngine engine;

    @BeforeEach
    void setUp() {
        flaggedIps = ConcurrentHashMap.newKeySet();
        checkedIps = ConcurrentHashMap.newKeySet();
        engine = new BurnDecisionEngine(
                new BlacklistPolicy(),
                new CategoryNormalizer(),
                new PassiveDnsInspector(ip -> {
                    checkedIps.add(ip);
                    return flaggedIps.contains(ip);
                })
        );
    }

    private static PrimarySourceResult primary(SourceQueryResult result, int samples, int urls,
                                               List<DnsResolution> resolutions) {
        return new PrimarySourceResult(result, samples, urls, resolutions);
    }

    private static SourceQueryResult vtCategories(String... categories) {
        return SourceQueryResult.success("virustotal", List.of(categories));
    }

    @Test
    @DisplayName("should burn a domain tied to a detected URL and keep DNS healthy")
    void shouldBurnOnDetectedUrl() throws Exception {
        DomainReport report = engine.evaluate(DOMAIN, MalwareDomainList.of(List.of()),
                primary(vtCategories("Business"), 0, 1, List.of()), List.of());

        assertThat(report.isBurned()).isTrue();
        assertThat(report.verdict().explanations()).containsExactly(BurnDecisionEngine.DETECTED_URL);
        assertThat(report.verdict().explanation()).contains("URL");
        assertThat(report.verdict().dnsHealth().isHealthy()).isTrue();
    }

    @Test
    @DisplayName("should burn a listed malware domain even when every source failed")
    void shouldBurnListedDomainWhenAllSourcesFail() throws Exception {
        DomainReport report = engine.evaluate(DOMAIN, MalwareDomainList.of(List.of("example.com")),
                PrimarySourceResult.of(SourceQueryResult.failed("virustotal", FailureType.NETWORK, "refused")),
                List.of(SourceQueryResult.failed("talos", FailureType.TIMEOUT, "timeout"),
                        SourceQueryResult.failed("xforce", FailureType.HTTP_STATUS, "HTTP 500")));

        assertThat(report.isBurned()).isTrue();
        assertThat(report.verdict().explanations()).containsExactly(BurnDecisionEngine.MALWARE_LIST);
        assertThat(report.categories()).isEmpty();
        assertThat(report.categoryBreakdown()).containsOnlyKeys("virustotal", "talos", "xforce");
        assertThat(report.categoryBreakdown().values()).allMatch(List::isEmpty);
    }

    @Test
    @DisplayName("should report but not burn when all sources fail and nothing else fires")
    void shouldNotBurnWhenAllSourcesFailWithoutSignals() throws Exception {
        DomainReport report = engine.evaluate(DOMAIN, MalwareDomainList.unavailable(),
                PrimarySourceResult.of(SourceQueryResult.failed("virustotal", FailureType.RATE_LIMITED, "quota")),
                List.of(SourceQueryResult.failed("talos", FailureType.NETWORK, "refused")));

        assertThat(report.isBurned()).isFalse();
        assertThat(report.verdict().explanations()).isEmpty();
        assertThat(report.failedSources()).containsOnlyKeys("virustotal", "talos");
    }

    @Test
    @DisplayName("should accumulate explanations in rule order without ever clearing the burn")
    void shouldAccumulateExplanations() throws Exception {
        DomainReport report = engine.evaluate(DOMAIN, MalwareDomainList.of(List.of("example.com")),
                primary(vtCategories("Business"), 2, 3, List.of()),
                List.of(SourceQueryResult.success("talos", List.of("Phishing"))));

        assertThat(report.isBurned()).isTrue();
        assertThat(report.verdict().explanations()).containsExactly(
                BurnDecisionEngine.MALWARE_LIST,
                BurnDecisionEngine.DETECTED_SAMPLE,
                BurnDecisionEngine.DETECTED_URL,
                BurnDecisionEngine.BAD_CATEGORY
        );
    }

    @Test
    @DisplayName("should burn on a bad category from any source, matched case-insensitively")
    void shouldBurnOnBadCategory() throws Exception {
        DomainReport report = engine.evaluate(DOMAIN, MalwareDomainList.unavailable(),
                primary(vtCategories("Business"), 0, 0, List.of()),
                List.of(SourceQueryResult.success("xforce", List.of("SPAM", "Business")),
                        SourceQueryResult.uncategorized("talos")));

        assertThat(report.isBurned()).isTrue();
        assertThat(report.verdict().explanations()).containsExactly(BurnDecisionEngine.BAD_CATEGORY);
        assertThat(report.badCategories()).containsExactly("Spam");
        assertThat(report.categories()).containsExactly("Business", "SPAM");
    }

    @Test
    @DisplayName("should flag DNS from the passive history without burning")
    void shouldFlagDnsWithoutBurning() throws Exception {
        flaggedIps.add("1.2.3.4");

        DomainReport report = engine.evaluate(DOMAIN, MalwareDomainList.unavailable(),
                primary(vtCategories("Business"), 0, 0, List.of(
                        new DnsResolution("1.2.3.4", "2020-01-01 00:00:00"),
                        new DnsResolution("5.6.7.8", "2019-06-01 12:00:00"))),
                List.of());

        assertThat(report.isBurned()).isFalse();
        assertThat(report.verdict().dnsHealth().labels()).containsExactly("1.2.3.4/2020-01-01");
        assertThat(report.resultingStatus()).isEqualTo(HealthStatus.FLAGGED_DNS);
        assertThat(checkedIps).containsExactlyInAnyOrder("1.2.3.4", "5.6.7.8");
    }

    @Test
    @DisplayName("should not query IP reputation when there is no passive DNS history")
    void shouldSkipIpChecksWithoutHistory() throws Exception {
        engine.evaluate(DOMAIN, MalwareDomainList.unavailable(),
                primary(vtCategories(), 0, 0, List.of()), List.of());

        assertThat(checkedIps).isEmpty();
    }

    @Test
    @DisplayName("should keep the primary source first in the breakdown")
    void shouldKeepPrimaryFirst() throws Exception {
        DomainReport report = engine.evaluate(DOMAIN, MalwareDomainList.unavailable(),
                primary(vtCategories("Ads"), 0, 0, List.of()),
                List.of(SourceQueryResult.success("opendns", List.of("ads", "Blogs"))));

        assertThat(report.sourceResults().keySet()).containsExactly("virustotal", "opendns");
        assertThat(report.categories()).containsExactly("Ads", "Blogs");
    }

    @Test
    @DisplayName("should leave healthy domains out of review")
    void shouldNotReviewHealthyDomains() {
        assertThat(engine.requiresReview(new Domain("ok.example", HealthStatus.HEALTHY))).isFalse();
        assertThat(engine.requiresReview(new Domain("old.example", HealthStatus.BURNED))).isTrue();
        assertThat(engine.requiresReview(Domain.of("new.example"))).isTrue();
    }
}
