package fr.lapetina.domainreview.source.rest;

import fr.lapetina.domainreview.domain.model.DnsResolution;
import fr.lapetina.domainreview.domain.model.FailureType;
import fr.lapetina.domainreview.domain.model.QueryStatus;
import fr.lapetina.domainreview.engine.exception.MissingCredentialException;
import fr.lapetina.domainreview.infrastructure.http.CircuitBreaker;
import fr.lapetina.domainreview.infrastructure.http.ReputationHttpClient;
import fr.lapetina.domainreview.source.PrimarySourceResult;
import fr.lapetina.domainreview.support.FakeReputationServer;
import fr.lapetina.domainreview.support.FakeReputationServer.RecordedRequest;
import fr.lapetina.domainreview.support.FakeReputationServer.Reply;
import fr.lapetina.domainreview.support.Fixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VirusTotalAdapterTest {

    private static final String REPORT_PATH = "/vtapi/v2/domain/report";

    private static final String REPORT = Fixtures.read("virustotal-report.json");

    private FakeReputationServer server;
    private ReputationHttpClient httpClient;
    private VirusTotalAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        server = FakeReputationServer.start();
        httpClient = new ReputationHttpClient("review-agent/1.0");
        adapter = new VirusTotalAdapter(httpClient, server.baseUri(), "vt-key",
                new CircuitBreaker(VirusTotalAdapter.NAME, 5, Duration.ofMinutes(5)));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Nested
    @DisplayName("Reports")
    class ReportTests {

        @Test
        @DisplayName("should read categories, detections and passive DNS")
        void shouldReadReport() {
            server.on("GET", REPORT_PATH, Reply.json(REPORT));

            PrimarySourceResult report = adapter.lookupReport("Bad.Example");

            assertThat(report.result().status()).isEqualTo(QueryStatus.SUCCESS);
            assertThat(report.result().categories()).containsExactly("business and economy", "spam");
            assertThat(report.detectedUrlCount()).isEqualTo(1);
            assertThat(report.detectedSampleCount()).isZero();
            assertThat(report.resolutions()).containsExactly(
                    new DnsResolution("198.51.100.7", "2018-04-01 10:00:00"),
                    new DnsResolution("198.51.100.8", "2018-05-01 10:00:00"));
            assertThat(report.result().latency()).isNotNull();
        }

        @Test
        @DisplayName("should send the key and the lowercased domain")
        void shouldSendCredentials() {
            server.on("GET", REPORT_PATH, Reply.json(REPORT));

            adapter.lookupReport("Bad.Example");

            RecordedRequest request = server.requests("GET", REPORT_PATH).get(0);
            assertThat(request.query()).isEqualTo("apikey=vt-key&domain=bad.example");
        }

        @Test
        @DisplayName("should accept categories given as an array")
        void shouldReadArrayCategories() {
            server.on("GET", REPORT_PATH, Reply.json("{\"response_code\":1,\"categories\":[\"parked\",\"ads\"]}"));

            PrimarySourceResult report = adapter.lookupReport("a.example");

            assertThat(report.result().categories()).containsExactly("parked", "ads");
            assertThat(report.resolutions()).isEmpty();
        }

        @Test
        @DisplayName("should report a known domain without categories as uncategorized")
        void shouldReportUncategorized() {
            server.on("GET", REPORT_PATH, Reply.json("{\"response_code\":1,\"categories\":{}}"));

            assertThat(adapter.lookupReport("a.example").result().status()).isEqualTo(QueryStatus.UNCATEGORIZED);
        }

        @Test
        @DisplayName("should report a domain outside the dataset as unknown")
        void shouldReportUnknown() {
            server.on("GET", REPORT_PATH, Reply.json("{\"response_code\":0,\"verbose_msg\":\"not found\"}"));

            PrimarySourceResult report = adapter.lookupReport("a.example");

            assertThat(report.result().status()).isEqualTo(QueryStatus.UNKNOWN);
            assertThat(report.hasDetectedUrls()).isFalse();
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("should report an exhausted quota as rate limited")
        void shouldReportRateLimit() {
            server.on("GET", REPORT_PATH, Reply.status(204));

            PrimarySourceResult report = adapter.lookupReport("a.example");

            assertThat(report.result().failureType()).isEqualTo(FailureType.RATE_LIMITED);
            assertThat(report.result().diagnostic()).isEqualTo("request rate limit exceeded");
            assertThat(report.resolutions()).isEmpty();
        }

        @Test
        @DisplayName("should report a rejected key as an HTTP failure")
        void shouldReportRejectedKey() {
            server.on("GET", REPORT_PATH, Reply.status(403));

            assertThat(adapter.lookupReport("a.example").result().failureType()).isEqualTo(FailureType.HTTP_STATUS);
        }

        @Test
        @DisplayName("should report malformed JSON as an unexpected response")
        void shouldReportMalformedJson() {
            server.on("GET", REPORT_PATH, Reply.html("<html>maintenance</html>"));

            assertThat(adapter.query("a.example").failureType()).isEqualTo(FailureType.UNEXPECTED_RESPONSE);
        }

        @Test
        @DisplayName("should refuse to run without an API key")
        void shouldRequireKey() {
            VirusTotalAdapter keyless = new VirusTotalAdapter(httpClient, server.baseUri(), " ",
                    new CircuitBreaker(VirusTotalAdapter.NAME, 5, Duration.ofMinutes(5)));

            assertThatThrownBy(keyless::checkPreconditions)
                    .isInstanceOf(MissingCredentialException.class)
                    .hasMessageContaining("virustotal");
            assertThatCode(adapter::checkPreconditions).doesNotThrowAnyException();
            assertThat(server.requests()).isEmpty();
        }
    }
}
