package fr.lapetina.domainreview.source.rest;

import fr.lapetina.domainreview.domain.model.FailureType;
import fr.lapetina.domainreview.domain.model.QueryStatus;
import fr.lapetina.domainreview.domain.model.SourceQueryResult;
import fr.lapetina.domainreview.infrastructure.http.CircuitBreaker;
import fr.lapetina.domainreview.infrastructure.http.ReputationHttpClient;
import fr.lapetina.domainreview.support.FakeReputationServer;
import fr.lapetina.domainreview.support.FakeReputationServer.RecordedRequest;
import fr.lapetina.domainreview.support.FakeReputationServer.Reply;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class XForceAdapterTest {

    private FakeReputationServer server;
    private XForceAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        server = FakeReputationServer.start();
        adapter = new XForceAdapter(new ReputationHttpClient("review-agent/1.0"), server.baseUri(),
                new CircuitBreaker(XForceAdapter.NAME, 5, Duration.ofMinutes(5)));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    @DisplayName("should read category names from the cats object")
    void shouldReadCategories() {
        server.on("GET", "/url/a.example", Reply.json(
                "{\"result\":{\"url\":\"a.example\",\"cats\":{\"Spam URLs\":true,\"Gambling\":true},\"score\":5}}"));

        SourceQueryResult result = adapter.query("a.example");

        assertThat(result.status()).isEqualTo(QueryStatus.SUCCESS);
        assertThat(result.categories()).containsExactly("Spam URLs", "Gambling");
    }

    @Test
    @DisplayName("should present itself as the exchange web UI")
    void shouldSendUiHeaders() {
        server.on("GET", "/url/a.example", Reply.json("{\"result\":{\"cats\":{}}}"));

        adapter.query("a.example");

        RecordedRequest request = server.requests("GET", "/url/a.example").get(0);
        assertThat(request.header("x-ui")).isEqualTo("XFE");
        assertThat(request.header("Referer")).isEqualTo("https://exchange.xforce.ibmcloud.com/url/a.example");
    }

    @Test
    @DisplayName("should report an empty cats object as uncategorized")
    void shouldReportUncategorized() {
        server.on("GET", "/url/a.example", Reply.json("{\"result\":{\"cats\":{}}}"));

        assertThat(adapter.query("a.example").status()).isEqualTo(QueryStatus.UNCATEGORIZED);
    }

    @Test
    @DisplayName("should report a never-seen domain as unknown")
    void shouldReportUnknownOnNotFound() {
        server.on("GET", "/url/a.example", Reply.json(404, "{\"error\":\"Not found.\"}"));

        SourceQueryResult result = adapter.query("a.example");

        assertThat(result.status()).isEqualTo(QueryStatus.UNKNOWN);
        assertThat(result.isFailed()).isFalse();
    }

    @Test
    @DisplayName("should fail when the result object is missing")
    void shouldFailWithoutResult() {
        server.on("GET", "/url/a.example", Reply.json("{\"error\":\"Not authorized.\"}"));

        SourceQueryResult result = adapter.query("a.example");

        assertThat(result.failureType()).isEqualTo(FailureType.UNEXPECTED_RESPONSE);
        assertThat(result.diagnostic()).isEqualTo("missing result object");
    }
}
