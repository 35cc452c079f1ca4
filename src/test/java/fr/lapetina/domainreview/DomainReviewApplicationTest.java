package fr.lapetina.domainreview;

import fr.lapetina.domainreview.domain.model.Domain;
import fr.lapetina.domainreview.domain.model.DomainReport;
import fr.lapetina.domainreview.integration.TestReviewEngineFactory;
import fr.lapetina.domainreview.support.FakeReputationServer;
import fr.lapetina.domainreview.support.FakeReputationServer.Reply;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class DomainReviewApplicationTest {

    @TempDir
    Path tempDir;

    private FakeReputationServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = FakeReputationServer.start()
                .on("GET", "/vtapi/v2/domain/report", Reply.json("{\"response_code\":1,\"categories\":[\"parked\"]}"))
                .on("GET", "/sb_api/query_lookup", Reply.json("{\"category\":null}"))
                .on("GET", "/webfilter", Reply.html("<html></html>"));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    @DisplayName("should run one pass over the inventory and export metrics")
    void shouldRunPassAndExportMetrics() throws Exception {
        Path textfile = tempDir.resolve("domain_review.prom");
        TestReviewEngineFactory factory = TestReviewEngineFactory.create(server,
                config -> config.getMetrics().setTextfilePath(textfile.toString()));

        Map<Domain, DomainReport> reports;
        try (DomainReviewApplication app = new DomainReviewApplication(factory)) {
            reports = app.run(() -> List.of(Domain.of("a.example"), Domain.of("b.example")));
        }

        assertThat(reports).hasSize(2);
        assertThat(reports.values()).noneMatch(DomainReport::isBurned);
        assertThat(Files.readString(textfile))
                .contains("review_test_verdicts_total")
                .contains("review_test_lookups_total");
    }

    @Test
    @DisplayName("should stop the pass when shutdown is requested")
    void shouldStopOnShutdownRequest() {
        AtomicReference<DomainReviewApplication> running = new AtomicReference<>();
        server.on("GET", "/vtapi/v2/domain/report", request -> {
            running.get().requestShutdown();
            return Reply.json("{\"response_code\":1,\"categories\":[\"parked\"]}");
        });
        TestReviewEngineFactory factory = TestReviewEngineFactory.create(server);

        try (DomainReviewApplication app = new DomainReviewApplication(factory)) {
            running.set(app);
            Map<Domain, DomainReport> reports = app.run(() -> List.of(Domain.of("a.example"), Domain.of("b.example")));

            assertThat(reports).doesNotContainKey(Domain.of("b.example"));
            assertThat(factory.getOrchestrator().isCancelled()).isTrue();
            assertThat(server.requests("GET", "/vtapi/v2/domain/report")).hasSize(1);
            assertThat(Thread.currentThread().isInterrupted()).isFalse();
        }
    }
}
