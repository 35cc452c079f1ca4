package fr.lapetina.domainreview.source.rest;

import fr.lapetina.domainreview.infrastructure.http.ReputationHttpClient;
import fr.lapetina.domainreview.support.FakeReputationServer;
import fr.lapetina.domainreview.support.FakeReputationServer.Reply;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class CymonIpReputationCheckerTest {

    private FakeReputationServer server;
    private ReputationHttpClient httpClient;

    @BeforeEach
    void setUp() throws Exception {
        server = FakeReputationServer.start()
                .on("GET", "/203.0.113.9", Reply.html("<h1>203.0.113.9</h1><p>malware, botnet</p>"))
                .on("GET", "/198.51.100.7", Reply.html("<h1>IP Not Found</h1>"));
        httpClient = new ReputationHttpClient("review-agent/1.0");
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    @DisplayName("should flag an address that has a reputation page")
    void shouldFlagListedAddress() throws Exception {
        CymonIpReputationChecker checker = new CymonIpReputationChecker(httpClient, server.baseUri());

        assertThat(checker.isFlagged("203.0.113.9")).isTrue();
    }

    @Test
    @DisplayName("should not flag an address Cymon does not know")
    void shouldNotFlagUnknownAddress() throws Exception {
        CymonIpReputationChecker checker = new CymonIpReputationChecker(httpClient, server.baseUri());

        assertThat(checker.isFlagged("198.51.100.7")).isFalse();
        assertThat(checker.isFlagged("192.0.2.1")).isFalse();
    }

    @Test
    @DisplayName("should not flag anything when the service is unreachable")
    void shouldNotFlagOnFailure() throws Exception {
        CymonIpReputationChecker checker = new CymonIpReputationChecker(httpClient, URI.create("http://127.0.0.1:1"));

        assertThat(checker.isFlagged("203.0.113.9")).isFalse();
    }
}
