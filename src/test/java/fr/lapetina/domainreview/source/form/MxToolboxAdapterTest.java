package fr.lapetina.domainreview.source.form;

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
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MxToolboxAdapterTest {

    private static final String PATH = MxToolboxAdapter.TOOL_PATH;

    private static final String FORM_PAGE = "<html><body><form method=\"post\">"
            + "<input type=\"hidden\" name=\"__VIEWSTATE\" value=\"vs-1\" />"
            + "<input type=\"hidden\" name=\"__VIEWSTATEGENERATOR\" value=\"gen-1\" />"
            + "<input type=\"hidden\" name=\"__EVENTVALIDATION\" value=\"ev-1\" />"
            + "</form></body></html>";

    private FakeReputationServer server;
    private MxToolboxAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        server = FakeReputationServer.start()
                .on("GET", PATH, Reply.html(FORM_PAGE).withHeader("Set-Cookie", "ASP.NET_SessionId=s-42; path=/; HttpOnly"));
        adapter = new MxToolboxAdapter(new ReputationHttpClient("review-agent/1.0"), server.baseUri(),
                new CircuitBreaker(MxToolboxAdapter.NAME, 5, Duration.ofMinutes(5)));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private void answerPostback(String resultDivs) {
        server.on("POST", PATH, Reply.html("<html><body>" + resultDivs + "</body></html>"));
    }

    @Test
    @DisplayName("should report a clean domain as a success without categories")
    void shouldReportNoIssues() {
        answerPostback("<div id=\"ctl00_ContentPlaceHolder1_noIssuesFound\">No issues</div>");

        SourceQueryResult result = adapter.query("a.example");

        assertThat(result.status()).isEqualTo(QueryStatus.SUCCESS);
        assertThat(result.categories()).isEmpty();
        assertThat(result.diagnostic()).isEqualTo(MxToolboxAdapter.NO_ISSUES);
    }

    @Test
    @DisplayName("should report each list that has issues")
    void shouldReportIssues() {
        answerPostback("<div id=\"ctl00_ContentPlaceHolder1_googleSafeBrowsingIssuesFound\">x</div>"
                + "<div id=\"ctl00_ContentPlaceHolder1_phishTankIssuesFound\">y</div>");

        SourceQueryResult result = adapter.query("a.example");

        assertThat(result.categories()).containsExactly(
                MxToolboxAdapter.SAFE_BROWSING_ISSUES, MxToolboxAdapter.PHISHTANK_ISSUES);
    }

    @Test
    @DisplayName("should echo the session cookie and form tokens in the postback")
    void shouldEchoSessionState() {
        answerPostback("<div id=\"ctl00_ContentPlaceHolder1_noIssuesFound\"></div>");

        adapter.query("a.example");

        RecordedRequest postback = server.requests("POST", PATH).get(0);
        assertThat(postback.cookie()).contains("ASP.NET_SessionId=s-42");
        assertThat(postback.body())
                .contains("__VIEWSTATE=vs-1")
                .contains("__VIEWSTATEGENERATOR=gen-1")
                .contains("__EVENTVALIDATION=ev-1")
                .contains("ctl00%24ContentPlaceHolder1%24brandReputationUrl=a.example");
    }

    @Test
    @DisplayName("should start every domain with a fresh session")
    void shouldNotLeakSessionAcrossDomains() {
        answerPostback("<div id=\"ctl00_ContentPlaceHolder1_noIssuesFound\"></div>");

        adapter.query("a.example");
        adapter.query("b.example");

        List<RecordedRequest> formLoads = server.requests("GET", PATH);
        assertThat(formLoads).hasSize(2);
        assertThat(formLoads).allSatisfy(request -> assertThat(request.cookie()).isEmpty());
    }

    @Test
    @DisplayName("should fail when the form tokens are missing")
    void shouldFailWithoutTokens() {
        server.on("GET", PATH, Reply.html("<html><body>Temporarily unavailable</body></html>"));

        SourceQueryResult result = adapter.query("a.example");

        assertThat(result.failureType()).isEqualTo(FailureType.UNEXPECTED_RESPONSE);
        assertThat(server.requests("POST", PATH)).isEmpty();
    }

    @Test
    @DisplayName("should fail when the result page has no known verdict")
    void shouldFailOnUnknownResultPage() {
        answerPostback("<p>Something changed</p>");

        assertThat(adapter.query("a.example").failureType()).isEqualTo(FailureType.UNEXPECTED_RESPONSE);
    }
}
