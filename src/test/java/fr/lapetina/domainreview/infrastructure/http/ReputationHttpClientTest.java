package fr.lapetina.domainreview.infrastructure.http;

import fr.lapetina.domainreview.support.FakeReputationServer;
import fr.lapetina.domainreview.support.FakeReputationServer.RecordedRequest;
import fr.lapetina.domainreview.support.FakeReputationServer.Reply;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ReputationHttpClientTest {

    private FakeReputationServer server;
    private ReputationHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = FakeReputationServer.start()
                .on("GET", "/form", Reply.html("<form/>").withHeader("Set-Cookie", "sid=abc123; Path=/"))
                .on("POST", "/form", Reply.html("ok"))
                .on("POST", "/api", Reply.json("{\"ok\":true}"));
        client = new ReputationHttpClient("review-agent/1.0");
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.close();
    }

    private URI uri(String path) {
        return URI.create(server.baseUrl() + path);
    }

    @Nested
    @DisplayName("Sessions")
    class SessionTests {

        @Test
        @DisplayName("should send back cookies received earlier in the same session")
        void shouldReplayCookiesWithinSession() throws Exception {
            SessionContext session = new SessionContext("mxtoolbox:a.example");

            client.get(uri("/form"), Map.of(), session);
            client.postForm(uri("/form"), Map.of(), Map.of("q", "a.example"), session);

            RecordedRequest post = server.requests("POST", "/form").get(0);
            assertThat(post.cookie()).contains("sid=abc123");
            assertThat(session.cookieCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should not send cookies on stateless requests")
        void shouldNotKeepCookiesWithoutSession() throws Exception {
            client.get(uri("/form"), Map.of(), null);
            client.postForm(uri("/form"), Map.of(), Map.of("q", "a.example"), null);

            assertThat(server.requests("POST", "/form").get(0).cookie()).isEmpty();
        }

        @Test
        @DisplayName("should not leak cookies from one session into another")
        void shouldIsolateSessions() throws Exception {
            SessionContext first = new SessionContext("mxtoolbox:a.example");
            SessionContext second = new SessionContext("mxtoolbox:b.example");

            client.get(uri("/form"), Map.of(), first);
            client.postForm(uri("/form"), Map.of(), Map.of("q", "b.example"), second);

            assertThat(server.requests("POST", "/form").get(0).cookie()).isEmpty();
            assertThat(second.cookieCount()).isZero();
        }

        @Test
        @DisplayName("should keep cookies set on a redirect response")
        void shouldKeepCookiesSetOnRedirect() throws Exception {
            server.on("GET", "/", Reply.redirect("/index.php").withHeader("Set-Cookie", "sid=abc; Path=/"))
                    .on("GET", "/index.php", Reply.html("<form/>"))
                    .on("POST", "/result.php", Reply.html("ok"));
            SessionContext session = new SessionContext("trendmicro:a.example");

            HttpResponse<String> landing = client.get(uri("/"), Map.of(), session);
            client.postForm(uri("/result.php"), Map.of(), Map.of("urlname", "a.example"), session);

            assertThat(landing.statusCode()).isEqualTo(200);
            assertThat(landing.uri().getPath()).isEqualTo("/index.php");
            assertThat(session.cookieCount()).isEqualTo(1);
            assertThat(server.requests("GET", "/index.php").get(0).cookie()).contains("sid=abc");
            assertThat(server.requests("POST", "/result.php").get(0).cookie()).contains("sid=abc");
        }
    }

    @Nested
    @DisplayName("Redirects")
    class RedirectTests {

        @Test
        @DisplayName("should switch to GET when a form POST is answered with 302")
        void shouldFollowPostRedirectWithGet() throws Exception {
            server.on("POST", "/submit", Reply.redirect("/done"))
                    .on("GET", "/done", Reply.html("done"));

            HttpResponse<String> response = client.postForm(uri("/submit"), Map.of(), Map.of("q", "a.example"), null);

            assertThat(response.body()).isEqualTo("done");
            assertThat(server.requests("GET", "/done")).hasSize(1);
            assertThat(server.requests("POST", "/done")).isEmpty();
        }

        @Test
        @DisplayName("should replay method and body on 307")
        void shouldKeepMethodOnTemporaryRedirect() throws Exception {
            server.on("POST", "/old", new Reply(307, Map.of("Location", "/new"), new byte[0]))
                    .on("POST", "/new", Reply.html("moved"));

            HttpResponse<String> response = client.postForm(uri("/old"), Map.of(), Map.of("q", "a.example"), null);

            assertThat(response.body()).isEqualTo("moved");
            assertThat(server.requests("POST", "/new").get(0).body()).isEqualTo("q=a.example");
        }

        @Test
        @DisplayName("should stop after too many redirects")
        void shouldStopRedirectLoop() throws Exception {
            server.on("GET", "/loop", Reply.redirect("/loop"));

            HttpResponse<String> response = client.get(uri("/loop"), Map.of(), null);

            assertThat(response.statusCode()).isEqualTo(302);
            assertThat(server.requests("GET", "/loop")).hasSize(6);
        }
    }

    @Nested
    @DisplayName("Requests")
    class RequestTests {

        @Test
        @DisplayName("should send the configured user agent and request headers")
        void shouldSendHeaders() throws Exception {
            client.get(uri("/form"), Map.of("Referer", "https://example.test/"), null);

            RecordedRequest request = server.requests("GET", "/form").get(0);
            assertThat(request.header("User-Agent")).isEqualTo("review-agent/1.0");
            assertThat(request.header("Referer")).isEqualTo("https://example.test/");
        }

        @Test
        @DisplayName("should encode form fields in insertion order")
        void shouldEncodeFormInOrder() throws Exception {
            Map<String, String> form = new LinkedHashMap<>();
            form.put("urlname", "a.example");
            form.put("getinfo", "Check Now");

            client.postForm(uri("/form"), Map.of(), form, null);

            RecordedRequest request = server.requests("POST", "/form").get(0);
            assertThat(request.body()).isEqualTo("urlname=a.example&getinfo=Check+Now");
            assertThat(request.header("Content-Type")).isEqualTo("application/x-www-form-urlencoded");
        }

        @Test
        @DisplayName("should serialize JSON bodies")
        void shouldPostJson() throws Exception {
            Map<String, String> body = new LinkedHashMap<>();
            body.put("url", "a.example");
            body.put("captcha", "");

            HttpResponse<String> response = client.postJson(uri("/api"), Map.of(), body, null);

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(client.readTree(response.body()).path("ok").asBoolean()).isTrue();
            assertThat(server.requests("POST", "/api").get(0).body())
                    .isEqualTo("{\"url\":\"a.example\",\"captcha\":\"\"}");
        }
    }

    @Nested
    @DisplayName("Support")
    class SupportTests {

        @Test
        @DisplayName("should mask API keys in logged URIs")
        void shouldRedactApiKeys() {
            URI uri = URI.create("https://www.virustotal.com/vtapi/v2/domain/report?apikey=s3cr3t&domain=a.example");

            assertThat(ReputationHttpClient.redact(uri))
                    .doesNotContain("s3cr3t")
                    .contains("apikey=***")
                    .contains("domain=a.example");
        }

        @Test
        @DisplayName("should hand out one circuit breaker per source")
        void shouldShareCircuitBreakerPerSource() {
            CircuitBreaker talos = client.getOrCreateCircuitBreaker("talos");

            assertThat(client.getOrCreateCircuitBreaker("talos")).isSameAs(talos);
            assertThat(client.getOrCreateCircuitBreaker("xforce")).isNotSameAs(talos);
            assertThat(client.getCircuitBreaker("opendns")).isNull();
        }

        @Test
        @DisplayName("should escape reserved characters in form values")
        void shouldEscapeFormValues() {
            Map<String, String> form = new LinkedHashMap<>();
            form.put("q", "a&b=c");

            assertThat(ReputationHttpClient.encodeForm(form)).isEqualTo("q=a%26b%3Dc");
            assertThat(ReputationHttpClient.encodeForm(Map.of())).isEmpty();
        }
    }
}
