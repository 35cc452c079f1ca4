package fr.lapetina.domainreview.infrastructure.http;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * HTTP client shared by every reputation source.
 *
 * Wraps one java.net.http.HttpClient (one connection pool) for the whole pass.
 * The underlying client has no cookie handler: cookies only travel through an explicit
 * {@link SessionContext}, and every request composes its own headers, so sources never
 * see each other's state. Redirects are followed here, hop by hop, so that cookies set on
 * a 3xx response reach the session. Keeps one circuit breaker per source.
 */
public class ReputationHttpClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReputationHttpClient.class);

    private static final Pattern API_KEY_PARAM = Pattern.compile("(?i)\\b(apikey|api_key|key)=[^&]*");
    private static final int MAX_REDIRECTS = 5;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Map<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();

    private final String userAgent;
    private final Duration requestTimeout;
    private final int failureThreshold;
    private final Duration circuitBreakerRecoveryTimeout;
    private final Clock clock;

    public ReputationHttpClient(
            String userAgent,
            Duration connectTimeout,
            Duration requestTimeout,
            int failureThreshold,
            Duration circuitBreakerRecoveryTimeout,
            Clock clock
    ) {
        this.userAgent = userAgent;
        this.requestTimeout = requestTimeout;
        this.failureThreshold = failureThreshold;
        this.circuitBreakerRecoveryTimeout = circuitBreakerRecoveryTimeout;
        this.clock = clock;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ReputationHttpClient(String userAgent) {
        this(userAgent, Duration.ofSeconds(10), Duration.ofSeconds(30), 5, Duration.ofMinutes(5), Clock.systemUTC());
    }

    /**
     * Sends a GET request.
     *
     * @param uri     target
     * @param headers request-scoped headers, added after the User-Agent
     * @param session cookie carrier, or null for a stateless request
     */
    public HttpResponse<String> get(URI uri, Map<String, String> headers, SessionContext session)
            throws IOException, InterruptedException {
        return send(uri, headers, "GET", null, null, session, HttpResponse.BodyHandlers.ofString());
    }

    /**
     * Sends a GET request and returns the raw body, used for challenge images.
     */
    public HttpResponse<byte[]> getBytes(URI uri, Map<String, String> headers, SessionContext session)
            throws IOException, InterruptedException {
        return send(uri, headers, "GET", null, null, session, HttpResponse.BodyHandlers.ofByteArray());
    }

    /**
     * Sends an {@code application/x-www-form-urlencoded} POST. Field order is preserved.
     */
    public HttpResponse<String> postForm(
            URI uri,
            Map<String, String> headers,
            Map<String, String> form,
            SessionContext session
    ) throws IOException, InterruptedException {
        return send(uri, headers, "POST", "application/x-www-form-urlencoded", encodeForm(form),
                session, HttpResponse.BodyHandlers.ofString());
    }

    /**
     * Sends a JSON POST.
     */
    public HttpResponse<String> postJson(
            URI uri,
            Map<String, String> headers,
            Object body,
            SessionContext session
    ) throws IOException, InterruptedException {
        return send(uri, headers, "POST", "application/json", objectMapper.writeValueAsString(body),
                session, HttpResponse.BodyHandlers.ofString());
    }

    /**
     * Parses a JSON body.
     */
    public JsonNode readTree(String body) throws IOException {
        return objectMapper.readTree(body);
    }

    private HttpRequest newRequest(
            URI uri,
            Map<String, String> headers,
            String method,
            String contentType,
            String body,
            SessionContext session
    ) throws IOException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header("User-Agent", userAgent);
        headers.forEach(builder::header);
        if (body == null) {
            builder.GET();
        } else {
            builder.header("Content-Type", contentType)
                    .method(method, HttpRequest.BodyPublishers.ofString(body));
        }
        if (session != null) {
            session.applyCookies(builder, uri);
        }
        return builder.build();
    }

    private <T> HttpResponse<T> send(
            URI uri,
            Map<String, String> headers,
            String method,
            String contentType,
            String body,
            SessionContext session,
            HttpResponse.BodyHandler<T> bodyHandler
    ) throws IOException, InterruptedException {
        URI target = uri;
        String currentMethod = method;
        String currentBody = body;

        for (int hop = 0; ; hop++) {
            HttpRequest request = newRequest(target, headers, currentMethod, contentType, currentBody, session);
            log.debug("Sending request: method={}, uri={}, session={}", request.method(), redact(target), session);

            HttpResponse<T> response = httpClient.send(request, bodyHandler);
            if (session != null) {
                session.storeCookies(target, response.headers());
            }
            log.debug("Response received: method={}, uri={}, status={}",
                    request.method(), redact(target), response.statusCode());

            Optional<URI> next = redirectTarget(target, response);
            if (next.isEmpty()) {
                return response;
            }
            if (hop == MAX_REDIRECTS) {
                log.warn("Too many redirects: uri={}, hops={}", redact(uri), hop);
                return response;
            }

            int status = response.statusCode();
            if (status != 307 && status != 308) {
                currentMethod = "GET";
                currentBody = null;
            }
            log.debug("Following redirect: status={}, from={}, to={}", status, redact(target), redact(next.get()));
            target = next.get();
        }
    }

    /**
     * Resolves the Location of a 3xx response. Never downgrades from https to http.
     */
    static Optional<URI> redirectTarget(URI current, HttpResponse<?> response) {
        int status = response.statusCode();
        if (status != 301 && status != 302 && status != 303 && status != 307 && status != 308) {
            return Optional.empty();
        }
        Optional<String> location = response.headers().firstValue("Location");
        if (location.isEmpty()) {
            return Optional.empty();
        }
        URI next = current.resolve(location.get().trim());
        if ("https".equalsIgnoreCase(current.getScheme()) && "http".equalsIgnoreCase(next.getScheme())) {
            return Optional.empty();
        }
        return Optional.of(next);
    }

    /**
     * Masks credentials passed as query parameters.
     */
    static String redact(URI uri) {
        return API_KEY_PARAM.matcher(uri.toString()).replaceAll("$1=***");
    }

    static String encodeForm(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                        + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    /**
     * Gets or creates the circuit breaker for a source.
     */
    public CircuitBreaker getOrCreateCircuitBreaker(String source) {
        return circuitBreakers.computeIfAbsent(source, id ->
                new CircuitBreaker(id, failureThreshold, circuitBreakerRecoveryTimeout, clock)
        );
    }

    /**
     * Gets the circuit breaker for a source, or null if it never ran.
     */
    public CircuitBreaker getCircuitBreaker(String source) {
        return circuitBreakers.get(source);
    }

    public String getUserAgent() {
        return userAgent;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    @Override
    public void close() {
        // HttpClient has no close() before Java 21
    }
}
