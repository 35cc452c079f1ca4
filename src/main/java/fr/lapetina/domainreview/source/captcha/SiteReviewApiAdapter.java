package fr.lapetina.domainreview.source.captcha;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.domainreview.domain.model.FailureType;
import fr.lapetina.domainreview.domain.model.SourceQueryResult;
import fr.lapetina.domainreview.infrastructure.captcha.CaptchaResult;
import fr.lapetina.domainreview.infrastructure.captcha.CaptchaSolver;
import fr.lapetina.domainreview.infrastructure.http.CircuitBreaker;
import fr.lapetina.domainreview.infrastructure.http.ReputationHttpClient;
import fr.lapetina.domainreview.infrastructure.http.SessionContext;
import fr.lapetina.domainreview.source.AbstractSourceAdapter;
import fr.lapetina.domainreview.source.SourceContext;
import fr.lapetina.domainreview.source.SourceLookupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Symantec (Bluecoat) Site Review through its JSON lookup endpoint.
 *
 * After a few lookups from one address the endpoint answers {@code errorType: captcha}.
 * The challenge image is fetched with the same session cookies, read by OCR and the
 * lookup is retried once with the answer.
 */
public final class SiteReviewApiAdapter extends AbstractSourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(SiteReviewApiAdapter.class);

    public static final String NAME = "bluecoat-api";
    static final String DEFAULT_ENDPOINT = "https://sitereview.bluecoat.com";

    private static final String CAPTCHA_ERROR = "captcha";
    private static final String UNRATED = "unrated";

    private final ReputationHttpClient httpClient;
    private final CaptchaSolver captchaSolver;
    private final URI baseUri;
    private final Clock clock;

    public SiteReviewApiAdapter(
            ReputationHttpClient httpClient,
            CaptchaSolver captchaSolver,
            URI baseUri,
            Clock clock,
            CircuitBreaker circuitBreaker
    ) {
        super(NAME, circuitBreaker);
        this.httpClient = httpClient;
        this.captchaSolver = captchaSolver;
        this.baseUri = baseUri;
        this.clock = clock;
    }

    public SiteReviewApiAdapter(SourceContext context) {
        this(context.getHttpClient(),
                context.getCaptchaSolver(),
                context.endpoint(NAME, DEFAULT_ENDPOINT),
                Clock.systemUTC(),
                context.circuitBreaker(NAME));
    }

    @Override
    protected SourceQueryResult lookup(String domainName)
            throws IOException, InterruptedException, SourceLookupException {
        SessionContext session = new SessionContext(NAME + ":" + domainName);

        JsonNode answer = submit(domainName, "", session);
        if (CAPTCHA_ERROR.equals(answer.path("errorType").asText())) {
            URI challenge = URI.create(baseUri + "/resource/captcha.jpg?" + clock.millis());
            CaptchaResult solved = captchaSolver.solve(challenge, session);
            if (!solved.isSolved()) {
                throw new SourceLookupException(FailureType.CAPTCHA, "CAPTCHA not solved: " + solved.failureReason());
            }
            log.debug("Retrying lookup with CAPTCHA answer: domain={}", domainName);
            answer = submit(domainName, solved.text(), session);
            if (CAPTCHA_ERROR.equals(answer.path("errorType").asText())) {
                throw new SourceLookupException(FailureType.CAPTCHA, "CAPTCHA answer rejected");
            }
        }

        String errorType = answer.path("errorType").asText("");
        if (!errorType.isEmpty()) {
            throw new SourceLookupException(FailureType.UNEXPECTED_RESPONSE, "lookup error: " + errorType);
        }

        List<String> categories = new ArrayList<>();
        for (JsonNode entry : answer.path("categorization")) {
            String name = entry.path("name").asText("").trim();
            if (!name.isEmpty() && !name.equalsIgnoreCase(UNRATED)) {
                categories.add(name);
            }
        }
        return categories.isEmpty() ? uncategorized() : success(categories);
    }

    private JsonNode submit(String domainName, String captcha, SessionContext session)
            throws IOException, InterruptedException, SourceLookupException {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("url", domainName);
        body.put("captcha", captcha);
        Map<String, String> headers = Map.of(
                "Accept", "application/json, text/plain, */*",
                "Origin", baseUri.toString(),
                "Referer", baseUri + "/"
        );

        HttpResponse<String> response = httpClient.postJson(URI.create(baseUri + "/resource/lookup"),
                headers, body, session);
        // challenges come back with a 4xx status and a JSON error body
        if (response.statusCode() >= 500) {
            throw SourceLookupException.httpStatus(response.statusCode());
        }
        JsonNode answer = parseJson(httpClient, response.body());
        if (response.statusCode() >= 300 && !answer.has("errorType")) {
            throw SourceLookupException.httpStatus(response.statusCode());
        }
        return answer;
    }
}
