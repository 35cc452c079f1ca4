package fr.lapetina.domainreview.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.domainreview.domain.model.FailureType;
import fr.lapetina.domainreview.domain.model.QueryStatus;
import fr.lapetina.domainreview.domain.model.SourceQueryResult;
import fr.lapetina.domainreview.infrastructure.http.CircuitBreaker;
import fr.lapetina.domainreview.infrastructure.http.ReputationHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Base class holding the failure boundary shared by every adapter.
 *
 * Subclasses implement {@link #lookup(String)} and may throw freely; {@link #query(String)}
 * converts every fault into a failed result and keeps the source's circuit breaker up to date.
 */
public abstract class AbstractSourceAdapter implements SourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(AbstractSourceAdapter.class);

    private final String name;
    private final CircuitBreaker circuitBreaker;

    protected AbstractSourceAdapter(String name, CircuitBreaker circuitBreaker) {
        this.name = name;
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public final String getName() {
        return name;
    }

    @Override
    public final SourceQueryResult query(String domainName) {
        return guarded(domainName, () -> lookup(domainName), Function.identity(), Function.identity());
    }

    /**
     * Performs the source-specific lookup.
     */
    protected abstract SourceQueryResult lookup(String domainName)
            throws IOException, InterruptedException, SourceLookupException;

    /**
     * Runs {@code call} inside the failure boundary.
     *
     * @param resultOf  extracts the status from a completed call
     * @param onFailure builds the return value for a skipped or failed call
     */
    protected final <T> T guarded(
            String domainName,
            LookupCall<T> call,
            Function<T, SourceQueryResult> resultOf,
            Function<SourceQueryResult, T> onFailure
    ) {
        if (!circuitBreaker.allowRequest()) {
            log.warn("Lookup skipped by circuit breaker: source={}, domain={}", name, domainName);
            return onFailure.apply(SourceQueryResult.failed(name, FailureType.CIRCUIT_OPEN,
                    "circuit open after repeated failures"));
        }

        T value;
        SourceQueryResult result;
        try {
            value = call.run();
            result = resultOf.apply(value);
        } catch (SourceLookupException e) {
            result = SourceQueryResult.failed(name, e.getFailureType(), e.getMessage());
            value = onFailure.apply(result);
        } catch (HttpTimeoutException e) {
            result = SourceQueryResult.failed(name, FailureType.TIMEOUT, "timeout");
            value = onFailure.apply(result);
        } catch (IOException e) {
            result = SourceQueryResult.failed(name, FailureType.NETWORK, describe(e));
            value = onFailure.apply(result);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = SourceQueryResult.failed(name, FailureType.TIMEOUT, "interrupted");
            value = onFailure.apply(result);
        } catch (RuntimeException e) {
            log.error("Lookup failed unexpectedly: source={}, domain={}", name, domainName, e);
            result = SourceQueryResult.failed(name, FailureType.INTERNAL, describe(e));
            value = onFailure.apply(result);
        }

        if (result.status() == QueryStatus.FAILED) {
            circuitBreaker.recordFailure();
            log.warn("Lookup failed: source={}, domain={}, failureType={}, reason={}",
                    name, domainName, result.failureType(), result.diagnostic());
        } else {
            circuitBreaker.recordSuccess();
            log.info("Lookup completed: source={}, domain={}, status={}, categories={}",
                    name, domainName, result.status(), result.categories());
        }
        return value;
    }

    protected SourceQueryResult success(List<String> categories) {
        return SourceQueryResult.success(name, categories);
    }

    protected SourceQueryResult uncategorized() {
        return SourceQueryResult.uncategorized(name);
    }

    protected SourceQueryResult unknown() {
        return SourceQueryResult.unknown(name);
    }

    /**
     * Throws unless the response status is 2xx.
     */
    protected static void requireSuccess(HttpResponse<?> response) throws SourceLookupException {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw SourceLookupException.httpStatus(status);
        }
    }

    /**
     * Parses a JSON body, reporting malformed content as an unexpected response.
     */
    protected static JsonNode parseJson(ReputationHttpClient httpClient, String body) throws SourceLookupException {
        try {
            JsonNode root = httpClient.readTree(body);
            if (root == null || !root.isObject()) {
                throw new SourceLookupException(FailureType.UNEXPECTED_RESPONSE, "response is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new SourceLookupException(FailureType.UNEXPECTED_RESPONSE, "malformed JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new SourceLookupException(FailureType.UNEXPECTED_RESPONSE, "unreadable JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Splits a comma-separated label list such as {@code "Blogs, Social Networking"}.
     */
    protected static List<String> splitLabels(String text) {
        return Arrays.stream(text.trim().split(",\\s*"))
                .map(String::trim)
                .filter(label -> !label.isEmpty())
                .toList();
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * A lookup body that may fail with any of the faults the boundary converts.
     */
    @FunctionalInterface
    protected interface LookupCall<T> {
        T run() throws IOException, InterruptedException, SourceLookupException;
    }
}
