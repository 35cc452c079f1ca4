package fr.lapetina.domainreview.source;

import fr.lapetina.domainreview.domain.model.FailureType;

/**
 * Raised inside an adapter when a lookup cannot complete.
 * Never escapes {@link AbstractSourceAdapter}; it becomes a failed result.
 */
public final class SourceLookupException extends Exception {

    private final FailureType failureType;

    public SourceLookupException(FailureType failureType, String message) {
        super(message);
        this.failureType = failureType;
    }

    public SourceLookupException(FailureType failureType, String message, Throwable cause) {
        super(message, cause);
        this.failureType = failureType;
    }

    public static SourceLookupException unexpectedPage() {
        return new SourceLookupException(FailureType.UNEXPECTED_RESPONSE, "unexpected page structure");
    }

    public static SourceLookupException httpStatus(int statusCode) {
        return new SourceLookupException(FailureType.HTTP_STATUS, "HTTP " + statusCode);
    }

    public FailureType getFailureType() {
        return failureType;
    }
}
