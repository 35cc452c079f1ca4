package fr.lapetina.domainreview.domain.model;

/**
 * Failure taxonomy for source lookups.
 * Each value is reported per source so operators can tell which service is unreachable.
 */
public enum FailureType {
    /** Connection refused, reset, DNS failure and other I/O errors */
    NETWORK,

    /** Non-success HTTP status */
    HTTP_STATUS,

    /** The source signalled that its rate ceiling was hit */
    RATE_LIMITED,

    /** Response body did not have the expected fields or markup */
    UNEXPECTED_RESPONSE,

    /** The image challenge could not be downloaded or read */
    CAPTCHA,

    /** The source redirected to an anti-automation challenge */
    ANTI_BOT,

    /** The daily lookup allowance is used up */
    QUOTA_EXHAUSTED,

    /** The lookup exceeded its time bound */
    TIMEOUT,

    /** The source has failed repeatedly and is temporarily skipped */
    CIRCUIT_OPEN,

    /** Internal error while handling the lookup */
    INTERNAL
}
