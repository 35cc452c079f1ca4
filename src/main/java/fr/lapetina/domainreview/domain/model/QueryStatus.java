package fr.lapetina.domainreview.domain.model;

/**
 * Terminal outcome of one source lookup.
 *
 * SUCCESS: the source answered with zero or more categories
 * UNCATEGORIZED: the source knows the domain but has no category for it
 * UNKNOWN: the source has never seen the domain (404-style answer)
 * FAILED: the lookup could not be completed, see {@link FailureType}
 */
public enum QueryStatus {
    SUCCESS,
    UNCATEGORIZED,
    UNKNOWN,
    FAILED
}
