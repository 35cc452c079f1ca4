package fr.lapetina.domainreview.source;

import fr.lapetina.domainreview.domain.model.SourceQueryResult;

/**
 * Uniform contract over one external reputation or categorization service.
 *
 * Implementations must be safe to call from several worker threads and must never throw:
 * network, protocol, parsing and anti-automation faults are returned as a
 * {@link fr.lapetina.domainreview.domain.model.QueryStatus#FAILED} result.
 */
public interface SourceAdapter {

    /**
     * Returns the source name used in configuration, reports and metrics.
     */
    String getName();

    /**
     * Looks up the categories the source assigns to a domain.
     *
     * @param domainName domain to look up
     * @return the source's answer, never null
     */
    SourceQueryResult query(String domainName);
}
