package fr.lapetina.domainreview.source;

import fr.lapetina.domainreview.engine.exception.MissingCredentialException;

/**
 * The primary detection source. Besides categories it reports detections and passive DNS
 * history, and a review cannot run without it.
 */
public interface PrimarySourceAdapter extends SourceAdapter {

    /**
     * Fails fast when the source cannot be used at all.
     *
     * @throws MissingCredentialException if the API credential is absent
     */
    void checkPreconditions();

    /**
     * Fetches the full report for a domain. Never throws; failures are carried by
     * {@link PrimarySourceResult#result()}.
     */
    PrimarySourceResult lookupReport(String domainName);
}
