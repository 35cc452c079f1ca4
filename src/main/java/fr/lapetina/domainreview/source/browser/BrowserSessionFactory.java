package fr.lapetina.domainreview.source.browser;

import fr.lapetina.domainreview.source.SourceLookupException;

/**
 * Starts browser sessions. Every call returns a fresh, unshared session.
 */
@FunctionalInterface
public interface BrowserSessionFactory {

    BrowserSession open() throws SourceLookupException;
}
