package fr.lapetina.domainreview.source.browser;

import fr.lapetina.domainreview.source.SourceLookupException;

import java.util.Optional;

/**
 * One rendering browser, owned by a single lookup and closed before the lookup returns.
 */
public interface BrowserSession extends AutoCloseable {

    void navigate(String url) throws SourceLookupException;

    /**
     * Clears the input with the given id and types {@code text} into it.
     */
    void typeInto(String elementId, String text) throws SourceLookupException;

    void runScript(String script) throws SourceLookupException;

    /**
     * Returns the visible text of the first element carrying {@code className}, if rendered.
     */
    Optional<String> textOfFirstByClass(String className) throws SourceLookupException;

    @Override
    void close();
}
