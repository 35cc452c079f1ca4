package fr.lapetina.domainreview.engine.exception;

/**
 * Thrown when the primary source has no API credential.
 *
 * This aborts the whole review before any network activity: without the primary
 * detection source a pass would produce verdicts that look clean but are not.
 */
public final class MissingCredentialException extends RuntimeException {

    private final String source;

    public MissingCredentialException(String source) {
        super("No API key configured for primary source: " + source);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
