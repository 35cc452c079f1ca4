package fr.lapetina.domainreview.infrastructure.captcha;

/**
 * Raised when the OCR engine cannot read an image.
 */
public class OcrException extends Exception {

    public OcrException(String message) {
        super(message);
    }

    public OcrException(String message, Throwable cause) {
        super(message, cause);
    }
}
