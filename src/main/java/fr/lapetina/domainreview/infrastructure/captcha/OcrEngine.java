package fr.lapetina.domainreview.infrastructure.captcha;

import java.nio.file.Path;

/**
 * Text-from-image black box used to read CAPTCHA challenges.
 */
@FunctionalInterface
public interface OcrEngine {

    /**
     * Reads the text in an image file.
     *
     * @param image image file on local disk
     * @return raw recognized text, possibly with stray whitespace
     * @throws OcrException if the engine cannot process the image
     */
    String imageToText(Path image) throws OcrException;
}
