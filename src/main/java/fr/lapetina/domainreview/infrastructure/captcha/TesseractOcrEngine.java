package fr.lapetina.domainreview.infrastructure.captcha;

import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * {@link OcrEngine} backed by Tesseract through Tess4J.
 *
 * A Tesseract handle is not safe for concurrent use, so recognition is serialized.
 */
public final class TesseractOcrEngine implements OcrEngine {

    private static final Logger log = LoggerFactory.getLogger(TesseractOcrEngine.class);

    private final Tesseract tesseract;

    public TesseractOcrEngine(String tessdataPath, String language) {
        this.tesseract = new Tesseract();
        if (tessdataPath != null && !tessdataPath.isBlank()) {
            tesseract.setDatapath(tessdataPath);
        }
        tesseract.setLanguage(language != null ? language : "eng");
        log.info("Tesseract OCR configured: tessdata={}, language={}", tessdataPath, language);
    }

    @Override
    public synchronized String imageToText(Path image) throws OcrException {
        try {
            return tesseract.doOCR(image.toFile());
        } catch (TesseractException e) {
            throw new OcrException("Tesseract failed on " + image.getFileName() + ": " + e.getMessage(), e);
        } catch (LinkageError e) {
            // Native library missing or incompatible
            throw new OcrException("Tesseract native library unavailable: " + e.getMessage(), e);
        }
    }
}
