package fr.lapetina.domainreview.infrastructure.captcha;

import fr.lapetina.domainreview.infrastructure.http.ReputationHttpClient;
import fr.lapetina.domainreview.infrastructure.http.SessionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Solves image CAPTCHAs for sources that gate lookups behind one.
 *
 * The image is downloaded through the caller's session so the challenge matches the
 * cookies of the page that issued it, written to a scratch file for the OCR engine and
 * deleted on every exit path. Never throws: faults come back as a failed {@link CaptchaResult}.
 */
public class CaptchaSolver {

    private static final Logger log = LoggerFactory.getLogger(CaptchaSolver.class);

    private final ReputationHttpClient httpClient;
    private final OcrEngine ocrEngine;
    private final Path workDir;

    public CaptchaSolver(ReputationHttpClient httpClient, OcrEngine ocrEngine, Path workDir) {
        this.httpClient = httpClient;
        this.ocrEngine = ocrEngine;
        this.workDir = workDir;
    }

    public CaptchaResult solve(URI challengeUri, SessionContext session) {
        Path image = null;
        try {
            HttpResponse<byte[]> response = httpClient.getBytes(challengeUri, Map.of(), session);
            if (response.statusCode() != 200) {
                log.warn("CAPTCHA download failed: uri={}, status={}", challengeUri, response.statusCode());
                return CaptchaResult.failed("challenge download returned HTTP " + response.statusCode());
            }

            Files.createDirectories(workDir);
            image = Files.createTempFile(workDir, "captcha-", ".jpg");
            Files.write(image, response.body());

            String text = normalize(ocrEngine.imageToText(image));
            if (text.isEmpty()) {
                return CaptchaResult.failed("OCR returned no text");
            }
            log.debug("CAPTCHA read: uri={}, length={}", challengeUri, text.length());
            return CaptchaResult.solved(text);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CaptchaResult.failed("interrupted");
        } catch (IOException | OcrException e) {
            log.warn("Error processing CAPTCHA: uri={}, error={}", challengeUri, e.getMessage());
            return CaptchaResult.failed(e.getMessage());
        } catch (RuntimeException e) {
            log.error("CAPTCHA solver crashed: uri={}", challengeUri, e);
            return CaptchaResult.failed(e.toString());
        } finally {
            deleteQuietly(image);
        }
    }

    /**
     * Cleans raw OCR output: drops whitespace and quotes, and reads {@code [} as {@code l},
     * a confusion Tesseract makes on these challenge fonts.
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.replaceAll("\\s+", "")
                .replace("[", "l")
                .replace("'", "");
    }

    private static void deleteQuietly(Path image) {
        if (image == null) {
            return;
        }
        try {
            Files.deleteIfExists(image);
        } catch (IOException e) {
            log.warn("Could not remove CAPTCHA image: path={}, error={}", image, e.getMessage());
        }
    }
}
