package fr.lapetina.domainreview.infrastructure.captcha;

/**
 * Outcome of a CAPTCHA solve: either the text to submit or the reason it failed.
 */
public record CaptchaResult(String text, String failureReason) {

    public static CaptchaResult solved(String text) {
        return new CaptchaResult(text, null);
    }

    public static CaptchaResult failed(String reason) {
        return new CaptchaResult(null, reason);
    }

    public boolean isSolved() {
        return text != null;
    }
}
