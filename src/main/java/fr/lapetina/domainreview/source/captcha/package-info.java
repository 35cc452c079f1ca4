/**
 * Sources gated behind an image challenge, answered with
 * {@link fr.lapetina.domainreview.infrastructure.captcha.CaptchaSolver}.
 */
package fr.lapetina.domainreview.source.captcha;
