/**
 * Configuration loading.
 *
 * <p>This package parses the YAML configuration of a review pass into a
 * {@link fr.lapetina.domainreview.infrastructure.config.ReviewConfig} bean tree.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code sleepTime} - Seconds between two domain reviews (default 20)</li>
 *   <li>{@code virustotalApiKey} - Primary source credential, required</li>
 *   <li>{@code delayPolicy} - {@code fixed} or {@code minimum-interval}</li>
 *   <li>{@code sources} - Enabled adapters and endpoint overrides</li>
 *   <li>{@code timeouts} - Connect, request and whole-lookup bounds</li>
 *   <li>{@code circuitBreaker} - Per-source failure threshold and recovery window</li>
 *   <li>{@code browser} - Headless browser driver and delays</li>
 *   <li>{@code captcha} - OCR data path and scratch directory</li>
 *   <li>{@code metrics} - Metric prefix and optional text-file export</li>
 * </ul>
 *
 * @see fr.lapetina.domainreview.infrastructure.config.ConfigLoader
 */
package fr.lapetina.domainreview.infrastructure.config;
