/**
 * Domain Review - reputation check of operational domains against public categorization
 * and threat-intelligence services.
 *
 * <p>Each domain of an inventory is looked up on a primary detection source (VirusTotal)
 * and a configurable set of category sources. The answers are reduced to a burned or
 * healthy verdict with explanations.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.domainreview.ReviewEngineFactory} - Main entry point for creating
 *       a fully-wired engine from YAML configuration</li>
 *   <li>{@link fr.lapetina.domainreview.DomainReviewApplication} - Command line runner over an
 *       inventory file</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (ReviewEngineFactory factory = ReviewEngineFactory.create("config.yaml")) {
 *     List<Domain> domains = new FileDomainInventory(Path.of("domains.txt")).domains();
 *     Map<Domain, DomainReport> reports = factory.getOrchestrator().review(domains);
 *     reports.values().forEach(report -> System.out.println(report.summary()));
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>REST, HTML, form, headless-browser and CAPTCHA-gated sources behind one contract</li>
 *   <li>Per-source timeouts and circuit breakers</li>
 *   <li>Configurable pacing between domains</li>
 *   <li>Micrometer metrics with Prometheus text-file export</li>
 * </ul>
 *
 * @see fr.lapetina.domainreview.engine.ReviewOrchestrator
 * @see fr.lapetina.domainreview.engine.BurnDecisionEngine
 */
package fr.lapetina.domainreview;
