/**
 * Review pass orchestration and the burn decision.
 *
 * {@link fr.lapetina.domainreview.engine.ReviewOrchestrator} drives a pass,
 * {@link fr.lapetina.domainreview.engine.BurnDecisionEngine} turns the gathered signals
 * into a verdict and {@link fr.lapetina.domainreview.engine.RateLimiter} paces domains.
 */
package fr.lapetina.domainreview.engine;
