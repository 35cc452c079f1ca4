/**
 * Domain model for a reputation review.
 *
 * <p>All types here are immutable records or enums and can be shared freely between the
 * adapter worker threads and the orchestrator.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.domainreview.domain.model.Domain} - Inventory record read by the engine</li>
 *   <li>{@link fr.lapetina.domainreview.domain.model.SourceQueryResult} - Tagged outcome of one source lookup</li>
 *   <li>{@link fr.lapetina.domainreview.domain.model.BurnVerdict} - Burned flag, explanations and DNS health</li>
 *   <li>{@link fr.lapetina.domainreview.domain.model.DomainReport} - Verdict plus per-source audit breakdown</li>
 *   <li>{@link fr.lapetina.domainreview.domain.model.FailureType} - Why a lookup failed</li>
 * </ul>
 */
package fr.lapetina.domainreview.domain.model;
