/**
 * Category rules applied to source answers.
 *
 * <p>{@link fr.lapetina.domainreview.domain.policy.CategoryNormalizer} merges the categories of
 * every source into one case-insensitive set, and
 * {@link fr.lapetina.domainreview.domain.policy.BlacklistPolicy} picks out the labels that
 * disqualify a domain. No cross-source taxonomy is attempted beyond string matching.
 */
package fr.lapetina.domainreview.domain.policy;
