/**
 * Immutable value objects produced and consumed by the verdict pipeline.
 *
 * <p>All domain models are:
 * <ul>
 *   <li>Immutable (Java records and enums)</li>
 *   <li>Self-validating (invariants checked in compact constructors)</li>
 *   <li>Free of I/O and framework dependencies</li>
 * </ul>
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.jobverdict.domain.MatchResult} - conservative consensus over several
 *       LLM match evaluations</li>
 *   <li>{@link com.phillippitts.jobverdict.domain.LocationAnalysis} - outcome of validating a job's
 *       declared location against its description</li>
 *   <li>{@link com.phillippitts.jobverdict.domain.JobVerdict} - both of the above for one job</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.jobverdict.domain;
