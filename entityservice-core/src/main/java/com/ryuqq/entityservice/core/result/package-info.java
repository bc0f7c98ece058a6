/**
 * Entity service result package.
 *
 * <p>This package defines the sealed interface hierarchy for service results,
 * replacing exception-based control flow for "not found" and "conflict".</p>
 *
 * <h2>Result Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.entityservice.core.result.Ok} - Success (value may be absent for delete)</li>
 *   <li>{@link com.ryuqq.entityservice.core.result.NotFound} - Target identifier absent</li>
 *   <li>{@link com.ryuqq.entityservice.core.result.Conflict} - Uniqueness violation</li>
 *   <li>{@link com.ryuqq.entityservice.core.result.InvalidInput} - Validation or credential failure</li>
 *   <li>{@link com.ryuqq.entityservice.core.result.Unexpected} - Storage/transport failure, cause kept for diagnostics</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Exhaustiveness:</strong> {@link com.ryuqq.entityservice.core.result.ResultKind} lets callers switch over every case</li>
 *   <li><strong>No leakage:</strong> Unexpected carries a generic message; the cause is for logs only</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Entity Service Team
 */
package com.ryuqq.entityservice.core.result;
