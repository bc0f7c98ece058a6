/**
 * Core domain model package containing Value Objects shared by every entity kind.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.entityservice.core.model.EntityId} - Store-assigned opaque identifier</li>
 *   <li>{@link com.ryuqq.entityservice.core.model.EntityKind} - Entity kind (user, post)</li>
 *   <li>{@link com.ryuqq.entityservice.core.model.EventName} - Event name ({@code <kind>_<transition>})</li>
 *   <li>{@link com.ryuqq.entityservice.core.model.Payload} - Serialized (JSON) message body</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable (final fields)</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Entity Service Team
 */
package com.ryuqq.entityservice.core.model;
