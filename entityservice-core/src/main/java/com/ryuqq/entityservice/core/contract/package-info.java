/**
 * Message contract package.
 *
 * <p>This package defines what travels over the message bus:</p>
 *
 * <h2>Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.entityservice.core.contract.Command} - Remote command (name, kind, payload)</li>
 *   <li>{@link com.ryuqq.entityservice.core.contract.EventMessage} - Fire-and-forget domain event</li>
 *   <li>{@link com.ryuqq.entityservice.core.contract.InboundMessage} - Command or event pulled from an inbox</li>
 *   <li>{@link com.ryuqq.entityservice.core.contract.ResponseEnvelope} - Uniform response for every command</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Records are immutable by default</li>
 *   <li><strong>Validation:</strong> Compact constructors enforce invariants</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Entity Service Team
 */
package com.ryuqq.entityservice.core.contract;
