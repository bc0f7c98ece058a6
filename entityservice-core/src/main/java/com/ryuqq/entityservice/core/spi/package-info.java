/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters
 * to provide concrete storage and messaging for the entity services.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.entityservice.core.spi.EntityStore} - Single-collection document CRUD</li>
 *   <li>{@link com.ryuqq.entityservice.core.spi.DocumentMapper} - Stored document → typed entity</li>
 *   <li>{@link com.ryuqq.entityservice.core.spi.EventPublisher} - Fire-and-forget event delivery</li>
 *   <li>{@link com.ryuqq.entityservice.core.spi.MessageInbox} - Inbound commands and events</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., entityservice-adapter-inmemory) provide concrete implementations.
 * The core depends on no infrastructure.</p>
 *
 * @since 1.0.0
 * @author Entity Service Team
 */
package com.ryuqq.entityservice.core.spi;
