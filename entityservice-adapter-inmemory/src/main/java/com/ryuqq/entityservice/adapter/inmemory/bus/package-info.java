/**
 * In-memory message bus adapter (event publisher and message inbox).
 *
 * @since 1.0.0
 */
package com.ryuqq.entityservice.adapter.inmemory.bus;
