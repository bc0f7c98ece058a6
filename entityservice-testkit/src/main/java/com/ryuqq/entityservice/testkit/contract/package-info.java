/**
 * Reusable SPI contract tests and fakes for adapter modules.
 *
 * <ul>
 *   <li>{@link com.ryuqq.entityservice.testkit.contract.AbstractEntityStoreContractTest} - EntityStore contract</li>
 *   <li>{@link com.ryuqq.entityservice.testkit.contract.RecordingEventPublisher} - recording/failing publisher</li>
 *   <li>{@link com.ryuqq.entityservice.testkit.contract.TestClock} - manually advanced clock</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.entityservice.testkit.contract;
