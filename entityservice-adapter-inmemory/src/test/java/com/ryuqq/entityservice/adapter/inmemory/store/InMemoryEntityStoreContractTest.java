package com.ryuqq.entityservice.adapter.inmemory.store;

import com.ryuqq.entityservice.core.model.EntityKind;
import com.ryuqq.entityservice.core.spi.DocumentMapper;
import com.ryuqq.entityservice.core.spi.EntityStore;
import com.ryuqq.entityservice.testkit.contract.AbstractEntityStoreContractTest;
import com.ryuqq.entityservice.testkit.contract.SampleDocument;

import java.time.Clock;
import java.util.Set;

/**
 * Contract Tests for InMemoryEntityStore implementation.
 *
 * <p>Runs the testkit's {@link AbstractEntityStoreContractTest} suite against
 * {@link InMemoryEntityStore}.</p>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
class InMemoryEntityStoreContractTest extends AbstractEntityStoreContractTest {

    @Override
    protected EntityStore<SampleDocument> createStore(
            EntityKind kind, DocumentMapper<SampleDocument> mapper, Set<String> uniqueFields, Clock clock) {
        return new InMemoryEntityStore<>(kind, mapper, uniqueFields, clock);
    }
}
