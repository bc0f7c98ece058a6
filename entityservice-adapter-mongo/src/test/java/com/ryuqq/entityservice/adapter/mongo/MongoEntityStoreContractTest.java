package com.ryuqq.entityservice.adapter.mongo;

import com.ryuqq.entityservice.core.model.EntityKind;
import com.ryuqq.entityservice.core.spi.DocumentMapper;
import com.ryuqq.entityservice.core.spi.EntityStore;
import com.ryuqq.entityservice.testkit.contract.AbstractEntityStoreContractTest;
import com.ryuqq.entityservice.testkit.contract.SampleDocument;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.util.Set;

/**
 * Contract Tests for MongoEntityStore implementation.
 *
 * <p>Runs the testkit's {@link AbstractEntityStoreContractTest} suite against a
 * throwaway MongoDB container. Each test starts from a dropped collection.</p>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
@DockerAvailable
@Testcontainers
class MongoEntityStoreContractTest extends AbstractEntityStoreContractTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static MongoConnection connection;

    @BeforeAll
    static void openConnection() {
        connection = MongoConnection.open(new MongoConfig()
            .withHost(MONGO.getHost(), MONGO.getFirstMappedPort())
            .withDatabase("entityservice_contract")
            .withServerSelectionTimeoutMs(10_000));
    }

    @AfterAll
    static void closeConnection() {
        if (connection != null) {
            connection.close();
        }
    }

    @Override
    protected EntityStore<SampleDocument> createStore(
            EntityKind kind, DocumentMapper<SampleDocument> mapper, Set<String> uniqueFields, Clock clock) {
        connection.database().getCollection(kind.plural()).drop();
        return connection.store(kind, mapper, uniqueFields, clock);
    }
}
