package com.ryuqq.entityservice.adapter.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import com.ryuqq.entityservice.core.model.Entity;
import com.ryuqq.entityservice.core.model.EntityKind;
import com.ryuqq.entityservice.core.spi.DocumentMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Owns one {@link MongoClient} and hands out a {@link MongoEntityStore} per entity kind.
 *
 * <p>Each kind is kept in the collection named by {@link EntityKind#plural()}
 * ({@code users}, {@code posts}).</p>
 *
 * <pre>
 * try (MongoConnection connection = MongoConnection.open(MongoConfig.fromEnvironment(System.getenv()))) {
 *     EntityStore&lt;User&gt; users = connection.store(UserService.KIND, userMapper, Set.of("email"), Clock.systemUTC());
 *     ...
 * }
 * </pre>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public final class MongoConnection implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MongoConnection.class);

    private final MongoClient client;
    private final MongoDatabase database;

    MongoConnection(MongoClient client, String databaseName) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (databaseName == null || databaseName.isBlank()) {
            throw new IllegalArgumentException("databaseName cannot be null or blank");
        }
        this.client = client;
        this.database = client.getDatabase(databaseName);
    }

    /**
     * Opens a client for the given settings. The driver connects lazily,
     * so an unreachable server surfaces on the first store call.
     *
     * @param config connection settings
     * @return open connection
     */
    public static MongoConnection open(MongoConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        MongoClientSettings settings = MongoClientSettings.builder()
            .applyConnectionString(new ConnectionString(config.connectionString()))
            .applyToClusterSettings(cluster ->
                cluster.serverSelectionTimeout(config.serverSelectionTimeoutMs(), TimeUnit.MILLISECONDS))
            .build();
        log.info("Opening MongoDB connection: {}", config);
        return new MongoConnection(MongoClients.create(settings), config.database());
    }

    /**
     * Store for one entity kind.
     *
     * @throws com.ryuqq.entityservice.core.spi.StorageException if a unique index cannot be created
     */
    public <E extends Entity> MongoEntityStore<E> store(
            EntityKind kind, DocumentMapper<E> mapper, Set<String> uniqueFields, Clock clock) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return new MongoEntityStore<>(kind, database.getCollection(kind.plural()), mapper, uniqueFields, clock);
    }

    public MongoDatabase database() {
        return database;
    }

    @Override
    public void close() {
        client.close();
    }
}
