package com.ryuqq.entityservice.adapter.inmemory.store;

import com.ryuqq.entityservice.core.model.Entity;
import com.ryuqq.entityservice.core.model.EntityKind;
import com.ryuqq.entityservice.core.spi.DocumentMapper;
import com.ryuqq.entityservice.core.spi.DuplicateKeyException;
import com.ryuqq.entityservice.core.spi.EntityStore;
import com.ryuqq.entityservice.core.spi.Filter;
import com.ryuqq.entityservice.core.spi.Patch;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * In-memory implementation of {@link EntityStore} SPI for testing and reference purposes.
 *
 * <p>Documents are kept as field maps in insertion order and handed out as typed
 * entities through the supplied {@link DocumentMapper}.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>documents:</strong> LinkedHashMap&lt;String, Map&gt; - id → stored document (insertion order)</li>
 *   <li><strong>uniqueFields:</strong> field names whose values must be unique across documents</li>
 * </ul>
 *
 * <p><strong>Concurrency:</strong> every method is {@code synchronized}, so each
 * operation is atomic per document and concurrent updates to the same document
 * are serialized (last write wins). Unique-index checks and the write happen
 * under the same lock, so two racing creates with the same unique value cannot
 * both succeed.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Linear scans for non-id filters</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * EntityStore&lt;User&gt; users = new InMemoryEntityStore&lt;&gt;(
 *     EntityKind.of("user"), mapper, Set.of("email"), Clock.systemUTC());
 *
 * User created = users.create(Map.of("email", "a@x.com", "password", hash));
 * Optional&lt;User&gt; found = users.findOne(Filter.byId(created.id()));
 * </pre>
 *
 * @param <E> entity type
 * @author Entity Service Team
 * @since 1.0.0
 */
public class InMemoryEntityStore<E extends Entity> implements EntityStore<E> {

    private static final String CREATED_AT = "createdAt";
    private static final String UPDATED_AT = "updatedAt";

    private final EntityKind kind;
    private final DocumentMapper<E> mapper;
    private final Set<String> uniqueFields;
    private final Clock clock;

    /**
     * Stored documents keyed by id, in insertion order.
     */
    private final Map<String, Map<String, Object>> documents = new LinkedHashMap<>();

    /**
     * Creates a store with no unique fields and the system UTC clock.
     */
    public InMemoryEntityStore(EntityKind kind, DocumentMapper<E> mapper) {
        this(kind, mapper, Set.of(), Clock.systemUTC());
    }

    /**
     * Creates a store.
     *
     * @param kind entity kind held by this store
     * @param mapper document → entity mapper
     * @param uniqueFields fields enforced unique (like a unique index)
     * @param clock clock used for createdAt/updatedAt
     */
    public InMemoryEntityStore(EntityKind kind, DocumentMapper<E> mapper, Set<String> uniqueFields, Clock clock) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (uniqueFields == null) {
            throw new IllegalArgumentException("uniqueFields cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.kind = kind;
        this.mapper = mapper;
        this.uniqueFields = Set.copyOf(uniqueFields);
        this.clock = clock;
    }

    @Override
    public EntityKind kind() {
        return kind;
    }

    @Override
    public synchronized List<E> find(Filter filter) {
        requireFilter(filter);
        List<E> result = new ArrayList<>();
        for (Map<String, Object> document : documents.values()) {
            if (filter.matches(document)) {
                result.add(toEntity(document));
            }
        }
        return result;
    }

    @Override
    public synchronized Optional<E> findOne(Filter filter) {
        requireFilter(filter);
        return locate(filter).map(this::toEntity);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Assigns a random UUID as id</li>
     *   <li>Sets createdAt and updatedAt to the same clock instant</li>
     *   <li>Rejects a value already held for any unique field</li>
     * </ul>
     */
    @Override
    public synchronized E create(Map<String, Object> fields) {
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        Map<String, Object> document = new LinkedHashMap<>(fields);
        String id = UUID.randomUUID().toString();
        Instant now = Instant.now(clock);
        document.put(Filter.ID_FIELD, id);
        document.put(CREATED_AT, now);
        document.put(UPDATED_AT, now);

        checkUnique(document, null);
        documents.put(id, document);
        return toEntity(document);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Applies the patch to a copy and swaps it in only after the unique check passes</li>
     *   <li>Refreshes updatedAt, keeps id and createdAt</li>
     * </ul>
     */
    @Override
    public synchronized Optional<E> updateOne(Filter filter, Patch patch) {
        requireFilter(filter);
        if (patch == null) {
            throw new IllegalArgumentException("patch cannot be null");
        }
        Optional<Map<String, Object>> existing = locate(filter);
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Object> updated = new LinkedHashMap<>(existing.get());
        updated.putAll(patch.fields());
        updated.put(UPDATED_AT, Instant.now(clock));

        String id = (String) updated.get(Filter.ID_FIELD);
        checkUnique(updated, id);
        documents.put(id, updated);
        return Optional.of(toEntity(updated));
    }

    @Override
    public synchronized boolean deleteOne(Filter filter) {
        requireFilter(filter);
        Optional<Map<String, Object>> existing = locate(filter);
        if (existing.isEmpty()) {
            return false;
        }
        documents.remove((String) existing.get().get(Filter.ID_FIELD));
        return true;
    }

    /**
     * Removes every document.
     */
    public synchronized void clear() {
        documents.clear();
    }

    /**
     * Number of stored documents.
     */
    public synchronized int size() {
        return documents.size();
    }

    private Optional<Map<String, Object>> locate(Filter filter) {
        Object id = filter.criteria().get(Filter.ID_FIELD);
        if (id != null) {
            // O(1) path for id lookups
            Map<String, Object> document = documents.get(id.toString());
            return document != null && filter.matches(document) ? Optional.of(document) : Optional.empty();
        }
        for (Map<String, Object> document : documents.values()) {
            if (filter.matches(document)) {
                return Optional.of(document);
            }
        }
        return Optional.empty();
    }

    private void checkUnique(Map<String, Object> candidate, String selfId) {
        for (String field : uniqueFields) {
            Object value = candidate.get(field);
            if (value == null) {
                continue;
            }
            for (Map.Entry<String, Map<String, Object>> entry : documents.entrySet()) {
                if (!entry.getKey().equals(selfId) && Objects.equals(entry.getValue().get(field), value)) {
                    throw new DuplicateKeyException(field);
                }
            }
        }
    }

    private E toEntity(Map<String, Object> document) {
        return mapper.fromDocument(Collections.unmodifiableMap(new LinkedHashMap<>(document)));
    }

    private static void requireFilter(Filter filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
    }
}
