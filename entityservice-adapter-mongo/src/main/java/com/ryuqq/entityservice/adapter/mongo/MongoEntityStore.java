package com.ryuqq.entityservice.adapter.mongo;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoServerException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.Updates;
import com.ryuqq.entityservice.core.model.Entity;
import com.ryuqq.entityservice.core.model.EntityId;
import com.ryuqq.entityservice.core.model.EntityKind;
import com.ryuqq.entityservice.core.spi.DocumentMapper;
import com.ryuqq.entityservice.core.spi.DuplicateKeyException;
import com.ryuqq.entityservice.core.spi.EntityStore;
import com.ryuqq.entityservice.core.spi.Filter;
import com.ryuqq.entityservice.core.spi.Patch;
import com.ryuqq.entityservice.core.spi.StorageException;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * MongoDB implementation of {@link EntityStore} on the synchronous driver.
 *
 * <p>One collection per entity kind. Documents are plain BSON field maps and are
 * handed out as typed entities through the supplied {@link DocumentMapper}.</p>
 *
 * <p><strong>Mapping:</strong></p>
 * <ul>
 *   <li>{@code _id} is an {@link ObjectId}; the entity sees its hex string under {@link Filter#ID_FIELD}</li>
 *   <li>{@link Instant} values are stored as BSON dates (millisecond precision) and read back as Instants</li>
 *   <li>each unique field gets a sparse unique index named {@code <field>_unique}</li>
 * </ul>
 *
 * <p><strong>Errors:</strong> a duplicate-key server error becomes {@link DuplicateKeyException}
 * naming the violated field; every other driver failure becomes {@link StorageException}.</p>
 *
 * <p><strong>Concurrency:</strong> each operation is a single server-side command, so it is
 * atomic per document. Unique indexes arbitrate racing creates.</p>
 *
 * @param <E> entity type
 * @author Entity Service Team
 * @since 1.0.0
 */
public class MongoEntityStore<E extends Entity> implements EntityStore<E> {

    private static final Logger log = LoggerFactory.getLogger(MongoEntityStore.class);

    static final String MONGO_ID = "_id";
    private static final String CREATED_AT = "createdAt";
    private static final String UPDATED_AT = "updatedAt";
    private static final Set<String> STORE_MANAGED = Set.of(MONGO_ID, Filter.ID_FIELD, CREATED_AT, UPDATED_AT);

    private final EntityKind kind;
    private final MongoCollection<Document> collection;
    private final DocumentMapper<E> mapper;
    private final Set<String> uniqueFields;
    private final Clock clock;

    /**
     * Creates a store and ensures the unique indexes exist.
     *
     * @param kind entity kind held by this store
     * @param collection backing collection
     * @param mapper document → entity mapper
     * @param uniqueFields fields enforced unique by index
     * @param clock clock used for createdAt/updatedAt
     * @throws StorageException if an index cannot be created
     */
    public MongoEntityStore(
            EntityKind kind,
            MongoCollection<Document> collection,
            DocumentMapper<E> mapper,
            Set<String> uniqueFields,
            Clock clock) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (collection == null) {
            throw new IllegalArgumentException("collection cannot be null");
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
        this.collection = collection;
        this.mapper = mapper;
        this.uniqueFields = Set.copyOf(uniqueFields);
        this.clock = clock;
        ensureUniqueIndexes();
    }

    @Override
    public EntityKind kind() {
        return kind;
    }

    @Override
    public List<E> find(Filter filter) {
        requireFilter(filter);
        Optional<Bson> query = toQuery(filter);
        if (query.isEmpty()) {
            return List.of();
        }
        try {
            List<E> result = new ArrayList<>();
            for (Document document : collection.find(query.get()).sort(Sorts.ascending(MONGO_ID))) {
                result.add(toEntity(document));
            }
            return result;
        } catch (MongoException e) {
            throw translate("find", e);
        }
    }

    @Override
    public Optional<E> findOne(Filter filter) {
        requireFilter(filter);
        Optional<Bson> query = toQuery(filter);
        if (query.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(collection.find(query.get()).sort(Sorts.ascending(MONGO_ID)).first())
                .map(this::toEntity);
        } catch (MongoException e) {
            throw translate("findOne", e);
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>Caller-supplied id and timestamps are dropped; the store assigns a fresh
     * {@link ObjectId} and sets createdAt and updatedAt to the same clock instant.</p>
     */
    @Override
    public E create(Map<String, Object> fields) {
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        Date now = now();
        Document document = new Document(MONGO_ID, new ObjectId());
        fields.forEach((field, value) -> {
            if (!STORE_MANAGED.contains(field)) {
                document.append(field, toBson(value));
            }
        });
        document.append(CREATED_AT, now);
        document.append(UPDATED_AT, now);

        try {
            collection.insertOne(document);
        } catch (MongoException e) {
            throw translate("create", e);
        }
        return toEntity(document);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Applies the patch with {@code $set} and returns the document after the update.
     * id and createdAt cannot be patched.</p>
     */
    @Override
    public Optional<E> updateOne(Filter filter, Patch patch) {
        requireFilter(filter);
        if (patch == null) {
            throw new IllegalArgumentException("patch cannot be null");
        }
        Optional<Bson> query = toQuery(filter);
        if (query.isEmpty()) {
            return Optional.empty();
        }

        List<Bson> updates = new ArrayList<>();
        patch.fields().forEach((field, value) -> {
            if (!STORE_MANAGED.contains(field)) {
                updates.add(Updates.set(field, toBson(value)));
            }
        });
        updates.add(Updates.set(UPDATED_AT, now()));

        try {
            Document updated = collection.findOneAndUpdate(
                query.get(),
                Updates.combine(updates),
                new FindOneAndUpdateOptions().returnDocument(ReturnDocument.AFTER)
            );
            return Optional.ofNullable(updated).map(this::toEntity);
        } catch (MongoException e) {
            throw translate("updateOne", e);
        }
    }

    @Override
    public boolean deleteOne(Filter filter) {
        requireFilter(filter);
        Optional<Bson> query = toQuery(filter);
        if (query.isEmpty()) {
            return false;
        }
        try {
            return collection.deleteOne(query.get()).getDeletedCount() > 0;
        } catch (MongoException e) {
            throw translate("deleteOne", e);
        }
    }

    static String indexName(String field) {
        return field + "_unique";
    }

    private void ensureUniqueIndexes() {
        for (String field : uniqueFields) {
            try {
                collection.createIndex(
                    Indexes.ascending(field),
                    new IndexOptions().name(indexName(field)).unique(true).sparse(true)
                );
            } catch (MongoException e) {
                throw new StorageException("Failed to create unique index on " + kind.plural() + "." + field, e);
            }
        }
    }

    /**
     * Builds the server query. Empty when the filter can match nothing
     * (an id that is not an ObjectId).
     */
    private Optional<Bson> toQuery(Filter filter) {
        List<Bson> conditions = new ArrayList<>();
        for (Map.Entry<String, Object> criterion : filter.criteria().entrySet()) {
            if (Filter.ID_FIELD.equals(criterion.getKey())) {
                Object id = criterion.getValue() instanceof EntityId entityId ? entityId.getValue() : criterion.getValue();
                if (id == null || !ObjectId.isValid(id.toString())) {
                    return Optional.empty();
                }
                conditions.add(Filters.eq(MONGO_ID, new ObjectId(id.toString())));
            } else {
                conditions.add(Filters.eq(criterion.getKey(), toBson(criterion.getValue())));
            }
        }
        return Optional.of(conditions.isEmpty() ? new Document() : Filters.and(conditions));
    }

    private StorageException translate(String operation, MongoException e) {
        if (e instanceof MongoServerException
                && ErrorCategory.fromErrorCode(e.getCode()) == ErrorCategory.DUPLICATE_KEY) {
            String field = violatedField(e.getMessage());
            log.debug("Duplicate key on {}.{}: {}", kind.plural(), field, e.getMessage());
            return new DuplicateKeyException(field);
        }
        return new StorageException(operation + " failed for " + kind.plural() + ": " + e.getMessage(), e);
    }

    /**
     * Reads the violated index name out of the server's E11000 message.
     */
    private String violatedField(String message) {
        String text = message == null ? "" : message;
        for (String field : uniqueFields) {
            if (text.contains("index: " + indexName(field) + " ")) {
                return field;
            }
        }
        return uniqueFields.size() == 1 ? uniqueFields.iterator().next() : null;
    }

    private E toEntity(Document document) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : document.entrySet()) {
            if (MONGO_ID.equals(entry.getKey())) {
                fields.put(Filter.ID_FIELD, fromBson(entry.getValue()).toString());
            } else {
                fields.put(entry.getKey(), fromBson(entry.getValue()));
            }
        }
        try {
            return mapper.fromDocument(Collections.unmodifiableMap(fields));
        } catch (IllegalArgumentException e) {
            throw new StorageException("Stored " + kind.getValue() + " document cannot be mapped: " + e.getMessage(), e);
        }
    }

    private Date now() {
        return Date.from(Instant.now(clock).truncatedTo(ChronoUnit.MILLIS));
    }

    static Object toBson(Object value) {
        if (value instanceof Instant instant) {
            return Date.from(instant);
        }
        if (value instanceof EntityId id) {
            return id.getValue();
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        if (value instanceof List<?> list) {
            List<Object> converted = new ArrayList<>(list.size());
            for (Object element : list) {
                converted.add(toBson(element));
            }
            return converted;
        }
        if (value instanceof Map<?, ?> map) {
            Document nested = new Document();
            map.forEach((key, nestedValue) -> nested.append(String.valueOf(key), toBson(nestedValue)));
            return nested;
        }
        return value;
    }

    static Object fromBson(Object value) {
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof ObjectId objectId) {
            return objectId.toHexString();
        }
        if (value instanceof List<?> list) {
            List<Object> converted = new ArrayList<>(list.size());
            for (Object element : list) {
                converted.add(fromBson(element));
            }
            return converted;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            map.forEach((key, nestedValue) -> nested.put(String.valueOf(key), fromBson(nestedValue)));
            return nested;
        }
        return value;
    }

    private static void requireFilter(Filter filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
    }
}
