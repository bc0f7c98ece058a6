package com.ryuqq.entityservice.testkit.contract;

import com.ryuqq.entityservice.core.model.EntityId;
import com.ryuqq.entityservice.core.model.EntityKind;
import com.ryuqq.entityservice.core.spi.DocumentMapper;
import com.ryuqq.entityservice.core.spi.DuplicateKeyException;
import com.ryuqq.entityservice.core.spi.EntityStore;
import com.ryuqq.entityservice.core.spi.Filter;
import com.ryuqq.entityservice.core.spi.Patch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract tests every {@link EntityStore} adapter must pass.
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>create assigns id, createdAt and updatedAt; unique fields are enforced</li>
 *   <li>absence is a value (empty Optional, empty list, false), never an exception</li>
 *   <li>updateOne is never a silent no-op: empty when nothing matches</li>
 *   <li>deleteOne on an already-deleted id reports false</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyStoreContractTest extends AbstractEntityStoreContractTest {
 *     {@literal @}Override
 *     protected EntityStore&lt;SampleDocument&gt; createStore(EntityKind kind,
 *             DocumentMapper&lt;SampleDocument&gt; mapper, Set&lt;String&gt; uniqueFields, Clock clock) {
 *         return new MyStore&lt;&gt;(kind, mapper, uniqueFields, clock);
 *     }
 * }
 * </pre>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public abstract class AbstractEntityStoreContractTest {

    protected static final EntityKind KIND = EntityKind.of("sample");
    protected static final String UNIQUE_FIELD = "code";

    protected TestClock clock;
    protected EntityStore<SampleDocument> store;

    /**
     * Creates the adapter under test.
     *
     * @param kind entity kind
     * @param mapper document mapper
     * @param uniqueFields fields to enforce unique
     * @param clock clock for timestamps
     * @return a fresh, empty store
     */
    protected abstract EntityStore<SampleDocument> createStore(
        EntityKind kind, DocumentMapper<SampleDocument> mapper, Set<String> uniqueFields, Clock clock);

    @BeforeEach
    protected void setUpStore() {
        clock = TestClock.at("2026-01-01T00:00:00Z");
        store = createStore(KIND, SampleDocument.MAPPER, Set.of(UNIQUE_FIELD), clock);
    }

    @Test
    void kind_ReturnsConfiguredKind() {
        assertEquals(KIND, store.kind());
    }

    @Test
    void create_AssignsIdAndTimestamps() {
        // When
        SampleDocument created = store.create(SampleDocument.fields("first", "A-1"));

        // Then
        assertNotNull(created.id());
        assertEquals("first", created.name());
        assertEquals("A-1", created.code());
        assertEquals(Instant.parse("2026-01-01T00:00:00Z"), created.createdAt());
        assertEquals(created.createdAt(), created.updatedAt());
    }

    @Test
    void create_IgnoresCallerSuppliedId() {
        // Given
        Map<String, Object> fields = Map.of(Filter.ID_FIELD, "chosen-by-caller", "name", "x", "code", "X-1");

        // When
        SampleDocument created = store.create(fields);

        // Then
        assertNotEquals(EntityId.of("chosen-by-caller"), created.id());
    }

    @Test
    void create_AssignsDistinctIds() {
        SampleDocument first = store.create(SampleDocument.fields("first", "A-1"));
        SampleDocument second = store.create(SampleDocument.fields("second", "A-2"));

        assertNotEquals(first.id(), second.id());
    }

    @Test
    void create_DuplicateUniqueValue_ThrowsAndStoresNothing() {
        // Given
        store.create(SampleDocument.fields("first", "A-1"));

        // When & Then
        DuplicateKeyException exception = assertThrows(
            DuplicateKeyException.class,
            () -> store.create(SampleDocument.fields("second", "A-1"))
        );
        assertEquals(UNIQUE_FIELD, exception.getField());
        assertEquals(1, store.find(Filter.all()).size());
    }

    @Test
    void create_NullFields_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> store.create(null));
    }

    @Test
    void find_All_ReturnsInsertionOrder() {
        // Given
        store.create(SampleDocument.fields("first", "A-1"));
        store.create(SampleDocument.fields("second", "A-2"));
        store.create(SampleDocument.fields("third", "A-3"));

        // When
        List<SampleDocument> all = store.find(Filter.all());

        // Then
        assertEquals(List.of("first", "second", "third"), all.stream().map(SampleDocument::name).toList());
    }

    @Test
    void find_NoMatch_ReturnsEmptyList() {
        store.create(SampleDocument.fields("first", "A-1"));

        assertTrue(store.find(Filter.by("name", "missing")).isEmpty());
    }

    @Test
    void find_EmptyStore_ReturnsEmptyList() {
        assertTrue(store.find(Filter.all()).isEmpty());
    }

    @Test
    void findOne_ById_ReturnsEntity() {
        // Given
        SampleDocument created = store.create(SampleDocument.fields("first", "A-1"));

        // When
        Optional<SampleDocument> found = store.findOne(Filter.byId(created.id()));

        // Then
        assertTrue(found.isPresent());
        assertEquals(created, found.get());
    }

    @Test
    void findOne_ByField_ReturnsEntity() {
        store.create(SampleDocument.fields("first", "A-1"));
        store.create(SampleDocument.fields("second", "A-2"));

        Optional<SampleDocument> found = store.findOne(Filter.by(UNIQUE_FIELD, "A-2"));

        assertTrue(found.isPresent());
        assertEquals("second", found.get().name());
    }

    @Test
    void findOne_Missing_ReturnsEmpty() {
        assertTrue(store.findOne(Filter.byId(EntityId.of("does-not-exist"))).isEmpty());
    }

    @Test
    void findOne_IdAndFieldMismatch_ReturnsEmpty() {
        SampleDocument created = store.create(SampleDocument.fields("first", "A-1"));

        Optional<SampleDocument> found = store.findOne(Filter.byId(created.id()).and("name", "other"));

        assertTrue(found.isEmpty());
    }

    @Test
    void updateOne_AppliesPatchAndRefreshesUpdatedAt() {
        // Given
        SampleDocument created = store.create(SampleDocument.fields("first", "A-1"));
        clock.advance(Duration.ofMinutes(5));

        // When
        Optional<SampleDocument> updated = store.updateOne(
            Filter.byId(created.id()), Patch.of(Map.of("name", "renamed")));

        // Then
        assertTrue(updated.isPresent());
        assertEquals(created.id(), updated.get().id());
        assertEquals("renamed", updated.get().name());
        assertEquals("A-1", updated.get().code());
        assertEquals(created.createdAt(), updated.get().createdAt());
        assertEquals(Instant.parse("2026-01-01T00:05:00Z"), updated.get().updatedAt());
        assertEquals("renamed", store.findOne(Filter.byId(created.id())).orElseThrow().name());
    }

    @Test
    void updateOne_Missing_ReturnsEmpty() {
        Optional<SampleDocument> updated = store.updateOne(
            Filter.byId(EntityId.of("does-not-exist")), Patch.of(Map.of("name", "x")));

        assertTrue(updated.isEmpty());
        assertTrue(store.find(Filter.all()).isEmpty());
    }

    @Test
    void updateOne_ToValueHeldByAnother_ThrowsAndKeepsOriginal() {
        // Given
        store.create(SampleDocument.fields("first", "A-1"));
        SampleDocument second = store.create(SampleDocument.fields("second", "A-2"));

        // When & Then
        assertThrows(
            DuplicateKeyException.class,
            () -> store.updateOne(Filter.byId(second.id()), Patch.of(Map.of(UNIQUE_FIELD, "A-1")))
        );
        assertEquals("A-2", store.findOne(Filter.byId(second.id())).orElseThrow().code());
    }

    @Test
    void updateOne_KeepingOwnUniqueValue_Succeeds() {
        SampleDocument created = store.create(SampleDocument.fields("first", "A-1"));

        Optional<SampleDocument> updated = store.updateOne(
            Filter.byId(created.id()), Patch.of(Map.of(UNIQUE_FIELD, "A-1", "name", "same-code")));

        assertTrue(updated.isPresent());
        assertEquals("same-code", updated.get().name());
    }

    @Test
    void deleteOne_RemovesDocument() {
        // Given
        SampleDocument created = store.create(SampleDocument.fields("first", "A-1"));

        // When
        boolean deleted = store.deleteOne(Filter.byId(created.id()));

        // Then
        assertTrue(deleted);
        assertTrue(store.findOne(Filter.byId(created.id())).isEmpty());
    }

    @Test
    void deleteOne_Twice_SecondReportsFalse() {
        SampleDocument created = store.create(SampleDocument.fields("first", "A-1"));

        assertTrue(store.deleteOne(Filter.byId(created.id())));
        assertFalse(store.deleteOne(Filter.byId(created.id())));
    }

    @Test
    void deleteOne_FreesUniqueValue() {
        SampleDocument created = store.create(SampleDocument.fields("first", "A-1"));
        store.deleteOne(Filter.byId(created.id()));

        assertDoesNotThrow(() -> store.create(SampleDocument.fields("again", "A-1")));
    }

    @Test
    void nullFilter_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> store.find(null));
        assertThrows(IllegalArgumentException.class, () -> store.findOne(null));
        assertThrows(IllegalArgumentException.class, () -> store.deleteOne(null));
        assertThrows(IllegalArgumentException.class,
            () -> store.updateOne(null, Patch.of(Map.of("name", "x"))));
    }
}
