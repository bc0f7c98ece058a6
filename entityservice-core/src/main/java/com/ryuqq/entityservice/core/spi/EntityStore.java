package com.ryuqq.entityservice.core.spi;

import com.ryuqq.entityservice.core.model.Entity;
import com.ryuqq.entityservice.core.model.EntityKind;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Document store SPI for a single collection of entities of one kind.
 *
 * <p>This interface provides uniform CRUD access to one collection, keyed by an
 * opaque identifier assigned by the store. It is the only place where the
 * {@code EntityService} pipeline touches durable state.</p>
 *
 * <p><strong>Absence vs. failure:</strong></p>
 * <ul>
 *   <li>Normal absence is a value: an empty {@link Optional}, an empty list, or {@code false}</li>
 *   <li>Backend/transport failures throw {@link StorageException}</li>
 *   <li>Unique constraint violations throw {@link DuplicateKeyException}</li>
 * </ul>
 *
 * <p><strong>Atomicity:</strong> every operation is single-document. No
 * multi-document transactions are assumed, which is why store writes and event
 * publication are two separate, non-atomic steps in the service.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods must be safely callable from multiple threads</li>
 *   <li>Per-document atomicity: concurrent updates race, last write wins</li>
 *   <li>Bounded: calls must not block indefinitely (transport-level timeout configured by the adapter)</li>
 * </ul>
 *
 * @param <E> entity type
 * @author Entity Service Team
 * @since 1.0.0
 */
public interface EntityStore<E extends Entity> {

    /**
     * Returns the entity kind this store holds.
     *
     * @return the entity kind
     */
    EntityKind kind();

    /**
     * Finds every entity matching the filter.
     *
     * @param filter equality criteria ({@link Filter#all()} for everything)
     * @return matching entities in insertion order (never null, may be empty)
     * @throws IllegalArgumentException if filter is null
     * @throws StorageException on backend failure
     */
    List<E> find(Filter filter);

    /**
     * Finds the first entity matching the filter.
     *
     * @param filter equality criteria
     * @return the entity, or empty when nothing matches
     * @throws IllegalArgumentException if filter is null
     * @throws StorageException on backend failure
     */
    Optional<E> findOne(Filter filter);

    /**
     * Inserts a new document.
     *
     * <p>The store assigns the identifier and the {@code createdAt}/{@code updatedAt}
     * bookkeeping fields; any such keys in {@code fields} are ignored.</p>
     *
     * @param fields creation fields
     * @return the created entity
     * @throws IllegalArgumentException if fields is null
     * @throws DuplicateKeyException if a unique field value is already held by another document
     * @throws StorageException on backend failure
     */
    E create(Map<String, Object> fields);

    /**
     * Atomically applies a partial update to the first matching document.
     *
     * <p>Never a silent no-op: when the filter matches nothing the result is empty.</p>
     *
     * @param filter equality criteria
     * @param patch fields to set
     * @return the post-update entity, or empty when nothing matches
     * @throws IllegalArgumentException if filter or patch is null
     * @throws DuplicateKeyException if the patch would violate a unique field
     * @throws StorageException on backend failure
     */
    Optional<E> updateOne(Filter filter, Patch patch);

    /**
     * Removes the first matching document.
     *
     * <p>Idempotent from the caller's perspective: deleting an already-deleted
     * identifier returns {@code false} rather than failing.</p>
     *
     * @param filter equality criteria
     * @return true if a document was removed
     * @throws IllegalArgumentException if filter is null
     * @throws StorageException on backend failure
     */
    boolean deleteOne(Filter filter);
}
