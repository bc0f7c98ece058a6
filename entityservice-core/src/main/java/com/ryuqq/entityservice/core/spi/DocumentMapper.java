package com.ryuqq.entityservice.core.spi;

import com.ryuqq.entityservice.core.model.Entity;

import java.util.Map;

/**
 * Converts a stored document into its typed entity.
 *
 * <p>Store adapters keep documents as field maps (the identifier under
 * {@link Filter#ID_FIELD}, plus {@code createdAt}/{@code updatedAt}) and use a
 * mapper supplied by the entity kind to hand out typed entities.</p>
 *
 * @param <E> entity type
 * @author Entity Service Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DocumentMapper<E extends Entity> {

    /**
     * Maps a document to an entity.
     *
     * @param document stored field map (never null)
     * @return the typed entity
     * @throws IllegalArgumentException if the document does not fit the entity schema
     */
    E fromDocument(Map<String, Object> document);
}
