package com.ryuqq.entityservice.core.spi;

import com.ryuqq.entityservice.core.model.EntityId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Equality criteria over document fields.
 *
 * <p>A document matches when every criterion's field equals the given value.
 * An empty filter matches every document.</p>
 *
 * @param criteria field → expected value (unmodifiable)
 * @author Entity Service Team
 * @since 1.0.0
 */
public record Filter(Map<String, Object> criteria) {

    /** Field name under which the identifier is stored. */
    public static final String ID_FIELD = "id";

    public Filter {
        if (criteria == null) {
            throw new IllegalArgumentException("criteria cannot be null");
        }
        criteria = Collections.unmodifiableMap(new LinkedHashMap<>(criteria));
    }

    /**
     * Filter matching every document.
     */
    public static Filter all() {
        return new Filter(Map.of());
    }

    /**
     * Filter matching a single identifier.
     *
     * @throws IllegalArgumentException if id is null
     */
    public static Filter byId(EntityId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return by(ID_FIELD, id.getValue());
    }

    /**
     * Filter matching one field value.
     *
     * @throws IllegalArgumentException if field is null or blank
     */
    public static Filter by(String field, Object value) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
        Map<String, Object> criteria = new LinkedHashMap<>();
        criteria.put(field, value);
        return new Filter(criteria);
    }

    /**
     * Returns a new filter with one more criterion.
     */
    public Filter and(String field, Object value) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
        Map<String, Object> merged = new LinkedHashMap<>(criteria);
        merged.put(field, value);
        return new Filter(merged);
    }

    /**
     * Tests a stored document against every criterion.
     *
     * @param document the stored field map
     * @return true if all criteria match
     */
    public boolean matches(Map<String, Object> document) {
        for (Map.Entry<String, Object> criterion : criteria.entrySet()) {
            if (!Objects.equals(document.get(criterion.getKey()), criterion.getValue())) {
                return false;
            }
        }
        return true;
    }
}
