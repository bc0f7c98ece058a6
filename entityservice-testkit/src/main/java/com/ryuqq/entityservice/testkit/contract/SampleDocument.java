package com.ryuqq.entityservice.testkit.contract;

import com.ryuqq.entityservice.core.model.Entity;
import com.ryuqq.entityservice.core.model.EntityId;
import com.ryuqq.entityservice.core.spi.DocumentMapper;
import com.ryuqq.entityservice.core.spi.Filter;

import java.time.Instant;
import java.util.Map;

/**
 * Minimal entity used by the store contract tests.
 *
 * <p>{@code code} is the field the contract tests declare unique.</p>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public record SampleDocument(
    EntityId id,
    String name,
    String code,
    Instant createdAt,
    Instant updatedAt
) implements Entity {

    /**
     * Hand-written mapper so the testkit needs no serialization library.
     */
    public static final DocumentMapper<SampleDocument> MAPPER = document -> new SampleDocument(
        EntityId.of((String) document.get(Filter.ID_FIELD)),
        (String) document.get("name"),
        (String) document.get("code"),
        toInstant(document.get("createdAt")),
        toInstant(document.get("updatedAt"))
    );

    /**
     * Creation fields for a sample document.
     */
    public static Map<String, Object> fields(String name, String code) {
        return Map.of("name", name, "code", code);
    }

    private static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        return Instant.parse(value.toString());
    }
}
