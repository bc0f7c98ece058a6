package com.ryuqq.entityservice.core.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Partial update: the set of fields to overwrite on one document.
 *
 * <p>Identity and creation bookkeeping cannot be patched, so an update mutates an
 * entity in place and never replaces its identity.</p>
 *
 * @param fields field → new value (non-empty, unmodifiable)
 * @author Entity Service Team
 * @since 1.0.0
 */
public record Patch(Map<String, Object> fields) {

    private static final Set<String> PROTECTED_FIELDS = Set.of(Filter.ID_FIELD, "createdAt", "updatedAt");

    public Patch {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("fields cannot be null or empty");
        }
        for (String field : fields.keySet()) {
            if (PROTECTED_FIELDS.contains(field)) {
                throw new IllegalArgumentException("field cannot be patched: " + field);
            }
        }
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Patch of(Map<String, Object> fields) {
        return new Patch(fields);
    }

    /**
     * Whether the patch sets the given field.
     */
    public boolean touches(String field) {
        return fields.containsKey(field);
    }

    @Override
    public String toString() {
        // values may carry credentials
        return "Patch{fields=" + fields.keySet() + '}';
    }
}
