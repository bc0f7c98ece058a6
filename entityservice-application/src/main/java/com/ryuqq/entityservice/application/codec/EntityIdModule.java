package com.ryuqq.entityservice.application.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.ryuqq.entityservice.core.model.EntityId;

import java.io.IOException;

/**
 * Writes {@link EntityId} as its plain string value and reads it back.
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
final class EntityIdModule extends SimpleModule {

    EntityIdModule() {
        super("EntityIdModule");
        addSerializer(EntityId.class, new EntityIdSerializer());
        addDeserializer(EntityId.class, new EntityIdDeserializer());
    }

    private static final class EntityIdSerializer extends JsonSerializer<EntityId> {
        @Override
        public void serialize(EntityId value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeString(value.getValue());
        }
    }

    private static final class EntityIdDeserializer extends JsonDeserializer<EntityId> {
        @Override
        public EntityId deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            String raw = p.getValueAsString();
            try {
                return EntityId.of(raw);
            } catch (IllegalArgumentException e) {
                return (EntityId) ctxt.handleWeirdStringValue(EntityId.class, raw, e.getMessage());
            }
        }
    }
}
