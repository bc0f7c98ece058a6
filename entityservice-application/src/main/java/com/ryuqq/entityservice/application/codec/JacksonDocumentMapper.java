package com.ryuqq.entityservice.application.codec;

import com.ryuqq.entityservice.core.model.Entity;
import com.ryuqq.entityservice.core.spi.DocumentMapper;

import java.util.Map;

/**
 * {@link DocumentMapper} backed by the shared Jackson configuration.
 *
 * @param <E> entity type
 * @author Entity Service Team
 * @since 1.0.0
 */
public final class JacksonDocumentMapper<E extends Entity> implements DocumentMapper<E> {

    private final PayloadCodec codec;
    private final Class<E> type;

    public JacksonDocumentMapper(PayloadCodec codec, Class<E> type) {
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        this.codec = codec;
        this.type = type;
    }

    @Override
    public E fromDocument(Map<String, Object> document) {
        try {
            return codec.fromFields(document, type);
        } catch (PayloadCodecException e) {
            throw new IllegalArgumentException("Document does not fit " + type.getSimpleName(), e);
        }
    }
}
