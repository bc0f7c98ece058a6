package com.ryuqq.entityservice.application.post;

import com.ryuqq.entityservice.application.codec.PayloadCodec;
import com.ryuqq.entityservice.application.service.EntityService;
import com.ryuqq.entityservice.application.validation.ValidationResult;
import com.ryuqq.entityservice.application.validation.Validator;
import com.ryuqq.entityservice.core.model.EntityKind;
import com.ryuqq.entityservice.core.spi.EntityStore;
import com.ryuqq.entityservice.core.spi.EventPublisher;

import java.util.List;
import java.util.Map;

/**
 * 게시글 서비스. 유일 필드가 없어 공통 파이프라인을 그대로 사용합니다.
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public class PostService extends EntityService<Post, CreatePost, UpdatePost> {

    public static final EntityKind KIND = EntityKind.of("post");

    private final Validator<CreatePost> creationValidator = new CreatePostValidator();
    private final Validator<UpdatePost> patchValidator = new UpdatePostValidator();

    public PostService(EntityStore<Post> store, EventPublisher publisher, PayloadCodec codec) {
        super(store, publisher, codec);
        if (!KIND.equals(store.kind())) {
            throw new IllegalArgumentException("store must hold " + KIND.getValue() + " entities, not " + store.kind().getValue());
        }
    }

    @Override
    public Class<Post> entityType() {
        return Post.class;
    }

    @Override
    public Class<CreatePost> creationType() {
        return CreatePost.class;
    }

    @Override
    public Class<UpdatePost> patchType() {
        return UpdatePost.class;
    }

    @Override
    protected ValidationResult validateCreation(CreatePost input) {
        return creationValidator.validate(input);
    }

    @Override
    protected ValidationResult validatePatch(UpdatePost input) {
        return patchValidator.validate(input);
    }

    @Override
    protected Map<String, Object> prepareCreation(CreatePost input) {
        Map<String, Object> fields = codec.toFields(input);
        fields.putIfAbsent("tags", List.of());
        fields.putIfAbsent("published", Boolean.FALSE);
        return fields;
    }
}
