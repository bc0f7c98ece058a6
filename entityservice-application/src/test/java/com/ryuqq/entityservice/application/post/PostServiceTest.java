package com.ryuqq.entityservice.application.post;

import com.ryuqq.entityservice.adapter.inmemory.store.InMemoryEntityStore;
import com.ryuqq.entityservice.application.codec.JacksonDocumentMapper;
import com.ryuqq.entityservice.application.codec.PayloadCodec;
import com.ryuqq.entityservice.core.model.EntityId;
import com.ryuqq.entityservice.core.model.EntityKind;
import com.ryuqq.entityservice.core.result.InvalidInput;
import com.ryuqq.entityservice.core.result.Result;
import com.ryuqq.entityservice.core.result.ResultKind;
import com.ryuqq.entityservice.testkit.contract.RecordingEventPublisher;
import com.ryuqq.entityservice.testkit.contract.TestClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PostService 테스트.
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
class PostServiceTest {

    private final PayloadCodec codec = new PayloadCodec();

    private InMemoryEntityStore<Post> store;
    private RecordingEventPublisher publisher;
    private PostService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryEntityStore<>(PostService.KIND, new JacksonDocumentMapper<>(codec, Post.class),
            Set.of(), TestClock.at("2026-01-01T00:00:00Z"));
        publisher = new RecordingEventPublisher();
        service = new PostService(store, publisher, codec);
    }

    @Test
    void 게시글_생성시_기본값이_적용되고_post_created가_발행된다() {
        // when
        Result<Post> result = service.create(CreatePost.of("Hello", "World", "u1"));

        // then
        Post created = result.valueOrNull();
        assertThat(created.id()).isNotNull();
        assertThat(created.tags()).isEmpty();
        assertThat(created.published()).isFalse();
        assertThat(created.authorId()).isEqualTo("u1");
        assertThat(publisher.deliveredNames()).containsExactly("post_created");
        assertThat(codec.decode(publisher.delivered().get(0).payload(), Post.class)).isEqualTo(created);
    }

    @Test
    void 같은_제목의_게시글은_여러개_생성할_수_있다() {
        service.create(CreatePost.of("Same", "a", "u1"));
        Result<Post> second = service.create(CreatePost.of("Same", "b", "u1"));

        assertThat(second.isOk()).isTrue();
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void 필수_필드가_없으면_모든_위반을_모아_InvalidInput을_반환한다() {
        // when
        Result<Post> result = service.create(new CreatePost("x".repeat(201), null, " ", List.of("ok", " "), null));

        // then
        assertThat(result.kind()).isEqualTo(ResultKind.INVALID_INPUT);
        assertThat(((InvalidInput<Post>) result).violations()).containsExactly(
            "title must be at most 200 characters",
            "content is required",
            "authorId is required",
            "tags must not contain blank entries"
        );
        assertThat(store.size()).isZero();
        assertThat(publisher.attempts()).isEmpty();
    }

    @Test
    void 제목을_수정하면_나머지_필드는_유지된다() {
        // given
        Post created = service.create(new CreatePost("Old", "Body", "u1", List.of("java"), true)).valueOrNull();

        // when
        Result<Post> result = service.update(created.id(), UpdatePost.title("New"));

        // then
        Post updated = result.valueOrNull();
        assertThat(updated.title()).isEqualTo("New");
        assertThat(updated.content()).isEqualTo("Body");
        assertThat(updated.tags()).containsExactly("java");
        assertThat(updated.published()).isTrue();
        assertThat(publisher.deliveredNames()).containsExactly("post_created", "post_updated");
    }

    @Test
    void 태그_목록은_통째로_교체된다() {
        Post created = service.create(new CreatePost("T", "B", "u1", List.of("a", "b"), null)).valueOrNull();

        Post updated = service.update(created.id(), new UpdatePost(null, null, List.of("c"), null)).valueOrNull();

        assertThat(updated.tags()).containsExactly("c");
    }

    @Test
    void 빈_수정_데이터는_InvalidInput이다() {
        Post created = service.create(CreatePost.of("T", "B", "u1")).valueOrNull();

        Result<Post> result = service.update(created.id(), new UpdatePost(null, null, null, null));

        assertThat(result.kind()).isEqualTo(ResultKind.INVALID_INPUT);
        assertThat(publisher.deliveredNames()).containsExactly("post_created");
    }

    @Test
    void 삭제는_한번만_성공한다() {
        // given
        Post created = service.create(CreatePost.of("T", "B", "u1")).valueOrNull();

        // when
        Result<Void> first = service.delete(created.id());
        Result<Void> second = service.delete(created.id());

        // then
        assertThat(first.isOk()).isTrue();
        assertThat(second.kind()).isEqualTo(ResultKind.NOT_FOUND);
        assertThat(second.message()).isEqualTo("Post not found");
        assertThat(publisher.deliveredNames()).containsExactly("post_created", "post_deleted");
    }

    @Test
    void findById는_게시글을_반환한다() {
        Post created = service.create(CreatePost.of("T", "B", "u1")).valueOrNull();

        assertThat(service.findById(created.id()).valueOrNull()).isEqualTo(created);
        assertThat(service.findById(EntityId.of("nope")).kind()).isEqualTo(ResultKind.NOT_FOUND);
    }

    @Test
    void 다른_종류의_저장소로는_생성할_수_없다() {
        InMemoryEntityStore<Post> wrong = new InMemoryEntityStore<>(
            EntityKind.of("comment"), new JacksonDocumentMapper<>(codec, Post.class));

        assertThatThrownBy(() -> new PostService(wrong, publisher, codec))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
