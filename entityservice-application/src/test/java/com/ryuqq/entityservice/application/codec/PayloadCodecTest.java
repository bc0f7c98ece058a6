package com.ryuqq.entityservice.application.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.entityservice.application.post.Post;
import com.ryuqq.entityservice.application.user.CreateUser;
import com.ryuqq.entityservice.application.user.UpdateUser;
import com.ryuqq.entityservice.application.user.User;
import com.ryuqq.entityservice.application.user.UserRole;
import com.ryuqq.entityservice.core.model.EntityId;
import com.ryuqq.entityservice.core.model.Payload;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PayloadCodecTest {

    private final PayloadCodec codec = new PayloadCodec();

    @Test
    void 엔티티는_문자열_id와_ISO_시각으로_직렬화된다() {
        // given
        Post post = new Post(EntityId.of("p1"), "T", "B", "u1", List.of("a"), true,
            Instant.parse("2026-01-01T00:00:00Z"), Instant.parse("2026-01-02T00:00:00Z"));

        // when
        JsonNode node = codec.readTree(codec.encode(post));

        // then
        assertThat(node.get("id").asText()).isEqualTo("p1");
        assertThat(node.get("createdAt").asText()).isEqualTo("2026-01-01T00:00:00Z");
        assertThat(node.get("published").asBoolean()).isTrue();
    }

    @Test
    void 사용자_상태_필드는_is_접두어로_직렬화되고_null은_생략된다() {
        User user = new User(EntityId.of("u1"), "a@x.com", null, null, UserRole.ADMIN, true, false,
            Instant.parse("2026-01-01T00:00:00Z"), Instant.parse("2026-01-01T00:00:00Z"));

        JsonNode node = codec.readTree(codec.encode(user));

        assertThat(node.has("isActive")).isTrue();
        assertThat(node.has("isEmailVerified")).isTrue();
        assertThat(node.get("role").asText()).isEqualTo("ADMIN");
        assertThat(node.has("password")).isFalse();
        assertThat(node.has("name")).isFalse();
    }

    @Test
    void 생성_페이로드의_알_수_없는_필드는_거부된다() {
        Payload payload = Payload.of("{\"email\":\"a@x.com\",\"password\":\"p\",\"admin\":true}");

        assertThatThrownBy(() -> codec.decode(payload, CreateUser.class))
            .isInstanceOf(PayloadCodecException.class);
    }

    @Test
    void 엔티티는_알_수_없는_필드를_무시한다() {
        Payload payload = Payload.of("{\"id\":\"p1\",\"title\":\"T\",\"__v\":0}");

        Post post = codec.decode(payload, Post.class);

        assertThat(post.id()).isEqualTo(EntityId.of("p1"));
        assertThat(post.tags()).isEmpty();
    }

    @Test
    void JSON이_아닌_페이로드는_PayloadCodecException이다() {
        assertThatThrownBy(() -> codec.readTree(Payload.of("{not json")))
            .isInstanceOf(PayloadCodecException.class);
        assertThatThrownBy(() -> codec.decode(Payload.of("[1,2]"), CreateUser.class))
            .isInstanceOf(PayloadCodecException.class);
    }

    @Test
    void 누락된_노드의_변환은_PayloadCodecException이다() {
        assertThatThrownBy(() -> codec.convert(null, UpdateUser.class))
            .isInstanceOf(PayloadCodecException.class);
    }

    @Test
    void toFields는_설정된_필드만_담는다() {
        Map<String, Object> fields = codec.toFields(UpdateUser.name("Alice"));

        assertThat(fields).containsExactly(Map.entry("name", "Alice"));
    }

    @Test
    void 문서의_Instant와_문자열_id로부터_엔티티를_만든다() {
        // given
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("id", "p1");
        document.put("title", "T");
        document.put("createdAt", Instant.parse("2026-01-01T00:00:00Z"));

        // when
        Post post = new JacksonDocumentMapper<>(codec, Post.class).fromDocument(document);

        // then
        assertThat(post.id().getValue()).isEqualTo("p1");
        assertThat(post.createdAt()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
    }

    @Test
    void 빈_id는_문서_매핑에서_거부된다() {
        Map<String, Object> document = Map.of("id", "", "title", "T");

        assertThatThrownBy(() -> new JacksonDocumentMapper<>(codec, Post.class).fromDocument(document))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
