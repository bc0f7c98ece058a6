package com.ryuqq.entityservice.application.user;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ryuqq.entityservice.core.model.Entity;
import com.ryuqq.entityservice.core.model.EntityId;

import java.time.Instant;

/**
 * 사용자 엔티티.
 *
 * <p>password는 항상 단방향 해시이며, 응답과 이벤트로 내보낼 때는
 * {@link #withoutPassword()}로 제거됩니다.</p>
 *
 * @param id 저장소가 할당한 식별자
 * @param email 이메일 (유일, 소문자로 정규화)
 * @param password 비밀번호 해시 (외부 노출 시 null)
 * @param name 이름 (선택)
 * @param role 권한
 * @param active 활성 여부
 * @param emailVerified 이메일 인증 여부
 * @param createdAt 생성 시각
 * @param updatedAt 최종 수정 시각
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record User(
    EntityId id,
    String email,
    String password,
    String name,
    UserRole role,
    @JsonProperty("isActive") boolean active,
    @JsonProperty("isEmailVerified") boolean emailVerified,
    Instant createdAt,
    Instant updatedAt
) implements Entity {

    /**
     * 비밀번호 해시를 제거한 사본.
     *
     * @return password가 null인 User
     */
    public User withoutPassword() {
        return new User(id, email, null, name, role, active, emailVerified, createdAt, updatedAt);
    }

    @Override
    public String toString() {
        return "User{id=" + id
            + ", email=" + email
            + ", name=" + name
            + ", role=" + role
            + ", active=" + active
            + ", emailVerified=" + emailVerified
            + ", createdAt=" + createdAt
            + ", updatedAt=" + updatedAt
            + '}';
    }
}
