package com.ryuqq.entityservice.application.user;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * create_user 페이로드.
 *
 * <p>role, isActive, isEmailVerified는 생략 가능하며 각각 USER, true, false가 기본값입니다.</p>
 *
 * @param email 이메일
 * @param password 평문 비밀번호 (저장 전 해싱)
 * @param name 이름 (선택)
 * @param role 권한 (선택)
 * @param active 활성 여부 (선택)
 * @param emailVerified 이메일 인증 여부 (선택)
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public record CreateUser(
    String email,
    String password,
    String name,
    UserRole role,
    @JsonProperty("isActive") Boolean active,
    @JsonProperty("isEmailVerified") Boolean emailVerified
) {

    /**
     * 필수 필드만으로 생성.
     */
    public static CreateUser of(String email, String password) {
        return new CreateUser(email, password, null, null, null, null);
    }

    @Override
    public String toString() {
        return "CreateUser{email=" + email + ", name=" + name + ", role=" + role + '}';
    }
}
