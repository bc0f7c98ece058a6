package com.ryuqq.entityservice.core.model;

import java.util.regex.Pattern;

/**
 * 엔티티 종류 구분자.
 *
 * <p>EntityKind는 하나의 스키마를 공유하는 문서 묶음을 가리키며,
 * 명령 패턴(create_post), 이벤트 이름(post_created), 리소스 경로(/posts)를 만드는 기준이 됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>EntityKind.of("user") - 사용자</li>
 *   <li>EntityKind.of("post") - 게시글</li>
 * </ul>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~50자</li>
 *   <li>패턴: 소문자로 시작하고 소문자와 숫자만 허용 (예: user, post)</li>
 * </ul>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public final class EntityKind {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-z][a-z0-9]*$");

    private final String value;

    private EntityKind(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("EntityKind cannot be null or blank");
        }
        if (value.length() > 50) {
            throw new IllegalArgumentException("EntityKind length cannot exceed 50 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("EntityKind must start with a lowercase letter and contain only lowercase letters and digits");
        }
        this.value = value;
    }

    /**
     * EntityKind 생성.
     *
     * @param value EntityKind 값 (예: user, post)
     * @return EntityKind 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static EntityKind of(String value) {
        return new EntityKind(value);
    }

    /**
     * EntityKind 값 조회.
     *
     * @return EntityKind 값
     */
    public String getValue() {
        return value;
    }

    /**
     * 복수형 이름 (예: post → posts).
     *
     * @return 복수형 이름
     */
    public String plural() {
        return value + "s";
    }

    /**
     * 첫 글자를 대문자로 바꾼 표시용 이름 (예: post → Post).
     *
     * @return 표시용 이름
     */
    public String displayName() {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    /**
     * 컬렉션 리소스 경로 (예: /posts).
     *
     * @return 리소스 경로
     */
    public String collectionPath() {
        return "/" + plural();
    }

    /**
     * 단일 리소스 경로 (예: /posts/abc).
     *
     * @param id 엔티티 식별자 원문
     * @return 리소스 경로
     */
    public String resourcePath(String id) {
        return collectionPath() + "/" + id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityKind that = (EntityKind) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "EntityKind{" + value + '}';
    }
}
