package com.ryuqq.entityservice.core.model;

import java.nio.charset.StandardCharsets;

/**
 * 명령과 이벤트에 실리는 JSON 본문.
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>생성: Payload.of("{\"email\":\"a@x.com\",\"password\":\"p\"}")</li>
 *   <li>단건 조회/삭제: Payload.of("{\"id\":\"abc\"}")</li>
 *   <li>수정: Payload.of("{\"id\":\"abc\",\"updateData\":{\"title\":\"t\"}}")</li>
 *   <li>read-all: Payload.empty()</li>
 * </ul>
 *
 * <p>null은 빈 본문으로 정규화되므로 {@link #getValue()}는 null을 반환하지 않습니다.
 * 해석(JSON 파싱)은 애플리케이션 계층의 코덱이 담당합니다.</p>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public final class Payload {

    private static final Payload EMPTY = new Payload("");

    private final String json;

    private Payload(String json) {
        this.json = json;
    }

    /**
     * JSON 텍스트로 Payload 생성.
     *
     * @param json JSON 텍스트 (null이면 빈 Payload)
     * @return Payload 인스턴스
     */
    public static Payload of(String json) {
        return json == null || json.isEmpty() ? EMPTY : new Payload(json);
    }

    public static Payload empty() {
        return EMPTY;
    }

    /**
     * JSON 텍스트.
     *
     * @return JSON 텍스트 (빈 Payload면 "")
     */
    public String getValue() {
        return json;
    }

    /**
     * 본문이 없거나 공백뿐인지 확인.
     */
    public boolean isEmpty() {
        return json.isBlank();
    }

    /**
     * UTF-8 기준 본문 크기 (로그용).
     */
    public int sizeInBytes() {
        return json.getBytes(StandardCharsets.UTF_8).length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Payload other && json.equals(other.json);
    }

    @Override
    public int hashCode() {
        return json.hashCode();
    }

    @Override
    public String toString() {
        // 자격 증명이 섞일 수 있으므로 본문은 출력하지 않음
        return "Payload{" + sizeInBytes() + " bytes}";
    }
}
