package com.ryuqq.entityservice.core.contract;

import com.ryuqq.entityservice.core.model.EntityKind;
import com.ryuqq.entityservice.core.model.Payload;

/**
 * 원격 명령.
 *
 * <p>Command는 명령 이름, 대상 엔티티 종류, 페이로드로 구성되며 디스패치 후에는 변경되지 않습니다.</p>
 *
 * <p><strong>페이로드 형식 (JSON):</strong></p>
 * <ul>
 *   <li>CREATE: 생성 필드</li>
 *   <li>READ_ALL: 없음</li>
 *   <li>READ_ONE, DELETE: {"id": "..."}</li>
 *   <li>UPDATE: {"id": "...", "updateData": {...}}</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Command command = Command.of(
 *     CommandName.CREATE,
 *     EntityKind.of("user"),
 *     Payload.of("{\"email\":\"a@x.com\",\"password\":\"p\"}")
 * );
 * </pre>
 *
 * @param name 명령 이름
 * @param kind 대상 엔티티 종류
 * @param payload 페이로드 (null이면 빈 Payload로 대체)
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public record Command(
    CommandName name,
    EntityKind kind,
    Payload payload
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public Command {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (payload == null) {
            payload = Payload.empty();
        }
    }

    /**
     * Command 인스턴스를 생성하는 static factory method.
     *
     * @param name 명령 이름
     * @param kind 대상 엔티티 종류
     * @param payload 페이로드 (null 가능)
     * @return Command 인스턴스
     */
    public static Command of(CommandName name, EntityKind kind, Payload payload) {
        return new Command(name, kind, payload);
    }

    /**
     * 와이어 패턴.
     *
     * @return 와이어 패턴 (예: update_user)
     */
    public String pattern() {
        return name.patternFor(kind);
    }
}
