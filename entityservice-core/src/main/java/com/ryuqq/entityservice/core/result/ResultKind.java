package com.ryuqq.entityservice.core.result;

/**
 * {@link Result}의 종류.
 *
 * <p>enum으로 분리하여 디스패처가 switch 식으로 상태 코드를 빠짐없이 매핑할 수 있도록 합니다.</p>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public enum ResultKind {

    /** 성공 */
    OK,

    /** 대상 식별자 없음 */
    NOT_FOUND,

    /** 유일성 위반 */
    CONFLICT,

    /** 입력 유효성 위반 (잘못된 자격 증명 포함) */
    INVALID_INPUT,

    /** 분류되지 않은 저장소/전송 계층 실패 */
    UNEXPECTED
}
