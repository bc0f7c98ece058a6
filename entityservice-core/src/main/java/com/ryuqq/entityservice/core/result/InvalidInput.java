package com.ryuqq.entityservice.core.result;

import java.util.List;
import java.util.function.Function;

/**
 * 입력 유효성 위반.
 *
 * <p>스키마 검증 실패와 잘못된 자격 증명을 모두 포함합니다.
 * 자격 증명 실패의 경우 violations는 비어 있어야 하며, 계정 존재 여부를 드러내지 않습니다.</p>
 *
 * @param message 오류 메시지
 * @param violations 위반 항목 목록 (비어 있을 수 있음)
 * @param <T> 성공 시 값 타입
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public record InvalidInput<T>(String message, List<String> violations) implements Result<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException message가 null이거나 빈 문자열인 경우
     */
    public InvalidInput {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    @Override
    public ResultKind kind() {
        return ResultKind.INVALID_INPUT;
    }

    @Override
    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        return new InvalidInput<>(message, violations);
    }
}
