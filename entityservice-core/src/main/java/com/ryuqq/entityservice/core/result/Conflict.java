package com.ryuqq.entityservice.core.result;

import java.util.function.Function;

/**
 * 유일성 제약 위반 (예
 *
 * <p> 이미 사용 중인 이메일).:쓰기 전에 감지되거나, 경합으로 저장소가 거부한 경우.</p>
 *
 * @param message 오류 메시지
 * @param <T> 성공 시 값 타입
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public record Conflict<T>(String message) implements Result<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException message가 null이거나 빈 문자열인 경우
     */
    public Conflict {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    @Override
    public ResultKind kind() {
        return ResultKind.CONFLICT;
    }

    @Override
    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        return new Conflict<>(message);
    }
}
