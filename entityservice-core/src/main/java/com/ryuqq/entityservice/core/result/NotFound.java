package com.ryuqq.entityservice.core.result;

import java.util.function.Function;

/**
 * 대상 식별자가 저장소에 없음.
 *
 * <p>리소스 없음 (404 Not Found).</p>
 *
 * @param message 오류 메시지
 * @param <T> 성공 시 값 타입
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public record NotFound<T>(String message) implements Result<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException message가 null이거나 빈 문자열인 경우
     */
    public NotFound {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    @Override
    public ResultKind kind() {
        return ResultKind.NOT_FOUND;
    }

    @Override
    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        return new NotFound<>(message);
    }
}
