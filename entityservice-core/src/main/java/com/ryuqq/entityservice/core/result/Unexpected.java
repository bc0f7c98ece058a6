package com.ryuqq.entityservice.core.result;

import java.util.function.Function;

/**
 * 분류되지 않은 실패 (저장소/전송 계층 오류).
 *
 * <p>원인은 진단(로그)용으로만 보존하며, 호출자에게 그대로 노출하지 않습니다.
 * {@link #message()}는 "Error creating post"처럼 일반화된 문구여야 합니다.</p>
 *
 * @param message 호출자에게 노출할 일반화된 메시지
 * @param cause 원인 (null 가능)
 * @param <T> 성공 시 값 타입
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public record Unexpected<T>(String message, Throwable cause) implements Result<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException message가 null이거나 빈 문자열인 경우
     */
    public Unexpected {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    @Override
    public ResultKind kind() {
        return ResultKind.UNEXPECTED;
    }

    @Override
    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        return new Unexpected<>(message, cause);
    }

    @Override
    public String toString() {
        return "Unexpected[message=" + message + ", cause=" + (cause == null ? "none" : cause.getClass().getSimpleName()) + "]";
    }
}
