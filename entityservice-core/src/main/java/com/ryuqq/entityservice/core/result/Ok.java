package com.ryuqq.entityservice.core.result;

import java.util.function.Function;

/**
 * 성공 결과.
 *
 * @param value 성공 값 (삭제처럼 반환할 값이 없는 경우 null)
 * @param <T> 값 타입
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public record Ok<T>(T value) implements Result<T> {

    /**
     * 값 없는 성공 결과 생성.
     *
     * @param <T> 값 타입
     * @return Ok 인스턴스
     */
    public static <T> Ok<T> empty() {
        return new Ok<>(null);
    }

    @Override
    public ResultKind kind() {
        return ResultKind.OK;
    }

    @Override
    public String message() {
        return null;
    }

    @Override
    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        return new Ok<>(mapper.apply(value));
    }
}
