package com.ryuqq.entityservice.core.result;

import java.util.List;
import java.util.function.Function;

/**
 * 엔티티 서비스 연산 결과.
 *
 * <p>Result는 다섯 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공 (값 포함, 삭제의 경우 값 없음)</li>
 *   <li>{@link NotFound}: 대상 식별자가 존재하지 않음</li>
 *   <li>{@link Conflict}: 유일성 제약 위반</li>
 *   <li>{@link InvalidInput}: 입력 유효성 위반</li>
 *   <li>{@link Unexpected}: 저장소/전송 계층 실패 (원인은 진단용으로만 보존)</li>
 * </ul>
 *
 * <p>"찾을 수 없음"을 예외로 흐름 제어하지 않고 값으로 표현합니다.
 * Sealed interface와 {@link ResultKind}로 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * int status = switch (result.kind()) {
 *     case OK -> 200;
 *     case NOT_FOUND -> 404;
 *     case CONFLICT, INVALID_INPUT -> 400;
 *     case UNEXPECTED -> 500;
 * };
 * </pre>
 *
 * @param <T> 성공 값 타입
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public sealed interface Result<T> permits Ok, NotFound, Conflict, InvalidInput, Unexpected {

    /**
     * 결과 종류.
     *
     * @return 결과 종류
     */
    ResultKind kind();

    /**
     * 사람이 읽을 수 있는 메시지 (성공인 경우 null).
     *
     * @return 메시지
     */
    String message();

    /**
     * 성공 값을 변환합니다. 실패인 경우 같은 실패를 새 타입으로 반환합니다.
     *
     * @param mapper 변환 함수
     * @param <R> 변환 후 타입
     * @return 변환된 Result
     */
    <R> Result<R> map(Function<? super T, ? extends R> mapper);

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return kind() == ResultKind.OK;
    }

    /**
     * 성공 값 조회 (실패이거나 값이 없으면 null).
     *
     * @return 성공 값
     */
    default T valueOrNull() {
        return this instanceof Ok<T> ok ? ok.value() : null;
    }

    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> notFound(String message) {
        return new NotFound<>(message);
    }

    static <T> Result<T> conflict(String message) {
        return new Conflict<>(message);
    }

    static <T> Result<T> invalidInput(String message) {
        return new InvalidInput<>(message, List.of());
    }

    static <T> Result<T> invalidInput(String message, List<String> violations) {
        return new InvalidInput<>(message, violations);
    }

    static <T> Result<T> unexpected(String message, Throwable cause) {
        return new Unexpected<>(message, cause);
    }
}
