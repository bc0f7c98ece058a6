package com.ryuqq.entityservice.core.contract;

/**
 * 모든 명령에 대해 반환되는 응답 봉투.
 *
 * <p>전송 계층 산출물이며 영속 데이터 모델의 일부가 아닙니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * {success: true, data: {...}, message: "Post created successfully",
 *  path: "/posts", statusCode: 201, timestamp: "2026-01-01T00:00:00Z"}
 * </pre>
 *
 * @param success 성공 여부
 * @param data 결과 데이터 (실패 또는 삭제 시 null)
 * @param message 사람이 읽을 수 있는 메시지 (버전 간 안정성 보장 없음)
 * @param path 원본 리소스 경로
 * @param statusCode 상태 코드 (2xx, 400, 404, 500)
 * @param timestamp ISO-8601 시각
 * @param <T> 데이터 타입
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public record ResponseEnvelope<T>(
    boolean success,
    T data,
    String message,
    String path,
    int statusCode,
    String timestamp
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException message, path, timestamp가 null이거나 statusCode가 범위를 벗어난 경우
     */
    public ResponseEnvelope {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        if (statusCode < 100 || statusCode > 599) {
            throw new IllegalArgumentException("statusCode must be between 100 and 599 (current: " + statusCode + ")");
        }
        if (timestamp == null || timestamp.isBlank()) {
            throw new IllegalArgumentException("timestamp cannot be null or blank");
        }
        if (!success && data != null) {
            throw new IllegalArgumentException("failed envelope cannot carry data");
        }
    }

    /**
     * 성공 응답 생성.
     */
    public static <T> ResponseEnvelope<T> success(T data, String message, String path, int statusCode, String timestamp) {
        return new ResponseEnvelope<>(true, data, message, path, statusCode, timestamp);
    }

    /**
     * 실패 응답 생성.
     */
    public static <T> ResponseEnvelope<T> failure(String message, String path, int statusCode, String timestamp) {
        return new ResponseEnvelope<>(false, null, message, path, statusCode, timestamp);
    }
}
