package com.ryuqq.entityservice.application.dispatcher;

import com.ryuqq.entityservice.core.contract.CommandName;
import com.ryuqq.entityservice.core.result.ResultKind;

/**
 * 결과 종류 → 응답 상태 코드 매핑.
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public final class StatusCodes {

    public static final int OK = 200;
    public static final int CREATED = 201;
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int INTERNAL_ERROR = 500;

    private StatusCodes() {
        // utility class
    }

    /**
     * 결과 종류에 대응하는 상태 코드.
     *
     * @param kind 결과 종류
     * @param command 처리한 명령 (OK일 때 201/200 구분)
     * @return 상태 코드
     */
    public static int of(ResultKind kind, CommandName command) {
        return switch (kind) {
            case OK -> command == CommandName.CREATE ? CREATED : OK;
            case NOT_FOUND -> NOT_FOUND;
            case CONFLICT, INVALID_INPUT -> BAD_REQUEST;
            case UNEXPECTED -> INTERNAL_ERROR;
        };
    }
}
