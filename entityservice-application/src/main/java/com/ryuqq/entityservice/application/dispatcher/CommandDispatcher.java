package com.ryuqq.entityservice.application.dispatcher;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.entityservice.application.codec.PayloadCodec;
import com.ryuqq.entityservice.application.codec.PayloadCodecException;
import com.ryuqq.entityservice.application.service.EntityService;
import com.ryuqq.entityservice.core.contract.Command;
import com.ryuqq.entityservice.core.contract.CommandName;
import com.ryuqq.entityservice.core.contract.CommandPattern;
import com.ryuqq.entityservice.core.contract.EventMessage;
import com.ryuqq.entityservice.core.contract.ResponseEnvelope;
import com.ryuqq.entityservice.core.model.Entity;
import com.ryuqq.entityservice.core.model.EntityId;
import com.ryuqq.entityservice.core.model.EntityKind;
import com.ryuqq.entityservice.core.model.Payload;
import com.ryuqq.entityservice.core.result.InvalidInput;
import com.ryuqq.entityservice.core.result.Result;
import com.ryuqq.entityservice.core.spi.Filter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 수신 명령을 엔티티 종류별 서비스로 보내고 결과를 {@link ResponseEnvelope}로 감쌉니다.
 *
 * <p><strong>명령 처리:</strong></p>
 * <ul>
 *   <li>create: 201, path=/&lt;kind&gt;s</li>
 *   <li>read-all: 200, path=/&lt;kind&gt;s</li>
 *   <li>read-one/update/delete: 200, path=/&lt;kind&gt;s/&lt;id&gt;</li>
 *   <li>실패: data=null, 상태 코드는 {@link StatusCodes}</li>
 *   <li>잘못된 페이로드, 알 수 없는 엔티티 종류: 400</li>
 * </ul>
 *
 * <p><strong>이벤트 처리:</strong> 서비스의 이벤트 핸들러로 전달하며,
 * 디코딩이나 핸들러 실패는 로그만 남기고 호출자에게 던지지 않습니다.</p>
 *
 * <p>null 명령 인자를 거부하는 것 외에 dispatch는 예외를 던지지 않습니다.
 * 처리 실패를 포함한 모든 결과는 봉투로 반환됩니다.</p>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    static final String UPDATE_DATA_FIELD = "updateData";

    private final Map<EntityKind, EntityService<?, ?, ?>> services;
    private final PayloadCodec codec;
    private final Clock clock;

    public CommandDispatcher(Collection<? extends EntityService<?, ?, ?>> services, PayloadCodec codec, Clock clock) {
        if (services == null || services.isEmpty()) {
            throw new IllegalArgumentException("services cannot be null or empty");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        Map<EntityKind, EntityService<?, ?, ?>> byKind = new LinkedHashMap<>();
        for (EntityService<?, ?, ?> service : services) {
            if (byKind.putIfAbsent(service.kind(), service) != null) {
                throw new IllegalArgumentException("duplicate service for kind: " + service.kind().getValue());
            }
        }
        this.services = Map.copyOf(byKind);
        this.codec = codec;
        this.clock = clock;
    }

    /**
     * 와이어 패턴(예: get_post)과 페이로드로 명령을 처리합니다.
     *
     * @param pattern 와이어 패턴
     * @param payload JSON 페이로드
     * @return 응답 봉투
     */
    public ResponseEnvelope<?> dispatch(String pattern, Payload payload) {
        Command command;
        try {
            command = CommandPattern.parse(pattern, payload);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected unknown command pattern {}: {}", pattern, e.getMessage());
            return ResponseEnvelope.failure("Unknown command: " + pattern, "/", StatusCodes.BAD_REQUEST, now());
        }
        return dispatch(command);
    }

    /**
     * 명령을 처리합니다.
     *
     * @param command 명령
     * @return 응답 봉투 (실패도 봉투로 반환)
     * @throws IllegalArgumentException command가 null인 경우
     */
    public ResponseEnvelope<?> dispatch(Command command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        EntityKind kind = command.kind();
        EntityService<?, ?, ?> service = services.get(kind);
        if (service == null) {
            return ResponseEnvelope.failure(
                "Unsupported entity kind: " + kind.getValue(), kind.collectionPath(), StatusCodes.BAD_REQUEST, now()
            );
        }

        String path = kind.collectionPath();
        try {
            return route(service, command);
        } catch (PayloadCodecException | IllegalArgumentException e) {
            log.info("Malformed {} payload: {}", command.pattern(), e.getMessage());
            return ResponseEnvelope.failure(
                "Invalid " + kind.getValue() + " payload", path, StatusCodes.BAD_REQUEST, now()
            );
        } catch (Exception e) {
            log.error("Unhandled failure while dispatching {}", command.pattern(), e);
            return ResponseEnvelope.failure("Internal server error", path, StatusCodes.INTERNAL_ERROR, now());
        }
    }

    /**
     * 수신 이벤트를 서비스의 이벤트 핸들러로 전달합니다. 예외를 던지지 않습니다.
     *
     * @param event 수신 이벤트
     */
    public void dispatchEvent(EventMessage event) {
        if (event == null) {
            log.warn("Ignored null event");
            return;
        }
        EntityService<?, ?, ?> service = services.get(event.name().kind());
        if (service == null) {
            log.warn("No handler for event {}", event.name());
            return;
        }
        try {
            routeEvent(service, event);
        } catch (Exception e) {
            log.warn("Failed to handle event {}", event.name(), e);
        }
    }

    private <E extends Entity, C, P> ResponseEnvelope<?> route(EntityService<E, C, P> service, Command command) {
        EntityKind kind = command.kind();
        CommandName name = command.name();
        switch (name) {
            case CREATE: {
                C input = codec.decode(command.payload(), service.creationType());
                return envelope(service.create(input), name, kind.collectionPath(), kind.displayName() + " created successfully");
            }
            case READ_ALL: {
                return envelope(service.findAll(), name, kind.collectionPath(), kind.displayName() + "s retrieved successfully");
            }
            case READ_ONE: {
                EntityId id = readId(codec.readTree(command.payload()));
                return envelope(service.findById(id), name, kind.resourcePath(id.getValue()), kind.displayName() + " retrieved successfully");
            }
            case UPDATE: {
                JsonNode root = codec.readTree(command.payload());
                EntityId id = readId(root);
                P patch = codec.convert(root.get(UPDATE_DATA_FIELD), service.patchType());
                return envelope(service.update(id, patch), name, kind.resourcePath(id.getValue()), kind.displayName() + " updated successfully");
            }
            case DELETE: {
                EntityId id = readId(codec.readTree(command.payload()));
                return envelope(service.delete(id), name, kind.resourcePath(id.getValue()), kind.displayName() + " deleted successfully");
            }
            default:
                throw new IllegalStateException("Unhandled command: " + name);
        }
    }

    private <E extends Entity, C, P> void routeEvent(EntityService<E, C, P> service, EventMessage event) {
        switch (event.name().transition()) {
            case CREATED:
                service.handleCreated(codec.decode(event.payload(), service.entityType()));
                break;
            case UPDATED:
                service.handleUpdated(codec.decode(event.payload(), service.entityType()));
                break;
            case DELETED:
                service.handleDeleted(readId(codec.readTree(event.payload())));
                break;
            default:
                throw new IllegalStateException("Unhandled transition: " + event.name().transition());
        }
    }

    private ResponseEnvelope<?> envelope(Result<?> result, CommandName name, String path, String successMessage) {
        int status = StatusCodes.of(result.kind(), name);
        if (result.isOk()) {
            return ResponseEnvelope.success(result.valueOrNull(), successMessage, path, status, now());
        }
        return ResponseEnvelope.failure(failureMessage(result), path, status, now());
    }

    private static String failureMessage(Result<?> result) {
        if (result instanceof InvalidInput<?> invalid && !invalid.violations().isEmpty()) {
            return invalid.message() + ": " + String.join(", ", invalid.violations());
        }
        return result.message();
    }

    private EntityId readId(JsonNode root) {
        JsonNode id = root.get(Filter.ID_FIELD);
        if (id == null || !id.isTextual()) {
            throw new PayloadCodecException("id is required", null);
        }
        return EntityId.of(id.textValue());
    }

    private String now() {
        return Instant.now(clock).toString();
    }
}
