package com.ryuqq.entityservice.application.service;

import com.ryuqq.entityservice.application.codec.PayloadCodec;
import com.ryuqq.entityservice.application.validation.ValidationResult;
import com.ryuqq.entityservice.core.model.Entity;
import com.ryuqq.entityservice.core.model.EntityId;
import com.ryuqq.entityservice.core.model.EntityKind;
import com.ryuqq.entityservice.core.model.EventName;
import com.ryuqq.entityservice.core.model.Payload;
import com.ryuqq.entityservice.core.model.Transition;
import com.ryuqq.entityservice.core.result.Result;
import com.ryuqq.entityservice.core.spi.DuplicateKeyException;
import com.ryuqq.entityservice.core.spi.EntityStore;
import com.ryuqq.entityservice.core.spi.EventPublisher;
import com.ryuqq.entityservice.core.spi.Filter;
import com.ryuqq.entityservice.core.spi.Patch;
import com.ryuqq.entityservice.core.spi.PublishOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 엔티티 종류 하나에 대한 명령 → 저장 → 이벤트 파이프라인.
 *
 * <p>변경 명령은 항상 다음 순서로 처리됩니다:</p>
 * <pre>
 * 0. 유효성 검증      → 위반 시 InvalidInput (저장소 호출 없음)
 * 1. 존재 확인        → (update/delete) 없으면 NotFound
 * 2. 유일성 확인      → 다른 엔티티가 값을 보유하면 Conflict
 * 3. 저장소 변경      → DuplicateKeyException → Conflict, 그 외 실패 → Unexpected (이벤트 없음)
 * 4. 이벤트 발행      → best-effort, 실패는 WARN 로그만 남기고 명령은 성공
 * 5. 변경 후 엔티티 반환 (delete는 값 없음)
 * </pre>
 *
 * <p>저장소 변경과 이벤트 발행은 원자적이지 않습니다. 저장 성공 후 발행이 실패하면
 * 상태는 바뀌었지만 알림은 전달되지 않을 수 있습니다. 반대로 저장이 실패하면 이벤트는 절대 발행되지 않습니다.</p>
 *
 * <p>서비스는 상태를 갖지 않으며 저장소, 발행자, 코덱을 생성자로 전달받습니다.</p>
 *
 * @param <E> 엔티티 타입
 * @param <C> 생성 입력 타입
 * @param <P> 부분 수정 입력 타입
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public abstract class EntityService<E extends Entity, C, P> {

    private static final Logger log = LoggerFactory.getLogger(EntityService.class);

    protected final EntityStore<E> store;
    protected final EventPublisher publisher;
    protected final PayloadCodec codec;

    protected EntityService(EntityStore<E> store, EventPublisher publisher, PayloadCodec codec) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (publisher == null) {
            throw new IllegalArgumentException("publisher cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.store = store;
        this.publisher = publisher;
        this.codec = codec;
    }

    /**
     * 서비스가 담당하는 엔티티 종류.
     */
    public EntityKind kind() {
        return store.kind();
    }

    /**
     * 엔티티 타입 (수신 이벤트 디코딩용).
     */
    public abstract Class<E> entityType();

    /**
     * 생성 입력 타입 (디스패처의 페이로드 디코딩용).
     */
    public abstract Class<C> creationType();

    /**
     * 부분 수정 입력 타입 (디스패처의 페이로드 디코딩용).
     */
    public abstract Class<P> patchType();

    protected abstract ValidationResult validateCreation(C input);

    protected abstract ValidationResult validatePatch(P input);

    /**
     * 유일 제약이 걸린 필드 이름 (기본: 없음).
     */
    protected Set<String> uniqueFields() {
        return Set.of();
    }

    /**
     * 생성 입력을 저장 필드로 변환 (기본값 적용, 정규화 등).
     */
    protected Map<String, Object> prepareCreation(C input) {
        return codec.toFields(input);
    }

    /**
     * 수정 입력을 저장 필드로 변환. null 필드는 제외됩니다.
     */
    protected Map<String, Object> preparePatch(P input) {
        return codec.toFields(input);
    }

    /**
     * 유일성 검사를 통과한 필드를 저장 직전에 변환합니다 (기본: 그대로).
     *
     * <p>비용이 큰 변환(예: 비밀번호 해싱)은 여기서 합니다.
     * 검증 실패나 충돌로 끝나는 명령에서는 호출되지 않습니다.</p>
     *
     * @param fields prepareCreation 또는 preparePatch의 결과
     * @return 저장할 필드
     */
    protected Map<String, Object> beforeWrite(Map<String, Object> fields) {
        return fields;
    }

    /**
     * 응답과 이벤트에 노출할 형태 (기본: 그대로).
     */
    protected E publicView(E entity) {
        return entity;
    }

    // ===== Reads =====

    public Result<List<E>> findAll() {
        try {
            return Result.ok(store.find(Filter.all()).stream().map(this::publicView).toList());
        } catch (RuntimeException e) {
            log.error("Failed to find {}", kind().plural(), e);
            return Result.unexpected("Error finding " + kind().plural(), e);
        }
    }

    public Result<E> findById(EntityId id) {
        if (id == null) {
            return Result.invalidInput("Invalid " + kind().getValue() + " id");
        }
        try {
            return store.findOne(Filter.byId(id))
                    .<Result<E>>map(entity -> Result.ok(publicView(entity)))
                    .orElseGet(this::notFound);
        } catch (RuntimeException e) {
            log.error("Failed to find {} {}", kind().getValue(), id.getValue(), e);
            return Result.unexpected("Error finding " + kind().getValue(), e);
        }
    }

    // ===== Mutations =====

    public Result<E> create(C input) {
        Result<E> rejected = validate(input == null ? null : validateCreation(input), input);
        if (rejected != null) {
            return rejected;
        }

        E created;
        try {
            Map<String, Object> fields = prepareCreation(input);
            Optional<String> taken = takenUniqueField(fields, null);
            if (taken.isPresent()) {
                return conflict(taken.get());
            }
            created = store.create(beforeWrite(fields));
        } catch (DuplicateKeyException e) {
            log.info("Create {} rejected by unique index on {}", kind().getValue(), e.getField());
            return conflict(e.getField());
        } catch (RuntimeException e) {
            log.error("Failed to create {}", kind().getValue(), e);
            return Result.unexpected("Error creating " + kind().getValue(), e);
        }

        E view = publicView(created);
        emit(Transition.CREATED, view);
        return Result.ok(view);
    }

    public Result<E> update(EntityId id, P input) {
        if (id == null) {
            return Result.invalidInput("Invalid " + kind().getValue() + " id");
        }
        Result<E> rejected = validate(input == null ? null : validatePatch(input), input);
        if (rejected != null) {
            return rejected;
        }

        E updated;
        try {
            Filter filter = Filter.byId(id);
            if (store.findOne(filter).isEmpty()) {
                return notFound();
            }
            Map<String, Object> fields = preparePatch(input);
            if (fields.isEmpty()) {
                return Result.invalidInput("Invalid " + kind().getValue() + " input", List.of("no fields to update"));
            }
            Optional<String> taken = takenUniqueField(fields, id);
            if (taken.isPresent()) {
                return conflict(taken.get());
            }
            Optional<E> result = store.updateOne(filter, Patch.of(beforeWrite(fields)));
            if (result.isEmpty()) {
                // removed between the existence check and the write
                return notFound();
            }
            updated = result.get();
        } catch (DuplicateKeyException e) {
            log.info("Update {} {} rejected by unique index on {}", kind().getValue(), id.getValue(), e.getField());
            return conflict(e.getField());
        } catch (RuntimeException e) {
            log.error("Failed to update {} {}", kind().getValue(), id.getValue(), e);
            return Result.unexpected("Error updating " + kind().getValue(), e);
        }

        E view = publicView(updated);
        emit(Transition.UPDATED, view);
        return Result.ok(view);
    }

    public Result<Void> delete(EntityId id) {
        if (id == null) {
            return Result.invalidInput("Invalid " + kind().getValue() + " id");
        }
        try {
            Filter filter = Filter.byId(id);
            if (store.findOne(filter).isEmpty() || !store.deleteOne(filter)) {
                return notFound();
            }
        } catch (RuntimeException e) {
            log.error("Failed to delete {} {}", kind().getValue(), id.getValue(), e);
            return Result.unexpected("Error deleting " + kind().getValue(), e);
        }

        emit(Transition.DELETED, Map.of(Filter.ID_FIELD, id.getValue()));
        return Result.ok(null);
    }

    // ===== Inbound event handlers =====

    /**
     * {@code <kind>_created} 수신 처리. 실패는 로그만 남기고 전파하지 않습니다.
     */
    public final void handleCreated(E entity) {
        try {
            onCreated(entity);
        } catch (Exception e) {
            log.error("Handler for {} failed", EventName.of(kind(), Transition.CREATED), e);
        }
    }

    /**
     * {@code <kind>_updated} 수신 처리. 실패는 로그만 남기고 전파하지 않습니다.
     */
    public final void handleUpdated(E entity) {
        try {
            onUpdated(entity);
        } catch (Exception e) {
            log.error("Handler for {} failed", EventName.of(kind(), Transition.UPDATED), e);
        }
    }

    /**
     * {@code <kind>_deleted} 수신 처리. 실패는 로그만 남기고 전파하지 않습니다.
     */
    public final void handleDeleted(EntityId id) {
        try {
            onDeleted(id);
        } catch (Exception e) {
            log.error("Handler for {} failed", EventName.of(kind(), Transition.DELETED), e);
        }
    }

    protected void onCreated(E entity) {
        log.info("{} received: {}", EventName.of(kind(), Transition.CREATED), entity == null ? null : entity.id());
    }

    protected void onUpdated(E entity) {
        log.info("{} received: {}", EventName.of(kind(), Transition.UPDATED), entity == null ? null : entity.id());
    }

    protected void onDeleted(EntityId id) {
        log.info("{} received: {}", EventName.of(kind(), Transition.DELETED), id);
    }

    // ===== Internals =====

    protected final <T> Result<T> notFound() {
        return Result.notFound(kind().displayName() + " not found");
    }

    private <T> Result<T> validate(ValidationResult validation, Object input) {
        if (input == null) {
            return Result.invalidInput("Invalid " + kind().getValue() + " input", List.of("payload is required"));
        }
        if (!validation.valid()) {
            return Result.invalidInput("Invalid " + kind().getValue() + " input", validation.errors());
        }
        return null;
    }

    private Optional<String> takenUniqueField(Map<String, Object> fields, EntityId self) {
        for (String field : uniqueFields()) {
            if (!fields.containsKey(field)) {
                continue;
            }
            Optional<E> holder = store.findOne(Filter.by(field, fields.get(field)));
            if (holder.isPresent() && !holder.get().id().equals(self)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    private <T> Result<T> conflict(String field) {
        String label = field == null || field.isEmpty()
                ? "Value"
                : Character.toUpperCase(field.charAt(0)) + field.substring(1);
        return Result.conflict(label + " already exists");
    }

    private void emit(Transition transition, Object body) {
        EventName name = EventName.of(kind(), transition);
        try {
            Payload payload = codec.encode(body);
            PublishOutcome outcome = publisher.publish(name, payload);
            if (!outcome.delivered()) {
                log.warn("Event {} was not delivered: {}", name, outcome.error());
            }
        } catch (Exception e) {
            log.warn("Event {} could not be published", name, e);
        }
    }
}
