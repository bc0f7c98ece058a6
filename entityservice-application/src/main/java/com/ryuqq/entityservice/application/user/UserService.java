package com.ryuqq.entityservice.application.user;

import com.ryuqq.entityservice.application.codec.PayloadCodec;
import com.ryuqq.entityservice.application.security.CredentialHasher;
import com.ryuqq.entityservice.application.service.EntityService;
import com.ryuqq.entityservice.application.validation.ValidationResult;
import com.ryuqq.entityservice.application.validation.Validator;
import com.ryuqq.entityservice.core.model.EntityKind;
import com.ryuqq.entityservice.core.result.Result;
import com.ryuqq.entityservice.core.spi.EntityStore;
import com.ryuqq.entityservice.core.spi.EventPublisher;
import com.ryuqq.entityservice.core.spi.Filter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 사용자 서비스.
 *
 * <p>공통 파이프라인에 다음을 더합니다:</p>
 * <ul>
 *   <li>email 유일성 (생성, email 변경 시 수정)</li>
 *   <li>유일성 검사 통과 후 저장 직전 비밀번호 해싱 (생성, password 변경 시 수정)</li>
 *   <li>응답과 이벤트에서 비밀번호 해시 제거</li>
 *   <li>{@link #findByEmail(String)}, {@link #validateCredentials(String, String)}</li>
 * </ul>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public class UserService extends EntityService<User, CreateUser, UpdateUser> {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    public static final EntityKind KIND = EntityKind.of("user");

    static final String EMAIL = "email";
    static final String PASSWORD = "password";

    private static final String INVALID_CREDENTIALS = "Invalid credentials";

    private final CredentialHasher hasher;
    private final Validator<CreateUser> creationValidator = new CreateUserValidator();
    private final Validator<UpdateUser> patchValidator = new UpdateUserValidator();

    // compared against for unknown emails so both failure paths cost one hash check
    private final String dummyHash;

    public UserService(EntityStore<User> store, EventPublisher publisher, PayloadCodec codec, CredentialHasher hasher) {
        super(store, publisher, codec);
        if (hasher == null) {
            throw new IllegalArgumentException("hasher cannot be null");
        }
        if (!KIND.equals(store.kind())) {
            throw new IllegalArgumentException("store must hold " + KIND.getValue() + " entities, not " + store.kind().getValue());
        }
        this.hasher = hasher;
        this.dummyHash = hasher.hash("not-a-real-password");
    }

    @Override
    public Class<User> entityType() {
        return User.class;
    }

    @Override
    public Class<CreateUser> creationType() {
        return CreateUser.class;
    }

    @Override
    public Class<UpdateUser> patchType() {
        return UpdateUser.class;
    }

    @Override
    protected ValidationResult validateCreation(CreateUser input) {
        return creationValidator.validate(input);
    }

    @Override
    protected ValidationResult validatePatch(UpdateUser input) {
        return patchValidator.validate(input);
    }

    @Override
    protected Set<String> uniqueFields() {
        return Set.of(EMAIL);
    }

    @Override
    protected Map<String, Object> prepareCreation(CreateUser input) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(EMAIL, normalizeEmail(input.email()));
        fields.put(PASSWORD, input.password());
        if (input.name() != null) {
            fields.put("name", input.name());
        }
        fields.put("role", (input.role() == null ? UserRole.USER : input.role()).name());
        fields.put("isActive", input.active() == null ? Boolean.TRUE : input.active());
        fields.put("isEmailVerified", input.emailVerified() == null ? Boolean.FALSE : input.emailVerified());
        return fields;
    }

    @Override
    protected Map<String, Object> preparePatch(UpdateUser input) {
        Map<String, Object> fields = codec.toFields(input);
        if (input.email() != null) {
            fields.put(EMAIL, normalizeEmail(input.email()));
        }
        if (input.password() != null) {
            fields.put(PASSWORD, input.password());
        }
        return fields;
    }

    /**
     * 평문 비밀번호를 해시로 바꿉니다. 유일성 검사를 통과한 쓰기에서만 호출되므로
     * 충돌로 끝나는 생성은 해싱 비용을 치르지 않습니다.
     */
    @Override
    protected Map<String, Object> beforeWrite(Map<String, Object> fields) {
        Object password = fields.get(PASSWORD);
        if (password == null) {
            return fields;
        }
        Map<String, Object> hashed = new LinkedHashMap<>(fields);
        hashed.put(PASSWORD, hasher.hash(password.toString()));
        return hashed;
    }

    @Override
    protected User publicView(User entity) {
        return entity.withoutPassword();
    }

    /**
     * 이메일로 사용자 조회.
     *
     * @param email 이메일 (대소문자 무시)
     * @return 사용자 (비밀번호 제외), 없으면 NotFound
     */
    public Result<User> findByEmail(String email) {
        if (email == null || email.isBlank()) {
            return Result.invalidInput("email is required");
        }
        try {
            return store.findOne(Filter.by(EMAIL, normalizeEmail(email)))
                .<Result<User>>map(user -> Result.ok(publicView(user)))
                .orElseGet(this::notFound);
        } catch (RuntimeException e) {
            log.error("Failed to find user by email", e);
            return Result.unexpected("Error finding user", e);
        }
    }

    /**
     * 자격 증명 확인.
     *
     * <p>존재하지 않는 이메일과 잘못된 비밀번호는 같은 InvalidInput("Invalid credentials")을 반환합니다.</p>
     *
     * @param email 이메일
     * @param password 평문 비밀번호
     * @return 일치하면 사용자 (비밀번호 제외)
     */
    public Result<User> validateCredentials(String email, String password) {
        if (email == null || email.isBlank() || password == null || password.isEmpty()) {
            return Result.invalidInput(INVALID_CREDENTIALS);
        }
        Optional<User> user;
        try {
            user = store.findOne(Filter.by(EMAIL, normalizeEmail(email)));
        } catch (RuntimeException e) {
            log.error("Failed to load user while validating credentials", e);
            return Result.unexpected("Error validating credentials", e);
        }
        if (user.isEmpty()) {
            hasher.matches(password, dummyHash);
            return Result.invalidInput(INVALID_CREDENTIALS);
        }
        if (!hasher.matches(password, user.get().password())) {
            return Result.invalidInput(INVALID_CREDENTIALS);
        }
        return Result.ok(publicView(user.get()));
    }

    private static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
