package com.ryuqq.entityservice.application.config;

/**
 * 엔티티 서비스 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>passwordHashStrength: BCrypt log rounds (기본 10, 허용 범위 4~31)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>테스트: passwordHashStrength=4 (최소값, 빠름)</li>
 *   <li>운영: 10~12 (1 증가할 때마다 해시 비용 2배)</li>
 * </ul>
 *
 * @author Entity Service Team
 * @since 1.0.0
 * @param passwordHashStrength BCrypt log rounds (4~31)
 */
public record EntityServiceConfig(int passwordHashStrength) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: passwordHashStrength=10</p>
     */
    public EntityServiceConfig() {
        this(10);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException passwordHashStrength가 4~31 범위를 벗어난 경우
     */
    public EntityServiceConfig {
        if (passwordHashStrength < 4 || passwordHashStrength > 31) {
            throw new IllegalArgumentException(
                "passwordHashStrength must be between 4 and 31 (current: " + passwordHashStrength + ")"
            );
        }
    }

    /**
     * passwordHashStrength만 변경한 새 인스턴스 생성.
     */
    public EntityServiceConfig withPasswordHashStrength(int passwordHashStrength) {
        return new EntityServiceConfig(passwordHashStrength);
    }
}
