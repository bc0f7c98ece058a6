package com.ryuqq.entityservice.application.user;

/**
 * 사용자 권한.
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public enum UserRole {
    USER,
    ADMIN
}
