package com.ryuqq.entityservice.application.user;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * update_user의 updateData. null 필드는 변경하지 않습니다.
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public record UpdateUser(
    String email,
    String password,
    String name,
    UserRole role,
    @JsonProperty("isActive") Boolean active,
    @JsonProperty("isEmailVerified") Boolean emailVerified
) {

    public static UpdateUser email(String email) {
        return new UpdateUser(email, null, null, null, null, null);
    }

    public static UpdateUser name(String name) {
        return new UpdateUser(null, null, name, null, null, null);
    }

    public static UpdateUser password(String password) {
        return new UpdateUser(null, password, null, null, null, null);
    }

    @JsonIgnore
    boolean isEmpty() {
        return email == null && password == null && name == null
            && role == null && active == null && emailVerified == null;
    }

    @Override
    public String toString() {
        return "UpdateUser{email=" + email + ", name=" + name + ", role=" + role
            + ", passwordChanged=" + (password != null) + '}';
    }
}
