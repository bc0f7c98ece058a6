package com.ryuqq.entityservice.application.security;

import com.ryuqq.entityservice.application.config.EntityServiceConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BCryptCredentialHasherTest {

    private final CredentialHasher hasher = new BCryptCredentialHasher(new EntityServiceConfig(4));

    @Test
    void 해시는_평문과_다르고_검증된다() {
        String hash = hasher.hash("secret");

        assertThat(hash).isNotEqualTo("secret").startsWith("$2");
        assertThat(hasher.matches("secret", hash)).isTrue();
        assertThat(hasher.matches("Secret", hash)).isFalse();
    }

    @Test
    void 같은_평문도_매번_다른_해시가_된다() {
        assertThat(hasher.hash("secret")).isNotEqualTo(hasher.hash("secret"));
    }

    @Test
    void 설정한_강도가_해시에_기록된다() {
        assertThat(hasher.hash("secret")).contains("$04$");
    }

    @Test
    void 비어있거나_형식이_틀린_해시는_불일치이다() {
        assertThat(hasher.matches("secret", null)).isFalse();
        assertThat(hasher.matches("secret", "")).isFalse();
        assertThat(hasher.matches("secret", "plain-text")).isFalse();
        assertThat(hasher.matches(null, hasher.hash("secret"))).isFalse();
    }

    @Test
    void null_평문은_해싱할_수_없다() {
        assertThatThrownBy(() -> hasher.hash(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
