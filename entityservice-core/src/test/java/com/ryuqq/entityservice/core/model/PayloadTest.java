package com.ryuqq.entityservice.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Payload Value Object 테스트.
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
class PayloadTest {

    @Test
    void of_Json_KeepsValue() {
        assertEquals("{\"id\":\"p1\"}", Payload.of("{\"id\":\"p1\"}").getValue());
    }

    @Test
    void of_Null_NormalizesToEmpty() {
        Payload payload = Payload.of(null);

        assertEquals("", payload.getValue());
        assertSame(Payload.empty(), payload);
    }

    @Test
    void isEmpty_NullOrBlank_ReturnsTrue() {
        assertTrue(Payload.of(null).isEmpty());
        assertTrue(Payload.of("  ").isEmpty());
        assertTrue(Payload.empty().isEmpty());
        assertFalse(Payload.of("{}").isEmpty());
    }

    @Test
    void sizeInBytes_CountsUtf8Bytes() {
        assertEquals(2, Payload.of("{}").sizeInBytes());
        assertEquals(3, Payload.of("가").sizeInBytes());
    }

    @Test
    void toString_DoesNotExposeBody() {
        String text = Payload.of("{\"password\":\"secret\"}").toString();

        assertFalse(text.contains("secret"));
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        assertEquals(Payload.of("{}"), Payload.of("{}"));
        assertEquals(Payload.of(null), Payload.empty());
        assertNotEquals(Payload.of("{}"), Payload.empty());
    }
}
