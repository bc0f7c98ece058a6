package com.ryuqq.entityservice.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EntityId Value Object 테스트.
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
class EntityIdTest {

    @Test
    void of_UuidValue_CreatesEntityId() {
        // Given
        String value = "3f2b8c1e-8a4d-4f7e-9b61-0c2d5e7f9a10";

        // When
        EntityId id = EntityId.of(value);

        // Then
        assertEquals(value, id.getValue());
    }

    @Test
    void of_HexObjectIdValue_CreatesEntityId() {
        assertEquals("65a1f0c2e4b0a1b2c3d4e5f6", EntityId.of("65a1f0c2e4b0a1b2c3d4e5f6").getValue());
    }

    @Test
    void of_NullValue_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> EntityId.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> EntityId.of("   "));
    }

    @Test
    void of_TooLongValue_ThrowsException() {
        String value = "a".repeat(129);

        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> EntityId.of(value)
        );
        assertTrue(exception.getMessage().contains("128"));
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> EntityId.of("abc/def"));
        assertThrows(IllegalArgumentException.class, () -> EntityId.of("abc def"));
        assertThrows(IllegalArgumentException.class, () -> EntityId.of("{\"$ne\":1}"));
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        EntityId first = EntityId.of("abc-1");
        EntityId second = EntityId.of("abc-1");

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void equals_DifferentValue_ReturnsFalse() {
        assertNotEquals(EntityId.of("abc-1"), EntityId.of("abc-2"));
    }

    @Test
    void toString_ContainsValue() {
        assertEquals("EntityId{abc-1}", EntityId.of("abc-1").toString());
    }
}
