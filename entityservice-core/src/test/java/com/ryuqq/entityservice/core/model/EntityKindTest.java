package com.ryuqq.entityservice.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EntityKind Value Object 테스트.
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
class EntityKindTest {

    @Test
    void of_ValidValue_CreatesEntityKind() {
        assertEquals("post", EntityKind.of("post").getValue());
    }

    @Test
    void of_UppercaseValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> EntityKind.of("Post"));
    }

    @Test
    void of_ValueWithUnderscore_ThrowsException() {
        // underscore separates verb/transition from kind in wire names
        assertThrows(IllegalArgumentException.class, () -> EntityKind.of("blog_post"));
    }

    @Test
    void of_NullValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> EntityKind.of(null));
    }

    @Test
    void plural_AppendsS() {
        assertEquals("users", EntityKind.of("user").plural());
    }

    @Test
    void displayName_CapitalizesFirstLetter() {
        assertEquals("Post", EntityKind.of("post").displayName());
    }

    @Test
    void collectionPath_ReturnsPluralPath() {
        assertEquals("/posts", EntityKind.of("post").collectionPath());
    }

    @Test
    void resourcePath_AppendsId() {
        assertEquals("/users/abc-1", EntityKind.of("user").resourcePath("abc-1"));
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        assertEquals(EntityKind.of("user"), EntityKind.of("user"));
        assertEquals(EntityKind.of("user").hashCode(), EntityKind.of("user").hashCode());
    }
}
