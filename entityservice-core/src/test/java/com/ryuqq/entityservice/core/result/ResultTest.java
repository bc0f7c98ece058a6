package com.ryuqq.entityservice.core.result;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Result Sealed Interface 테스트.
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
class ResultTest {

    @Test
    void ok_IsOk_ReturnsValue() {
        // Given
        Result<String> result = Result.ok("value");

        // When & Then
        assertTrue(result.isOk());
        assertEquals(ResultKind.OK, result.kind());
        assertEquals("value", result.valueOrNull());
        assertNull(result.message());
    }

    @Test
    void okEmpty_HasNoValue() {
        Result<Void> result = Ok.empty();

        assertTrue(result.isOk());
        assertNull(result.valueOrNull());
    }

    @Test
    void failures_AreNotOk_AndCarryMessage() {
        Result<String> notFound = Result.notFound("Post not found");
        Result<String> conflict = Result.conflict("Email already exists");
        Result<String> invalid = Result.invalidInput("Invalid credentials");
        Result<String> unexpected = Result.unexpected("Error creating user", new IllegalStateException("db down"));

        assertFalse(notFound.isOk());
        assertFalse(conflict.isOk());
        assertFalse(invalid.isOk());
        assertFalse(unexpected.isOk());

        assertEquals(ResultKind.NOT_FOUND, notFound.kind());
        assertEquals(ResultKind.CONFLICT, conflict.kind());
        assertEquals(ResultKind.INVALID_INPUT, invalid.kind());
        assertEquals(ResultKind.UNEXPECTED, unexpected.kind());

        assertEquals("Post not found", notFound.message());
        assertNull(notFound.valueOrNull());
    }

    @Test
    void map_Ok_TransformsValue() {
        Result<Integer> result = Result.ok("abc").map(String::length);

        assertEquals(3, result.valueOrNull());
    }

    @Test
    void map_Failure_KeepsFailure() {
        Result<Integer> result = Result.<String>notFound("User not found").map(String::length);

        assertEquals(ResultKind.NOT_FOUND, result.kind());
        assertEquals("User not found", result.message());
    }

    @Test
    void map_Unexpected_KeepsCause() {
        IllegalStateException cause = new IllegalStateException("db down");

        Result<Integer> result = Result.<String>unexpected("Error finding users", cause).map(String::length);

        assertInstanceOf(Unexpected.class, result);
        assertSame(cause, ((Unexpected<Integer>) result).cause());
    }

    @Test
    void invalidInput_CopiesViolations() {
        // Given
        List<String> violations = new java.util.ArrayList<>(List.of("email is required"));

        // When
        InvalidInput<Object> result = new InvalidInput<>("Invalid user input", violations);
        violations.add("password is required");

        // Then
        assertEquals(List.of("email is required"), result.violations());
    }

    @Test
    void invalidInput_NullViolations_BecomesEmpty() {
        assertEquals(List.of(), new InvalidInput<>("Invalid credentials", null).violations());
    }

    @Test
    void unexpected_ToString_HidesCauseMessage() {
        Result<Object> result = Result.unexpected("Error creating user", new IllegalStateException("password=secret"));

        assertFalse(result.toString().contains("secret"));
        assertTrue(result.toString().contains("IllegalStateException"));
    }

    @Test
    void notFound_BlankMessage_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Result.notFound(" "));
    }

    @Test
    void kind_ExhaustiveSwitch_HandlesAllCases() {
        for (ResultKind kind : ResultKind.values()) {
            int status = switch (kind) {
                case OK -> 200;
                case NOT_FOUND -> 404;
                case CONFLICT, INVALID_INPUT -> 400;
                case UNEXPECTED -> 500;
            };
            assertTrue(status >= 200);
        }
    }
}
