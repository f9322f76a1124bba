package com.ryuqq.taskflow.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Payload Value Object 테스트.
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
class PayloadTest {

    @Test
    void of_JsonValue_KeepsValue() {
        // Given
        String json = "{\"username\":\"octocat\",\"total_public_repos\":8}";

        // When
        Payload payload = Payload.of(json);

        // Then
        assertEquals(json, payload.getValue());
        assertEquals(json.length(), payload.length());
        assertFalse(payload.isEmpty());
    }

    @Test
    void of_NullValue_ThrowsException() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> Payload.of(null));

        assertEquals("value cannot be null", exception.getMessage());
    }

    @Test
    void of_EmptyString_IsSharedEmptyPayload() {
        assertSame(Payload.empty(), Payload.of(""));
        assertTrue(Payload.empty().isEmpty());
        assertEquals("", Payload.empty().getValue());
    }

    @Test
    void equals_ComparesValue() {
        assertEquals(Payload.of("A1"), Payload.of("A1"));
        assertEquals(Payload.of("A1").hashCode(), Payload.of("A1").hashCode());
        assertNotEquals(Payload.of("A1"), Payload.of("C1"));
    }

    @Test
    void toString_DoesNotExposeContent() {
        // Given
        Payload payload = Payload.of("secret resume text");

        // Then
        assertEquals("Payload{18 chars}", payload.toString());
    }
}
