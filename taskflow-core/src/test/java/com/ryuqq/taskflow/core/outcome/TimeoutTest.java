package com.ryuqq.taskflow.core.outcome;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Timeout Record 테스트.
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
class TimeoutTest {

    @Test
    void constructor_ValidValues_CreatesTimeout() {
        // When
        Timeout timeout = new Timeout(500, 512);

        // Then
        assertEquals(500, timeout.deadlineMs());
        assertEquals(512, timeout.elapsedMs());
    }

    @Test
    void constructor_NonPositiveDeadline_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Timeout(0, 10)
        );
        assertTrue(exception.getMessage().contains("deadlineMs must be positive"));
    }

    @Test
    void constructor_NegativeElapsed_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Timeout(100, -1));
    }
}
