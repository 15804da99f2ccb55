package com.ryuqq.loadguard.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TaskHandle Value Object 테스트.
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
class TaskHandleTest {

    @Test
    void generate_ProducesUniqueHandles() {
        // Given
        Set<TaskHandle> handles = new HashSet<>();

        // When
        for (int i = 0; i < 1000; i++) {
            handles.add(TaskHandle.generate());
        }

        // Then
        assertEquals(1000, handles.size());
    }

    @Test
    void of_GeneratedValue_RoundTripsEqual() {
        // Given
        TaskHandle handle = TaskHandle.generate();

        // When
        TaskHandle restored = TaskHandle.of(handle.getValue());

        // Then
        assertEquals(handle, restored);
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> TaskHandle.of("task/../etc")
        );
        assertTrue(exception.getMessage().contains("invalid characters"));
    }

    @Test
    void of_NullValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> TaskHandle.of(null));
    }

    @Test
    void toString_ContainsValue() {
        // Given
        TaskHandle handle = TaskHandle.of("task-1");

        // When & Then
        assertEquals("TaskHandle{task-1}", handle.toString());
    }
}
