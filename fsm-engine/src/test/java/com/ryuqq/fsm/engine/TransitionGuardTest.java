package com.ryuqq.fsm.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TransitionGuard 테스트.
 *
 * @author FSM Team
 * @since 1.0.0
 */
class TransitionGuardTest {

    @Test
    void tryEnter_UpToMaxDepth_Succeeds() {
        // Given
        TransitionGuard guard = new TransitionGuard(2);

        // When & Then
        assertTrue(guard.tryEnter());
        assertTrue(guard.tryEnter());
        assertEquals(2, guard.depth());
    }

    @Test
    void tryEnter_AtMaxDepth_ReturnsFalseWithoutChangingDepth() {
        // Given
        TransitionGuard guard = new TransitionGuard(1);
        guard.tryEnter();

        // When
        boolean entered = guard.tryEnter();

        // Then
        assertFalse(entered);
        assertEquals(1, guard.depth());
    }

    @Test
    void exit_ReleasesDepth() {
        // Given
        TransitionGuard guard = new TransitionGuard(1);
        guard.tryEnter();

        // When
        guard.exit();

        // Then
        assertEquals(0, guard.depth());
        assertTrue(guard.tryEnter());
    }

    @Test
    void exit_WithoutEnter_ThrowsException() {
        // Given
        TransitionGuard guard = new TransitionGuard(3);

        // When & Then
        IllegalStateException exception = assertThrows(IllegalStateException.class, guard::exit);
        assertTrue(exception.getMessage().contains("without a matching tryEnter"));
    }

    @Test
    void constructor_NonPositiveDepth_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new TransitionGuard(0)
        );
        assertTrue(exception.getMessage().contains("maxDepth must be positive"));
    }
}
