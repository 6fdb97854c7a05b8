package com.ryuqq.fsm.core.outcome;

import com.ryuqq.fsm.core.statemachine.FsmErrorCode;
import com.ryuqq.fsm.core.statemachine.FsmOperation;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Fail Record 테스트.
 *
 * @author FSM Team
 * @since 1.0.0
 */
class FailTest {

    @Test
    void constructor_ValidValues_CreatesFail() {
        // When
        Fail fail = new Fail(FsmOperation.POP_STATE, FsmErrorCode.NO_HISTORY, "nothing pushed");

        // Then
        assertEquals(FsmOperation.POP_STATE, fail.operation());
        assertEquals(FsmErrorCode.NO_HISTORY, fail.errorCode());
        assertEquals("nothing pushed", fail.message());
        assertTrue(fail.isFail());
        assertFalse(fail.isOk());
    }

    @Test
    void constructor_NullOperation_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Fail(null, FsmErrorCode.NULL_TARGET, "message")
        );
        assertTrue(exception.getMessage().contains("operation cannot be null"));
    }

    @Test
    void constructor_NullErrorCode_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Fail(FsmOperation.ADD_STATE, null, "message")
        );
        assertTrue(exception.getMessage().contains("errorCode cannot be null"));
    }

    @Test
    void constructor_BlankMessage_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Fail.of(FsmOperation.ADD_STATE, FsmErrorCode.DUPLICATE_STATE, "  ")
        );
        assertTrue(exception.getMessage().contains("message cannot be null or blank"));
    }

    @Test
    void equals_SameValues_AreEqual() {
        // Given
        Fail first = Fail.of(FsmOperation.GO_TO_STATE, FsmErrorCode.STATE_NOT_FOUND, "missing");
        Fail second = Fail.of(FsmOperation.GO_TO_STATE, FsmErrorCode.STATE_NOT_FOUND, "missing");

        // Then
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }
}
