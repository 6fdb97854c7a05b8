package com.ryuqq.fsm.testkit.contract;

import com.ryuqq.fsm.core.statemachine.FsmErrorCode;
import com.ryuqq.fsm.engine.StateMachineConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the legacy single-level configuration.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>A second push overwrites the return point; the first origin is unreachable by pop</li>
 *   <li>Registration records the current state as previous</li>
 * </ul>
 *
 * @author FSM Team
 * @since 1.0.0
 */
class LegacyCompatibilityContractTest extends AbstractStateMachineContractTest {

    @Override
    protected StateMachineConfig config() {
        return StateMachineConfig.legacy();
    }

    @Test
    void testPushTwice_SecondPushOverwritesReturnPoint() {
        // Given
        registerAll();
        machine.goToState(walk);

        // When: walk → push jump → push fall
        machine.pushState(jump);
        machine.pushState(fall);

        // Then
        assertEquals(1, machine.pushDepth());
        assertSame(jump, machine.pushOrigin().orElseThrow());

        machine.popState();
        assertCurrentState(jump);
        assertFalse(machine.isStatePushed());

        // walk can no longer be reached via pop
        assertRejected(machine.popState(), FsmErrorCode.NO_HISTORY);
        assertCurrentState(jump);
    }

    @Test
    void testRegistration_RecordsPreviousState() {
        // When
        registerAll();

        // Then: previous is the current state at registration time
        assertSame(idle, machine.previousState().orElseThrow());
        assertTrue(machine.goToPreviousState().isOk());
        assertJournal("idle.onExit", "idle.onEnter");
    }
}
