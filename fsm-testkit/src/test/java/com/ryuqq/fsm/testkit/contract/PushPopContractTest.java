package com.ryuqq.fsm.testkit.contract;

import com.ryuqq.fsm.core.outcome.Outcome;
import com.ryuqq.fsm.core.statemachine.FsmErrorCode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for push/pop with the default stack push mode.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>push suspends the current state without onExit; pop restores it without onEnter</li>
 *   <li>push and pop do not disturb transition history</li>
 *   <li>Repeated pushes unwind one pop at a time</li>
 *   <li>pop without push is rejected</li>
 *   <li>A transition requested from the popped state's onExit is rejected</li>
 * </ul>
 *
 * @author FSM Team
 * @since 1.0.0
 */
class PushPopContractTest extends AbstractStateMachineContractTest {

    @Test
    void testPushPop_SuspendAndResumeWithoutReentering() {
        // Given
        registerAll();
        machine.goToState(walk);
        journal.clear();

        // When
        machine.pushState(jump);

        // Then
        assertCurrentState(jump);
        assertTrue(machine.isStatePushed());
        assertJournal("jump.onEnter");

        // When
        Outcome popped = machine.popState();

        // Then
        assertTrue(popped.isOk());
        assertCurrentState(walk);
        assertFalse(machine.isStatePushed());
        assertTrue(machine.pushOrigin().isEmpty());
        assertJournal("jump.onEnter", "jump.onExit");
    }

    @Test
    void testPushPop_TransitionHistoryUntouched() {
        // Given
        registerAll();
        machine.goToState(walk);

        // When
        machine.pushState(jump);
        machine.popState();
        machine.goToPreviousState();

        // Then
        assertCurrentState(idle);
    }

    @Test
    void testPushPop_DirectTransitionKeepsPushHistory() {
        // Given
        registerAll();
        machine.pushState(jump);

        // When
        machine.goToState(fall);

        // Then
        assertTrue(machine.isStatePushed());
        machine.popState();
        assertCurrentState(idle);
        assertEquals(1, journal.count("fall.onExit"));
    }

    @Test
    void testPushPop_NestedPushesUnwindInOrder() {
        // Given
        registerAll();

        // When
        machine.pushState(walk);
        machine.pushState(jump, "menu");

        // Then
        assertEquals(2, machine.pushDepth());
        assertEquals("menu", jump.lastPayload());

        machine.popState();
        assertCurrentState(walk);
        machine.popState();
        assertCurrentState(idle);
        assertRejected(machine.popState(), FsmErrorCode.NO_HISTORY);
        assertEquals(0, journal.count("idle.onEnter"));
    }

    @Test
    void testPop_WithoutPushRejected() {
        // Given
        registerAll();

        // When
        Outcome outcome = machine.popState();

        // Then
        assertRejected(outcome, FsmErrorCode.NO_HISTORY);
        assertCurrentState(idle);
        assertJournal();
    }

    @Test
    void testPush_UnregisteredTargetRejected() {
        // Given
        machine.addState(idle);

        // When & Then
        assertRejected(machine.pushState(walk), FsmErrorCode.STATE_NOT_FOUND);
        assertRejected(machine.pushState(null), FsmErrorCode.NULL_TARGET);
        assertFalse(machine.isStatePushed());
        assertCurrentState(idle);
    }

    @Test
    void testPop_TransitionRequestedFromOnExitIsRejected() {
        // Given
        registerAll();
        machine.pushState(jump);
        List<Outcome> fromExit = new ArrayList<>();
        jump.onExitDo(() -> fromExit.add(machine.goToState(fall)));
        journal.clear();

        // When
        Outcome popped = machine.popState();

        // Then
        assertTrue(popped.isOk());
        assertEquals(1, fromExit.size());
        assertRejected(fromExit.get(0), FsmErrorCode.TRANSITION_DURING_EXIT);
        assertCurrentState(idle);
        assertFalse(machine.isStatePushed());
        assertJournal("jump.onExit");
    }

    @Test
    void testPop_OnExitFailureKeepsReturnPoint() {
        // Given
        registerAll();
        machine.pushState(jump);
        jump.onExitDo(() -> {
            throw new IllegalStateException("exit failed");
        });

        // When
        assertThrows(IllegalStateException.class, () -> machine.popState());

        // Then
        assertCurrentState(jump);
        assertEquals(1, machine.pushDepth());
        assertSame(idle, machine.pushOrigin().orElseThrow());
    }
}
