package com.ryuqq.fsm.testkit.contract;

import com.ryuqq.fsm.application.machine.StateMachine;
import com.ryuqq.fsm.core.outcome.Fail;
import com.ryuqq.fsm.core.outcome.Outcome;
import com.ryuqq.fsm.core.state.State;
import com.ryuqq.fsm.core.statemachine.FsmErrorCode;
import com.ryuqq.fsm.engine.PushdownStateMachine;
import com.ryuqq.fsm.engine.StateMachineConfig;
import org.junit.jupiter.api.BeforeEach;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for state machine contract tests.
 *
 * <p>This class provides a fresh {@link PushdownStateMachine}, a shared
 * {@link HookJournal} and four recording states for every test.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>machine: built from {@link #config()} (defaults unless overridden)</li>
 *   <li>idle, walk, jump, fall: {@link RecordingState}s sharing one journal, not yet registered</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractStateMachineContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         registerAll();
 *         machine.goToState(walk);
 *
 *         assertCurrentState(walk);
 *         assertJournal("idle.onExit", "walk.onEnter");
 *     }
 * }
 * </pre>
 *
 * @author FSM Team
 * @since 1.0.0
 */
public abstract class AbstractStateMachineContractTest {

    protected HookJournal journal;
    protected StateMachine machine;

    protected RecordingState idle;
    protected RecordingState walk;
    protected RecordingState jump;
    protected RecordingState fall;

    /**
     * Sets up test fixtures before each test.
     */
    @BeforeEach
    void setUpMachine() {
        journal = new HookJournal();
        machine = new PushdownStateMachine(config());
        idle = new RecordingState("idle", journal);
        walk = new RecordingState("walk", journal);
        jump = new RecordingState("jump", journal);
        fall = new RecordingState("fall", journal);
    }

    /**
     * Configuration used to build the machine under test.
     *
     * @return the engine configuration
     */
    protected StateMachineConfig config() {
        return new StateMachineConfig();
    }

    /**
     * Registers idle, walk, jump and fall in that order and clears the journal.
     */
    protected void registerAll() {
        for (State state : List.of(idle, walk, jump, fall)) {
            assertTrue(machine.addState(state).isOk(), "registration failed for " + state.name());
        }
        journal.clear();
    }

    /**
     * Asserts that the given state is the current state (identity).
     *
     * @param expected the expected current state
     */
    protected void assertCurrentState(State expected) {
        State actual = machine.currentState().orElse(null);
        assertSame(expected, actual,
                String.format("Expected current state %s but was %s", expected, actual));
    }

    /**
     * Asserts that the outcome is a failure with the expected error code.
     *
     * @param outcome the outcome to check
     * @param expected the expected error code
     */
    protected void assertRejected(Outcome outcome, FsmErrorCode expected) {
        assertTrue(outcome instanceof Fail, "Expected Fail but was " + outcome);
        assertEquals(expected, ((Fail) outcome).errorCode());
    }

    /**
     * Asserts the journal holds exactly the given entries, in order.
     *
     * @param expected the expected entries
     */
    protected void assertJournal(String... expected) {
        assertEquals(List.of(expected), journal.entries());
    }
}
