/**
 * State machine API package.
 *
 * <p>This package defines the public surface that host loops and state
 * implementations use to drive a pushdown state machine.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fsm.application.machine.StateMachine} - Registration, query, transition and frame hooks</li>
 *   <li>{@link com.ryuqq.fsm.application.machine.AbstractState} - State base class holding its machine and owner explicitly</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <pre>
 * engine (PushdownStateMachine, FrameRunner)
 *   ↓ implements
 * application (StateMachine, FrameRuntime)
 *   ↓ depends on
 * core (State, Outcome, FsmOperation, FsmErrorCode)
 * </pre>
 *
 * @since 1.0.0
 * @author FSM Team
 */
package com.ryuqq.fsm.application.machine;
