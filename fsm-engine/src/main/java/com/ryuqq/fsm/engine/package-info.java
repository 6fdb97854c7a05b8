/**
 * Pushdown state machine engine.
 *
 * <p>This package contains the concrete implementations of the application
 * layer interfaces.</p>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fsm.engine.PushdownStateMachine} - Registration, transitions, push/pop and frame hook forwarding</li>
 *   <li>{@link com.ryuqq.fsm.engine.FrameRunner} - Calls every frame phase once, in fixed order</li>
 * </ul>
 *
 * <h2>Supporting Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fsm.engine.StateMachineConfig} - Immutable engine settings</li>
 *   <li>{@link com.ryuqq.fsm.engine.PushMode} - Stack or legacy single-slot return points</li>
 *   <li>{@link com.ryuqq.fsm.engine.TransitionGuard} - Bounds nested transitions started from state hooks</li>
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
 * @author FSM Team
 * @since 1.0.0
 */
package com.ryuqq.fsm.engine;
