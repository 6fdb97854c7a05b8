/**
 * State machine vocabulary package.
 *
 * <p>This package names the operations the pushdown state machine exposes
 * and the reasons an operation can be rejected.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fsm.core.statemachine.FsmOperation} - Registration and transition operations</li>
 *   <li>{@link com.ryuqq.fsm.core.statemachine.FsmErrorCode} - Rejection reasons</li>
 * </ul>
 *
 * <h2>Transition Semantics</h2>
 * <pre>
 * GO_TO_STATE          : previous = current, exit current, enter target
 * GO_TO_PREVIOUS_STATE : swap current and previous (two-state toggle)
 * PUSH_STATE           : record return point, enter target (no exit)
 * POP_STATE            : exit current, restore return point (no enter)
 * </pre>
 *
 * @since 1.0.0
 * @author FSM Team
 */
package com.ryuqq.fsm.core.statemachine;
