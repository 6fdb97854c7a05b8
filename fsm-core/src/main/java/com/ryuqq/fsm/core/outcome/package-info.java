/**
 * State machine operation outcome package.
 *
 * <p>This package defines the sealed result hierarchy every registration and
 * transition operation returns. Misuse is reported as a value, never thrown.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fsm.core.outcome.Outcome} - Sealed interface (permits Ok, Fail)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fsm.core.outcome.Ok} - Operation applied</li>
 *   <li>{@link com.ryuqq.fsm.core.outcome.Fail} - Operation rejected, machine unchanged</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * Outcome outcome = machine.popState();
 * if (outcome instanceof Fail fail
 *         &amp;&amp; fail.errorCode() == FsmErrorCode.NO_HISTORY) {
 *     machine.goToState(idle);
 * }
 * </pre>
 *
 * @since 1.0.0
 * @author FSM Team
 */
package com.ryuqq.fsm.core.outcome;
