/**
 * Contract test support for the pushdown state machine.
 *
 * <ul>
 *   <li>{@link com.ryuqq.fsm.testkit.contract.AbstractStateMachineContractTest} - Fresh machine and recording states per test</li>
 *   <li>{@link com.ryuqq.fsm.testkit.contract.RecordingState} - State that journals every hook call</li>
 *   <li>{@link com.ryuqq.fsm.testkit.contract.HookJournal} - Ordered hook call log</li>
 * </ul>
 *
 * @author FSM Team
 * @since 1.0.0
 */
package com.ryuqq.fsm.testkit.contract;
