/**
 * Host loop runtime package.
 *
 * <ul>
 *   <li>{@link com.ryuqq.fsm.application.runtime.FrameRuntime} - Drives one state machine frame by frame</li>
 * </ul>
 *
 * @since 1.0.0
 * @author FSM Team
 */
package com.ryuqq.fsm.application.runtime;
