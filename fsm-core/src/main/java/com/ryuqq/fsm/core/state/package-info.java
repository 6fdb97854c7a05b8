/**
 * State contract package.
 *
 * <p>This package defines the lifecycle hooks every state driven by the
 * pushdown state machine exposes.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fsm.core.state.State} - Lifecycle and per-frame hooks (all default no-op)</li>
 * </ul>
 *
 * <h2>Hook Order per Frame</h2>
 * <pre>
 * onUpdate → onFixedUpdate → onLateUpdate → reason → onGui → onPostRender
 * </pre>
 *
 * @since 1.0.0
 * @author FSM Team
 */
package com.ryuqq.fsm.core.state;
