package com.ryuqq.fsm.application.runtime;

/**
 * Frame-driven host loop runtime.
 *
 * <p>This interface defines how a host loop drives a state machine once per
 * logical frame.</p>
 *
 * <p><strong>Frame Phase Order:</strong></p>
 * <pre>
 * runFrame()
 *   ↓
 * 1. update()       → current.onUpdate()
 * 2. fixedUpdate()  → current.onFixedUpdate()
 * 3. lateUpdate()   → current.onLateUpdate(), then (possibly new) current.reason()
 * 4. gui()          → current.onGui()        (presentation hooks only)
 * 5. postRender()   → current.onPostRender() (presentation hooks only)
 * </pre>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>Single-threaded and cooperative: no phase may block</li>
 *   <li>Transitions requested inside a phase complete before the phase returns</li>
 *   <li>No deferred or queued transitions</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * FrameRuntime runtime = new FrameRunner(machine);
 * while (game.isRunning()) {
 *     runtime.runFrame();
 * }
 * </pre>
 *
 * @author FSM Team
 * @since 1.0.0
 */
public interface FrameRuntime {

    /**
     * Executes a single frame: every phase hook once, in fixed order.
     *
     * <p>Exceptions thrown by state hooks propagate to the caller and abort
     * the remaining phases of this frame.</p>
     */
    void runFrame();

    /**
     * Number of frames that completed every phase.
     *
     * @return completed frame count
     */
    long frameCount();
}
