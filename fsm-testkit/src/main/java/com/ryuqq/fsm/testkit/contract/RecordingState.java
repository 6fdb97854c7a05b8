package com.ryuqq.fsm.testkit.contract;

import com.ryuqq.fsm.core.state.State;

/**
 * State that records every hook call into a {@link HookJournal}.
 *
 * <p>Optional actions can be attached to {@code onEnter}, {@code onExit},
 * {@code onLateUpdate} and {@code reason} to simulate states that request
 * transitions from inside their own hooks.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * RecordingState walk = new RecordingState("walk", journal);
 * walk.onEnterDo(() -&gt; machine.goToState(jump));
 * </pre>
 *
 * @author FSM Team
 * @since 1.0.0
 */
public class RecordingState implements State {

    private static final Runnable NOTHING = () -> { };

    private final String name;
    private final HookJournal journal;

    private Runnable onEnterAction = NOTHING;
    private Runnable onExitAction = NOTHING;
    private Runnable onLateUpdateAction = NOTHING;
    private Runnable reasonAction = NOTHING;
    private Object lastPayload;

    /**
     * Creates a recording state.
     *
     * @param name the name used in journal entries and logs
     * @param journal the shared journal
     */
    public RecordingState(String name, HookJournal journal) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (journal == null) {
            throw new IllegalArgumentException("journal cannot be null");
        }
        this.name = name;
        this.journal = journal;
    }

    public RecordingState onEnterDo(Runnable action) {
        this.onEnterAction = action;
        return this;
    }

    public RecordingState onExitDo(Runnable action) {
        this.onExitAction = action;
        return this;
    }

    public RecordingState onLateUpdateDo(Runnable action) {
        this.onLateUpdateAction = action;
        return this;
    }

    public RecordingState reasonDo(Runnable action) {
        this.reasonAction = action;
        return this;
    }

    /**
     * Returns the payload received by the last {@code onEnter(Object)} call.
     *
     * @return the last payload, or null if none was received
     */
    public Object lastPayload() {
        return lastPayload;
    }

    @Override
    public void onEnter() {
        journal.record(name + ".onEnter");
        onEnterAction.run();
    }

    @Override
    public void onEnter(Object payload) {
        journal.record(name + ".onEnter(payload)");
        lastPayload = payload;
        onEnterAction.run();
    }

    @Override
    public void onExit() {
        journal.record(name + ".onExit");
        onExitAction.run();
    }

    @Override
    public void onUpdate() {
        journal.record(name + ".onUpdate");
    }

    @Override
    public void onFixedUpdate() {
        journal.record(name + ".onFixedUpdate");
    }

    @Override
    public void onLateUpdate() {
        journal.record(name + ".onLateUpdate");
        onLateUpdateAction.run();
    }

    @Override
    public void reason() {
        journal.record(name + ".reason");
        reasonAction.run();
    }

    @Override
    public void onGui() {
        journal.record(name + ".onGui");
    }

    @Override
    public void onPostRender() {
        journal.record(name + ".onPostRender");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
