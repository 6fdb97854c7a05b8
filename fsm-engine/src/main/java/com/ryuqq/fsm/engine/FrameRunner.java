package com.ryuqq.fsm.engine;

import com.ryuqq.fsm.application.machine.StateMachine;
import com.ryuqq.fsm.application.runtime.FrameRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 고정 순서 프레임 러너.
 *
 * <p>호스트 루프가 프레임마다 {@link #runFrame()}을 한 번 호출하면
 * 상태 머신의 프레임 훅을 정해진 순서로 한 번씩 호출합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * runFrame()
 *   ↓
 * update → fixedUpdate → lateUpdate(+reason)
 *   ↓ (presentationHooksEnabled)
 * gui → postRender
 *   ↓
 * frameCount++
 * </pre>
 *
 * <p>훅에서 예외가 발생하면 남은 단계를 건너뛰고 예외를 전파하며,
 * 해당 프레임은 완료 프레임 수에 포함되지 않습니다.</p>
 *
 * @author FSM Team
 * @since 1.0.0
 */
public final class FrameRunner implements FrameRuntime {

    private static final Logger log = LoggerFactory.getLogger(FrameRunner.class);

    private final StateMachine machine;
    private final boolean presentationHooksEnabled;
    private long frameCount;

    /**
     * 생성자 (표시 단계 훅 포함).
     *
     * @param machine 구동할 상태 머신
     * @throws IllegalArgumentException machine이 null인 경우
     */
    public FrameRunner(StateMachine machine) {
        this(machine, true);
    }

    /**
     * 생성자.
     *
     * @param machine 구동할 상태 머신
     * @param presentationHooksEnabled gui/postRender 단계 호출 여부
     * @throws IllegalArgumentException machine이 null인 경우
     */
    public FrameRunner(StateMachine machine, boolean presentationHooksEnabled) {
        if (machine == null) {
            throw new IllegalArgumentException("machine cannot be null");
        }
        this.machine = machine;
        this.presentationHooksEnabled = presentationHooksEnabled;
    }

    @Override
    public void runFrame() {
        machine.update();
        machine.fixedUpdate();
        machine.lateUpdate();

        if (presentationHooksEnabled) {
            machine.gui();
            machine.postRender();
        }

        frameCount++;
        if (log.isTraceEnabled()) {
            log.trace("Frame {} completed in state {}", frameCount,
                machine.currentState().map(state -> state.name()).orElse("none"));
        }
    }

    @Override
    public long frameCount() {
        return frameCount;
    }
}
