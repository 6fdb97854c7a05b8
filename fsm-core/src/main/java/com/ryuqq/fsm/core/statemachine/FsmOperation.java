package com.ryuqq.fsm.core.statemachine;

/**
 * 상태 머신이 외부에 제공하는 연산 종류.
 *
 * <p>{@link com.ryuqq.fsm.core.outcome.Outcome}에 기록되어
 * 어떤 연산의 결과인지 식별하는 데 사용됩니다.</p>
 *
 * @author FSM Team
 * @since 1.0.0
 */
public enum FsmOperation {

    /**
     * 상태 등록.
     */
    ADD_STATE,

    /**
     * 상태 삭제.
     */
    DELETE_STATE,

    /**
     * 직접 전이 (exit → enter).
     */
    GO_TO_STATE,

    /**
     * 직전 상태로 복귀 (두 상태 간 토글).
     */
    GO_TO_PREVIOUS_STATE,

    /**
     * 현재 상태를 일시 중단하고 대상 상태 활성화 (exit 없음).
     */
    PUSH_STATE,

    /**
     * push된 상태를 종료하고 복귀 지점 재활성화 (enter 없음).
     */
    POP_STATE
}
