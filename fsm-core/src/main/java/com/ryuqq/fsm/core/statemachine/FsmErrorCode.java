package com.ryuqq.fsm.core.statemachine;

/**
 * 상태 머신 연산 실패 사유.
 *
 * <p>모든 실패는 비치명적(non-fatal)입니다. 실패한 연산은 current/previous/next/pushed
 * 슬롯을 전혀 변경하지 않으며, 엔진은 자동으로 재시도하지 않습니다.</p>
 *
 * @author FSM Team
 * @since 1.0.0
 */
public enum FsmErrorCode {

    /**
     * null 상태 참조가 전달됨.
     */
    NULL_TARGET,

    /**
     * 이미 등록된 상태(동일 참조)를 다시 등록하려 함.
     */
    DUPLICATE_STATE,

    /**
     * 등록되지 않은 상태를 삭제/전이/복귀 대상으로 지정함.
     */
    STATE_NOT_FOUND,

    /**
     * 복귀할 기록이 없음 (goToPreviousState 또는 popState).
     */
    NO_HISTORY,

    /**
     * 훅 내부에서 중첩된 전이가 허용 깊이를 초과함 (전이 순환 의심).
     */
    REENTRANCY_LIMIT_EXCEEDED,

    /**
     * 떠나는 상태의 onExit 안에서 전이를 요청함.
     *
     * <p>exit 중인 상태는 아직 current이므로 이 시점의 전이는 같은 상태를
     * 두 번 exit시키게 됩니다. 전이는 onEnter 또는 프레임 훅에서 요청해야 합니다.</p>
     */
    TRANSITION_DURING_EXIT
}
