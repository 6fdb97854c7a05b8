package com.ryuqq.fsm.engine;

/**
 * push 복귀 지점 보관 방식.
 *
 * @author FSM Team
 * @since 1.0.0
 */
public enum PushMode {

    /**
     * 복귀 지점을 스택으로 보관.
     *
     * <p>연속 push 후 같은 횟수만큼 pop하면 최초 push 직전 상태로 돌아옵니다.</p>
     */
    STACK,

    /**
     * 복귀 지점을 단일 슬롯으로 보관 (레거시 호환).
     *
     * <p>push된 상태에서 다시 push하면 이전 복귀 지점을 덮어씁니다.
     * 첫 push 이전 상태로는 pop으로 돌아갈 수 없습니다.</p>
     */
    SINGLE_SLOT
}
