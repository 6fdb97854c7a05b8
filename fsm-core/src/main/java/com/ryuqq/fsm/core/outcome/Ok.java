package com.ryuqq.fsm.core.outcome;

import com.ryuqq.fsm.core.state.State;
import com.ryuqq.fsm.core.statemachine.FsmOperation;

/**
 * 연산 성공.
 *
 * <p>state의 의미는 연산에 따라 다릅니다:</p>
 * <ul>
 *   <li>ADD_STATE / DELETE_STATE: 등록 또는 삭제된 상태</li>
 *   <li>전이 연산: 연산 후 current 상태</li>
 * </ul>
 *
 * @param operation 수행된 연산
 * @param state 연산 대상 또는 결과 상태
 *
 * @author FSM Team
 * @since 1.0.0
 */
public record Ok(FsmOperation operation, State state) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException operation 또는 state가 null인 경우
     */
    public Ok {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
    }

    /**
     * Ok 생성.
     *
     * @param operation 수행된 연산
     * @param state 연산 대상 또는 결과 상태
     * @return Ok 인스턴스
     */
    public static Ok of(FsmOperation operation, State state) {
        return new Ok(operation, state);
    }
}
