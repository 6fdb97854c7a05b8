package com.ryuqq.fsm.core.outcome;

import com.ryuqq.fsm.core.statemachine.FsmOperation;

/**
 * 상태 머신 연산 결과.
 *
 * <p>Outcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 연산이 적용됨</li>
 *   <li>{@link Fail}: 연산이 거부됨 (상태 변경 없음)</li>
 * </ul>
 *
 * <p>잘못된 사용은 예외가 아니라 Fail로 보고됩니다.
 * 호출자는 Fail을 "전이가 일어나지 않았음"으로 해석하고
 * 필요하면 올바른 대상으로 다시 요청할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Outcome outcome = machine.goToState(jump);
 * if (outcome instanceof Fail fail) {
 *     handle(fail.errorCode());
 * }
 * </pre>
 *
 * @author FSM Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Fail {

    /**
     * 결과를 만든 연산.
     *
     * @return 연산 종류
     */
    FsmOperation operation();

    /**
     * 연산이 적용되었는지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 연산이 거부되었는지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
