package com.ryuqq.fsm.core.outcome;

import com.ryuqq.fsm.core.statemachine.FsmErrorCode;
import com.ryuqq.fsm.core.statemachine.FsmOperation;

/**
 * 연산 거부.
 *
 * <p>잘못된 사용(null 대상, 중복 등록, 미등록 대상, 기록 없음, 전이 순환)으로
 * 연산이 수행되지 않았음을 나타냅니다. Fail이 반환되면 상태 머신의
 * current/previous/next/pushed 슬롯은 호출 전과 동일합니다.</p>
 *
 * @param operation 거부된 연산
 * @param errorCode 거부 사유
 * @param message 상세 메시지
 *
 * @author FSM Team
 * @since 1.0.0
 */
public record Fail(
    FsmOperation operation,
    FsmErrorCode errorCode,
    String message
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException operation, errorCode가 null이거나 message가 비어있는 경우
     */
    public Fail {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * Fail 생성.
     *
     * @param operation 거부된 연산
     * @param errorCode 거부 사유
     * @param message 상세 메시지
     * @return Fail 인스턴스
     */
    public static Fail of(FsmOperation operation, FsmErrorCode errorCode, String message) {
        return new Fail(operation, errorCode, message);
    }
}
