package com.ryuqq.fsm.engine;

/**
 * PushdownStateMachine 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxTransitionDepth: 훅 내부 중첩 전이 허용 깊이 (기본 32)</li>
 *   <li>pushMode: push 복귀 지점 보관 방식 (기본 STACK)</li>
 *   <li>registrationRecordsHistory: 상태 등록 시 current를 previous로 기록할지 여부 (기본 false)</li>
 * </ul>
 *
 * <p><strong>레거시 호환:</strong> {@link #legacy()}는 단일 슬롯 push와
 * 등록 시 previous 기록을 켜서 기존 단일 레벨 엔진과 동일하게 동작합니다.</p>
 *
 * @author FSM Team
 * @since 1.0.0
 * @param maxTransitionDepth 중첩 전이 허용 깊이 (1 이상이어야 함)
 * @param pushMode push 복귀 지점 보관 방식
 * @param registrationRecordsHistory 등록 시 previous 기록 여부
 */
public record StateMachineConfig(
    int maxTransitionDepth,
    PushMode pushMode,
    boolean registrationRecordsHistory
) {

    /**
     * 기본 중첩 전이 허용 깊이.
     */
    public static final int DEFAULT_MAX_TRANSITION_DEPTH = 32;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxTransitionDepth=32, pushMode=STACK, registrationRecordsHistory=false</p>
     */
    public StateMachineConfig() {
        this(DEFAULT_MAX_TRANSITION_DEPTH, PushMode.STACK, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public StateMachineConfig {
        if (maxTransitionDepth <= 0) {
            throw new IllegalArgumentException(
                "maxTransitionDepth must be positive (current: " + maxTransitionDepth + ")"
            );
        }
        if (pushMode == null) {
            throw new IllegalArgumentException("pushMode cannot be null");
        }
    }

    /**
     * 레거시 단일 레벨 엔진과 동일하게 동작하는 설정.
     *
     * @return maxTransitionDepth=32, pushMode=SINGLE_SLOT, registrationRecordsHistory=true
     */
    public static StateMachineConfig legacy() {
        return new StateMachineConfig(DEFAULT_MAX_TRANSITION_DEPTH, PushMode.SINGLE_SLOT, true);
    }

    /**
     * maxTransitionDepth만 변경한 새 인스턴스 생성.
     *
     * @param maxTransitionDepth 새로운 허용 깊이
     * @return 새 StateMachineConfig 인스턴스
     */
    public StateMachineConfig withMaxTransitionDepth(int maxTransitionDepth) {
        return new StateMachineConfig(maxTransitionDepth, pushMode, registrationRecordsHistory);
    }

    /**
     * pushMode만 변경한 새 인스턴스 생성.
     *
     * @param pushMode 새로운 보관 방식
     * @return 새 StateMachineConfig 인스턴스
     */
    public StateMachineConfig withPushMode(PushMode pushMode) {
        return new StateMachineConfig(maxTransitionDepth, pushMode, registrationRecordsHistory);
    }

    /**
     * registrationRecordsHistory만 변경한 새 인스턴스 생성.
     *
     * @param registrationRecordsHistory 등록 시 previous 기록 여부
     * @return 새 StateMachineConfig 인스턴스
     */
    public StateMachineConfig withRegistrationRecordsHistory(boolean registrationRecordsHistory) {
        return new StateMachineConfig(maxTransitionDepth, pushMode, registrationRecordsHistory);
    }
}
