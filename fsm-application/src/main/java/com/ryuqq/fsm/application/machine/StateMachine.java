package com.ryuqq.fsm.application.machine;

import com.ryuqq.fsm.core.outcome.Outcome;
import com.ryuqq.fsm.core.state.State;

import java.util.List;
import java.util.Optional;

/**
 * Pushdown 상태 머신 API.
 *
 * <p>하나의 제어 대상(entity)에 대해 등록된 상태 집합과 전이 기록을 소유하고,
 * 호스트 루프의 프레임 훅을 current 상태로 전달합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>상태 등록/삭제 (참조 동일성 기준, 삽입 순서 유지)</li>
 *   <li>직접 전이, payload 전이, 직전 상태 복귀, push, pop</li>
 *   <li>프레임 훅 전달 (update → fixedUpdate → lateUpdate(+reason) → gui → postRender)</li>
 * </ul>
 *
 * <p><strong>두 가지 "이전 상태":</strong></p>
 * <ul>
 *   <li>전이 기록(previous): 직접 전이 직전의 current. {@link #goToPreviousState()}만 사용</li>
 *   <li>push 기록(push origin): push 직전의 current. {@link #popState()}만 사용</li>
 * </ul>
 * <p>push는 전이 기록을 건드리지 않고, 직접 전이는 push 기록을 건드리지 않습니다.</p>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>등록/전이 연산은 예외를 던지지 않고 {@link Outcome}을 반환</li>
 *   <li>실패({@link com.ryuqq.fsm.core.outcome.Fail})는 상태 슬롯을 전혀 변경하지 않음</li>
 *   <li>State 훅이 던진 예외는 호출자에게 그대로 전파</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 단일 스레드, 협력적, 프레임 구동 모델을 가정합니다.
 * 구현체는 스레드 안전하지 않아도 됩니다.</p>
 *
 * @author FSM Team
 * @since 1.0.0
 */
public interface StateMachine {

    // ========== 등록 ==========

    /**
     * 상태 등록.
     *
     * <p>처음 등록된 상태가 초기 current 상태가 됩니다.</p>
     *
     * @param state 등록할 상태
     * @return Ok 또는 Fail(NULL_TARGET, DUPLICATE_STATE)
     */
    Outcome addState(State state);

    /**
     * 상태 삭제.
     *
     * <p>current/previous/push 기록은 변경되지 않습니다. 삭제된 current 상태는
     * 다음 전이 전까지 계속 current로 남습니다.</p>
     *
     * @param state 삭제할 상태
     * @return Ok 또는 Fail(NULL_TARGET, STATE_NOT_FOUND)
     */
    Outcome deleteState(State state);

    // ========== 조회 ==========

    /**
     * 현재 상태.
     *
     * @return current 상태 (아직 등록된 상태가 없으면 empty)
     */
    Optional<State> currentState();

    /**
     * 전이 중인 대상 상태.
     *
     * <p>exit/enter 훅이 실행되는 동안에만 값이 있습니다.</p>
     *
     * @return 전이 대상 (전이 중이 아니면 empty)
     */
    Optional<State> nextState();

    /**
     * 전이 기록의 이전 상태.
     *
     * @return previous 상태 (기록이 없으면 empty)
     */
    Optional<State> previousState();

    /**
     * pop 시 복귀할 상태.
     *
     * @return 가장 최근 push의 복귀 지점 (push되지 않았으면 empty)
     */
    Optional<State> pushOrigin();

    /**
     * push된 상태가 활성 중인지 확인.
     *
     * @return pop되지 않은 push가 있으면 true
     */
    boolean isStatePushed();

    /**
     * 기록된 복귀 지점 수.
     *
     * @return push 깊이
     */
    int pushDepth();

    /**
     * 등록된 상태 목록 (삽입 순서).
     *
     * @return 변경 불가능한 스냅샷
     */
    List<State> states();

    /**
     * 등록된 상태 수.
     *
     * @return 상태 수
     */
    int size();

    /**
     * 상태가 등록되어 있는지 확인 (참조 동일성).
     *
     * @param state 확인할 상태
     * @return 등록되어 있으면 true
     */
    boolean contains(State state);

    // ========== 전이 ==========

    /**
     * 직접 전이.
     *
     * @param target 대상 상태
     * @return Ok 또는 Fail(NULL_TARGET, STATE_NOT_FOUND, REENTRANCY_LIMIT_EXCEEDED)
     */
    Outcome goToState(State target);

    /**
     * payload를 전달하는 직접 전이.
     *
     * @param target 대상 상태
     * @param payload 대상의 {@link State#onEnter(Object)}에 전달할 데이터 (null 허용)
     * @return Ok 또는 Fail(NULL_TARGET, STATE_NOT_FOUND, REENTRANCY_LIMIT_EXCEEDED)
     */
    Outcome goToState(State target, Object payload);

    /**
     * 직전 상태로 복귀.
     *
     * <p>떠나는 상태가 새 previous가 되므로 반복 호출 시 두 상태 사이를 오갑니다.</p>
     *
     * @return Ok 또는 Fail(NO_HISTORY, STATE_NOT_FOUND, REENTRANCY_LIMIT_EXCEEDED)
     */
    Outcome goToPreviousState();

    /**
     * current를 일시 중단(exit 없음)하고 대상 상태 활성화.
     *
     * @param target 대상 상태
     * @return Ok 또는 Fail(NULL_TARGET, STATE_NOT_FOUND, REENTRANCY_LIMIT_EXCEEDED)
     */
    Outcome pushState(State target);

    /**
     * payload를 전달하는 push.
     *
     * @param target 대상 상태
     * @param payload 대상의 {@link State#onEnter(Object)}에 전달할 데이터 (null 허용)
     * @return Ok 또는 Fail(NULL_TARGET, STATE_NOT_FOUND, REENTRANCY_LIMIT_EXCEEDED)
     */
    Outcome pushState(State target, Object payload);

    /**
     * push된 상태를 종료하고 복귀 지점을 재활성화 (enter 없음).
     *
     * @return Ok 또는 Fail(NO_HISTORY, STATE_NOT_FOUND, REENTRANCY_LIMIT_EXCEEDED)
     */
    Outcome popState();

    // ========== 프레임 훅 ==========

    /**
     * 메인 업데이트 단계를 current 상태에 전달.
     */
    void update();

    /**
     * 고정 주기 업데이트 단계를 current 상태에 전달.
     */
    void fixedUpdate();

    /**
     * 후반 업데이트 단계 전달 후, 그 시점의 current 상태에 reason 전달.
     */
    void lateUpdate();

    /**
     * GUI 단계를 current 상태에 전달.
     */
    void gui();

    /**
     * 렌더링 직후 단계를 current 상태에 전달.
     */
    void postRender();
}
