package com.ryuqq.fsm.core.state;

/**
 * 상태 머신이 구동하는 하나의 행동 단위.
 *
 * <p>State는 엔진의 전이 기록(current/previous/pushed)을 알지 못하며,
 * 엔진이 정해진 시점에 호출하는 생명주기 훅만 제공합니다.
 * 모든 훅은 no-op 기본 구현을 가지므로 필요한 훅만 재정의하면 됩니다.</p>
 *
 * <p><strong>훅 호출 시점:</strong></p>
 * <ul>
 *   <li>{@link #onEnter()} / {@link #onEnter(Object)}: 직접 전이 또는 push로 current가 될 때 1회</li>
 *   <li>{@link #onExit()}: 직접 전이 또는 pop으로 current에서 벗어날 때 1회 (push로 일시 중단될 때는 호출 안 됨)</li>
 *   <li>{@link #onUpdate()}, {@link #onFixedUpdate()}, {@link #onLateUpdate()}: 프레임 단계마다 1회</li>
 *   <li>{@link #reason()}: {@link #onLateUpdate()} 직후 1회 (전이 조건 판단 전용)</li>
 *   <li>{@link #onGui()}, {@link #onPostRender()}: 표시 단계 훅 (선택)</li>
 * </ul>
 *
 * <p><strong>동일성:</strong> 엔진은 State를 참조 동일성({@code ==})으로만 비교합니다.
 * 내용이 같은 두 인스턴스도 서로 다른 등록으로 취급되며,
 * {@code equals}/{@code hashCode} 재정의는 엔진 동작에 영향을 주지 않습니다.</p>
 *
 * @author FSM Team
 * @since 1.0.0
 */
public interface State {

    /**
     * current 상태가 될 때 호출.
     */
    default void onEnter() {
    }

    /**
     * 보조 데이터와 함께 current 상태가 될 때 호출.
     *
     * <p>기본 구현은 payload를 무시하고 {@link #onEnter()}에 위임합니다.</p>
     *
     * @param payload 전이와 함께 전달된 데이터 (null 허용)
     */
    default void onEnter(Object payload) {
        onEnter();
    }

    /**
     * current 상태에서 벗어날 때 호출.
     */
    default void onExit() {
    }

    /**
     * 메인 업데이트 단계.
     */
    default void onUpdate() {
    }

    /**
     * 고정 주기 업데이트 단계.
     */
    default void onFixedUpdate() {
    }

    /**
     * 후반 업데이트 단계.
     */
    default void onLateUpdate() {
    }

    /**
     * 전이 조건 판단 단계.
     *
     * <p>{@link #onLateUpdate()} 직후 호출됩니다. 행동("act")과
     * 전이 결정("decide")을 분리하기 위한 위치이며,
     * 다른 업데이트 훅에서 전이를 요청하는 것도 허용됩니다.</p>
     */
    default void reason() {
    }

    /**
     * GUI 표시 단계.
     */
    default void onGui() {
    }

    /**
     * 렌더링 직후 단계.
     */
    default void onPostRender() {
    }

    /**
     * 로그 출력용 이름.
     *
     * <p>비교에는 사용되지 않습니다.</p>
     *
     * @return 표시 이름 (기본값: 단순 클래스명)
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
