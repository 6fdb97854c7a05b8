package com.ryuqq.fsm.application.machine;

import com.ryuqq.fsm.core.outcome.Outcome;
import com.ryuqq.fsm.core.state.State;

/**
 * 제어 대상과 상태 머신을 명시적으로 참조하는 State 기반 클래스.
 *
 * <p>상태는 생성 시점에 자신을 구동하는 {@link StateMachine}과 제어 대상(owner)을
 * 전달받습니다. 전역 조회 없이 소유 관계와 수명이 생성자에 드러납니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * final class Walk extends AbstractState&lt;Player&gt; {
 *     Walk(StateMachine machine, Player player) {
 *         super(machine, player);
 *     }
 *
 *     {@literal @}Override
 *     public void reason() {
 *         if (owner().jumpPressed()) {
 *             goTo(owner().jump());
 *         }
 *     }
 * }
 * </pre>
 *
 * @param <E> 제어 대상 타입
 * @author FSM Team
 * @since 1.0.0
 */
public abstract class AbstractState<E> implements State {

    private final StateMachine machine;
    private final E owner;

    /**
     * 생성자.
     *
     * @param machine 이 상태를 구동하는 상태 머신
     * @param owner 제어 대상
     * @throws IllegalArgumentException machine 또는 owner가 null인 경우
     */
    protected AbstractState(StateMachine machine, E owner) {
        if (machine == null) {
            throw new IllegalArgumentException("machine cannot be null");
        }
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        this.machine = machine;
        this.owner = owner;
    }

    /**
     * 이 상태를 구동하는 상태 머신.
     *
     * @return 상태 머신
     */
    public StateMachine machine() {
        return machine;
    }

    /**
     * 제어 대상.
     *
     * @return owner
     */
    public E owner() {
        return owner;
    }

    /**
     * 이 상태가 current인지 확인.
     *
     * @return current이면 true
     */
    public boolean isCurrent() {
        return machine.currentState().filter(current -> current == this).isPresent();
    }

    /**
     * 대상 상태로 직접 전이.
     */
    protected Outcome goTo(State target) {
        return machine.goToState(target);
    }

    /**
     * payload와 함께 대상 상태로 직접 전이.
     */
    protected Outcome goTo(State target, Object payload) {
        return machine.goToState(target, payload);
    }

    /**
     * 직전 상태로 복귀.
     */
    protected Outcome goToPrevious() {
        return machine.goToPreviousState();
    }

    /**
     * 현재 상태를 일시 중단하고 대상 상태를 push.
     */
    protected Outcome push(State target) {
        return machine.pushState(target);
    }

    /**
     * payload와 함께 대상 상태를 push.
     */
    protected Outcome push(State target, Object payload) {
        return machine.pushState(target, payload);
    }

    /**
     * push된 상태를 종료하고 복귀 지점으로 돌아감.
     */
    protected Outcome pop() {
        return machine.popState();
    }

    @Override
    public String toString() {
        return name();
    }
}
