package com.ryuqq.fsm.engine;

import com.ryuqq.fsm.application.machine.StateMachine;
import com.ryuqq.fsm.core.outcome.Fail;
import com.ryuqq.fsm.core.outcome.Ok;
import com.ryuqq.fsm.core.outcome.Outcome;
import com.ryuqq.fsm.core.state.State;
import com.ryuqq.fsm.core.statemachine.FsmErrorCode;
import com.ryuqq.fsm.core.statemachine.FsmOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import static com.ryuqq.fsm.core.statemachine.FsmErrorCode.*;
import static com.ryuqq.fsm.core.statemachine.FsmOperation.*;

/**
 * Pushdown 상태 머신 구현체.
 *
 * <p>하나의 제어 대상에 대한 상태 집합과 전이 기록을 소유하며,
 * 호스트 루프의 프레임 훅을 current 상태로 전달합니다.</p>
 *
 * <p><strong>전이 처리 흐름:</strong></p>
 * <pre>
 * goToState(target)
 *   1. 검증: null → NULL_TARGET, 미등록 → STATE_NOT_FOUND,
 *            onExit 실행 중 → TRANSITION_DURING_EXIT, 깊이 초과 → REENTRANCY_LIMIT_EXCEEDED
 *   2. next = target
 *   3. current.onExit()
 *   4. previous = 떠난 상태
 *   5. current = target
 *   6. target.onEnter() / target.onEnter(payload)
 *   7. next = (바깥 전이의 next 또는 empty)
 *
 * pushState(target)   : 복귀 지점 기록, current = target, onEnter (onExit 없음)
 * popState()          : current.onExit, 복귀 지점 제거, current = 복귀 지점 (onEnter 없음)
 * goToPreviousState() : current ↔ previous 교환 (onExit → onEnter)
 * </pre>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>등록 집합에는 같은 참조가 두 번 존재하지 않음</li>
 *   <li>최초 등록 이후 current는 항상 존재</li>
 *   <li>isStatePushed()는 복귀 지점이 있을 때만 true</li>
 *   <li>거부된 연산은 어떤 슬롯도 변경하지 않음</li>
 *   <li>삭제는 current/previous/복귀 지점을 변경하지 않음</li>
 * </ul>
 *
 * <p><strong>중첩 전이:</strong> onEnter 안에서 요청된 전이는 바깥 전이가
 * 끝나기 전에 완료되며, 순서대로 합성됩니다. 중첩 깊이는
 * {@link StateMachineConfig#maxTransitionDepth()}로 제한됩니다.
 * onExit 안에서 요청된 전이는 {@code TRANSITION_DURING_EXIT}로 거부됩니다.
 * 기록 슬롯(previous, 복귀 지점)은 onExit가 정상 반환된 뒤에만 갱신되므로
 * onExit 예외 후에도 기록은 전이 이전 그대로입니다.</p>
 *
 * <p><strong>동시성:</strong> 스레드 안전하지 않습니다. 하나의 호스트 루프 스레드에서만 사용해야 합니다.</p>
 *
 * @author FSM Team
 * @since 1.0.0
 */
public final class PushdownStateMachine implements StateMachine {

    private static final Logger log = LoggerFactory.getLogger(PushdownStateMachine.class);

    private final StateMachineConfig config;
    private final TransitionGuard guard;

    private final List<State> states = new ArrayList<>();
    private final Deque<State> pushOrigins = new ArrayDeque<>();

    private State currentState;
    private State nextState;
    private State previousState;
    private State exitingState;

    /**
     * 기본 설정으로 생성.
     */
    public PushdownStateMachine() {
        this(new StateMachineConfig());
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public PushdownStateMachine(StateMachineConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.guard = new TransitionGuard(config.maxTransitionDepth());
    }

    /**
     * 적용된 설정.
     *
     * @return 설정
     */
    public StateMachineConfig config() {
        return config;
    }

    // ========== 등록 ==========

    @Override
    public Outcome addState(State state) {
        if (state == null) {
            return reject(ADD_STATE, NULL_TARGET, "Null reference is not allowed");
        }

        // 최초 등록 상태가 초기 상태
        if (states.isEmpty()) {
            states.add(state);
            currentState = state;
            log.info("Initial state registered: {}", describe(state));
            return Ok.of(ADD_STATE, state);
        }

        if (indexOf(state) >= 0) {
            return reject(ADD_STATE, DUPLICATE_STATE,
                "Unable to add state " + describe(state) + " because state has already been added");
        }

        if (config.registrationRecordsHistory()) {
            previousState = currentState;
        }
        states.add(state);
        log.info("State registered: {} ({} total)", describe(state), states.size());
        return Ok.of(ADD_STATE, state);
    }

    @Override
    public Outcome deleteState(State state) {
        if (state == null) {
            return reject(DELETE_STATE, NULL_TARGET, "Null reference is not allowed");
        }

        int index = indexOf(state);
        if (index < 0) {
            return reject(DELETE_STATE, STATE_NOT_FOUND,
                "Unable to delete state " + describe(state) + " because state is not registered");
        }

        states.remove(index);
        log.info("State deleted: {} ({} remaining)", describe(state), states.size());
        return Ok.of(DELETE_STATE, state);
    }

    // ========== 조회 ==========

    @Override
    public Optional<State> currentState() {
        return Optional.ofNullable(currentState);
    }

    @Override
    public Optional<State> nextState() {
        return Optional.ofNullable(nextState);
    }

    @Override
    public Optional<State> previousState() {
        return Optional.ofNullable(previousState);
    }

    @Override
    public Optional<State> pushOrigin() {
        return Optional.ofNullable(pushOrigins.peek());
    }

    @Override
    public boolean isStatePushed() {
        return !pushOrigins.isEmpty();
    }

    @Override
    public int pushDepth() {
        return pushOrigins.size();
    }

    @Override
    public List<State> states() {
        return Collections.unmodifiableList(new ArrayList<>(states));
    }

    @Override
    public int size() {
        return states.size();
    }

    @Override
    public boolean contains(State state) {
        return state != null && indexOf(state) >= 0;
    }

    // ========== 전이 ==========

    @Override
    public Outcome goToState(State target) {
        return goTo(target, null, false);
    }

    @Override
    public Outcome goToState(State target, Object payload) {
        return goTo(target, payload, true);
    }

    @Override
    public Outcome goToPreviousState() {
        if (previousState == null) {
            return reject(GO_TO_PREVIOUS_STATE, NO_HISTORY, "No previous state to return to");
        }
        if (indexOf(previousState) < 0) {
            return reject(GO_TO_PREVIOUS_STATE, STATE_NOT_FOUND,
                "Unable to go to previous state " + describe(previousState) + " because state is not registered anymore");
        }
        if (exitingState != null) {
            return rejectDuringExit(GO_TO_PREVIOUS_STATE, previousState);
        }
        if (!guard.tryEnter()) {
            return rejectReentrant(GO_TO_PREVIOUS_STATE, previousState);
        }

        try {
            State departed = currentState;
            State target = previousState;
            log.debug("Returning to previous state: {} → {}", describe(departed), describe(target));

            // 떠나는 상태가 새 previous (두 상태 간 토글)
            switchTo(departed, target, null, false);
            return Ok.of(GO_TO_PREVIOUS_STATE, currentState);
        } finally {
            guard.exit();
        }
    }

    @Override
    public Outcome pushState(State target) {
        return push(target, null, false);
    }

    @Override
    public Outcome pushState(State target, Object payload) {
        return push(target, payload, true);
    }

    @Override
    public Outcome popState() {
        State origin = pushOrigins.peek();
        if (origin == null) {
            return reject(POP_STATE, NO_HISTORY, "No pushed state to pop");
        }
        if (indexOf(origin) < 0) {
            return reject(POP_STATE, STATE_NOT_FOUND,
                "Unable to pop to " + describe(origin) + " because state is not registered anymore");
        }
        if (exitingState != null) {
            return rejectDuringExit(POP_STATE, origin);
        }
        if (!guard.tryEnter()) {
            return rejectReentrant(POP_STATE, origin);
        }

        try {
            State departed = currentState;
            log.debug("Popping state: {} → {} (depth {})", describe(departed), describe(origin), pushOrigins.size() - 1);

            // 복귀 지점은 exit된 적이 없으므로 onEnter 호출 안 함
            State outerNext = nextState;
            nextState = origin;
            try {
                exit(departed);
                pushOrigins.pop();
                currentState = origin;
            } finally {
                nextState = outerNext;
            }
            return Ok.of(POP_STATE, currentState);
        } finally {
            guard.exit();
        }
    }

    // ========== 프레임 훅 ==========

    @Override
    public void update() {
        State state = activeState("update");
        if (state != null) {
            state.onUpdate();
        }
    }

    @Override
    public void fixedUpdate() {
        State state = activeState("fixedUpdate");
        if (state != null) {
            state.onFixedUpdate();
        }
    }

    @Override
    public void lateUpdate() {
        State state = activeState("lateUpdate");
        if (state == null) {
            return;
        }
        state.onLateUpdate();
        // onLateUpdate에서 전이가 일어났다면 새 current가 reason을 받음
        currentState.reason();
    }

    @Override
    public void gui() {
        State state = activeState("gui");
        if (state != null) {
            state.onGui();
        }
    }

    @Override
    public void postRender() {
        State state = activeState("postRender");
        if (state != null) {
            state.onPostRender();
        }
    }

    // ========== 내부 ==========

    private Outcome goTo(State target, Object payload, boolean withPayload) {
        if (target == null) {
            return reject(GO_TO_STATE, NULL_TARGET, "Null reference is not allowed");
        }
        if (indexOf(target) < 0) {
            return reject(GO_TO_STATE, STATE_NOT_FOUND,
                "Unable to go to state " + describe(target) + " because state is not registered");
        }
        if (exitingState != null) {
            return rejectDuringExit(GO_TO_STATE, target);
        }
        if (!guard.tryEnter()) {
            return rejectReentrant(GO_TO_STATE, target);
        }

        try {
            State departed = currentState;
            log.debug("Going to state: {} → {}", describe(departed), describe(target));

            switchTo(departed, target, payload, withPayload);
            return Ok.of(GO_TO_STATE, currentState);
        } finally {
            guard.exit();
        }
    }

    private Outcome push(State target, Object payload, boolean withPayload) {
        if (target == null) {
            return reject(PUSH_STATE, NULL_TARGET, "Null reference is not allowed");
        }
        if (indexOf(target) < 0) {
            return reject(PUSH_STATE, STATE_NOT_FOUND,
                "Unable to push state " + describe(target) + " because state is not registered");
        }
        if (exitingState != null) {
            return rejectDuringExit(PUSH_STATE, target);
        }
        if (!guard.tryEnter()) {
            return rejectReentrant(PUSH_STATE, target);
        }

        try {
            State suspended = currentState;
            if (config.pushMode() == PushMode.SINGLE_SLOT && !pushOrigins.isEmpty()) {
                log.warn("Push return point {} overwritten by {}", describe(pushOrigins.peek()), describe(suspended));
                pushOrigins.clear();
            }
            pushOrigins.push(suspended);
            log.debug("Pushing state: {} → {} (depth {})", describe(suspended), describe(target), pushOrigins.size());

            // 일시 중단되는 상태는 onExit 호출 안 함
            State outerNext = nextState;
            nextState = target;
            try {
                currentState = target;
                enter(target, payload, withPayload);
            } finally {
                nextState = outerNext;
            }
            return Ok.of(PUSH_STATE, currentState);
        } finally {
            guard.exit();
        }
    }

    /**
     * exit → assign → enter. next는 훅 실행 동안만 target을 가리킴.
     */
    private void switchTo(State departed, State target, Object payload, boolean withPayload) {
        State outerNext = nextState;
        nextState = target;
        try {
            exit(departed);
            previousState = departed;
            currentState = target;
            enter(target, payload, withPayload);
        } finally {
            nextState = outerNext;
        }
    }

    private void exit(State departed) {
        exitingState = departed;
        try {
            departed.onExit();
        } finally {
            exitingState = null;
        }
    }

    private static void enter(State target, Object payload, boolean withPayload) {
        if (withPayload) {
            target.onEnter(payload);
        } else {
            target.onEnter();
        }
    }

    private State activeState(String phase) {
        if (currentState == null) {
            log.debug("Skipping {}: no state registered", phase);
        }
        return currentState;
    }

    private int indexOf(State state) {
        for (int i = 0; i < states.size(); i++) {
            if (states.get(i) == state) {
                return i;
            }
        }
        return -1;
    }

    private Outcome rejectReentrant(FsmOperation operation, State target) {
        return reject(operation, REENTRANCY_LIMIT_EXCEEDED,
            "Unable to transition to " + describe(target) + ": nested transition depth exceeds "
                + guard.maxDepth() + " (transition cycle?)");
    }

    private Outcome rejectDuringExit(FsmOperation operation, State target) {
        return reject(operation, TRANSITION_DURING_EXIT,
            "Unable to transition to " + describe(target) + " while " + describe(exitingState) + " is exiting");
    }

    private static Fail reject(FsmOperation operation, FsmErrorCode errorCode, String message) {
        Fail fail = Fail.of(operation, errorCode, message);
        log.error("FSM {} rejected [{}]: {}", operation, errorCode, message);
        return fail;
    }

    private static String describe(State state) {
        if (state == null) {
            return "none";
        }
        return state.name() + "@" + Integer.toHexString(System.identityHashCode(state));
    }
}
