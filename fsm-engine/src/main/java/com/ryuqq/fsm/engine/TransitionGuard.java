package com.ryuqq.fsm.engine;

/**
 * 중첩 전이 깊이 제한기.
 *
 * <p>State 훅(onEnter/onExit) 안에서 다시 전이를 요청하면 전이가 재귀적으로 중첩됩니다.
 * 이 클래스는 현재 진행 중인 전이 수를 세고, 허용 깊이를 넘는 전이를 거부하여
 * 전이 순환이 {@link StackOverflowError} 대신 보고 가능한 실패로 드러나게 합니다.</p>
 *
 * <p><strong>사용 패턴:</strong></p>
 * <pre>
 * if (!guard.tryEnter()) {
 *     return reject(REENTRANCY_LIMIT_EXCEEDED);
 * }
 * try {
 *     // exit → assign → enter
 * } finally {
 *     guard.exit();
 * }
 * </pre>
 *
 * <p>단일 스레드 전용입니다.</p>
 *
 * @author FSM Team
 * @since 1.0.0
 */
public class TransitionGuard {

    private final int maxDepth;
    private int depth;

    /**
     * 생성자.
     *
     * @param maxDepth 동시에 진행 가능한 최대 전이 수 (1 이상)
     * @throws IllegalArgumentException maxDepth가 양수가 아닌 경우
     */
    public TransitionGuard(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException(
                "maxDepth must be positive (current: " + maxDepth + ")"
            );
        }
        this.maxDepth = maxDepth;
    }

    /**
     * 전이 시작 시도.
     *
     * @return 허용되면 true (깊이 1 증가), 한도에 도달했으면 false (변경 없음)
     */
    public boolean tryEnter() {
        if (depth >= maxDepth) {
            return false;
        }
        depth++;
        return true;
    }

    /**
     * 전이 종료.
     *
     * @throws IllegalStateException 진행 중인 전이가 없는 경우
     */
    public void exit() {
        if (depth == 0) {
            throw new IllegalStateException("exit() called without a matching tryEnter()");
        }
        depth--;
    }

    /**
     * 현재 진행 중인 전이 수.
     *
     * @return 중첩 깊이 (전이 중이 아니면 0)
     */
    public int depth() {
        return depth;
    }

    /**
     * 허용 깊이.
     *
     * @return 최대 깊이
     */
    public int maxDepth() {
        return maxDepth;
    }
}
