package com.ryuqq.fsm.core.state;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * State 기본 훅 동작 테스트.
 *
 * @author FSM Team
 * @since 1.0.0
 */
class StateTest {

    static final class Walk implements State {
        final List<String> calls = new ArrayList<>();

        @Override
        public void onEnter() {
            calls.add("onEnter");
        }
    }

    @Test
    void onEnter_payload_기본구현은_onEnter에_위임() {
        // given
        Walk walk = new Walk();

        // when
        walk.onEnter("landed");

        // then
        assertThat(walk.calls).containsExactly("onEnter");
    }

    @Test
    void 재정의하지_않은_훅은_아무것도_하지_않음() {
        // given
        State state = new State() { };

        // when & then
        assertThatCode(() -> {
            state.onExit();
            state.onUpdate();
            state.onFixedUpdate();
            state.onLateUpdate();
            state.reason();
            state.onGui();
            state.onPostRender();
        }).doesNotThrowAnyException();
    }

    @Test
    void name_기본값은_단순_클래스명() {
        assertThat(new Walk().name()).isEqualTo("Walk");
    }
}
