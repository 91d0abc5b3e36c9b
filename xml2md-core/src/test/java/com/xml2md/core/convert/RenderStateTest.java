package com.xml2md.core.convert;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RenderState}.
 */
class RenderStateTest {

    @Test
    void initial_isTopAtDepthZero() {
        assertThat(RenderState.initial()).isEqualTo(new RenderState(RenderMode.TOP, 0));
    }

    @Test
    void right_returnsDeeperCopyAndLeavesOriginalUntouched() {
        RenderState state = new RenderState(RenderMode.SECTION, 1);

        RenderState deeper = state.right();

        assertThat(deeper.depth()).isEqualTo(2);
        assertThat(state.depth()).isEqualTo(1);
    }

    @Test
    void left_atDepthZero_staysAtZero() {
        assertThat(RenderState.initial().left().depth()).isZero();
    }

    @Test
    void constructor_withNegativeDepth_clampsToZero() {
        assertThat(new RenderState(RenderMode.BODY, -3).depth()).isZero();
    }

    @Test
    void constructor_withNullMode_throws() {
        assertThatThrownBy(() -> new RenderState(null, 0))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("mode");
    }

    @Test
    void withMode_keepsDepth() {
        RenderState state = new RenderState(RenderMode.BODY, 2).withMode(RenderMode.NOTE);

        assertThat(state).isEqualTo(new RenderState(RenderMode.NOTE, 2));
    }

    @Test
    void isIn_matchesAnyGivenMode() {
        RenderState state = new RenderState(RenderMode.SECTION, 1);

        assertThat(state.isIn(RenderMode.BODY, RenderMode.SECTION)).isTrue();
        assertThat(state.isIn(RenderMode.NOTE)).isFalse();
        assertThat(state.isIn()).isFalse();
    }
}
