package io.fullerstack.rmw.wait;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GuardConditionTest {

    @Test
    void shouldSignalAttachedWaitSetOnTrigger() {
        GuardCondition guard = new GuardCondition();
        WaitSetData data = new WaitSetData();

        assertThat(guard.hasDataAndAttachIfNot(data)).isFalse();
        guard.trigger();

        assertThat(data.isTriggered()).isTrue();
        assertThat(guard.detachAndIsEmpty(data)).isFalse();
    }

    @Test
    void shouldConsumeTriggerOnDetach() {
        GuardCondition guard = new GuardCondition();
        WaitSetData data = new WaitSetData();
        guard.trigger();

        assertThat(guard.hasDataAndAttachIfNot(data)).isTrue();
        assertThat(guard.detachAndIsEmpty(data)).isFalse();
        assertThat(guard.isTriggered()).isFalse();
        assertThat(guard.detachAndIsEmpty(data)).isTrue();
    }

    @Test
    void shouldRejectSecondWaitSet() {
        GuardCondition guard = new GuardCondition();
        guard.hasDataAndAttachIfNot(new WaitSetData());

        assertThatThrownBy(() -> guard.hasDataAndAttachIfNot(new WaitSetData()))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldKeepOtherWaitSetAttachedOnDetach() {
        GuardCondition guard = new GuardCondition();
        WaitSetData first = new WaitSetData();
        guard.hasDataAndAttachIfNot(first);

        assertThat(guard.detachAndIsEmpty(new WaitSetData())).isTrue();
        guard.trigger();

        assertThat(first.isTriggered()).isTrue();
    }
}
