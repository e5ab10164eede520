package io.fullerstack.rmw.event;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventKindTest {

    @Test
    void shouldUseInvalidAsIndexZero() {
        assertThat(EventKind.INVALID.ordinal()).isZero();
        assertThat(EventKind.COUNT).isEqualTo(EventKind.PUBLICATION_MATCHED.ordinal() + 1);
    }

    @Test
    void shouldPartitionKindsBySide() {
        assertThat(EventKind.SUBSCRIPTION_MATCHED.isSubscriptionKind()).isTrue();
        assertThat(EventKind.MESSAGE_LOST.isSubscriptionKind()).isTrue();
        assertThat(EventKind.REQUESTED_QOS_INCOMPATIBLE.isPublisherKind()).isFalse();

        assertThat(EventKind.PUBLICATION_MATCHED.isPublisherKind()).isTrue();
        assertThat(EventKind.OFFERED_QOS_INCOMPATIBLE.isPublisherKind()).isTrue();
        assertThat(EventKind.PUBLISHER_INCOMPATIBLE_TYPE.isSubscriptionKind()).isFalse();

        assertThat(EventKind.INVALID.isSubscriptionKind()).isFalse();
        assertThat(EventKind.INVALID.isPublisherKind()).isFalse();
        assertThat(EventKind.INVALID.isValid()).isFalse();
    }

    @Test
    void shouldMapSupportedEventTypes() {
        assertThat(EventKind.from(RmwEventType.REQUESTED_QOS_INCOMPATIBLE)).isEqualTo(EventKind.REQUESTED_QOS_INCOMPATIBLE);
        assertThat(EventKind.from(RmwEventType.MESSAGE_LOST)).isEqualTo(EventKind.MESSAGE_LOST);
        assertThat(EventKind.from(RmwEventType.SUBSCRIPTION_INCOMPATIBLE_TYPE)).isEqualTo(EventKind.SUBSCRIPTION_INCOMPATIBLE_TYPE);
        assertThat(EventKind.from(RmwEventType.SUBSCRIPTION_MATCHED)).isEqualTo(EventKind.SUBSCRIPTION_MATCHED);
        assertThat(EventKind.from(RmwEventType.OFFERED_QOS_INCOMPATIBLE)).isEqualTo(EventKind.OFFERED_QOS_INCOMPATIBLE);
        assertThat(EventKind.from(RmwEventType.PUBLISHER_INCOMPATIBLE_TYPE)).isEqualTo(EventKind.PUBLISHER_INCOMPATIBLE_TYPE);
        assertThat(EventKind.from(RmwEventType.PUBLICATION_MATCHED)).isEqualTo(EventKind.PUBLICATION_MATCHED);
    }

    @ParameterizedTest
    @EnumSource(value = RmwEventType.class, names = {
        "LIVELINESS_CHANGED", "REQUESTED_DEADLINE_MISSED", "LIVELINESS_LOST", "OFFERED_DEADLINE_MISSED", "INVALID"
    })
    void shouldMapUnsupportedEventTypesToInvalid(RmwEventType type) {
        assertThat(EventKind.from(type)).isEqualTo(EventKind.INVALID);
    }

    @Test
    void shouldRejectNullEventType() {
        assertThatThrownBy(() -> EventKind.from(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("type cannot be null");
    }
}
