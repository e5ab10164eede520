package io.fullerstack.rmw.event.status;

import io.fullerstack.rmw.event.EventStatus;

/**
 * Requested/offered QoS incompatibility status.
 *
 * @param lastPolicyKind policy named by the latest {@link QosIncompatibilityPayload}, {@link QosPolicyKind#INVALID} if none was attached
 */
public record QosIncompatibleStatus(long totalCount, long totalCountChange, QosPolicyKind lastPolicyKind) {

    public static QosIncompatibleStatus from(EventStatus status) {
        QosIncompatibilityPayload payload = StatusPayloads.decode(status.data(), QosIncompatibilityPayload.class);
        QosPolicyKind policy = payload == null || payload.lastPolicyKind() == null
            ? QosPolicyKind.INVALID
            : payload.lastPolicyKind();
        return new QosIncompatibleStatus(status.totalCount(), status.totalCountChange(), policy);
    }
}
