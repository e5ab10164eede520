package io.fullerstack.rmw.event.status;

/**
 * Detail attached to QoS incompatibility events, stored JSON-encoded in
 * {@link io.fullerstack.rmw.event.EventStatus#data()}.
 *
 * @param lastPolicyKind the policy found incompatible by the most recent match attempt
 */
public record QosIncompatibilityPayload(QosPolicyKind lastPolicyKind) {
}
