package io.fullerstack.rmw.event.status;

/**
 * QoS policies that can be reported as the cause of an incompatibility.
 */
public enum QosPolicyKind {
    INVALID,
    DURABILITY,
    DEADLINE,
    LIVELINESS,
    RELIABILITY,
    HISTORY,
    LIFESPAN,
    DEPTH,
    LIVELINESS_LEASE_DURATION,
    AVOID_ROS_NAMESPACE_CONVENTIONS
}
