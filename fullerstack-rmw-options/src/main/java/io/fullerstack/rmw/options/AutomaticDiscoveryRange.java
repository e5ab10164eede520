package io.fullerstack.rmw.options;

/**
 * How far automatic peer discovery reaches.
 */
public enum AutomaticDiscoveryRange {
    NOT_SET,
    OFF,
    LOCALHOST,
    SUBNET,
    SYSTEM_DEFAULT
}
