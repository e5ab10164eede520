package io.fullerstack.rmw.options;

public enum EnforcementPolicy {
    PERMISSIVE,
    ENFORCE
}
