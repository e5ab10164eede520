package io.fullerstack.rmw;

/**
 * Identity of this middleware implementation.
 */
public final class RmwImplementation {

    /**
     * Tag stamped on every record this implementation initializes. Records carrying a
     * different tag were produced by another implementation and are rejected.
     */
    public static final String IDENTIFIER = "rmw_fullerstack";

    private RmwImplementation() {
    }

    public static boolean isOwnIdentifier(String identifier) {
        return IDENTIFIER.equals(identifier);
    }
}
