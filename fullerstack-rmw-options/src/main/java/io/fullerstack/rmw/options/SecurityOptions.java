package io.fullerstack.rmw.options;

import java.util.Objects;

/**
 * Security settings: enforcement policy and the root directory of the security artifacts.
 * <p>
 * Instances are immutable. Copies made through an {@link Allocator} own their root path
 * block and must be {@linkplain #release released} through the same allocator.
 */
public final class SecurityOptions {

    private static final SecurityOptions DEFAULTS = new SecurityOptions(EnforcementPolicy.PERMISSIVE, null);

    private final EnforcementPolicy enforceSecurity;
    private final String securityRootPath;

    public SecurityOptions(EnforcementPolicy enforceSecurity, String securityRootPath) {
        this.enforceSecurity = Objects.requireNonNull(enforceSecurity, "enforceSecurity cannot be null");
        this.securityRootPath = securityRootPath;
    }

    /**
     * Permissive, no root path.
     */
    public static SecurityOptions defaults() {
        return DEFAULTS;
    }

    public EnforcementPolicy enforceSecurity() {
        return enforceSecurity;
    }

    public String securityRootPath() {
        return securityRootPath;
    }

    /**
     * Deep copy through {@code allocator}.
     *
     * @return the copy, or {@code null} if the allocator is exhausted
     */
    SecurityOptions copy(Allocator allocator) {
        if (securityRootPath == null) {
            return new SecurityOptions(enforceSecurity, null);
        }
        String root = allocator.allocate(() -> new String(securityRootPath));
        if (root == null) {
            return null;
        }
        return new SecurityOptions(enforceSecurity, root);
    }

    void release(Allocator allocator) {
        allocator.deallocate(securityRootPath);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SecurityOptions)) return false;
        SecurityOptions that = (SecurityOptions) o;
        return enforceSecurity == that.enforceSecurity && Objects.equals(securityRootPath, that.securityRootPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enforceSecurity, securityRootPath);
    }

    @Override
    public String toString() {
        return "SecurityOptions[enforce=" + enforceSecurity + ", root=" + securityRootPath + "]";
    }
}
