package io.fullerstack.rmw.options;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Discovery settings: automatic discovery range plus a table of statically configured peers.
 * <p>
 * The peer table and every peer address are separate allocator blocks. Instances built by
 * {@link #of} or {@link #copy} own those blocks and must be {@linkplain #release released}
 * through the allocator that created them.
 */
public final class DiscoveryOptions {

    private static final DiscoveryOptions ZERO =
        new DiscoveryOptions(AutomaticDiscoveryRange.NOT_SET, null);

    private final AutomaticDiscoveryRange automaticDiscoveryRange;
    private final List<String> peerTable;

    private DiscoveryOptions(AutomaticDiscoveryRange range, List<String> peerTable) {
        this.automaticDiscoveryRange = range;
        this.peerTable = peerTable;
    }

    public static DiscoveryOptions zeroInitialized() {
        return ZERO;
    }

    /**
     * Builds discovery options holding allocator-owned copies of {@code staticPeers}.
     * If any allocation fails, the blocks obtained so far are returned to the allocator.
     *
     * @return the options, or {@code null} if the allocator is exhausted
     */
    public static DiscoveryOptions of(AutomaticDiscoveryRange range, List<String> staticPeers, Allocator allocator) {
        Objects.requireNonNull(range, "range cannot be null");
        Objects.requireNonNull(staticPeers, "staticPeers cannot be null");
        Objects.requireNonNull(allocator, "allocator cannot be null");

        if (staticPeers.isEmpty()) {
            return new DiscoveryOptions(range, null);
        }
        for (String peer : staticPeers) {
            Objects.requireNonNull(peer, "static peer cannot be null");
        }

        List<String> table = allocator.allocate(() -> new ArrayList<>(staticPeers.size()));
        if (table == null) {
            return null;
        }
        for (String peer : staticPeers) {
            String address = allocator.allocate(() -> new String(peer));
            if (address == null) {
                for (String copied : table) {
                    allocator.deallocate(copied);
                }
                allocator.deallocate(table);
                return null;
            }
            table.add(address);
        }
        return new DiscoveryOptions(range, table);
    }

    public AutomaticDiscoveryRange automaticDiscoveryRange() {
        return automaticDiscoveryRange;
    }

    public List<String> staticPeers() {
        return peerTable == null ? List.of() : Collections.unmodifiableList(peerTable);
    }

    /**
     * @return the copy, or {@code null} if the allocator is exhausted
     */
    DiscoveryOptions copy(Allocator allocator) {
        return of(automaticDiscoveryRange, staticPeers(), allocator);
    }

    void release(Allocator allocator) {
        if (peerTable == null) {
            return;
        }
        for (String peer : peerTable) {
            allocator.deallocate(peer);
        }
        allocator.deallocate(peerTable);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiscoveryOptions)) return false;
        DiscoveryOptions that = (DiscoveryOptions) o;
        return automaticDiscoveryRange == that.automaticDiscoveryRange && staticPeers().equals(that.staticPeers());
    }

    @Override
    public int hashCode() {
        return Objects.hash(automaticDiscoveryRange, staticPeers());
    }

    @Override
    public String toString() {
        return "DiscoveryOptions[range=" + automaticDiscoveryRange + ", staticPeers=" + staticPeers() + "]";
    }
}
