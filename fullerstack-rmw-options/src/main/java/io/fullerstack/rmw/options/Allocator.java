package io.fullerstack.rmw.options;

import java.util.function.Supplier;

/**
 * Source of the owned sub-resources (strings, peer tables) held by the options records.
 * <p>
 * An allocator reports exhaustion by returning {@code null} from {@link #allocate}; callers
 * translate that into {@link io.fullerstack.rmw.ReturnCode#BAD_ALLOC}. Every block obtained
 * from {@code allocate} is handed back to {@link #deallocate} exactly once when its owner is
 * finalized or when a partially built copy is rolled back.
 */
public interface Allocator {

    /**
     * @param factory builds the block
     * @return the block, or {@code null} if the allocator is exhausted
     */
    <T> T allocate(Supplier<T> factory);

    /**
     * Returns a block previously obtained from {@link #allocate}. {@code null} is ignored.
     */
    void deallocate(Object block);

    /**
     * @return the default allocator, backed by the garbage-collected heap
     */
    static Allocator system() {
        return HeapAllocator.INSTANCE;
    }
}
