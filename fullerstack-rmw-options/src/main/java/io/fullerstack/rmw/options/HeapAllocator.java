package io.fullerstack.rmw.options;

import java.util.function.Supplier;

/**
 * Allocator that never reports exhaustion; blocks are reclaimed by the garbage collector.
 */
final class HeapAllocator implements Allocator {

    static final HeapAllocator INSTANCE = new HeapAllocator();

    private HeapAllocator() {
    }

    @Override
    public <T> T allocate(Supplier<T> factory) {
        return factory.get();
    }

    @Override
    public void deallocate(Object block) {
        // reclaimed by the GC
    }

    @Override
    public String toString() {
        return "HeapAllocator";
    }
}
