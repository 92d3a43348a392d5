package org.compacttz.historical;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.IntFunction;

/**
 * Fixed-size, index-keyed cache whose slots are filled at most once.
 *
 * <p>Reads of a filled slot are a single volatile load. Concurrent first requests for the same
 * slot run the loader once; different slots never wait for each other. A loader that throws
 * leaves the slot empty.</p>
 *
 * @param <V> cached value type.
 */
public final class LoadOnceCache<V> {
    private final AtomicReferenceArray<V> slots;
    private final Object[] locks;

    /**
     * Creates an empty cache.
     *
     * @param capacity number of slots.
     */
    public LoadOnceCache(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0");
        }
        this.slots = new AtomicReferenceArray<>(capacity);
        this.locks = new Object[capacity];
        for (int i = 0; i < capacity; i++) {
            locks[i] = new Object();
        }
    }

    /**
     * Returns the slot value, running the loader if the slot is empty.
     *
     * @param index slot index.
     * @param loader computes the value; must not return {@code null}.
     * @return cached value.
     */
    public V get(int index, IntFunction<? extends V> loader) {
        V value = slots.get(index);
        if (value != null) {
            return value;
        }
        synchronized (locks[index]) {
            value = slots.get(index);
            if (value == null) {
                value = Objects.requireNonNull(loader.apply(index), "loader returned null");
                slots.set(index, value);
            }
            return value;
        }
    }

    /**
     * Returns {@code true} when the slot holds a value.
     */
    public boolean isLoaded(int index) {
        return slots.get(index) != null;
    }

    /**
     * Returns number of filled slots.
     */
    public int loadedCount() {
        int count = 0;
        for (int i = 0; i < slots.length(); i++) {
            if (slots.get(i) != null) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns number of slots.
     */
    public int capacity() {
        return slots.length();
    }
}
