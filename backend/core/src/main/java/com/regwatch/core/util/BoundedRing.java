package com.regwatch.core.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Fixed-capacity, newest-first buffer. Pushing onto a full ring evicts the oldest
 * element. Not thread-safe; callers guard it.
 */
public final class BoundedRing<T> {
    private final int capacity;
    private final ArrayDeque<T> items;

    public BoundedRing(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.items = new ArrayDeque<>(Math.min(capacity, 256));
    }

    /**
     * Builds a ring from elements ordered newest first, keeping at most
     * {@code capacity} of the newest ones.
     */
    public static <T> BoundedRing<T> ofNewestFirst(int capacity, Collection<? extends T> newestFirst) {
        BoundedRing<T> ring = new BoundedRing<>(capacity);
        for (T item : newestFirst) {
            if (ring.items.size() == capacity) {
                break;
            }
            ring.items.addLast(item);
        }
        return ring;
    }

    public void push(T item) {
        items.addFirst(item);
        if (items.size() > capacity) {
            items.pollLast();
        }
    }

    public void replaceAll(UnaryOperator<T> operator) {
        ArrayDeque<T> replaced = new ArrayDeque<>(items.size());
        for (T item : items) {
            replaced.addLast(operator.apply(item));
        }
        items.clear();
        items.addAll(replaced);
    }

    public List<T> newestFirst() {
        return new ArrayList<>(items);
    }

    public int size() {
        return items.size();
    }
}
