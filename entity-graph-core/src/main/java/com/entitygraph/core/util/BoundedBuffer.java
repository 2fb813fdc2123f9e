package com.entitygraph.core.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Fixed-capacity FIFO buffer: appending past capacity evicts the oldest element.
 *
 * <p>Individual operations are synchronized so a timer thread and a caller thread can
 * append concurrently without corrupting the buffer. Compound sequences are not atomic.
 *
 * @param <T> element type
 */
public final class BoundedBuffer<T> {

    private final int capacity;
    private final Deque<T> elements;

    /**
     * Creates a buffer.
     *
     * @param capacity maximum number of retained elements, must be positive
     */
    public BoundedBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, was " + capacity);
        }
        this.capacity = capacity;
        this.elements = new ArrayDeque<>(Math.min(capacity, 64));
    }

    /**
     * Appends an element, evicting the oldest ones while over capacity.
     *
     * @param element element to append
     */
    public synchronized void add(T element) {
        elements.addLast(element);
        while (elements.size() > capacity) {
            elements.removeFirst();
        }
    }

    /**
     * @return newest element, if any
     */
    public synchronized Optional<T> last() {
        return Optional.ofNullable(elements.peekLast());
    }

    /**
     * Finds the oldest element matching a predicate.
     *
     * @param predicate match condition
     * @return matching element, if any
     */
    public synchronized Optional<T> find(Predicate<? super T> predicate) {
        for (T element : elements) {
            if (predicate.test(element)) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    /**
     * @return copy of the contents, oldest first
     */
    public synchronized List<T> toList() {
        return List.copyOf(new ArrayList<>(elements));
    }

    public synchronized int size() {
        return elements.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized void clear() {
        elements.clear();
    }
}
