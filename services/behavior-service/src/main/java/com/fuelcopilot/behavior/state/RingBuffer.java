package com.fuelcopilot.behavior.state;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-capacity circular buffer. Once full, each add overwrites the oldest element.
 *
 * <p>Not thread-safe; callers hold the owning vehicle's lock.
 */
public final class RingBuffer<T> {

    private final Object[] elements;
    private int head;
    private int size;

    public RingBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Ring buffer capacity must be at least 1, got " + capacity);
        }
        this.elements = new Object[capacity];
    }

    public void add(T element) {
        int tail = (head + size) % elements.length;
        elements[tail] = element;
        if (size < elements.length) {
            size++;
        } else {
            head = (head + 1) % elements.length;
        }
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return elements.length;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean isFull() {
        return size == elements.length;
    }

    public void clear() {
        for (int i = 0; i < elements.length; i++) {
            elements[i] = null;
        }
        head = 0;
        size = 0;
    }

    /**
     * Copy of the contents, oldest first
     */
    @SuppressWarnings("unchecked")
    public List<T> toList() {
        List<T> copy = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            copy.add((T) elements[(head + i) % elements.length]);
        }
        return copy;
    }
}
