/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.browser.capture;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Fixed-capacity, append-only buffer that evicts its oldest element once full.
 * All operations are serialized on an internal lock, so appends from event
 * callbacks may interleave with snapshots and clears.
 *
 * @param <T>
 *            element type
 */
public class RingBuffer<T> {

    private final Object lock = new Object();
    private final Deque<T> entries;
    private final int capacity;

    public RingBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    public void append(T entry) {
        synchronized (lock) {
            if (entries.size() >= capacity) {
                entries.removeFirst();
            }
            entries.addLast(entry);
        }
    }

    /**
     * Copy of the current contents, oldest first.
     */
    public List<T> snapshot() {
        synchronized (lock) {
            return new ArrayList<>(entries);
        }
    }

    /**
     * Copy of the current contents, oldest first, emptying the buffer in the
     * same critical section.
     */
    public List<T> snapshotAndClear() {
        synchronized (lock) {
            List<T> copy = new ArrayList<>(entries);
            entries.clear();
            return copy;
        }
    }

    public void clear() {
        synchronized (lock) {
            entries.clear();
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public int capacity() {
        return capacity;
    }
}
