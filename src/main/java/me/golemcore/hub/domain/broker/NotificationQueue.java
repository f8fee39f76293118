package me.golemcore.hub.domain.broker;

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

import me.golemcore.hub.domain.model.ToolNotification;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded per-connection notification buffer.
 *
 * <p>
 * When full, the oldest non-critical entry is dropped to make room; critical
 * entries (errors, connection state changes) are never dropped, so the buffer
 * may exceed its capacity when it holds only critical entries. Arrival order
 * of the surviving entries is preserved.
 *
 * <p>
 * The queue never blocks. The owning connection registers a drain callback
 * that runs after every accepted entry and on close; the consumer pulls with
 * {@link #poll()} as far as its demand allows.
 */
public class NotificationQueue {

    private static final Runnable NO_LISTENER = () -> {
    };

    private final int capacity;
    private final Deque<ToolNotification> entries = new ArrayDeque<>();
    private final AtomicLong dropped = new AtomicLong();
    private volatile Runnable drainListener = NO_LISTENER;
    private boolean closed;

    public NotificationQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public void setDrainListener(Runnable listener) {
        this.drainListener = listener != null ? listener : NO_LISTENER;
    }

    /**
     * Enqueues a notification. Returns false if it was discarded, which only
     * happens to a non-critical entry arriving at a buffer full of critical
     * ones, or after close.
     */
    public boolean offer(ToolNotification notification) {
        synchronized (entries) {
            if (closed) {
                return false;
            }
            if (entries.size() >= capacity && !dropOldestNonCritical() && !notification.isCritical()) {
                dropped.incrementAndGet();
                return false;
            }
            entries.addLast(notification);
        }
        drainListener.run();
        return true;
    }

    /**
     * Oldest entry, or {@code null} when empty.
     */
    public ToolNotification poll() {
        synchronized (entries) {
            return entries.pollFirst();
        }
    }

    /**
     * Stops accepting entries. Consumers drain what is left, then see the end.
     */
    public void close() {
        synchronized (entries) {
            closed = true;
        }
        drainListener.run();
    }

    /**
     * True once closed and empty: nothing more will ever be delivered.
     */
    public boolean isDrained() {
        synchronized (entries) {
            return closed && entries.isEmpty();
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    private boolean dropOldestNonCritical() {
        Iterator<ToolNotification> it = entries.iterator();
        while (it.hasNext()) {
            if (!it.next().isCritical()) {
                it.remove();
                dropped.incrementAndGet();
                return true;
            }
        }
        return false;
    }
}
