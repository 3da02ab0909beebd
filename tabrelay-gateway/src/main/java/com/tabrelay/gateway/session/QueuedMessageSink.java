package com.tabrelay.gateway.session;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Holds notifications for request/response clients until their next poll.
 * Bounded; the oldest messages are dropped first.
 */
@Slf4j
public class QueuedMessageSink implements MessageSink {

    public static final int DEFAULT_CAPACITY = 500;

    private final ConcurrentLinkedDeque<String> queue = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();
    private final int capacity;

    public QueuedMessageSink() {
        this(DEFAULT_CAPACITY);
    }

    public QueuedMessageSink(int capacity) {
        this.capacity = capacity;
    }

    @Override
    public void send(String json) {
        queue.addLast(json);
        if (size.incrementAndGet() > capacity && queue.pollFirst() != null) {
            size.decrementAndGet();
            log.debug("Notification queue full, dropped oldest message");
        }
    }

    public List<String> drain() {
        List<String> drained = new ArrayList<>();
        String next;
        while ((next = queue.pollFirst()) != null) {
            size.decrementAndGet();
            drained.add(next);
        }
        return drained;
    }

    public int size() {
        return size.get();
    }

    @Override
    public void close() {
        queue.clear();
        size.set(0);
    }
}
