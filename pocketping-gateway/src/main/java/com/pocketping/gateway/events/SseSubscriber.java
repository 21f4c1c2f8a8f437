package com.pocketping.gateway.events;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * One stream listener: a bounded queue drained by the task serving the
 * listener's HTTP response.
 */
public class SseSubscriber implements AutoCloseable {

    private static final AtomicLong IDS = new AtomicLong();

    private final long id = IDS.incrementAndGet();
    private final BlockingQueue<OutgoingEvent> queue;
    private final Consumer<SseSubscriber> onClose;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    SseSubscriber(int capacity, Consumer<SseSubscriber> onClose) {
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.onClose = onClose;
    }

    public long getId() {
        return id;
    }

    /** Enqueue without blocking; false when the queue is full or closed. */
    boolean offer(OutgoingEvent event) {
        return !closed.get() && queue.offer(event);
    }

    /**
     * Wait for the next event.
     *
     * @return the event, or null when none arrived within the timeout
     */
    public OutgoingEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public int pending() {
        return queue.size();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            queue.clear();
            onClose.accept(this);
        }
    }
}
