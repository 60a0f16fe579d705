package com.example.demo.pdfform.event;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Handle returned by {@link EventBus#subscribe}. Holds a bounded buffer of matching events.
 *
 * Once closed, no further events are accepted; events already buffered can still be
 * drained, after which {@link #take()} and {@link #poll(Duration)} return null.
 */
public class Subscription implements AutoCloseable {
    /**
     * Queued behind the remaining events on close; never handed to callers
     */
    private static final Event CLOSED = Event.of(null, Instant.EPOCH, null);

    private final EventBus bus;
    private final String pattern;
    private final int capacity;
    private final BlockingQueue<Event> buffer;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicLong dropped = new AtomicLong();

    Subscription(EventBus bus, String pattern, int capacity) {
        this.bus = bus;
        this.pattern = pattern;
        this.capacity = capacity;
        // one slot beyond capacity is kept free for the close marker
        this.buffer = new ArrayBlockingQueue<>(capacity + 1);
    }

    public String pattern() {
        return pattern;
    }

    public boolean matches(EventType type) {
        return EventBus.matches(pattern, type.wireName());
    }

    /**
     * Next event, waiting as long as needed; null once the subscription is closed and drained.
     */
    public Event take() throws InterruptedException {
        return unlessClosed(buffer.take());
    }

    /**
     * Next event, or null if none arrives within {@code timeout} or the subscription is
     * closed and drained.
     */
    public Event poll(Duration timeout) throws InterruptedException {
        return unlessClosed(buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Events discarded because the buffer was full when they were published.
     */
    public long droppedCount() {
        return dropped.get();
    }

    public int buffered() {
        return (int) buffer.stream().filter(event -> event != CLOSED).count();
    }

    @Override
    public void close() {
        bus.unsubscribe(this);
    }

    synchronized boolean deliver(Event event) {
        if (closed.get()) {
            return false;
        }
        if (buffer.size() >= capacity || !buffer.offer(event)) {
            dropped.incrementAndGet();
            return false;
        }
        return true;
    }

    /**
     * @return true only for the call that actually closed the subscription
     */
    synchronized boolean markClosed() {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        buffer.offer(CLOSED);
        return true;
    }

    private Event unlessClosed(Event event) {
        if (event != CLOSED) {
            return event;
        }
        // put the marker back so every later read also sees the close
        buffer.offer(CLOSED);
        return null;
    }
}
