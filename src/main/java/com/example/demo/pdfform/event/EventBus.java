package com.example.demo.pdfform.event;

import com.example.demo.pdfform.config.PdfFormProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-process publish/subscribe with pattern subscriptions.
 *
 * Patterns: {@code "*"} matches every type, {@code "prefix.*"} matches types starting
 * with {@code "prefix."}, anything else matches one type exactly. A null pattern matches
 * nothing. Delivery never blocks the publisher: a subscriber whose buffer is full loses
 * that event.
 */
@Slf4j
@Component
public class EventBus {
    public static final String ALL = "*";

    private final int bufferSize;
    private final List<Subscription> subscriptions = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Autowired
    public EventBus(PdfFormProperties properties) {
        this(properties.getEventBufferSize());
    }

    public EventBus(int bufferSize) {
        if (bufferSize < 1) {
            throw new IllegalArgumentException("Event buffer size must be positive: " + bufferSize);
        }
        this.bufferSize = bufferSize;
    }

    public Subscription subscribe(String pattern) {
        Subscription subscription = new Subscription(this, pattern, bufferSize);
        lock.writeLock().lock();
        try {
            subscriptions.add(subscription);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Subscribed to '{}'", pattern);
        return subscription;
    }

    public void publish(Event event) {
        lock.readLock().lock();
        try {
            for (Subscription subscription : subscriptions) {
                if (subscription.matches(event.getType()) && !subscription.deliver(event)) {
                    log.debug("Dropped {} for subscriber '{}'", event.getType(), subscription.pattern());
                }
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Remove and close {@code subscription}. Unknown or already closed handles are ignored.
     */
    public void unsubscribe(Subscription subscription) {
        if (subscription == null) {
            return;
        }
        lock.writeLock().lock();
        try {
            subscriptions.remove(subscription);
        } finally {
            lock.writeLock().unlock();
        }
        if (subscription.markClosed()) {
            log.debug("Unsubscribed from '{}'", subscription.pattern());
        }
    }

    public int subscriberCount() {
        lock.readLock().lock();
        try {
            return subscriptions.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    static boolean matches(String pattern, String type) {
        if (pattern == null || type == null) {
            return false;
        }
        if (ALL.equals(pattern)) {
            return true;
        }
        if (pattern.endsWith(".*")) {
            return type.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return pattern.equals(type);
    }
}
