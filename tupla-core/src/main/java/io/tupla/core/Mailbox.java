package io.tupla.core;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Per-actor message queue with selective receive.
 * <p>
 * {@link #receive} takes the oldest message of the requested type that satisfies a filter,
 * leaving every other message queued in arrival order.
 */
public final class Mailbox {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition arrived = lock.newCondition();
    private final Deque<Object> messages = new ArrayDeque<>();

    public void post(Object message) {
        if (message == null) {
            throw new IllegalArgumentException("message required");
        }
        lock.lock();
        try {
            messages.addLast(message);
            arrived.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove and return the oldest matching message, waiting up to {@code timeout}.
     *
     * @param type    message type to look for
     * @param filter  additional condition on the message
     * @param timeout maximum wait, zero means poll
     * @return the message, or empty when the deadline passes first
     * @throws InterruptedException if interrupted while waiting
     */
    public <T> Optional<T> receive(Class<T> type, Predicate<? super T> filter, Duration timeout)
            throws InterruptedException {
        var remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (true) {
                var found = takeFirst(type, filter);
                if (found != null) {
                    return Optional.of(found);
                }
                if (remaining <= 0L) {
                    return Optional.empty();
                }
                remaining = arrived.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    public <T> Optional<T> poll(Class<T> type, Predicate<? super T> filter) {
        lock.lock();
        try {
            return Optional.ofNullable(takeFirst(type, filter));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return messages.size();
        } finally {
            lock.unlock();
        }
    }

    private <T> T takeFirst(Class<T> type, Predicate<? super T> filter) {
        Iterator<Object> it = messages.iterator();
        while (it.hasNext()) {
            var message = it.next();
            if (type.isInstance(message)) {
                var candidate = type.cast(message);
                if (filter.test(candidate)) {
                    it.remove();
                    return candidate;
                }
            }
        }
        return null;
    }
}
