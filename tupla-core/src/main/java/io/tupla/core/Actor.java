package io.tupla.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Identity that owns tables and receives ownership transfers.
 * <p>
 * Every thread starts out as its own actor ({@link #current()}); code can run under another
 * actor's identity with {@link #call(Supplier)} or {@link #run(Runnable)}. An actor is alive
 * until {@link #terminate()} is called, which fires the registered termination listeners so
 * that arenas can hand the actor's tables to their heirs or delete them.
 */
public final class Actor {
    private static final Logger log = LoggerFactory.getLogger(Actor.class);

    private static final AtomicLong NEXT_ID = new AtomicLong(1);
    private static final List<TerminationListener> LISTENERS = new CopyOnWriteArrayList<>();
    private static final ThreadLocal<Actor> CURRENT =
            ThreadLocal.withInitial(() -> new Actor(Thread.currentThread().getName()));

    private final long id;
    private final String name;
    private final AtomicBoolean alive = new AtomicBoolean(true);
    private final Mailbox mailbox = new Mailbox();

    private Actor(String name) {
        this.id = NEXT_ID.getAndIncrement();
        this.name = name;
    }

    /**
     * The actor the calling thread is acting as.
     */
    public static Actor current() {
        return CURRENT.get();
    }

    /**
     * Create a new live actor. It acts only when code is run under it.
     */
    public static Actor spawn(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name required");
        }
        return new Actor(name);
    }

    public static void addTerminationListener(TerminationListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener required");
        }
        LISTENERS.add(listener);
    }

    public static void removeTerminationListener(TerminationListener listener) {
        LISTENERS.remove(listener);
    }

    /**
     * Run {@code body} on the calling thread with this actor as {@link #current()}.
     */
    public <T> T call(Supplier<T> body) {
        var previous = CURRENT.get();
        CURRENT.set(this);
        try {
            return body.get();
        } finally {
            CURRENT.set(previous);
        }
    }

    public void run(Runnable body) {
        call(() -> {
            body.run();
            return null;
        });
    }

    public long id() {
        return id;
    }

    public String name() {
        return name;
    }

    public boolean isAlive() {
        return alive.get();
    }

    public Mailbox mailbox() {
        return mailbox;
    }

    /**
     * Mark this actor dead and notify listeners. Idempotent.
     */
    public void terminate() {
        if (!alive.compareAndSet(true, false)) {
            return;
        }
        log.debug("Actor {} terminated", this);
        for (var listener : LISTENERS) {
            try {
                listener.onTerminated(this);
            } catch (RuntimeException e) {
                log.error("Termination listener failed for actor {}", this, e);
            }
        }
    }

    @Override
    public String toString() {
        return "<" + id + "." + name + ">";
    }

    @FunctionalInterface
    public interface TerminationListener {
        void onTerminated(Actor actor);
    }
}
