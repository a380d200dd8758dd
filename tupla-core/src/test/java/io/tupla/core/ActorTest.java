package io.tupla.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ActorTest {

    @Test
    void callBindsAndRestoresCurrentActor() {
        var outer = Actor.current();
        var worker = Actor.spawn("worker");

        var seen = worker.call(Actor::current);

        assertThat(seen).isSameAs(worker);
        assertThat(Actor.current()).isSameAs(outer);
    }

    @Test
    void eachThreadIsItsOwnActor() throws Exception {
        var executor = Executors.newSingleThreadExecutor();
        try {
            var other = executor.submit(Actor::current).get(5, TimeUnit.SECONDS);
            assertThat(other).isNotSameAs(Actor.current());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void terminateNotifiesListenersOnce() {
        var actor = Actor.spawn("short-lived");
        var seen = new CopyOnWriteArrayList<Actor>();
        Actor.TerminationListener listener = terminated -> {
            if (terminated == actor) {
                seen.add(terminated);
            }
        };
        Actor.addTerminationListener(listener);
        try {
            actor.terminate();
            actor.terminate();
        } finally {
            Actor.removeTerminationListener(listener);
        }

        assertThat(actor.isAlive()).isFalse();
        assertThat(seen).containsExactly(actor);
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        var actor = Actor.spawn("victim");
        var seen = new CopyOnWriteArrayList<Actor>();
        Actor.TerminationListener failing = terminated -> {
            if (terminated == actor) {
                throw new IllegalStateException("boom");
            }
        };
        Actor.TerminationListener recording = terminated -> {
            if (terminated == actor) {
                seen.add(terminated);
            }
        };
        Actor.addTerminationListener(failing);
        Actor.addTerminationListener(recording);
        try {
            actor.terminate();
        } finally {
            Actor.removeTerminationListener(failing);
            Actor.removeTerminationListener(recording);
        }

        assertThat(seen).containsExactly(actor);
    }

    @Test
    @Timeout(5)
    void mailboxReceivesSelectively() throws InterruptedException {
        var mailbox = Actor.spawn("inbox").mailbox();
        mailbox.post("first");
        mailbox.post(42);
        mailbox.post("second");

        var number = mailbox.receive(Integer.class, n -> true, Duration.ZERO);
        var second = mailbox.receive(String.class, s -> s.startsWith("s"), Duration.ZERO);

        assertThat(number).contains(42);
        assertThat(second).contains("second");
        assertThat(mailbox.poll(String.class, s -> true)).contains("first");
        assertThat(mailbox.size()).isZero();
    }

    @Test
    @Timeout(5)
    void mailboxReceiveTimesOut() throws InterruptedException {
        var mailbox = Actor.spawn("idle").mailbox();

        assertThat(mailbox.receive(String.class, s -> true, Duration.ofMillis(50))).isEmpty();
    }

    @Test
    @Timeout(5)
    void mailboxReceiveWakesOnPost() throws Exception {
        var mailbox = Actor.spawn("waiting").mailbox();
        var executor = Executors.newSingleThreadExecutor();
        try {
            var pending = executor.submit(() -> mailbox.receive(String.class, s -> true, Duration.ofSeconds(3)));
            Thread.sleep(50);
            mailbox.post("hello");

            assertThat(pending.get(3, TimeUnit.SECONDS)).contains("hello");
        } finally {
            executor.shutdownNow();
        }
    }
}
