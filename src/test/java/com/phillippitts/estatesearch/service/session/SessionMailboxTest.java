package com.phillippitts.estatesearch.service.session;

import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class SessionMailboxTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() throws InterruptedException {
        pool.shutdownNow();
        pool.awaitTermination(2, TimeUnit.SECONDS);
    }

    @Test
    void runsTasksOneAtATimeInSubmissionOrder() throws InterruptedException {
        SessionMailbox mailbox = new SessionMailbox("s1", pool);
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();

        for (int i = 0; i < 200; i++) {
            int n = i;
            mailbox.submit(() -> {
                maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                order.add(n);
                active.decrementAndGet();
            });
        }

        await().atMost(Duration.ofSeconds(5)).until(() -> order.size() == 200);
        assertThat(maxActive.get()).isEqualTo(1);
        for (int i = 0; i < 200; i++) {
            assertThat(order.get(i)).isEqualTo(i);
        }
    }

    @Test
    void concurrentSubmittersNeverOverlap() throws InterruptedException {
        SessionMailbox mailbox = new SessionMailbox("s1", pool);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        AtomicInteger done = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService submitters = Executors.newFixedThreadPool(4);

        for (int t = 0; t < 4; t++) {
            submitters.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < 250; i++) {
                    mailbox.submit(() -> {
                        maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                        active.decrementAndGet();
                        done.incrementAndGet();
                    });
                }
            });
        }
        start.countDown();

        await().atMost(Duration.ofSeconds(5)).until(() -> done.get() == 1000);
        assertThat(maxActive.get()).isEqualTo(1);
        submitters.shutdownNow();
    }

    @Test
    void nestedSubmitRunsAfterCurrentTask() {
        SessionMailbox mailbox = new SessionMailbox("s1", Runnable::run);
        List<String> order = new ArrayList<>();

        mailbox.submit(() -> {
            order.add("outer-start");
            mailbox.submit(() -> order.add("inner"));
            order.add("outer-end");
        });

        assertThat(order).containsExactly("outer-start", "outer-end", "inner");
        assertThat(mailbox.unfinishedTasks()).isZero();
    }

    @Test
    void failingTaskDoesNotStopTheMailbox() {
        SessionMailbox mailbox = new SessionMailbox("s1", Runnable::run);
        List<String> order = new ArrayList<>();

        mailbox.submit(() -> {
            throw new IllegalStateException("boom");
        });
        mailbox.submit(() -> order.add("next"));

        assertThat(order).containsExactly("next");
    }

    @Test
    void putsSessionIdInThreadContextWhileDraining() {
        SessionMailbox mailbox = new SessionMailbox("session-7", Runnable::run);
        List<String> seen = new ArrayList<>();

        mailbox.submit(() -> seen.add(ThreadContext.get("sessionId")));

        assertThat(seen).containsExactly("session-7");
        assertThat(ThreadContext.get("sessionId")).isNull();
    }

    @Test
    void runningTaskCountsAsUnfinishedAndBlocksClose() {
        SessionMailbox mailbox = new SessionMailbox("s1", Runnable::run);
        List<Boolean> closedWhileRunning = new ArrayList<>();

        mailbox.submit(() -> {
            closedWhileRunning.add(mailbox.closeIfIdle(() -> true));
            assertThat(mailbox.unfinishedTasks()).isEqualTo(1);
        });

        assertThat(closedWhileRunning).containsExactly(false);
        assertThat(mailbox.isClosed()).isFalse();
        assertThat(mailbox.unfinishedTasks()).isZero();
    }

    @Test
    void closedMailboxRejectsSubmissions() {
        SessionMailbox mailbox = new SessionMailbox("s1", Runnable::run);
        List<String> ran = new ArrayList<>();

        assertThat(mailbox.closeIfIdle(() -> false)).isFalse();
        assertThat(mailbox.closeIfIdle(() -> true)).isTrue();

        assertThat(mailbox.submit(() -> ran.add("late"))).isFalse();
        assertThat(ran).isEmpty();
        assertThat(mailbox.closeIfIdle(() -> true)).isFalse();
    }
}
