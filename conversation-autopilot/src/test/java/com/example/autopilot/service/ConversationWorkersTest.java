package com.example.autopilot.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConversationWorkersTest {

    private ExecutorService executor;
    private ConversationWorkers workers;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        workers = new ConversationWorkers(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void tasksOfOneConversationRunInSubmissionOrder() throws Exception {
        List<Integer> order = new CopyOnWriteArrayList<>();
        CompletableFuture<Void> last = null;
        for (int i = 0; i < 50; i++) {
            int index = i;
            last = workers.submit("c1", () -> order.add(index));
        }

        last.get(5, TimeUnit.SECONDS);

        assertThat(order).hasSize(50);
        assertThat(order).isSorted();
    }

    @Test
    void failingTaskDoesNotBlockTheNextOne() throws Exception {
        List<String> ran = new CopyOnWriteArrayList<>();
        workers.submit("c1", () -> {
            throw new IllegalStateException("boom");
        });
        workers.submit("c1", () -> ran.add("second")).get(5, TimeUnit.SECONDS);

        assertThat(ran).containsExactly("second");
    }

    @Test
    void differentConversationsRunInParallel() throws Exception {
        CountDownLatch blocker = new CountDownLatch(1);
        CompletableFuture<Void> slow = workers.submit("slow", () -> {
            try {
                blocker.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });

        workers.submit("fast", () -> { }).get(5, TimeUnit.SECONDS);

        assertThat(slow).isNotDone();
        blocker.countDown();
        slow.get(5, TimeUnit.SECONDS);
        assertThat(workers.activeConversations()).isZero();
    }
}
