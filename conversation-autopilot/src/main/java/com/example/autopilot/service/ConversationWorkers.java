package com.example.autopilot.service;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Serial worker per conversation on a shared pool. Tasks for one conversation run one at a time in
 * submission order; different conversations run in parallel. A failing task is logged and does not
 * stop the ones queued behind it.
 */
@Slf4j
@Component
public class ConversationWorkers {

    private final Executor executor;
    private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public ConversationWorkers(@Qualifier("conversationTaskExecutor") Executor executor) {
        this.executor = executor;
    }

    public CompletableFuture<Void> submit(String conversationId, Runnable task) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        CompletableFuture<Void> previous = tails.put(conversationId, done);
        CompletableFuture<Void> after = previous != null ? previous : CompletableFuture.completedFuture(null);
        try {
            after.whenCompleteAsync((ignored, failure) -> runTask(conversationId, task, done), executor);
        } catch (RuntimeException rejected) {
            log.error("Worker pool rejected a task for conversation {}", conversationId, rejected);
            complete(conversationId, done);
        }
        return done;
    }

    public int activeConversations() {
        return tails.size();
    }

    private void runTask(String conversationId, Runnable task, CompletableFuture<Void> done) {
        try {
            task.run();
        } catch (RuntimeException ex) {
            log.error("Worker task for conversation {} failed", conversationId, ex);
        } finally {
            complete(conversationId, done);
        }
    }

    private void complete(String conversationId, CompletableFuture<Void> done) {
        tails.remove(conversationId, done);
        done.complete(null);
    }
}
