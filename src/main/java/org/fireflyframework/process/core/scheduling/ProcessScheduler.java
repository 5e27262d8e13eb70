/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.process.core.scheduling;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Small scheduling facade for the engine: one-shot wake-ups of parked executions and the
 * periodic recovery sweep. Tasks are keyed; scheduling under an existing key replaces
 * the previous task.
 */
@Slf4j
public class ProcessScheduler {
    private final ScheduledExecutorService executor;
    private final Map<String, ScheduledFuture<?>> scheduledTasks = new ConcurrentHashMap<>();
    private final Clock clock;

    public ProcessScheduler(int threadPoolSize) {
        this(threadPoolSize, Clock.systemUTC());
    }

    public ProcessScheduler(int threadPoolSize, Clock clock) {
        var counter = new AtomicInteger(0);
        this.executor = Executors.newScheduledThreadPool(threadPoolSize, r -> {
            Thread t = new Thread(r, "process-scheduler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.clock = clock;
    }

    /** Runs {@code task} once at {@code at}, or immediately when that instant has passed. */
    public void scheduleAt(String taskId, Instant at, Runnable task) {
        long delayMs = Math.max(0, Duration.between(clock.instant(), at).toMillis());
        var holder = new CompletableFuture<ScheduledFuture<?>>();
        ScheduledFuture<?> future = executor.schedule(() -> {
            holder.thenAccept(self -> scheduledTasks.remove(taskId, self));
            try {
                task.run();
            } catch (Exception e) {
                log.error("[scheduler] Task '{}' failed: {}", taskId, e.getMessage(), e);
            }
        }, delayMs, TimeUnit.MILLISECONDS);
        holder.complete(future);
        replace(taskId, future);
        log.debug("[scheduler] Scheduled task '{}' in {}ms", taskId, delayMs);
    }

    public void scheduleWithFixedDelay(String taskId, Runnable task, long initialDelayMs, long delayMs) {
        var future = executor.scheduleWithFixedDelay(() -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("[scheduler] Task '{}' failed: {}", taskId, e.getMessage(), e);
            }
        }, initialDelayMs, delayMs, TimeUnit.MILLISECONDS);
        replace(taskId, future);
        log.info("[scheduler] Scheduled task '{}' with fixed delay {}ms", taskId, delayMs);
    }

    public void cancel(String taskId) {
        var future = scheduledTasks.remove(taskId);
        if (future != null) {
            future.cancel(false);
            log.debug("[scheduler] Cancelled task '{}'", taskId);
        }
    }

    /** Cancels every task whose key starts with {@code prefix}. */
    public int cancelMatching(String prefix) {
        int cancelled = 0;
        for (String taskId : scheduledTasks.keySet()) {
            if (taskId.startsWith(prefix)) {
                cancel(taskId);
                cancelled++;
            }
        }
        return cancelled;
    }

    public void shutdown() {
        scheduledTasks.values().forEach(f -> f.cancel(false));
        scheduledTasks.clear();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[scheduler] Scheduler shutdown completed");
    }

    public int activeTaskCount() {
        return scheduledTasks.size();
    }

    private void replace(String taskId, ScheduledFuture<?> future) {
        var existing = scheduledTasks.put(taskId, future);
        if (existing != null && existing != future) {
            existing.cancel(false);
        }
    }
}
