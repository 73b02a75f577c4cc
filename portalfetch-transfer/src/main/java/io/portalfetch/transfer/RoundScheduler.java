package io.portalfetch.transfer;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.portalfetch.manifest.Manifest;
import io.portalfetch.manifest.WorkItem;
import io.portalfetch.transport.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/// Runs a manifest through a fixed pool of workers in rounds.
///
/// Round 1 contains every item. Each later round contains only the items that failed in the
/// round before it, in manifest order, after a cooldown. The run ends when a round has no
/// failures, when it is cancelled, or when the configured round limit is reached. Without a
/// limit, an item that never succeeds keeps the run going.
///
/// Items that were stopped by cancellation are not counted as failures; they are reported as
/// pending together with the failed ones.
public class RoundScheduler {
    private static final Logger logger = LogManager.getLogger(RoundScheduler.class);

    private static final long WORKER_DRAIN_SECONDS = 5;

    private final ItemFetcher fetcher;
    private final TransferConfig config;
    private final TransferEventSink events;
    private final CancellationToken cancellation;
    private final Sleeper sleeper;
    private final Set<Future<TransferOutcome>> inFlight = ConcurrentHashMap.newKeySet();

    public RoundScheduler(ItemFetcher fetcher, TransferConfig config, TransferEventSink events,
                          CancellationToken cancellation, Sleeper sleeper)
    {
        this.fetcher = fetcher;
        this.config = config;
        this.events = events;
        this.cancellation = cancellation;
        this.sleeper = sleeper;
    }

    /// Requests that the run stop. Workers of the current round are interrupted, which also ends
    /// any transport backoff they are waiting in.
    public void cancel() {
        cancellation.cancel();
        interruptInFlight();
    }

    private void interruptInFlight() {
        for (Future<TransferOutcome> future : inFlight) {
            future.cancel(true);
        }
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    /// Runs rounds until the work list is empty, the run is cancelled or the round limit is hit.
    ///
    /// @param manifest The deduplicated work list
    /// @return What happened
    public RunSummary run(Manifest manifest) {
        List<WorkItem> remaining = new ArrayList<>(manifest.items());
        Map<WorkItem, Integer> failureCounts = new LinkedHashMap<>();
        int rounds = 0;
        int completed = 0;
        int skipped = 0;

        ExecutorService pool = Executors.newFixedThreadPool(config.workers(), new WorkerThreadFactory());
        try {
            while (!remaining.isEmpty()) {
                if (cancellation.isCancelled()) {
                    return summary(RunStatus.CANCELLED, rounds, completed, skipped, failureCounts, remaining);
                }
                if (config.hasRoundLimit() && rounds >= config.maxRounds()) {
                    logger.warn("Round limit of {} reached with {} item(s) still failing", config.maxRounds(),
                        remaining.size());
                    return summary(RunStatus.ROUND_LIMIT_REACHED, rounds, completed, skipped, failureCounts,
                        remaining);
                }
                if (rounds > 0) {
                    try {
                        sleeper.sleep(config.roundCooldown());
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        cancellation.cancel();
                        return summary(RunStatus.CANCELLED, rounds, completed, skipped, failureCounts, remaining);
                    }
                    if (cancellation.isCancelled()) {
                        return summary(RunStatus.CANCELLED, rounds, completed, skipped, failureCounts, remaining);
                    }
                }

                rounds++;
                int round = rounds;
                events.roundStarted(round, remaining.size());

                CompletionService<TransferOutcome> completion = new ExecutorCompletionService<>(pool);
                Map<Future<TransferOutcome>, WorkItem> submitted = new LinkedHashMap<>();
                for (WorkItem item : remaining) {
                    Future<TransferOutcome> future = completion.submit(() -> attempt(item));
                    submitted.put(future, item);
                    inFlight.add(future);
                }
                if (cancellation.isCancelled()) {
                    interruptInFlight();
                }

                Set<WorkItem> unfinished = new HashSet<>();
                Set<WorkItem> finished = new HashSet<>();
                int roundCompleted = 0;
                int roundSkipped = 0;
                int roundFailed = 0;
                for (int i = 0; i < submitted.size(); i++) {
                    Future<TransferOutcome> future;
                    try {
                        future = completion.take();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        cancellation.cancel();
                        logger.info("Interrupted while waiting for round {}, stopping", round);
                        List<WorkItem> pending = new ArrayList<>();
                        for (WorkItem item : remaining) {
                            if (!finished.contains(item)) {
                                pending.add(item);
                            }
                        }
                        return summary(RunStatus.CANCELLED, rounds, completed + roundCompleted,
                            skipped + roundSkipped, failureCounts, pending);
                    }
                    WorkItem item = submitted.get(future);
                    TransferOutcome outcome = outcomeOf(future, item);
                    events.itemFinished(round, outcome);
                    switch (outcome.status()) {
                        case COMPLETED:
                            roundCompleted++;
                            finished.add(item);
                            break;
                        case SKIPPED:
                            roundSkipped++;
                            finished.add(item);
                            break;
                        default:
                            unfinished.add(item);
                            if (!outcome.isCancelled()) {
                                roundFailed++;
                                failureCounts.merge(item, 1, Integer::sum);
                            }
                    }
                }
                inFlight.clear();
                completed += roundCompleted;
                skipped += roundSkipped;
                events.roundFinished(round, roundCompleted, roundSkipped, roundFailed);

                List<WorkItem> next = new ArrayList<>();
                for (WorkItem item : remaining) {
                    if (unfinished.contains(item)) {
                        next.add(item);
                    }
                }
                remaining = next;
            }
            return summary(RunStatus.SUCCEEDED, rounds, completed, skipped, failureCounts, remaining);
        } finally {
            inFlight.clear();
            pool.shutdownNow();
            if (cancellation.isCancelled()) {
                awaitWorkers(pool);
            }
        }
    }

    private static void awaitWorkers(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(WORKER_DRAIN_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Workers still running {}s after cancellation", WORKER_DRAIN_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private TransferOutcome attempt(WorkItem item) {
        if (cancellation.isCancelled()) {
            return TransferOutcome.failed(item, new TransferCancelledException("Cancelled before start: " + item));
        }
        return fetcher.fetch(item);
    }

    private static TransferOutcome outcomeOf(Future<TransferOutcome> future, WorkItem item) {
        try {
            TransferOutcome outcome = future.get();
            return outcome != null ? outcome : TransferOutcome.failed(item, new TransferException("No outcome"));
        } catch (CancellationException e) {
            return TransferOutcome.failed(item, new TransferCancelledException("Cancelled: " + item));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            Exception error = cause instanceof Exception ? (Exception) cause : new TransferException(
                "Worker error for " + item, cause);
            return TransferOutcome.failed(item, error);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TransferOutcome.failed(item, new TransferCancelledException("Interrupted: " + item));
        }
    }

    private RunSummary summary(RunStatus status, int rounds, int completed, int skipped,
                               Map<WorkItem, Integer> failureCounts, List<WorkItem> pending)
    {
        RunSummary summary = new RunSummary(status, rounds, completed, skipped, failureCounts, pending);
        logger.info("Run {} after {} round(s): {} downloaded, {} already complete, {} pending", status, rounds,
            completed, skipped, pending.size());
        return summary;
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "portalfetch-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
