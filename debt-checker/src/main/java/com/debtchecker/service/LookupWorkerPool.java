package com.debtchecker.service;

import com.debtchecker.config.DebtCheckerProperties;
import com.debtchecker.model.ErrorKind;
import com.debtchecker.model.LookupOutcome;
import com.debtchecker.model.RunResult;
import com.debtchecker.model.RunState;
import com.debtchecker.output.CheckpointStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs lookups for a list of identifiers on a fixed pool of worker threads.
 *
 * The dispatcher hands identifiers out in input order, one per free worker, and
 * stops as soon as cancellation is requested. Workers record each outcome through
 * the {@link CheckpointTracker} the moment it is known. After a cancel, in-flight
 * lookups get the configured grace period to finish before they are interrupted
 * and left in {@code remaining}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LookupWorkerPool {

    private static final long POLL_MILLIS = 200;
    private static final Duration ABANDON_WAIT = Duration.ofSeconds(10);

    private final DebtLookupClient lookupClient;
    private final CheckpointStore checkpointStore;
    private final DebtCheckerProperties properties;
    private final Clock clock;

    public RunResult run(List<String> identifiers) {
        return run(identifiers, Map.of(), new CancellationController(), ProgressListener.NONE);
    }

    /**
     * @param seeded outcomes known before the run; carried into the result and the
     *               checkpoint but never queried
     * @throws FatalRunException if a run-level error aborted the run; the final
     *                           checkpoint has been written by then
     */
    public RunResult run(List<String> identifiers,
                         Map<String, LookupOutcome> seeded,
                         CancellationController cancellation,
                         ProgressListener listener) {
        String runId = UUID.randomUUID().toString();
        int workers = properties.getWorkerCount();
        RunState state = new RunState(identifiers, seeded);
        CheckpointTracker tracker = new CheckpointTracker(
                runId, state, checkpointStore, properties.getCheckpoint(), clock, listener);
        ExecutorService executor = Executors.newFixedThreadPool(workers, new WorkerThreadFactory(runId));
        Run run = new Run(state, tracker, cancellation, new Semaphore(workers));

        cancellation.onEscalation(executor::shutdownNow);
        log.info("Run {} starting: {} identifiers to check, {} already known, {} workers",
                runId, identifiers.size(), seeded.size(), workers);

        boolean interrupted = false;
        try {
            dispatch(run, executor);
        } catch (InterruptedException e) {
            interrupted = true;
            cancellation.requestCancel("dispatcher interrupted");
        } finally {
            interrupted |= drain(run, executor);
        }

        state.seal();
        List<String> remaining = state.remaining();
        boolean partial = cancellation.isCancelRequested() || !remaining.isEmpty();
        tracker.flush(partial);
        cancellation.markStopped();

        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        FatalRunException fatal = run.fatal.get();
        if (fatal != null) {
            log.error("Run {} aborted: {}. {} outcomes kept in the checkpoint, {} identifiers unresolved",
                    runId, fatal.getMessage(), state.completedCount(), remaining.size());
            throw fatal;
        }

        log.info("Run {} {}: {} completed, {} remaining",
                runId, partial ? "stopped early" : "finished", state.completedCount(), remaining.size());
        return new RunResult(state.results(), partial, remaining, tracker.reportProgress());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void dispatch(Run run, ExecutorService executor) throws InterruptedException {
        while (!run.cancellation.isCancelRequested()) {
            if (!run.slots.tryAcquire(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                continue;
            }
            if (run.cancellation.isCancelRequested()) {
                run.slots.release();
                break;
            }
            Optional<String> next = run.state.nextPending();
            if (next.isEmpty()) {
                run.slots.release();
                break;
            }
            String identifier = next.get();
            try {
                executor.execute(() -> work(run, identifier));
            } catch (RejectedExecutionException e) {
                // pool already shut down by an escalated stop
                run.state.abandon(identifier);
                run.slots.release();
                break;
            }
        }
    }

    private void work(Run run, String identifier) {
        try {
            Optional<LookupOutcome> outcome = lookupClient.lookup(identifier, run.cancellation);
            if (outcome.isPresent()) {
                run.tracker.record(identifier, outcome.get());
            } else {
                run.state.abandon(identifier);
            }
        } catch (FatalRunException e) {
            run.state.abandon(identifier);
            if (run.fatal.compareAndSet(null, e)) {
                run.cancellation.forceStop(e.getMessage());
            }
        } catch (RuntimeException e) {
            log.error("Unexpected error checking {}: {}", identifier, e.getMessage(), e);
            run.tracker.record(identifier, LookupOutcome.failed(ErrorKind.INVALID_RESPONSE, 1,
                    e.getClass().getSimpleName() + ": " + e.getMessage()));
        } finally {
            run.slots.release();
        }
    }

    /**
     * Waits for in-flight lookups. Without a cancel this waits for normal completion;
     * once a cancel is seen the grace period starts.
     *
     * @return true if the waiting thread was interrupted
     */
    private boolean drain(Run run, ExecutorService executor) {
        CancellationController cancellation = run.cancellation;
        executor.shutdown();
        long graceNanos = properties.getCancellation().getGracePeriod().toNanos();
        long graceStart = 0;
        boolean draining = false;
        boolean interrupted = false;

        while (true) {
            try {
                if (executor.awaitTermination(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    return interrupted;
                }
            } catch (InterruptedException e) {
                interrupted = true;
                cancellation.forceStop("interrupted while draining");
            }
            if (!cancellation.isCancelRequested()) {
                continue;
            }
            if (!draining) {
                draining = true;
                graceStart = System.nanoTime();
                cancellation.beginDraining();
                log.info("Waiting up to {} for {} in-flight lookups",
                        properties.getCancellation().getGracePeriod(), run.state.inFlightCount());
            }
            if (cancellation.isStopRequested() || System.nanoTime() - graceStart >= graceNanos) {
                break;
            }
        }

        if (!cancellation.isStopRequested()) {
            log.warn("Grace period elapsed with {} lookups still in flight, abandoning them",
                    run.state.inFlightCount());
            cancellation.forceStop("grace period elapsed");
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(ABANDON_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers did not exit within {} of being interrupted", ABANDON_WAIT);
            }
        } catch (InterruptedException e) {
            interrupted = true;
        }
        return interrupted;
    }

    private static final class Run {
        final RunState state;
        final CheckpointTracker tracker;
        final CancellationController cancellation;
        final Semaphore slots;
        final AtomicReference<FatalRunException> fatal = new AtomicReference<>();

        Run(RunState state, CheckpointTracker tracker, CancellationController cancellation, Semaphore slots) {
            this.state = state;
            this.tracker = tracker;
            this.cancellation = cancellation;
            this.slots = slots;
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        WorkerThreadFactory(String runId) {
            this.prefix = "lookup-" + runId.substring(0, 8) + "-";
        }

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
