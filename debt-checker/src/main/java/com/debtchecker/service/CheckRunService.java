package com.debtchecker.service;

import com.debtchecker.config.DebtCheckerProperties;
import com.debtchecker.model.CheckRun;
import com.debtchecker.model.CheckRun.RunStatus;
import com.debtchecker.model.CheckpointSnapshot;
import com.debtchecker.model.InputRow;
import com.debtchecker.model.LookupOutcome;
import com.debtchecker.model.Progress;
import com.debtchecker.model.RunPlan;
import com.debtchecker.model.RunResult;
import com.debtchecker.output.CheckpointStore;
import com.debtchecker.output.ResultCsvWriter;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orchestrates one check run end to end:
 * verify the token, read the input, plan, run the worker pool, write the output.
 *
 * Only one run may be active at a time. A context shutdown (Ctrl+C) cancels the
 * active run and waits for it to flush its checkpoint and output.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CheckRunService {

    private static final Duration SHUTDOWN_MARGIN = Duration.ofSeconds(30);

    private final DebtApi debtApi;
    private final IdentifierCsvReader reader;
    private final ResultCsvWriter writer;
    private final LookupWorkerPool workerPool;
    private final CheckpointStore checkpointStore;
    private final RunPlanner planner;
    private final DebtCheckerProperties properties;

    private final AtomicReference<ActiveRun> active = new AtomicReference<>();
    private volatile CheckRun lastRun;

    public CheckRun runFromInput() {
        return run(Path.of(properties.getInput().getFile()), Path.of(properties.getOutput().getFile()));
    }

    /**
     * @throws FatalRunException     on a run-level error (missing or rejected token, exhausted balance)
     * @throws IllegalStateException if another run is already active
     */
    public CheckRun run(Path inputPath, Path outputPath) {
        debtApi.verifyCredentials();

        ActiveRun current = new ActiveRun(new CancellationController());
        if (!active.compareAndSet(null, current)) {
            throw new IllegalStateException("A check run is already in progress");
        }

        CheckRun run = CheckRun.builder()
                .runId(UUID.randomUUID().toString())
                .inputFile(inputPath.toString())
                .startedAt(LocalDateTime.now())
                .status(RunStatus.RUNNING)
                .build();
        lastRun = run;

        try {
            List<InputRow> rows = reader.read(inputPath);
            run.setIdentifiersRead(rows.size());

            Optional<CheckpointSnapshot> checkpoint = properties.getCheckpoint().isResume()
                    ? checkpointStore.load()
                    : Optional.empty();
            RunPlan plan = planner.plan(rows, checkpoint, properties.getPolicy());
            run.setQueried(plan.toQuery().size());

            RunResult result = workerPool.run(
                    plan.toQuery(), plan.seeded(), current.cancellation, current::setProgress);

            writer.write(rows, result, outputPath);
            if (!result.partial()) {
                checkpointStore.clear();
            }

            run.setStatus(result.partial() ? RunStatus.PARTIAL : RunStatus.COMPLETED);
            run.setFound((int) result.results().count(LookupOutcome.Found.class));
            run.setNotFound((int) result.results().count(LookupOutcome.NotFound.class));
            run.setFailed((int) result.results().count(LookupOutcome.Failed.class));
            run.setRemaining(result.remaining().size());
            logSummary(run, result, outputPath);
            return run;

        } catch (FatalRunException e) {
            run.setStatus(RunStatus.FATAL);
            run.setErrorMessage(e.getMessage());
            log.error("Check run {} failed: {}", run.getRunId(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            run.setStatus(RunStatus.FAILED);
            run.setErrorMessage(e.getMessage());
            throw e;
        } finally {
            run.setCompletedAt(LocalDateTime.now());
            active.set(null);
            current.done.countDown();
        }
    }

    /**
     * @return false if no run is active
     */
    public boolean cancel(boolean force) {
        ActiveRun current = active.get();
        if (current == null) {
            return false;
        }
        if (force) {
            current.cancellation.forceStop("stop requested via API");
        } else {
            current.cancellation.requestCancel("cancel requested via API");
        }
        return true;
    }

    public boolean isRunning() {
        return active.get() != null;
    }

    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        ActiveRun current = active.get();
        status.put("running", current != null);
        if (current != null) {
            status.put("state", current.cancellation.state().name());
            Progress progress = current.progress;
            if (progress != null) {
                status.put("completed", progress.completed());
                status.put("total", progress.total());
            }
        }
        lastRun().ifPresent(last -> status.put("lastRun", last));
        return status;
    }

    public Optional<CheckRun> lastRun() {
        return Optional.ofNullable(lastRun);
    }

    /** Run and log failures instead of propagating them; used by the HTTP trigger. */
    public void runSafely() {
        try {
            runFromInput();
        } catch (Exception e) {
            log.error("Check run failed: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        ActiveRun current = active.get();
        if (current == null) {
            return;
        }
        log.warn("Shutdown requested, saving progress of the active run");
        current.cancellation.requestCancel("application shutdown");
        Duration wait = properties.getCancellation().getGracePeriod().plus(SHUTDOWN_MARGIN);
        try {
            if (!current.done.await(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Active run did not stop within {}", wait);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void logSummary(CheckRun run, RunResult result, Path outputPath) {
        log.info("Check run {} {}: read={}, queried={}, found={}, notFound={}, failed={}, remaining={} -> {}",
                run.getRunId(), run.getStatus(), run.getIdentifiersRead(), run.getQueried(),
                run.getFound(), run.getNotFound(), run.getFailed(), run.getRemaining(), outputPath);

        List<String> failed = result.results().failedIdentifiers();
        for (String id : failed) {
            result.results().get(id).ifPresent(o -> {
                LookupOutcome.Failed f = (LookupOutcome.Failed) o;
                log.warn("  failed {}: {} after {} attempts{}", id, f.reason(), f.attempts(),
                        f.detail() == null ? "" : " (" + f.detail() + ")");
            });
        }
        if (result.partial()) {
            log.warn("Run stopped early, {} numbers unresolved. Restart to resume from the checkpoint.",
                    result.remaining().size());
        }
    }

    private static final class ActiveRun {
        final CancellationController cancellation;
        final CountDownLatch done = new CountDownLatch(1);
        volatile Progress progress;

        ActiveRun(CancellationController cancellation) {
            this.cancellation = cancellation;
        }

        void setProgress(Progress progress) {
            this.progress = progress;
        }
    }
}
