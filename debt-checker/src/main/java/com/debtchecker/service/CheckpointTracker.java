package com.debtchecker.service;

import com.debtchecker.config.DebtCheckerProperties;
import com.debtchecker.model.CheckpointSnapshot;
import com.debtchecker.model.LookupOutcome;
import com.debtchecker.model.Progress;
import com.debtchecker.model.RunState;
import com.debtchecker.output.CheckpointStore;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Records outcomes into the run state, reports progress, and persists a
 * snapshot every N completions or every T, whichever comes first.
 *
 * A failed snapshot write is logged and the run carries on; the next
 * successful write supersedes it.
 */
@Slf4j
public class CheckpointTracker {

    private final String runId;
    private final RunState state;
    private final CheckpointStore store;
    private final int everyCompletions;
    private final Duration interval;
    private final int progressLogEvery;
    private final Clock clock;
    private final ProgressListener listener;

    private int sinceLastWrite;
    private Instant lastWrite;
    private int snapshotsWritten;

    public CheckpointTracker(String runId,
                             RunState state,
                             CheckpointStore store,
                             DebtCheckerProperties.Checkpoint settings,
                             Clock clock,
                             ProgressListener listener) {
        this.runId = runId;
        this.state = state;
        this.store = store;
        this.everyCompletions = settings.getIntervalCompletions();
        this.interval = settings.getInterval();
        this.progressLogEvery = settings.getProgressLogEvery();
        this.clock = clock;
        this.listener = listener;
        this.lastWrite = clock.instant();
    }

    /**
     * Called once per dispatched identifier after its terminal outcome is known.
     *
     * @return false if the run had already stopped and the outcome was discarded
     */
    public boolean record(String identifier, LookupOutcome outcome) {
        if (!state.record(identifier, outcome)) {
            log.warn("Discarding outcome for {} that arrived after the run stopped", identifier);
            return false;
        }

        Progress progress = reportProgress();
        if (progress.completed() % progressLogEvery == 0 || progress.completed() == progress.total()) {
            log.info("Processed {}/{} numbers ({}%)",
                    progress.completed(), progress.total(), String.format("%.1f", progress.percent()));
        }
        listener.onProgress(progress);

        maybeWriteSnapshot();
        return true;
    }

    public CheckpointSnapshot snapshot() {
        return snapshot(state.isSealed() && !state.remaining().isEmpty());
    }

    public CheckpointSnapshot snapshot(boolean partial) {
        return new CheckpointSnapshot(
                runId,
                clock.instant(),
                state.total() + state.seededCount(),
                state.results().asMap(),
                state.remaining(),
                partial);
    }

    public Progress reportProgress() {
        return state.progress();
    }

    /** Final write at the end of a run, regardless of cadence. */
    public synchronized void flush(boolean partial) {
        write(snapshot(partial));
    }

    public synchronized int snapshotsWritten() {
        return snapshotsWritten;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private synchronized void maybeWriteSnapshot() {
        sinceLastWrite++;
        boolean countDue = sinceLastWrite >= everyCompletions;
        boolean timeDue = !Duration.between(lastWrite, clock.instant()).minus(interval).isNegative();
        if (countDue || timeDue) {
            write(snapshot(true));
        }
    }

    private void write(CheckpointSnapshot snapshot) {
        try {
            store.save(snapshot);
            snapshotsWritten++;
            log.info("Checkpoint saved after {} completions ({} remaining)",
                    snapshot.completed().size(), snapshot.remaining().size());
        } catch (UncheckedIOException e) {
            log.error("Error saving checkpoint: {}", e.getMessage(), e);
        } finally {
            sinceLastWrite = 0;
            lastWrite = clock.instant();
        }
    }
}
