package com.debtchecker.service;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives the orderly shutdown of one run:
 *
 *   RUNNING → CANCEL_REQUESTED → DRAINING → STOPPED
 *
 * The first cancel request stops dispatching; in-flight lookups finish on their
 * own retry budget. A second request while still cancelling escalates to an
 * immediate stop, which abandons whatever is in flight.
 */
@Slf4j
public class CancellationController implements CancellationToken {

    public enum State {
        RUNNING, CANCEL_REQUESTED, DRAINING, STOPPED
    }

    private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final List<Runnable> escalationListeners = new CopyOnWriteArrayList<>();
    private volatile boolean stopRequested;
    private volatile String reason;

    /**
     * @return true if this call moved the run out of RUNNING, false if it was already cancelling
     */
    public boolean requestCancel(String reason) {
        if (state.compareAndSet(State.RUNNING, State.CANCEL_REQUESTED)) {
            this.reason = reason;
            log.warn("Cancellation requested ({}). No new identifiers will be dispatched.", reason);
            return true;
        }
        State current = state.get();
        if (current == State.CANCEL_REQUESTED || current == State.DRAINING) {
            escalate("repeated cancel request: " + reason);
        }
        return false;
    }

    /** Cancel and abandon in-flight lookups without waiting for the grace period. */
    public void forceStop(String reason) {
        if (!requestCancel(reason) && state.get() == State.STOPPED) {
            return;
        }
        escalate(reason);
    }

    /** Registers a callback run once when the stop is escalated, e.g. interrupting workers. */
    public void onEscalation(Runnable listener) {
        escalationListeners.add(listener);
        if (stopRequested) {
            listener.run();
        }
    }

    void beginDraining() {
        if (state.compareAndSet(State.CANCEL_REQUESTED, State.DRAINING)) {
            log.info("Draining in-flight lookups");
        }
    }

    void markStopped() {
        State previous = state.getAndSet(State.STOPPED);
        if (previous != State.STOPPED) {
            stopped.countDown();
        }
    }

    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public State state() {
        return state.get();
    }

    public String reason() {
        return reason;
    }

    @Override
    public boolean isCancelRequested() {
        return state.get() != State.RUNNING;
    }

    @Override
    public boolean isStopRequested() {
        return stopRequested;
    }

    private synchronized void escalate(String why) {
        if (stopRequested || state.get() == State.STOPPED) {
            return;
        }
        stopRequested = true;
        log.warn("Immediate stop requested ({}). Abandoning in-flight lookups.", why);
        for (Runnable listener : escalationListeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.error("Escalation listener failed: {}", e.getMessage(), e);
            }
        }
    }
}
