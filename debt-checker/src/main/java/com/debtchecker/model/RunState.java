package com.debtchecker.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable state of one run: identifiers still queued, identifiers in flight,
 * and the outcomes recorded so far. Every accessor is synchronized on the
 * instance, so workers never race on the same outcome slot.
 *
 * Once sealed, late outcomes are rejected so the result handed back to the
 * caller cannot change underneath it.
 */
public class RunState {

    private final Deque<String> pending;
    private final Map<String, Integer> inFlight = new LinkedHashMap<>();
    private final List<String> abandoned = new ArrayList<>();
    private final Map<String, LookupOutcome> results;
    private final int total;
    private final int seeded;
    private int completed;
    private boolean sealed;

    public RunState(List<String> identifiers, Map<String, LookupOutcome> seededOutcomes) {
        this.pending = new ArrayDeque<>(identifiers);
        this.results = new LinkedHashMap<>(seededOutcomes);
        this.total = identifiers.size();
        this.seeded = seededOutcomes.size();
    }

    /** Moves the next queued identifier to in-flight. */
    public synchronized Optional<String> nextPending() {
        if (sealed || pending.isEmpty()) {
            return Optional.empty();
        }
        String identifier = pending.pollFirst();
        inFlight.merge(identifier, 1, Integer::sum);
        return Optional.of(identifier);
    }

    /**
     * Records a terminal outcome for an in-flight identifier.
     *
     * When the same identifier completes more than once (duplicates in the input),
     * a success replaces an earlier failure; otherwise the first outcome stays.
     *
     * @return false if the run was already sealed and the outcome was dropped
     */
    public synchronized boolean record(String identifier, LookupOutcome outcome) {
        if (sealed) {
            return false;
        }
        leaveInFlight(identifier);
        LookupOutcome existing = results.get(identifier);
        if (existing == null || (!existing.isSuccess() && outcome.isSuccess())) {
            results.put(identifier, outcome);
        }
        completed++;
        return true;
    }

    /** The lookup ended without an outcome (stopped or interrupted); the identifier stays unresolved. */
    public synchronized void abandon(String identifier) {
        if (sealed) {
            return;
        }
        leaveInFlight(identifier);
        abandoned.add(identifier);
    }

    public synchronized void seal() {
        sealed = true;
    }

    public synchronized boolean isSealed() {
        return sealed;
    }

    public synchronized ResultSet results() {
        return new ResultSet(results);
    }

    /** Identifiers without an outcome from this run: abandoned, then in flight, then still queued. */
    public synchronized List<String> remaining() {
        List<String> remaining = new ArrayList<>(abandoned);
        inFlight.forEach((identifier, count) -> {
            for (int i = 0; i < count; i++) {
                remaining.add(identifier);
            }
        });
        remaining.addAll(pending);
        return remaining;
    }

    public synchronized int inFlightCount() {
        return inFlight.values().stream().mapToInt(Integer::intValue).sum();
    }

    public synchronized int completedCount() {
        return completed;
    }

    /** Number of identifiers queued for lookup in this run. */
    public int total() {
        return total;
    }

    /** Number of outcomes known before the run started (resume, known amounts). */
    public int seededCount() {
        return seeded;
    }

    public synchronized Progress progress() {
        return new Progress(completed, total);
    }

    private void leaveInFlight(String identifier) {
        inFlight.computeIfPresent(identifier, (id, count) -> count > 1 ? count - 1 : null);
    }
}
