package com.debtchecker.service;

/**
 * Read side of a run's cancellation state, checked by workers between attempts.
 */
public interface CancellationToken {

    CancellationToken NONE = new CancellationToken() {
        @Override
        public boolean isCancelRequested() {
            return false;
        }

        @Override
        public boolean isStopRequested() {
            return false;
        }
    };

    /** No new identifiers should be dispatched. In-flight lookups may finish. */
    boolean isCancelRequested();

    /** In-flight lookups should be abandoned at their next suspension point. */
    boolean isStopRequested();
}
