package com.debtchecker.service;

/**
 * A condition that invalidates the whole run (bad token, empty balance).
 * Never raised for a single identifier's failure.
 */
public class FatalRunException extends RuntimeException {

    private final FatalReason reason;

    public FatalRunException(FatalReason reason, String detail) {
        super(detail == null || detail.isBlank()
                ? reason.description()
                : reason.description() + ": " + detail);
        this.reason = reason;
    }

    public FatalReason reason() {
        return reason;
    }
}
