package com.debtchecker.model;

/**
 * Classification of everything that can go wrong with a single lookup attempt.
 *
 * The category decides what the retry loop does with it:
 *  - TRANSIENT: retried with backoff until the attempt budget runs out
 *  - TERMINAL: recorded as the identifier's final outcome, run continues
 *  - FATAL: the whole run stops, the token or account is unusable
 */
public enum ErrorKind {

    TIMEOUT(Category.TRANSIENT),
    NETWORK(Category.TRANSIENT),
    SERVER_ERROR(Category.TRANSIENT),
    RATE_LIMITED(Category.TRANSIENT),

    MALFORMED_IDENTIFIER(Category.TERMINAL),
    INVALID_RESPONSE(Category.TERMINAL),

    /** Recorded on a Failed outcome once transient errors used up every attempt. */
    EXHAUSTED(Category.TERMINAL),

    AUTH_REJECTED(Category.FATAL),
    BALANCE_EXHAUSTED(Category.FATAL);

    public enum Category {
        TRANSIENT, TERMINAL, FATAL
    }

    private final Category category;

    ErrorKind(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }

    public boolean isRetryable() {
        return category == Category.TRANSIENT;
    }

    public boolean isFatal() {
        return category == Category.FATAL;
    }
}
