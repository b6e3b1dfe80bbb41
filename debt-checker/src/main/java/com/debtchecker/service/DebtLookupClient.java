package com.debtchecker.service;

import com.debtchecker.model.ApiReply;
import com.debtchecker.model.ErrorKind;
import com.debtchecker.model.LookupOutcome;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Resolves one identifier to a terminal {@link LookupOutcome}.
 *
 * Each attempt takes a throttle permit, calls the API, and releases the permit
 * before deciding what to do next. Transient errors are retried with backoff
 * until the attempt budget runs out; terminal errors are returned as-is; fatal
 * errors end the whole run via {@link FatalRunException}.
 */
@Slf4j
public class DebtLookupClient {

    private final DebtApi api;
    private final RequestThrottle throttle;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public DebtLookupClient(DebtApi api, RequestThrottle throttle, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.api = api;
        this.throttle = throttle;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    /**
     * Blocking lookup outside of any run.
     *
     * @throws CancellationException if the calling thread is interrupted mid-lookup
     */
    public LookupOutcome lookup(String identifier) {
        return lookup(identifier, CancellationToken.NONE)
                .orElseThrow(() -> new CancellationException("Lookup interrupted for " + identifier));
    }

    /**
     * @return the terminal outcome, or empty if the lookup was abandoned because
     *         the run was stopped or the worker thread interrupted
     */
    public Optional<LookupOutcome> lookup(String identifier, CancellationToken cancellation) {
        int maxAttempts = retryPolicy.maxAttempts();
        ApiReply last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (cancellation.isStopRequested()) {
                log.info("Lookup for {} abandoned before attempt {}", identifier, attempt);
                return Optional.empty();
            }

            ApiReply reply;
            try (RequestThrottle.Permit ignored = throttle.acquire()) {
                reply = callApi(identifier);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Lookup for {} interrupted waiting for a request permit", identifier);
                return Optional.empty();
            }

            switch (reply.kind()) {
                case FOUND -> {
                    log.info("Debt found for {}: {} (attempt {})", identifier, reply.amount(), attempt);
                    return Optional.of(LookupOutcome.found(reply.amount(), attempt));
                }
                case NOT_FOUND -> {
                    log.info("No debt found for {} (attempt {})", identifier, attempt);
                    return Optional.of(LookupOutcome.notFound(attempt));
                }
                default -> {
                    // error, handled below
                }
            }

            ErrorKind error = reply.error();
            if (error.isFatal()) {
                log.error("Fatal API error {} while checking {}: {}", error, identifier, reply.detail());
                throw new FatalRunException(FatalReason.from(error), reply.detail());
            }
            if (!error.isRetryable()) {
                log.warn("Terminal error {} for {}: {}", error, identifier, reply.detail());
                return Optional.of(LookupOutcome.failed(error, attempt, reply.detail()));
            }

            last = reply;
            if (attempt < maxAttempts) {
                long delay = retryPolicy.delayMillis(attempt);
                log.warn("{} for {} (attempt {}/{}), retrying in {} ms",
                        error, identifier, attempt, maxAttempts, delay);
                try {
                    sleeper.sleep(Duration.ofMillis(delay));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.info("Lookup for {} interrupted during backoff", identifier);
                    return Optional.empty();
                }
            }
        }

        log.error("Giving up on {} after {} attempts, last error {}: {}",
                identifier, maxAttempts, last.error(), last.detail());
        return Optional.of(LookupOutcome.failed(ErrorKind.EXHAUSTED, maxAttempts,
                last.error() + (last.detail() == null ? "" : ": " + last.detail())));
    }

    private ApiReply callApi(String identifier) {
        try {
            return api.query(identifier);
        } catch (FatalRunException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected error querying {}: {}", identifier, e.getMessage(), e);
            return ApiReply.error(ErrorKind.INVALID_RESPONSE, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
