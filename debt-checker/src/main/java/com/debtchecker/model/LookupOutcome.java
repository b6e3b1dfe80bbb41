package com.debtchecker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Terminal result of checking one enforcement-procedure number.
 *
 * Serialised with a "status" discriminator so checkpoint files stay readable:
 * {"status":"FOUND","amount":1520.75,"attempts":1}
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "status")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LookupOutcome.Found.class, name = "FOUND"),
        @JsonSubTypes.Type(value = LookupOutcome.NotFound.class, name = "NOT_FOUND"),
        @JsonSubTypes.Type(value = LookupOutcome.Failed.class, name = "FAILED")
})
public interface LookupOutcome {

    /** Number of remote calls spent on this identifier; 0 when the outcome was known up front. */
    int attempts();

    @JsonIgnore
    default boolean isSuccess() {
        return !(this instanceof Failed);
    }

    static LookupOutcome found(BigDecimal amount, int attempts) {
        return new Found(amount, attempts);
    }

    static LookupOutcome notFound(int attempts) {
        return new NotFound(attempts);
    }

    static LookupOutcome failed(ErrorKind reason, int attempts, String detail) {
        return new Failed(reason, attempts, detail);
    }

    /** Outstanding debt was reported for the identifier. */
    record Found(BigDecimal amount, int attempts) implements LookupOutcome {
        public Found {
            Objects.requireNonNull(amount, "amount must not be null");
        }
    }

    /** The remote service has no debt on record for the identifier. */
    record NotFound(int attempts) implements LookupOutcome {
    }

    record Failed(ErrorKind reason, int attempts, String detail) implements LookupOutcome {
        public Failed {
            Objects.requireNonNull(reason, "reason must not be null");
        }
    }
}
