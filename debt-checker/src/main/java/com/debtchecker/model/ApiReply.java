package com.debtchecker.model;

import java.math.BigDecimal;

/**
 * Classified result of a single call to the debt API.
 * Exactly one of {@code amount} (FOUND) or {@code error} (ERROR) is set.
 */
public record ApiReply(Kind kind, BigDecimal amount, ErrorKind error, String detail) {

    public enum Kind {
        FOUND, NOT_FOUND, ERROR
    }

    public static ApiReply found(BigDecimal amount) {
        return new ApiReply(Kind.FOUND, amount, null, null);
    }

    public static ApiReply notFound() {
        return new ApiReply(Kind.NOT_FOUND, null, null, null);
    }

    public static ApiReply error(ErrorKind error, String detail) {
        return new ApiReply(Kind.ERROR, null, error, detail);
    }
}
