package com.debtchecker.service;

import com.debtchecker.model.ErrorKind;

public enum FatalReason {

    MISSING_TOKEN("API token is not configured"),
    AUTH_REJECTED("authentication rejected"),
    BALANCE_EXHAUSTED("API token balance exhausted");

    private final String description;

    FatalReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    public static FatalReason from(ErrorKind kind) {
        return switch (kind) {
            case AUTH_REJECTED -> AUTH_REJECTED;
            case BALANCE_EXHAUSTED -> BALANCE_EXHAUSTED;
            default -> throw new IllegalArgumentException(kind + " is not a fatal error kind");
        };
    }
}
