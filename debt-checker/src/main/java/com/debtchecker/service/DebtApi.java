package com.debtchecker.service;

import com.debtchecker.model.ApiReply;

/**
 * One request to the remote debt lookup service. Implementations classify every
 * response, including transport errors, into an {@link ApiReply} instead of throwing.
 */
public interface DebtApi {

    ApiReply query(String identifier);

    /**
     * Fails fast with a {@link FatalRunException} when the credentials can never work.
     */
    default void verifyCredentials() {
    }
}
