package com.guno.drawimport.dto.internal;

/**
 * Classification of one upstream call.
 */
public enum FetchOutcome {
    SUCCESS,
    EMPTY_RESULT,
    CLIENT_ERROR,
    SERVER_ERROR,
    TRANSPORT_FAILURE;

    public boolean isRetryable() {
        return this == SERVER_ERROR || this == TRANSPORT_FAILURE;
    }
}
