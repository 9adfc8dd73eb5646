package com.guno.drawimport.dto.internal;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of one logical fetch (retries included) for one shape and page, or one HTML URL
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FetchAttemptResult {

    private FetchOutcome outcome;

    private String url;

    private Integer statusCode;

    /** Raw body text, null unless the call returned 2xx. */
    private String body;

    /** Decoded JSON body for API calls. */
    private JsonNode payload;

    @Builder.Default
    private int attempts = 1;

    private String failureMessage;

    public boolean isSuccess() {
        return outcome == FetchOutcome.SUCCESS;
    }

    public static FetchAttemptResult failure(FetchOutcome outcome, String url, Integer statusCode, String message) {
        return FetchAttemptResult.builder()
                .outcome(outcome)
                .url(url)
                .statusCode(statusCode)
                .failureMessage(message)
                .build();
    }
}
