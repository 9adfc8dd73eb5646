package com.guno.drawimport.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

/**
 * Diagnostic entry for a dropped item or an abandoned call
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorReport {

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();

    private String entityType;
    private String entityId;
    private String source;
    private String errorCode;
    private String errorMessage;

    public static ErrorReport rejection(String source, String entityId, String reasonCode, String message) {
        return ErrorReport.builder()
                .entityType("DRAW")
                .entityId(entityId)
                .source(source)
                .errorCode(reasonCode)
                .errorMessage(message)
                .build();
    }
}
