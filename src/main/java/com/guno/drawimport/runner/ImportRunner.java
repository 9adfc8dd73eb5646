package com.guno.drawimport.runner;

import com.guno.drawimport.api.service.DrawImportService;
import com.guno.drawimport.config.DrawSourceProperties;
import com.guno.drawimport.dto.internal.ImportSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * ImportRunner - runs one import when the application starts
 *
 * Scheduling is left to the caller (cron, CI workflow). The exit code tells it what happened:
 * 0, or {@code bingo.run.changed-exit-code} when the store was rewritten, or
 * {@code bingo.run.exhausted-exit-code} when no source produced a draw. Failures propagate and
 * end the process with a non-zero code.
 */
@Component
@ConditionalOnProperty(prefix = "bingo.run", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ImportRunner implements ApplicationRunner, ExitCodeGenerator {

    private final DrawImportService importService;
    private final DrawSourceProperties properties;

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private volatile ImportSummary lastSummary;

    @Override
    public void run(ApplicationArguments args) {
        String startTime = LocalDateTime.now().format(TIME_FORMATTER);
        log.info("╔════════════════════════════════════════════════════════════╗");
        log.info("║   DRAW IMPORT STARTED at {}                 ║", startTime);
        log.info("╚════════════════════════════════════════════════════════════╝");

        logSourceConfiguration();

        try {
            lastSummary = importService.runImport();
            logImportSummary(lastSummary);
        } catch (RuntimeException e) {
            log.error("❌ Draw import failed: {}", e.getMessage(), e);
            logErrorContext(e);
            throw e;
        }

        String endTime = LocalDateTime.now().format(TIME_FORMATTER);
        log.info("╔════════════════════════════════════════════════════════════╗");
        log.info("║   DRAW IMPORT COMPLETED at {}               ║", endTime);
        log.info("╚════════════════════════════════════════════════════════════╝");
    }

    @Override
    public int getExitCode() {
        ImportSummary summary = lastSummary;
        if (summary == null) return 0;
        if (summary.isNoData()) return properties.getRun().getExhaustedExitCode();
        if (summary.isWritten()) return properties.getRun().getChangedExitCode();
        return 0;
    }

    public ImportSummary getLastSummary() {
        return lastSummary;
    }

    // ================================
    // LOGGING HELPERS
    // ================================

    private void logSourceConfiguration() {
        DrawSourceProperties.ApiSettings api = properties.getApi();
        log.info("🔧 Source Configuration:");
        log.info("   ├─ API endpoints:  {}", api.getEndpoints().size());
        log.info("   ├─ Shape space:    {} candidates", properties.toSearchDimensions().size());
        log.info("   ├─ HTML pages:     {}", properties.getHtml().getUrls().size());
        log.info("   └─ Store:          {}", properties.getStore().getPath());
    }

    private void logImportSummary(ImportSummary summary) {
        log.info("╔════════════════════════════════════════════════════════════╗");
        log.info("║                    DRAW IMPORT SUMMARY                     ║");
        log.info("╠════════════════════════════════════════════════════════════╣");
        log.info("║  Status:         {}", String.format("%-42s", summary.getStatus()) + "║");
        log.info("║  Draw Date:      {}", String.format("%-42s", summary.getDrawDate()) + "║");
        log.info("║  Final State:    {}", String.format("%-42s", summary.getFinalState()) + "║");
        log.info("║  Source:         {}", String.format("%-42s", summary.getSource() != null ? summary.getSource() : "-") + "║");
        log.info("║  Duration:       {}", String.format("%-42s", summary.getDurationFormatted()) + "║");
        log.info("║  API Calls:      {}", String.format("%-42s", summary.getTotalApiCalls()) + "║");
        log.info("║  HTML Calls:     {}", String.format("%-42s", summary.getTotalHtmlCalls()) + "║");
        log.info("╠════════════════════════════════════════════════════════════╣");
        log.info("║  Draw Counts:                                              ║");
        log.info("║    ├─ Fetched:   {}", String.format("%-42s", summary.getRecordsFetched()) + "║");
        log.info("║    ├─ Rejected:  {}", String.format("%-42s", summary.getRecordsRejected()) + "║");
        log.info("║    ├─ Added:     {}", String.format("%-42s", summary.getRecordsAdded()) + "║");
        log.info("║    ├─ Upgraded:  {}", String.format("%-42s", summary.getRecordsUpgraded()) + "║");
        log.info("║    ├─ Conflicts: {}", String.format("%-42s", summary.getConflicts()) + "║");
        log.info("║    └─ Stored:    {}", String.format("%-42s", summary.getTotalRecords()) + "║");
        log.info("╠════════════════════════════════════════════════════════════╣");
        log.info("║  Max Period:     {}", String.format("%-42s",
                summary.getPreviousMaxPeriod() + " -> " + summary.getNewMaxPeriod()) + "║");
        log.info("║  Written:        {}", String.format("%-42s", summary.isWritten() ? "✅ YES" : "NO") + "║");

        log.info("╚════════════════════════════════════════════════════════════╝");
    }

    private void logErrorContext(Exception e) {
        log.error("╔════════════════════════════════════════════════════════════╗");
        log.error("║                    ERROR CONTEXT                           ║");
        log.error("╠════════════════════════════════════════════════════════════╣");
        log.error("║  Error Type:    {}", String.format("%-43s", e.getClass().getSimpleName()) + "║");
        log.error("║  Error Message: {}", String.format("%-43s", e.getMessage() != null ? e.getMessage() : "Unknown") + "║");
        log.error("╠════════════════════════════════════════════════════════════╣");
        log.error("║  💡 Troubleshooting Tips:                                  ║");
        log.error("║    1. Check write permission on the store directory        ║");
        log.error("║    2. Verify bingo.* settings in application.yml           ║");
        log.error("║    3. Review full stack trace in logs                      ║");
        log.error("╚════════════════════════════════════════════════════════════╝");
    }
}
