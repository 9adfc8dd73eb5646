package com.guno.drawimport.api.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.guno.drawimport.api.client.DrawApiClient;
import com.guno.drawimport.api.client.DrawPageClient;
import com.guno.drawimport.api.explore.CandidateRequestShape;
import com.guno.drawimport.api.explore.ParameterSpaceExplorer;
import com.guno.drawimport.api.explore.SearchDimensions;
import com.guno.drawimport.api.extract.HtmlDrawExtractor;
import com.guno.drawimport.config.DrawSourceProperties;
import com.guno.drawimport.dto.internal.AcquisitionResult;
import com.guno.drawimport.dto.internal.FetchAttemptResult;
import com.guno.drawimport.dto.internal.PaginationOutcome;
import com.guno.drawimport.dto.internal.RunState;
import com.guno.drawimport.mapper.DrawRecordNormalizer;
import com.guno.drawimport.mapper.NormalizedBatch;
import com.guno.drawimport.processor.PaginationController;
import com.guno.drawimport.processor.PaginationController.PageContent;
import com.guno.drawimport.util.ArtifactRecorder;
import com.guno.drawimport.util.RequestPacer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * DrawAcquisitionOrchestrator - TRY_API -> TRY_HTML -> DONE | EXHAUSTED
 *
 * TRY_API walks the candidate request shapes in order. The first shape whose first page
 * normalizes to at least one record is pinned and paginated; nothing else is tried after that.
 * When every shape fails, each HTML page is fetched and re-polled while it yields nothing
 * (the page is often mid-update right after a draw).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DrawAcquisitionOrchestrator {

    public static final String SOURCE_API = "API";
    public static final String SOURCE_HTML = "HTML";

    private final ParameterSpaceExplorer explorer;
    private final DrawApiClient apiClient;
    private final DrawPageClient pageClient;
    private final PaginationController paginationController;
    private final HtmlDrawExtractor htmlExtractor;
    private final DrawRecordNormalizer normalizer;
    private final ArtifactRecorder artifactRecorder;
    private final DrawSourceProperties properties;

    public AcquisitionResult acquire(LocalDate date) {
        AcquisitionResult result = AcquisitionResult.builder().state(RunState.TRY_API).build();

        while (!result.getState().isTerminal()) {
            switch (result.getState()) {
                case TRY_API:
                    result.setState(tryApi(date, result) ? RunState.DONE : RunState.TRY_HTML);
                    break;
                case TRY_HTML:
                    result.setState(tryHtml(date, result) ? RunState.DONE : RunState.EXHAUSTED);
                    break;
                default:
                    throw new IllegalStateException("Unexpected run state " + result.getState());
            }
        }

        if (result.isExhausted()) {
            log.warn("⚠️ No draws acquired for {} - {} shapes, {} API calls, {} HTML calls",
                    date, result.getCandidatesTried(), result.getApiCalls(), result.getHtmlCalls());
        } else {
            log.info("✅ Acquired {} draws for {} via {}", result.getRecords().size(), date, result.getSource());
        }
        return result;
    }

    // ========== TRY_API ==========

    private boolean tryApi(LocalDate date, AcquisitionResult result) {
        SearchDimensions dimensions = properties.toSearchDimensions();
        int pageSize = properties.getPagination().getPageSize();
        log.info("🔎 Probing {} candidate API shapes for {}", dimensions.size(), date);

        for (CandidateRequestShape shape : explorer.candidates(dimensions)) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("⚠️ Interrupted while probing API shapes");
                return false;
            }

            result.setCandidatesTried(result.getCandidatesTried() + 1);
            FetchAttemptResult first = apiClient.fetchPage(shape, date, 0, pageSize);
            result.setApiCalls(result.getApiCalls() + first.getAttempts());
            artifactRecorder.recordApiPage(date, shape.getOrdinal(), shape.getPageIndexOrigin(), first.getBody());

            if (!first.isSuccess()) {
                log.debug("Shape {} rejected: {} {}", shape.getOrdinal(), first.getOutcome(),
                        first.getFailureMessage() != null ? first.getFailureMessage() : "");
                continue;
            }

            PageContent firstPage = paginationController.readPage(first.getPayload(), date);
            if (!firstPage.hasRecords()) {
                log.debug("Shape {} rejected: {} rows, no usable draw", shape.getOrdinal(), firstPage.getRowCount());
                result.getRejections().addAll(firstPage.getBatch().getRejections());
                continue;
            }

            log.info("📌 Pinned shape {}", shape.describe());
            PaginationOutcome pages = paginationController.paginate(shape, date, firstPage);

            result.setPinnedShape(shape);
            result.setSource(SOURCE_API);
            result.setStopReason(pages.getStopReason());
            result.setPagesFetched(pages.getPagesFetched());
            result.setApiCalls(result.getApiCalls() + pages.getApiCalls());
            result.getRecords().addAll(pages.getRecords());
            result.getRejections().addAll(pages.getRejections());
            return true;
        }

        log.warn("⚠️ All {} API shapes exhausted after {} calls - switching to HTML",
                result.getCandidatesTried(), result.getApiCalls());
        return false;
    }

    // ========== TRY_HTML ==========

    private boolean tryHtml(LocalDate date, AcquisitionResult result) {
        List<String> urls = properties.getHtml().getUrls();
        int pollAttempts = Math.max(1, properties.getHtml().getPollAttempts());

        for (int urlIndex = 0; urlIndex < urls.size(); urlIndex++) {
            String url = urls.get(urlIndex);

            for (int poll = 1; poll <= pollAttempts; poll++) {
                FetchAttemptResult page = pageClient.fetchDocument(url);
                result.setHtmlCalls(result.getHtmlCalls() + page.getAttempts());
                artifactRecorder.recordHtmlPage(date, urlIndex, poll, page.getBody());

                if (!page.isSuccess()) {
                    log.warn("⚠️ HTML page {} unavailable: {} (status: {})", url, page.getOutcome(), page.getStatusCode());
                    break;
                }

                List<JsonNode> items = htmlExtractor.extractItems(page.getBody());
                NormalizedBatch batch = normalizer.normalizeAll(items, null, SOURCE_HTML);
                result.getRejections().addAll(batch.getRejections());

                if (!batch.getRecords().isEmpty()) {
                    log.info("📄 HTML page {} yielded {} draws (poll {}/{})",
                            url, batch.getRecords().size(), poll, pollAttempts);
                    result.setSource(SOURCE_HTML);
                    result.setHtmlUrl(url);
                    result.getRecords().addAll(batch.getRecords());
                    return true;
                }

                if (poll < pollAttempts) {
                    log.info("⏳ HTML page {} has no draws yet, polling again in {}ms ({}/{})",
                            url, properties.getHtml().getPollWaitMs(), poll, pollAttempts);
                    if (!RequestPacer.sleep(properties.getHtml().getPollWaitMs())) {
                        log.warn("⚠️ Interrupted while polling {}", url);
                        return false;
                    }
                }
            }
        }
        return false;
    }
}
