package com.guno.drawimport.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.guno.drawimport.api.client.DrawApiClient;
import com.guno.drawimport.api.explore.CandidateRequestShape;
import com.guno.drawimport.api.extract.ResponseExtractor;
import com.guno.drawimport.config.DrawSourceProperties;
import com.guno.drawimport.dto.internal.FetchAttemptResult;
import com.guno.drawimport.dto.internal.FetchOutcome;
import com.guno.drawimport.dto.internal.PageStopReason;
import com.guno.drawimport.dto.internal.PaginationOutcome;
import com.guno.drawimport.mapper.DrawRecordNormalizer;
import com.guno.drawimport.mapper.NormalizedBatch;
import com.guno.drawimport.util.ArtifactRecorder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * PaginationController - walks the pages of a pinned shape
 *
 * Stop conditions, highest priority first:
 * 1. total-count hint reached (rows seen, or pages needed for the hint)
 * 2. short page (fewer rows than the page size), unless a hint says more rows remain
 * 3. max-page ceiling
 * An empty page or a failed fetch also ends the walk. Never fetches more than max-pages pages.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaginationController {

    public static final String SOURCE = "API";

    private final DrawApiClient apiClient;
    private final ResponseExtractor extractor;
    private final DrawRecordNormalizer normalizer;
    private final ArtifactRecorder artifactRecorder;
    private final DrawSourceProperties properties;

    /**
     * Rows, normalized batch and count hint of one fetched page.
     */
    @Value
    public static class PageContent {
        int rowCount;
        NormalizedBatch batch;
        Optional<Integer> totalCountHint;

        public boolean hasRecords() {
            return !batch.getRecords().isEmpty();
        }
    }

    public PageContent readPage(JsonNode payload, LocalDate date) {
        List<JsonNode> rows = extractor.extractRows(payload);
        NormalizedBatch batch = normalizer.normalizeAll(rows, date, SOURCE);
        return new PageContent(rows.size(), batch, extractor.totalCountHint(payload));
    }

    /**
     * Continue a shape whose first page has already been fetched and read.
     * {@link PaginationOutcome#getApiCalls()} counts only the calls made here.
     */
    public PaginationOutcome paginate(CandidateRequestShape shape, LocalDate date, PageContent firstPage) {
        int pageSize = properties.getPagination().getPageSize();
        int maxPages = Math.max(1, properties.getPagination().getMaxPages());

        PaginationOutcome outcome = PaginationOutcome.builder().build();
        Integer hint = null;
        PageContent page = firstPage;

        while (true) {
            outcome.setPagesFetched(outcome.getPagesFetched() + 1);
            outcome.setRowsSeen(outcome.getRowsSeen() + page.getRowCount());
            outcome.getRecords().addAll(page.getBatch().getRecords());
            outcome.getRejections().addAll(page.getBatch().getRejections());

            if (hint == null && page.getTotalCountHint().isPresent()) {
                hint = page.getTotalCountHint().get();
                log.debug("Shape {} reports {} rows in total", shape.getOrdinal(), hint);
            }

            PageStopReason stop = stopReason(outcome, page, hint, pageSize, maxPages);
            if (stop != null) {
                outcome.setStopReason(stop);
                break;
            }

            int pageOffset = outcome.getPagesFetched();
            FetchAttemptResult next = apiClient.fetchPage(shape, date, pageOffset, pageSize);
            outcome.setApiCalls(outcome.getApiCalls() + next.getAttempts());
            artifactRecorder.recordApiPage(date, shape.getOrdinal(), pageOffset + shape.getPageIndexOrigin(), next.getBody());

            if (!next.isSuccess()) {
                if (next.getOutcome() == FetchOutcome.EMPTY_RESULT) {
                    outcome.setStopReason(PageStopReason.EMPTY_PAGE);
                } else {
                    log.warn("⚠️ Page {} of shape {} failed ({}), keeping {} records from earlier pages",
                            pageOffset + shape.getPageIndexOrigin(), shape.getOrdinal(),
                            next.getOutcome(), outcome.getRecords().size());
                    outcome.setStopReason(PageStopReason.FETCH_FAILED);
                }
                break;
            }

            page = readPage(next.getPayload(), date);
            if (page.getRowCount() == 0) {
                outcome.setStopReason(PageStopReason.EMPTY_PAGE);
                break;
            }
        }

        log.info("📄 Shape {} paginated: {} pages, {} rows, {} records (stop: {})",
                shape.getOrdinal(), outcome.getPagesFetched(), outcome.getRowsSeen(),
                outcome.getRecords().size(), outcome.getStopReason());
        return outcome;
    }

    static PageStopReason stopReason(PaginationOutcome soFar, PageContent lastPage, Integer hint,
                                     int pageSize, int maxPages) {
        if (hint != null) {
            int pagesForHint = pageSize > 0 ? (int) Math.ceil(hint / (double) pageSize) : 0;
            if (soFar.getRowsSeen() >= hint || soFar.getPagesFetched() >= pagesForHint) {
                return PageStopReason.TOTAL_COUNT_HINT;
            }
        } else if (lastPage.getRowCount() < pageSize) {
            return PageStopReason.ROW_SHORTFALL;
        }

        if (soFar.getPagesFetched() >= maxPages) {
            return PageStopReason.MAX_PAGES;
        }
        return null;
    }
}
