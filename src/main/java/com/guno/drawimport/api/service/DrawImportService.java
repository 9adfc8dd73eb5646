package com.guno.drawimport.api.service;

import com.guno.drawimport.dto.internal.AcquisitionResult;
import com.guno.drawimport.dto.internal.ImportSummary;
import com.guno.drawimport.dto.internal.MergeResult;
import com.guno.drawimport.entity.DrawStore;
import com.guno.drawimport.processor.DrawReconciler;
import com.guno.drawimport.repository.DrawStoreRepository;
import com.guno.drawimport.util.DrawDateResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * DrawImportService - one complete run: load, acquire, reconcile, persist
 *
 * The store is loaded once and written at most once, and only when its serialized content
 * changed. An exhausted acquisition never touches the store.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DrawImportService {

    public static final String STATUS_NO_DATA = "NO_DATA";

    private final DrawStoreRepository repository;
    private final DrawAcquisitionOrchestrator orchestrator;
    private final DrawReconciler reconciler;
    private final DrawDateResolver dateResolver;

    public ImportSummary runImport() {
        return runImport(dateResolver.resolveDrawDate());
    }

    /**
     * @throws com.guno.drawimport.exception.StoreWriteException when the changed store cannot be saved
     */
    public ImportSummary runImport(LocalDate drawDate) {
        ImportSummary summary = ImportSummary.builder().drawDate(drawDate).build();

        log.info("📋 Step 1: Loading draw store...");
        DrawStore existing = repository.load();
        summary.setPreviousMaxPeriod(existing.maxPeriod().orElse(null));
        summary.setNewMaxPeriod(summary.getPreviousMaxPeriod());
        summary.setTotalRecords(existing.size());

        log.info("📋 Step 2: Acquiring draws for {}...", drawDate);
        AcquisitionResult acquisition = orchestrator.acquire(drawDate);
        applyAcquisition(summary, acquisition);

        if (acquisition.isExhausted()) {
            log.warn("⚠️ Nothing acquired - store left untouched");
            summary.setStatus(STATUS_NO_DATA);
            summary.setEndTime(LocalDateTime.now());
            return summary;
        }

        log.info("📋 Step 3: Reconciling {} draws into {} stored...", acquisition.getRecords().size(), existing.size());
        MergeResult merge = reconciler.reconcile(existing, acquisition.getRecords());
        summary.setRecordsAdded(merge.getAdded());
        summary.setRecordsUpgraded(merge.getUpgraded());
        summary.setConflicts(merge.getConflicts());
        summary.setChanged(merge.isChanged());
        summary.setTotalRecords(merge.getStore().size());
        summary.setNewMaxPeriod(merge.getStore().maxPeriod().orElse(null));

        if (merge.isChanged()) {
            log.info("📋 Step 4: Persisting changed store...");
            repository.save(merge.getStore());
            summary.setWritten(true);
        } else {
            log.info("✅ No new or upgraded draws - skipping write");
        }

        summary.markSuccess();
        return summary;
    }

    private static void applyAcquisition(ImportSummary summary, AcquisitionResult acquisition) {
        summary.setFinalState(acquisition.getState());
        summary.setSource(acquisition.getSource());
        summary.setStopReason(acquisition.getStopReason());
        summary.setTotalApiCalls(acquisition.getApiCalls());
        summary.setTotalHtmlCalls(acquisition.getHtmlCalls());
        summary.setRecordsFetched(acquisition.getRecords().size());
        summary.setRecordsRejected(acquisition.getRejections().size());
        if (acquisition.getPinnedShape() != null) {
            summary.setPinnedShape(acquisition.getPinnedShape().describe());
        } else if (acquisition.getHtmlUrl() != null) {
            summary.setPinnedShape(acquisition.getHtmlUrl());
        }
    }
}
